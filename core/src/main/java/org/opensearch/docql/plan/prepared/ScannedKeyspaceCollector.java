/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.opensearch.docql.plan.prepared;

import java.util.Map;
import java.util.TreeMap;
import org.opensearch.docql.plan.AbstractOperatorVisitor;
import org.opensearch.docql.plan.Operator;
import org.opensearch.docql.plan.scan.KeyspaceScan;

/**
 * Collects the keyspaces read by the scans of a plan, by full name, with whether any scan of the
 * keyspace was planned against uncommitted transaction writes.
 */
public class ScannedKeyspaceCollector
    extends AbstractOperatorVisitor<Void, Map<String, Boolean>> {

  public Map<String, Boolean> collect(Operator root) {
    Map<String, Boolean> scanned = new TreeMap<>();
    if (root != null) {
      root.accept(this, scanned);
    }
    return scanned;
  }

  @Override
  public Void visitOperator(Operator op, Map<String, Boolean> scanned) {
    if (op instanceof KeyspaceScan) {
      KeyspaceScan scan = (KeyspaceScan) op;
      if (scan.getKeyspace() != null) {
        String name = scan.getKeyspace().getPath().getFullName();
        scanned.merge(name, scan.hasDeltaKeyspace(), Boolean::logicalOr);
      }
    }
    return super.visitOperator(op, scanned);
  }
}
