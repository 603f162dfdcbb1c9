/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.opensearch.docql.plan.prepared;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.NullNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.google.common.base.Strings;
import java.nio.charset.StandardCharsets;
import java.util.Map;
import java.util.TreeMap;
import lombok.Getter;
import lombok.RequiredArgsConstructor;
import org.opensearch.docql.common.codec.TextCodec;
import org.opensearch.docql.plan.PlanDecodingContext;
import org.opensearch.docql.plan.PlanJson;
import org.opensearch.docql.plan.exceptions.PlanDecodingException;

/**
 * Converts {@link Prepared} records to and from their portable form: a JSON envelope around the
 * encoded operator tree, compressed and made text-safe by a {@link TextCodec}.
 */
@RequiredArgsConstructor
public class PreparedCodec {

  @Getter private final TextCodec textCodec;

  @Getter private final PlanDecodingContext decodingContext;

  /** Encode the plan and store the result as its encoded plan. */
  public String buildEncodedPlan(Prepared prepared) {
    String encoded = textCodec.encode(toJson(prepared, false).getBytes(StandardCharsets.UTF_8));
    prepared.setEncodedPlan(encoded);
    return encoded;
  }

  /**
   * Decode a portable plan. The operator tree is re-resolved against the datastore, the version
   * stamps start empty.
   *
   * @throws PlanDecodingException if the text is not a valid encoding of a plan
   * @throws org.opensearch.docql.plan.exceptions.UnresolvedReferenceException if the plan names a
   *     keyspace or index that no longer exists
   */
  public Prepared decode(String encoded) {
    byte[] json;
    try {
      json = textCodec.decode(encoded);
    } catch (IllegalArgumentException e) {
      throw new PlanDecodingException("Invalid encoded plan: " + e.getMessage(), e);
    }
    Prepared prepared = fromJson(PlanJson.parseObject(json));
    prepared.setEncodedPlan(encoded);
    return prepared;
  }

  /** JSON envelope of the plan, as shown to users. */
  public String toJson(Prepared prepared) {
    return toJson(prepared, true);
  }

  private String toJson(Prepared prepared, boolean withEncodedPlan) {
    return PlanJson.toJson(encodeEnvelope(prepared, withEncodedPlan));
  }

  public ObjectNode encodeEnvelope(Prepared prepared, boolean withEncodedPlan) {
    ObjectNode node = PlanJson.newObject();
    node.put("planVersion", prepared.getPlanVersion());
    node.set("operator", prepared.getOperator().encode());
    node.set(
        "signature",
        prepared.getSignature() == null ? NullNode.getInstance() : prepared.getSignature());
    node.put("name", Strings.nullToEmpty(prepared.getName()));
    node.put("encoded_plan", withEncodedPlan ? Strings.nullToEmpty(prepared.getEncodedPlan()) : "");
    node.put("text", Strings.nullToEmpty(prepared.getText()));
    node.put("reqType", Strings.nullToEmpty(prepared.getType()));
    node.put("indexApiVersion", prepared.getIndexApiVersion());
    node.put("featureControls", prepared.getFeatureControls());
    node.put("namespace", Strings.nullToEmpty(prepared.getNamespace()));
    node.put("queryContext", Strings.nullToEmpty(prepared.getQueryContext()));
    PlanJson.putFlag(node, "useFts", prepared.isUseFts());
    PlanJson.putFlag(node, "useCBO", prepared.isUseCbo());
    if (!prepared.getIndexScanKeyspaces().isEmpty()) {
      ObjectNode keyspaces = node.putObject("indexScanKeyspaces");
      prepared.getIndexScanKeyspaces().forEach(keyspaces::put);
    }
    if (prepared.getOptimizerHints() != null) {
      node.set("optimizer_hints", prepared.getOptimizerHints());
    }
    PlanJson.putString(node, "tenant", prepared.getTenant());
    return node;
  }

  public Prepared fromJson(ObjectNode node) {
    JsonNode operatorNode = node.get("operator");
    if (operatorNode == null) {
      throw new PlanDecodingException("prepared plan has no operator");
    }
    JsonNode signature = node.get("signature");
    Prepared prepared =
        new Prepared(
            decodingContext.decodeOperator(operatorNode),
            signature == null || signature.isNull() ? null : signature);
    prepared.setPlanVersion((int) PlanJson.optLong(node, "planVersion", 0));
    prepared.setName(PlanJson.optString(node, "name"));
    prepared.setText(PlanJson.optString(node, "text"));
    prepared.setType(PlanJson.optString(node, "reqType"));
    prepared.setIndexApiVersion((int) PlanJson.optLong(node, "indexApiVersion", 0));
    prepared.setFeatureControls(PlanJson.optLong(node, "featureControls", 0));
    prepared.setNamespace(PlanJson.optString(node, "namespace"));
    prepared.setQueryContext(Strings.nullToEmpty(PlanJson.optString(node, "queryContext")));
    prepared.setTenant(PlanJson.optString(node, "tenant"));
    prepared.setUseFts(PlanJson.optBoolean(node, "useFts"));
    prepared.setUseCbo(PlanJson.optBoolean(node, "useCBO"));
    ObjectNode keyspaces = PlanJson.optObject(node, "indexScanKeyspaces");
    if (keyspaces != null) {
      Map<String, Boolean> scanned = new TreeMap<>();
      keyspaces.fields().forEachRemaining(e -> scanned.put(e.getKey(), e.getValue().asBoolean()));
      prepared.setIndexScanKeyspaces(scanned);
    }
    prepared.setOptimizerHints(PlanJson.optValue(node, "optimizer_hints"));
    return prepared;
  }
}
