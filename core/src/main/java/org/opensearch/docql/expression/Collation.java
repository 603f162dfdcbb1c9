/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.opensearch.docql.expression;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.Comparator;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Total order over document values as seen by an index: null, then false and true, then numbers,
 * then strings, then arrays (element-wise), then objects.
 *
 * <p>Integral and floating point numbers compare by exact value, so a long above 2^53 is not
 * taken for the nearest double. Objects compare by number of fields, then by their sorted field
 * names, then by the values of those fields.
 */
public final class Collation implements Comparator<Object> {

  public static final Collation INSTANCE = new Collation();

  private Collation() {}

  @Override
  public int compare(Object left, Object right) {
    int rank = Integer.compare(rank(left), rank(right));
    if (rank != 0) {
      return rank;
    }
    if (left == null) {
      return 0;
    }
    if (left instanceof Boolean) {
      return Boolean.compare((Boolean) left, (Boolean) right);
    }
    if (left instanceof Number) {
      return compareNumbers((Number) left, (Number) right);
    }
    if (left instanceof String) {
      return ((String) left).compareTo((String) right);
    }
    if (left instanceof List) {
      return compareLists((List<?>) left, (List<?>) right);
    }
    return compareObjects((Map<?, ?>) left, (Map<?, ?>) right);
  }

  private int compareNumbers(Number left, Number right) {
    if (isIntegral(left) && isIntegral(right)) {
      return Long.compare(left.longValue(), right.longValue());
    }
    double l = left.doubleValue();
    double r = right.doubleValue();
    if (!Double.isFinite(l) || !Double.isFinite(r) || !(isExact(left) || isExact(right))) {
      return Double.compare(l, r);
    }
    return exactValue(left).compareTo(exactValue(right));
  }

  private static boolean isIntegral(Number value) {
    return value instanceof Long
        || value instanceof Integer
        || value instanceof Short
        || value instanceof Byte;
  }

  private static boolean isExact(Number value) {
    return isIntegral(value) || value instanceof BigDecimal || value instanceof BigInteger;
  }

  private static BigDecimal exactValue(Number value) {
    if (isIntegral(value)) {
      return BigDecimal.valueOf(value.longValue());
    }
    if (value instanceof BigDecimal) {
      return (BigDecimal) value;
    }
    if (value instanceof BigInteger) {
      return new BigDecimal((BigInteger) value);
    }
    return new BigDecimal(value.doubleValue());
  }

  private int compareLists(List<?> left, List<?> right) {
    int n = Math.min(left.size(), right.size());
    for (int i = 0; i < n; i++) {
      int c = compare(left.get(i), right.get(i));
      if (c != 0) {
        return c;
      }
    }
    return Integer.compare(left.size(), right.size());
  }

  private int compareObjects(Map<?, ?> left, Map<?, ?> right) {
    int c = Integer.compare(left.size(), right.size());
    if (c != 0) {
      return c;
    }
    Map<Object, Object> l = new TreeMap<>(this);
    l.putAll(left);
    Map<Object, Object> r = new TreeMap<>(this);
    r.putAll(right);
    Iterator<Object> rightKeys = r.keySet().iterator();
    for (Object key : l.keySet()) {
      c = compare(key, rightKeys.next());
      if (c != 0) {
        return c;
      }
    }
    Iterator<Object> rightValues = r.values().iterator();
    for (Object value : l.values()) {
      c = compare(value, rightValues.next());
      if (c != 0) {
        return c;
      }
    }
    return 0;
  }

  private static int rank(Object value) {
    if (value == null) {
      return 0;
    }
    if (value instanceof Boolean) {
      return 1;
    }
    if (value instanceof Number) {
      return 2;
    }
    if (value instanceof String) {
      return 3;
    }
    if (value instanceof List) {
      return 4;
    }
    if (value instanceof Map) {
      return 5;
    }
    throw new IllegalArgumentException("value is not collatable: " + value.getClass().getName());
  }
}
