/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.opensearch.docql.common.utils;

import java.util.Locale;

public class StringUtils {

  /**
   * Format a string with the root locale so that output does not depend on the default one.
   *
   * @param format format string
   * @param args arguments
   * @return formatted string
   */
  public static String format(final String format, Object... args) {
    return String.format(Locale.ROOT, format, args);
  }

  /**
   * Wrap a name in backticks unless it is a plain identifier. Embedded backticks are doubled.
   *
   * @param name identifier
   * @return name usable in an expression string
   */
  public static String quoteIdentifier(String name) {
    if (isPlainIdentifier(name)) {
      return name;
    }
    return "`" + name.replace("`", "``") + "`";
  }

  /** Returns true if the name starts with a letter or underscore and has only word characters. */
  public static boolean isPlainIdentifier(String name) {
    if (name == null || name.isEmpty()) {
      return false;
    }
    char first = name.charAt(0);
    if (!Character.isLetter(first) && first != '_') {
      return false;
    }
    for (int i = 1; i < name.length(); i++) {
      char c = name.charAt(i);
      if (!Character.isLetterOrDigit(c) && c != '_') {
        return false;
      }
    }
    return true;
  }
}
