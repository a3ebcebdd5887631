package org.hypertrace.core.query.translator.parse;

import java.util.regex.Pattern;

public class QueryNormalizer {
  private static final Pattern WHITESPACE = Pattern.compile("\\s+");

  private QueryNormalizer() {}

  /** Collapses every whitespace run, newlines included, to a single space and trims the result. */
  public static String normalize(String query) {
    if (query == null) {
      return "";
    }
    return WHITESPACE.matcher(query).replaceAll(" ").trim();
  }
}
