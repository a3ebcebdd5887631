package org.hypertrace.core.query.translator.parse;

import java.util.ArrayList;
import java.util.List;

/**
 * Splits comma separated lists where only commas outside parentheses and quoted text separate
 * items, so {@code count(*), percentile(duration, 95)} yields two items.
 */
public class TopLevelSplitter {

  private TopLevelSplitter() {}

  public static List<String> split(String text) {
    List<String> parts = new ArrayList<>();
    StringBuilder current = new StringBuilder();
    int depth = 0;
    char quote = 0;
    for (int i = 0; i < text.length(); i++) {
      char c = text.charAt(i);
      if (quote != 0) {
        current.append(c);
        if (c == '\\' && i + 1 < text.length()) {
          current.append(text.charAt(++i));
        } else if (c == quote) {
          quote = 0;
        }
        continue;
      }
      if (c == '\'' || c == '"' || c == '`') {
        quote = c;
      } else if (c == '(') {
        depth++;
      } else if (c == ')') {
        depth = Math.max(0, depth - 1);
      } else if (c == ',' && depth == 0) {
        addIfNotBlank(parts, current);
        current.setLength(0);
        continue;
      }
      current.append(c);
    }
    addIfNotBlank(parts, current);
    return parts;
  }

  /**
   * Index of the parenthesis closing the one opened at {@code openIndex}, or -1 when it is never
   * closed.
   */
  public static int findClosingParenthesis(String text, int openIndex) {
    int depth = 0;
    char quote = 0;
    for (int i = openIndex; i < text.length(); i++) {
      char c = text.charAt(i);
      if (quote != 0) {
        if (c == '\\') {
          i++;
        } else if (c == quote) {
          quote = 0;
        }
      } else if (c == '\'' || c == '"' || c == '`') {
        quote = c;
      } else if (c == '(') {
        depth++;
      } else if (c == ')') {
        depth--;
        if (depth == 0) {
          return i;
        }
      }
    }
    return -1;
  }

  public static String unquote(String text) {
    String trimmed = text.trim();
    if (trimmed.length() >= 2) {
      char first = trimmed.charAt(0);
      char last = trimmed.charAt(trimmed.length() - 1);
      if (first == last && (first == '\'' || first == '"' || first == '`')) {
        return trimmed.substring(1, trimmed.length() - 1);
      }
    }
    return trimmed;
  }

  private static void addIfNotBlank(List<String> parts, StringBuilder current) {
    String part = current.toString().trim();
    if (!part.isEmpty()) {
      parts.add(part);
    }
  }
}
