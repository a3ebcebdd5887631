package org.hypertrace.core.query.translator.mapping;

import java.util.ArrayList;
import java.util.List;
import org.hypertrace.core.query.translator.mapping.ExpressionToken.Type;

/** Splits a NRQL condition or expression into tokens. Whitespace is dropped. */
class ExpressionTokenizer {
  private static final String OPERATOR_CHARS = "=!<>+-*/%";

  List<ExpressionToken> tokenize(String expression) {
    List<ExpressionToken> tokens = new ArrayList<>();
    int i = 0;
    while (i < expression.length()) {
      char c = expression.charAt(i);
      if (Character.isWhitespace(c)) {
        i++;
      } else if (c == '\'' || c == '"') {
        int end = endOfQuoted(expression, i);
        tokens.add(new ExpressionToken(Type.STRING, expression.substring(i, end)));
        i = end;
      } else if (c == '`') {
        int end = endOfQuoted(expression, i);
        tokens.add(new ExpressionToken(Type.QUOTED_IDENTIFIER, expression.substring(i, end)));
        i = end;
      } else if (Character.isDigit(c)
          || (c == '-' && startsNegativeNumber(expression, i, tokens))) {
        int end = i + 1;
        while (end < expression.length()
            && (Character.isDigit(expression.charAt(end)) || expression.charAt(end) == '.')) {
          end++;
        }
        tokens.add(new ExpressionToken(Type.NUMBER, expression.substring(i, end)));
        i = end;
      } else if (isIdentifierStart(c)) {
        int end = i + 1;
        while (end < expression.length() && isIdentifierPart(expression.charAt(end))) {
          end++;
        }
        tokens.add(new ExpressionToken(Type.IDENTIFIER, expression.substring(i, end)));
        i = end;
      } else if (c == '(') {
        tokens.add(new ExpressionToken(Type.OPEN_PAREN, "("));
        i++;
      } else if (c == ')') {
        tokens.add(new ExpressionToken(Type.CLOSE_PAREN, ")"));
        i++;
      } else if (c == ',') {
        tokens.add(new ExpressionToken(Type.COMMA, ","));
        i++;
      } else if (OPERATOR_CHARS.indexOf(c) >= 0) {
        int end = i + 1;
        while (end < expression.length() && "=<>".indexOf(expression.charAt(end)) >= 0) {
          end++;
        }
        tokens.add(new ExpressionToken(Type.OPERATOR, expression.substring(i, end)));
        i = end;
      } else {
        tokens.add(new ExpressionToken(Type.OTHER, String.valueOf(c)));
        i++;
      }
    }
    return tokens;
  }

  /** Index just past the closing quote, or the end of input for an unterminated literal. */
  private int endOfQuoted(String expression, int start) {
    char quote = expression.charAt(start);
    int i = start + 1;
    while (i < expression.length()) {
      char c = expression.charAt(i);
      if (c == '\\') {
        i += 2;
      } else if (c == quote) {
        return i + 1;
      } else {
        i++;
      }
    }
    return expression.length();
  }

  private boolean startsNegativeNumber(String expression, int index, List<ExpressionToken> tokens) {
    if (index + 1 >= expression.length() || !Character.isDigit(expression.charAt(index + 1))) {
      return false;
    }
    if (tokens.isEmpty()) {
      return true;
    }
    ExpressionToken previous = tokens.get(tokens.size() - 1);
    return previous.is(Type.OPERATOR)
        || previous.is(Type.OPEN_PAREN)
        || previous.is(Type.COMMA)
        || (previous.is(Type.IDENTIFIER) && isConjunction(previous));
  }

  private boolean isConjunction(ExpressionToken token) {
    return token.isKeyword("AND") || token.isKeyword("OR") || token.isKeyword("NOT");
  }

  private boolean isIdentifierStart(char c) {
    return Character.isLetter(c) || c == '_' || c == '$' || c == '@';
  }

  private boolean isIdentifierPart(char c) {
    return Character.isLetterOrDigit(c) || c == '_' || c == '.' || c == '$' || c == '@';
  }
}
