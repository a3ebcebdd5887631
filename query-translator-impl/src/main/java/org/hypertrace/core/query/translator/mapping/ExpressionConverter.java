package org.hypertrace.core.query.translator.mapping;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import javax.inject.Inject;
import org.hypertrace.core.query.translator.ConversionContext;
import org.hypertrace.core.query.translator.mapping.ExpressionToken.Type;

/**
 * Rewrites NRQL conditions and expressions into DQL syntax: maps attribute names through the
 * {@link FieldMapper}, turns {@code =} into {@code ==}, lower-cases boolean keywords and rewrites
 * {@code LIKE}, {@code IN} and {@code IS [NOT] NULL} into their DQL function forms.
 *
 * <p>String literals are copied untouched, and identifiers directly followed by {@code (} are
 * function names, not attributes.
 */
public class ExpressionConverter {
  private static final String LIKE_WILDCARD = "%";
  private static final Set<String> LOWER_CASED_KEYWORDS =
      Set.of("AND", "OR", "NOT", "TRUE", "FALSE", "NULL");

  private final FieldMapper fieldMapper;
  private final ExpressionTokenizer tokenizer = new ExpressionTokenizer();

  @Inject
  public ExpressionConverter(FieldMapper fieldMapper) {
    this.fieldMapper = fieldMapper;
  }

  public String convert(String expression, ConversionContext context) {
    return render(convertTokens(tokenizer.tokenize(expression), context));
  }

  private List<Piece> convertTokens(List<ExpressionToken> tokens, ConversionContext context) {
    List<Piece> pieces = new ArrayList<>();
    int i = 0;
    while (i < tokens.size()) {
      ExpressionToken token = tokens.get(i);
      switch (token.getType()) {
        case IDENTIFIER:
          if (LOWER_CASED_KEYWORDS.contains(token.upperText())) {
            pieces.add(Piece.word(token.getText().toLowerCase(Locale.ROOT)));
            i++;
          } else if (isAt(tokens, i + 1, Type.OPEN_PAREN)) {
            pieces.add(new Piece(PieceType.FUNCTION_NAME, token.getText()));
            i++;
          } else {
            i = convertFieldReference(tokens, i, pieces, context);
          }
          break;
        case QUOTED_IDENTIFIER:
          i = convertFieldReference(tokens, i, pieces, context);
          break;
        case OPERATOR:
          pieces.add(Piece.word(convertOperator(token.getText())));
          i++;
          break;
        case OPEN_PAREN:
          pieces.add(new Piece(PieceType.OPEN, "("));
          i++;
          break;
        case CLOSE_PAREN:
          pieces.add(new Piece(PieceType.CLOSE, ")"));
          i++;
          break;
        case COMMA:
          pieces.add(new Piece(PieceType.COMMA, ","));
          i++;
          break;
        default:
          pieces.add(Piece.word(token.getText()));
          i++;
      }
    }
    return pieces;
  }

  /**
   * Converts the attribute at {@code index} together with any postfix predicate applied to it and
   * returns the index of the first token not consumed.
   */
  private int convertFieldReference(
      List<ExpressionToken> tokens, int index, List<Piece> pieces, ConversionContext context) {
    String field = mapField(tokens.get(index), context);
    int next = index + 1;
    boolean negated = false;
    if (isKeywordAt(tokens, next, "NOT")
        && (isKeywordAt(tokens, next + 1, "LIKE") || isKeywordAt(tokens, next + 1, "IN"))) {
      negated = true;
      next++;
    }

    if (isKeywordAt(tokens, next, "LIKE") && isAt(tokens, next + 1, Type.STRING)) {
      pieces.add(Piece.word(convertLike(field, tokens.get(next + 1).getText(), negated, context)));
      return next + 2;
    }

    if (isKeywordAt(tokens, next, "IN") && isAt(tokens, next + 1, Type.OPEN_PAREN)) {
      int close = findClosingParenthesis(tokens, next + 1);
      if (close > 0) {
        String values = render(convertTokens(tokens.subList(next + 2, close), context));
        pieces.add(Piece.word((negated ? "not " : "") + "in(" + field + ", " + values + ")"));
        return close + 1;
      }
    }

    if (isKeywordAt(tokens, next, "IS")) {
      if (isKeywordAt(tokens, next + 1, "NULL")) {
        pieces.add(Piece.word("isNull(" + field + ")"));
        return next + 2;
      }
      if (isKeywordAt(tokens, next + 1, "NOT") && isKeywordAt(tokens, next + 2, "NULL")) {
        pieces.add(Piece.word("isNotNull(" + field + ")"));
        return next + 3;
      }
    }

    pieces.add(Piece.word(field));
    return index + 1;
  }

  private String mapField(ExpressionToken token, ConversionContext context) {
    if (token.is(Type.QUOTED_IDENTIFIER)) {
      String unquoted = token.getText().substring(1, Math.max(1, token.getText().length() - 1));
      String mapped = fieldMapper.mapField(unquoted, context);
      return mapped.equals(unquoted) ? token.getText() : mapped;
    }
    return fieldMapper.mapField(token.getText(), context);
  }

  /**
   * {@code %a%} becomes a phrase match, {@code a%} a prefix match, {@code %a} a suffix match and a
   * pattern without wildcards an equality check. A wildcard anywhere else cannot be expressed
   * directly and falls back to {@code matchesValue} with a warning.
   */
  private String convertLike(
      String field, String literal, boolean negated, ConversionContext context) {
    char quote = literal.charAt(0);
    String pattern =
        literal.length() >= 2 && literal.charAt(literal.length() - 1) == quote
            ? literal.substring(1, literal.length() - 1)
            : literal.substring(1);
    boolean leading = pattern.startsWith(LIKE_WILDCARD);
    boolean trailing = pattern.length() > 1 && pattern.endsWith(LIKE_WILDCARD);
    String value =
        pattern.substring(
            leading ? 1 : 0, Math.max(leading ? 1 : 0, pattern.length() - (trailing ? 1 : 0)));

    if (value.contains(LIKE_WILDCARD)) {
      context.addWarning(
          String.format(
              "LIKE pattern %s has inner wildcards; translated to matchesValue, verify the result",
              literal));
      String call =
          "matchesValue(" + field + ", " + quote + pattern.replace('%', '*') + quote + ")";
      return negated ? "not " + call : call;
    }

    String quoted = quote + value + quote;
    if (!leading && !trailing) {
      return field + (negated ? " != " : " == ") + quoted;
    }
    String function;
    if (leading && trailing) {
      function = "matchesPhrase";
    } else if (trailing) {
      function = "startsWith";
    } else {
      function = "endsWith";
    }
    String call = function + "(" + field + ", " + quoted + ")";
    return negated ? "not " + call : call;
  }

  private String convertOperator(String operator) {
    switch (operator) {
      case "=":
        return "==";
      case "<>":
        return "!=";
      default:
        return operator;
    }
  }

  private int findClosingParenthesis(List<ExpressionToken> tokens, int openIndex) {
    int depth = 0;
    for (int i = openIndex; i < tokens.size(); i++) {
      if (tokens.get(i).is(Type.OPEN_PAREN)) {
        depth++;
      } else if (tokens.get(i).is(Type.CLOSE_PAREN)) {
        depth--;
        if (depth == 0) {
          return i;
        }
      }
    }
    return -1;
  }

  private boolean isAt(List<ExpressionToken> tokens, int index, Type type) {
    return index < tokens.size() && tokens.get(index).is(type);
  }

  private boolean isKeywordAt(List<ExpressionToken> tokens, int index, String keyword) {
    return index < tokens.size() && tokens.get(index).isKeyword(keyword);
  }

  private String render(List<Piece> pieces) {
    StringBuilder builder = new StringBuilder();
    Piece previous = null;
    for (Piece piece : pieces) {
      if (previous != null && needsSpace(previous, piece)) {
        builder.append(' ');
      }
      builder.append(piece.text);
      previous = piece;
    }
    return builder.toString();
  }

  private boolean needsSpace(Piece previous, Piece current) {
    if (current.type == PieceType.CLOSE || current.type == PieceType.COMMA) {
      return false;
    }
    if (previous.type == PieceType.OPEN) {
      return false;
    }
    return !(previous.type == PieceType.FUNCTION_NAME && current.type == PieceType.OPEN);
  }

  private enum PieceType {
    WORD,
    FUNCTION_NAME,
    OPEN,
    CLOSE,
    COMMA
  }

  private static class Piece {
    private final PieceType type;
    private final String text;

    private Piece(PieceType type, String text) {
      this.type = type;
      this.text = text;
    }

    private static Piece word(String text) {
      return new Piece(PieceType.WORD, text);
    }
  }
}
