package org.hypertrace.core.query.translator.mapping;

import java.util.Locale;
import lombok.Value;

@Value
class ExpressionToken {
  enum Type {
    IDENTIFIER,
    QUOTED_IDENTIFIER,
    STRING,
    NUMBER,
    OPERATOR,
    OPEN_PAREN,
    CLOSE_PAREN,
    COMMA,
    OTHER
  }

  Type type;
  String text;

  boolean isKeyword(String keyword) {
    return type == Type.IDENTIFIER && text.equalsIgnoreCase(keyword);
  }

  boolean is(Type type) {
    return this.type == type;
  }

  String upperText() {
    return text.toUpperCase(Locale.ROOT);
  }
}
