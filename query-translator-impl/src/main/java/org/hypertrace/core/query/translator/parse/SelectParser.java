package org.hypertrace.core.query.translator.parse;

import java.util.List;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Collectors;
import org.hypertrace.core.query.translator.api.Selection;
import org.hypertrace.core.query.translator.api.Selection.Aggregation;
import org.hypertrace.core.query.translator.api.Selection.AllFields;
import org.hypertrace.core.query.translator.api.Selection.BareExpression;

/** Parses the text of a SELECT clause into {@link Selection}s. */
public class SelectParser {
  private static final String ALL_FIELDS = "*";
  private static final Pattern FUNCTION_NAME = Pattern.compile("[A-Za-z_][A-Za-z0-9_]*");
  private static final Pattern ALIAS = Pattern.compile("(?i)^AS\\s+(.+)$");

  public List<Selection> parse(String selectClause) {
    return TopLevelSplitter.split(selectClause).stream()
        .map(this::parseSelection)
        .collect(Collectors.toUnmodifiableList());
  }

  public Selection parseSelection(String part) {
    if (ALL_FIELDS.equals(part)) {
      return AllFields.INSTANCE;
    }
    return parseAggregation(part).orElseGet(() -> new BareExpression(part));
  }

  private Optional<Selection> parseAggregation(String part) {
    int openIndex = part.indexOf('(');
    if (openIndex <= 0) {
      return Optional.empty();
    }
    String functionName = part.substring(0, openIndex).trim();
    if (!FUNCTION_NAME.matcher(functionName).matches()) {
      return Optional.empty();
    }
    int closeIndex = TopLevelSplitter.findClosingParenthesis(part, openIndex);
    if (closeIndex < 0) {
      return Optional.empty();
    }
    String fieldExpression = part.substring(openIndex + 1, closeIndex).trim();
    String remainder = part.substring(closeIndex + 1).trim();
    if (remainder.isEmpty()) {
      return Optional.of(new Aggregation(functionName, fieldExpression, Optional.empty()));
    }
    Matcher aliasMatcher = ALIAS.matcher(remainder);
    if (!aliasMatcher.matches()) {
      // e.g. count(*) * 100, an arithmetic expression rather than a single aggregation
      return Optional.empty();
    }
    String alias = TopLevelSplitter.unquote(aliasMatcher.group(1));
    return Optional.of(
        new Aggregation(
            functionName,
            fieldExpression,
            alias.isEmpty() ? Optional.empty() : Optional.of(alias)));
  }
}
