package org.hypertrace.core.query.translator.dql;

import java.util.Locale;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Collectors;
import javax.inject.Inject;
import org.hypertrace.core.query.translator.ConversionContext;
import org.hypertrace.core.query.translator.mapping.ExpressionConverter;
import org.hypertrace.core.query.translator.parse.TopLevelSplitter;

class SortClauseBuilder implements DqlClauseBuilder {
  private static final Pattern SORT_ITEM =
      Pattern.compile("^(.*?)(?:\\s+(ASC|DESC))?$", Pattern.CASE_INSENSITIVE);

  private final ExpressionConverter expressionConverter;

  @Inject
  SortClauseBuilder(ExpressionConverter expressionConverter) {
    this.expressionConverter = expressionConverter;
  }

  @Override
  public Optional<String> build(ConversionContext context) {
    return context
        .getParsedQuery()
        .getOrderBy()
        .map(
            orderBy ->
                TopLevelSplitter.split(orderBy).stream()
                    .map(item -> convertSortItem(item, context))
                    .collect(Collectors.joining(", ")))
        .filter(sort -> !sort.isEmpty())
        .map(sort -> "sort " + sort);
  }

  @Override
  public int getPriority() {
    return 30;
  }

  private String convertSortItem(String item, ConversionContext context) {
    Matcher matcher = SORT_ITEM.matcher(item);
    if (!matcher.matches() || matcher.group(2) == null) {
      return expressionConverter.convert(item, context);
    }
    return expressionConverter.convert(matcher.group(1), context)
        + " "
        + matcher.group(2).toLowerCase(Locale.ROOT);
  }
}
