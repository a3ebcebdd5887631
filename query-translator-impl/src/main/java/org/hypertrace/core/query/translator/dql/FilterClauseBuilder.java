package org.hypertrace.core.query.translator.dql;

import java.util.Optional;
import javax.inject.Inject;
import org.hypertrace.core.query.translator.ConversionContext;
import org.hypertrace.core.query.translator.mapping.ExpressionConverter;

class FilterClauseBuilder implements DqlClauseBuilder {
  private final ExpressionConverter expressionConverter;

  @Inject
  FilterClauseBuilder(ExpressionConverter expressionConverter) {
    this.expressionConverter = expressionConverter;
  }

  @Override
  public Optional<String> build(ConversionContext context) {
    return context
        .getParsedQuery()
        .getWhere()
        .map(where -> expressionConverter.convert(where, context))
        .filter(condition -> !condition.isEmpty())
        .map(condition -> "filter " + condition);
  }

  @Override
  public int getPriority() {
    return 10;
  }
}
