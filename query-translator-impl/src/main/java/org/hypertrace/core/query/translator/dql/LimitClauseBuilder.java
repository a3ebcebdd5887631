package org.hypertrace.core.query.translator.dql;

import java.util.Optional;
import org.hypertrace.core.query.translator.ConversionContext;

class LimitClauseBuilder implements DqlClauseBuilder {

  @Override
  public Optional<String> build(ConversionContext context) {
    return context.getParsedQuery().getLimit().map(limit -> "limit " + limit);
  }

  @Override
  public int getPriority() {
    return 40;
  }
}
