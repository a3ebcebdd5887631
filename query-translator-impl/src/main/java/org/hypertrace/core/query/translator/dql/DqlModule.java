package org.hypertrace.core.query.translator.dql;

import com.google.inject.AbstractModule;
import com.google.inject.multibindings.Multibinder;

public class DqlModule extends AbstractModule {
  @Override
  protected void configure() {
    Multibinder<DqlClauseBuilder> clauseBuilderMultibinder =
        Multibinder.newSetBinder(binder(), DqlClauseBuilder.class);
    clauseBuilderMultibinder.addBinding().to(FetchClauseBuilder.class);
    clauseBuilderMultibinder.addBinding().to(FilterClauseBuilder.class);
    clauseBuilderMultibinder.addBinding().to(SummarizeClauseBuilder.class);
    clauseBuilderMultibinder.addBinding().to(SortClauseBuilder.class);
    clauseBuilderMultibinder.addBinding().to(LimitClauseBuilder.class);
  }
}
