package org.hypertrace.core.query.translator;

import com.google.inject.AbstractModule;
import com.typesafe.config.Config;
import org.hypertrace.core.query.translator.api.QueryTranslator;
import org.hypertrace.core.query.translator.dql.DqlModule;
import org.hypertrace.core.query.translator.mapping.MappingTables;
import org.hypertrace.core.query.translator.validation.QueryValidationModule;

class QueryTranslatorModule extends AbstractModule {

  private final QueryTranslatorConfig config;

  QueryTranslatorModule(Config config) {
    this.config = new QueryTranslatorConfig(config);
  }

  @Override
  protected void configure() {
    bind(QueryTranslatorConfig.class).toInstance(this.config);
    bind(MappingTables.class).toInstance(this.config.getMappingTables());
    bind(QueryTranslator.class).to(QueryTranslatorImpl.class);
    install(new DqlModule());
    install(new QueryValidationModule());
  }
}
