package org.hypertrace.core.query.translator;

import com.google.inject.Guice;
import com.google.inject.Injector;
import com.typesafe.config.Config;
import com.typesafe.config.ConfigFactory;
import org.hypertrace.core.query.translator.api.QueryTranslator;

public class QueryTranslatorFactory {
  private static final String QUERY_TRANSLATOR_CONFIG = "query.translator";

  private final Injector injector;

  private QueryTranslatorFactory(Config config) {
    this.injector =
        Guice.createInjector(new QueryTranslatorModule(config.getConfig(QUERY_TRANSLATOR_CONFIG)));
  }

  /** Builds a factory from a root config holding a {@code query.translator} section. */
  public static QueryTranslatorFactory fromConfig(Config config) {
    return new QueryTranslatorFactory(config);
  }

  /** Builds a factory from the default configuration, including the bundled mapping tables. */
  public static QueryTranslatorFactory fromDefaultConfig() {
    return new QueryTranslatorFactory(ConfigFactory.load());
  }

  public QueryTranslator buildTranslator() {
    return injector.getInstance(QueryTranslator.class);
  }

  public QueryTranslationService buildService() {
    return injector.getInstance(QueryTranslationService.class);
  }
}
