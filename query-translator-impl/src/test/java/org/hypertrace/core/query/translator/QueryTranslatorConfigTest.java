package org.hypertrace.core.query.translator;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigException;
import com.typesafe.config.ConfigFactory;
import java.util.Optional;
import org.hypertrace.core.query.translator.QueryTranslatorConfig.LimitValidationConfig.LimitValidationMode;
import org.hypertrace.core.query.translator.api.QueryType;
import org.hypertrace.core.query.translator.mapping.EventTypeMapping;
import org.hypertrace.core.query.translator.mapping.MappingTables;
import org.junit.jupiter.api.Test;

class QueryTranslatorConfigTest {

  @Test
  void parsesDefaultTables() {
    QueryTranslatorConfig config = new QueryTranslatorConfig(TranslatorTestUtils.defaultConfig());
    MappingTables mappingTables = config.getMappingTables();

    assertEquals(Optional.of("service.name"), mappingTables.findFieldMapping("appName"));
    assertEquals(Optional.of("error.type"), mappingTables.findFieldMapping("error.class"));
    assertEquals(Optional.of("content"), mappingTables.findFieldMapping("log.message"));
    assertEquals(Optional.of("avg"), mappingTables.findAggregationFunction("average"));
    assertEquals(Optional.of("count"), mappingTables.findAggregationFunction("count"));
    assertTrue(mappingTables.isUnsupportedAggregationFunction("funnel"));
    assertTrue(mappingTables.isUnsupportedAggregationFunction("histogram"));
    assertTrue(mappingTables.isUnsupportedAggregationFunction("percentage"));
    assertFalse(mappingTables.findAggregationFunction("funnel").isPresent());
    assertEquals(
        Optional.of(EventTypeMapping.of(QueryType.METRICS, "builtin:service.response.time")),
        mappingTables.findEventType("Transaction"));
    assertEquals(
        Optional.of(EventTypeMapping.of(QueryType.EVENTS)),
        mappingTables.findEventType("PageView"));
    assertEquals(Optional.of("7d"), mappingTables.findTimePhrase("1 week ago"));

    assertEquals(1, config.getLimitValidationConfig().getMin());
    assertEquals(100000, config.getLimitValidationConfig().getMax());
    assertEquals(LimitValidationMode.WARN, config.getLimitValidationConfig().getMode());
    assertEquals(4, config.getBatchMaxConcurrency());
  }

  @Test
  void overridesMergeWithDefaults() {
    Config overrides =
        ConfigFactory.parseString(
            "mappings.fields { appName = \"app.name\", \"custom.attr\" = \"custom\" }\n"
                + "mappings.timePhrases { \"Last Hour\" = \"1h\" }\n"
                + "validation.limit.mode = DISABLED");
    QueryTranslatorConfig config =
        new QueryTranslatorConfig(overrides.withFallback(TranslatorTestUtils.defaultConfig()));

    assertEquals(Optional.of("app.name"), config.getMappingTables().findFieldMapping("appName"));
    assertEquals(Optional.of("custom"), config.getMappingTables().findFieldMapping("custom.attr"));
    assertEquals(Optional.of("host.name"), config.getMappingTables().findFieldMapping("host"));
    assertEquals(Optional.of("1h"), config.getMappingTables().findTimePhrase("last hour"));
    assertEquals(LimitValidationMode.DISABLED, config.getLimitValidationConfig().getMode());
  }

  @Test
  void rejectsMalformedTables() {
    Config nonStringField = ConfigFactory.parseString("mappings.fields { appName = 5 }");
    assertThrows(
        ConfigException.WrongType.class,
        () ->
            new QueryTranslatorConfig(
                nonStringField.withFallback(TranslatorTestUtils.defaultConfig())));

    Config badDomain =
        ConfigFactory.parseString("mappings.eventTypes { Checkout { domain = WIDGETS } }");
    assertThrows(
        ConfigException.BadValue.class,
        () ->
            new QueryTranslatorConfig(badDomain.withFallback(TranslatorTestUtils.defaultConfig())));
  }
}
