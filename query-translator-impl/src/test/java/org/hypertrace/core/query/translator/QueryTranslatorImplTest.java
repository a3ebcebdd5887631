package org.hypertrace.core.query.translator;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.google.inject.Guice;
import com.google.inject.util.Modules;
import java.util.List;
import java.util.Map;
import org.hypertrace.core.query.translator.api.Confidence;
import org.hypertrace.core.query.translator.api.ConversionResult;
import org.hypertrace.core.query.translator.api.QueryTranslator;
import org.hypertrace.core.query.translator.api.QueryType;
import org.hypertrace.core.query.translator.mapping.EventTypeMapping;
import org.hypertrace.core.query.translator.mapping.MappingTables;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class QueryTranslatorImplTest {
  private QueryTranslator queryTranslator;

  @BeforeEach
  void setup() {
    queryTranslator =
        Guice.createInjector(new QueryTranslatorModule(TranslatorTestUtils.defaultConfig()))
            .getInstance(QueryTranslator.class);
  }

  @Test
  void convertsCountOverTransactions() {
    ConversionResult result =
        queryTranslator.convert("SELECT count(*) FROM Transaction SINCE 1 hour ago");

    assertEquals(
        "timeseries builtin:service.response.time, from:now()-1h\n| summarize count()",
        result.getConvertedQuery());
    assertEquals(QueryType.METRICS, result.getQueryType());
    assertEquals(Confidence.HIGH, result.getConfidence());
    assertTrue(result.getWarnings().isEmpty());
    assertFalse(result.needsManualReview());
  }

  @Test
  void convertsFilteredFacetedAverage() {
    ConversionResult result =
        queryTranslator.convert(
            "SELECT average(duration) FROM Transaction WHERE appName = 'MyApp' FACET name "
                + "SINCE 24 hours ago LIMIT 10");

    assertEquals(
        "timeseries builtin:service.response.time, from:now()-24h\n"
            + "| filter service.name == 'MyApp'\n"
            + "| summarize avg(response_time), by: {service.name}\n"
            + "| limit 10",
        result.getConvertedQuery());
    assertEquals(
        List.of("appName", "duration", "name"),
        List.copyOf(result.getFieldMappingsApplied().keySet()));
    assertEquals(
        Map.of("appName", "service.name", "duration", "response_time", "name", "service.name"),
        result.getFieldMappingsApplied());
    assertEquals(Confidence.HIGH, result.getConfidence());
  }

  @Test
  void convertsLikeToPhraseMatch() {
    ConversionResult result =
        queryTranslator.convert(
            "SELECT count(*) FROM Transaction WHERE name LIKE '%login%' SINCE 1 hour ago");

    assertEquals(
        "timeseries builtin:service.response.time, from:now()-1h\n"
            + "| filter matchesPhrase(service.name, 'login')\n"
            + "| summarize count()",
        result.getConvertedQuery());
  }

  @Test
  void convertsUniqueCount() {
    ConversionResult result =
        queryTranslator.convert("SELECT uniqueCount(userId) FROM Transaction SINCE 1 hour ago");

    assertTrue(result.getConvertedQuery().endsWith("\n| summarize countDistinct(userId)"));
    assertEquals(Confidence.HIGH, result.getConfidence());
  }

  @Test
  void compareWithNeedsManualReview() {
    ConversionResult result =
        queryTranslator.convert(
            "SELECT count(*) FROM Transaction SINCE 1 day ago COMPARE WITH 1 week ago");

    assertEquals(
        List.of("COMPARE WITH 1 week ago requires manual implementation in DQL"),
        result.getManualReviewItems());
    assertEquals(Confidence.LOW, result.getConfidence());
    assertEquals(
        "timeseries builtin:service.response.time, from:now()-1d\n| summarize count()",
        result.getConvertedQuery());
  }

  @Test
  void convertsLogSearch() {
    ConversionResult result =
        queryTranslator.convert(
            "SELECT message FROM Log WHERE level = 'ERROR' AND message LIKE '%timeout%' "
                + "SINCE 30 minutes ago ORDER BY timestamp DESC LIMIT 100");

    assertEquals(
        "fetch logs, from:now()-30m\n"
            + "| filter loglevel == 'ERROR' and matchesPhrase(content, 'timeout')\n"
            + "| sort timestamp desc\n"
            + "| limit 100",
        result.getConvertedQuery());
    assertEquals(QueryType.LOGS, result.getQueryType());
    assertEquals(Confidence.HIGH, result.getConfidence());
  }

  @Test
  void convertsTimeseriesWithUntil() {
    ConversionResult result =
        queryTranslator.convert(
            "SELECT average(duration) FROM Transaction SINCE 2 days ago UNTIL 1 day ago "
                + "TIMESERIES 1 hour");

    assertEquals(
        "timeseries builtin:service.response.time, from:now()-2d, to:now()-1d\n"
            + "| makeTimeseries avg(response_time), interval:1h",
        result.getConvertedQuery());
  }

  @Test
  void oversizedTimeAmountsBecomeWarnings() {
    ConversionResult since =
        queryTranslator.convert(
            "SELECT count(*) FROM Transaction SINCE 99999999999999999999 hours ago");
    assertEquals(
        "timeseries builtin:service.response.time\n| summarize count()", since.getConvertedQuery());
    assertEquals(
        List.of("Could not convert time range: 99999999999999999999 hours ago"),
        since.getWarnings());

    ConversionResult months =
        queryTranslator.convert("SELECT count(*) FROM Log SINCE 999999999999999999 months ago");
    assertEquals("fetch logs\n| summarize count()", months.getConvertedQuery());
    assertEquals(Confidence.MEDIUM, months.getConfidence());

    ConversionResult timeseries =
        queryTranslator.convert(
            "SELECT count(*) FROM Transaction TIMESERIES 99999999999999999999 minutes");
    assertEquals(
        List.of("Could not convert TIMESERIES interval: 99999999999999999999 minutes"),
        timeseries.getWarnings());
  }

  @Test
  void dottedAttributeKeepsWholeFilter() {
    ConversionResult result =
        queryTranslator.convert("SELECT count(*) FROM Log WHERE email.from = 'a' FACET level");

    assertEquals(
        "fetch logs\n| filter email.from == 'a'\n| summarize count(), by: {loglevel}",
        result.getConvertedQuery());
    assertTrue(result.getWarnings().isEmpty());
  }

  @Test
  void normalizesWhitespaceIntoOriginalQuery() {
    ConversionResult result = queryTranslator.convert("  SELECT  count(*)\n  FROM   Log  ");

    assertEquals("SELECT count(*) FROM Log", result.getOriginalQuery());
    assertEquals("fetch logs\n| summarize count()", result.getConvertedQuery());
  }

  @Test
  void emptyQueryStillProducesPipeline() {
    ConversionResult result = queryTranslator.convert(null);

    assertEquals("", result.getOriginalQuery());
    assertEquals("fetch bizevents", result.getConvertedQuery());
    assertEquals(QueryType.UNKNOWN, result.getQueryType());
    assertEquals(Confidence.LOW, result.getConfidence());
    assertEquals(List.of("No SELECT clause found"), result.getWarnings());
    assertTrue(result.needsManualReview());
  }

  @Test
  void unsupportedAggregationLowersConfidence() {
    ConversionResult result =
        queryTranslator.convert("SELECT histogram(duration) FROM Transaction SINCE 1 hour ago");

    assertTrue(result.getConvertedQuery().contains("histogram(response_time) /* unmapped */"));
    assertEquals(Confidence.LOW, result.getConfidence());
  }

  @Test
  void warningsLowerConfidence() {
    ConversionResult oneWarning =
        queryTranslator.convert("SELECT count(*) FROM CheckoutCompleted SINCE 1 hour ago");
    assertEquals(Confidence.MEDIUM, oneWarning.getConfidence());
    assertEquals(
        "fetch bizevents, from:now()-1h\n| summarize count()", oneWarning.getConvertedQuery());

    ConversionResult threeWarnings =
        queryTranslator.convert(
            "SELECT appName, count(*) FROM CheckoutCompleted SINCE yesterday");
    assertEquals(3, threeWarnings.getWarnings().size());
    assertEquals(Confidence.LOW, threeWarnings.getConfidence());
  }

  @Test
  void usesInjectedTables() {
    MappingTables mappingTables =
        MappingTables.builder()
            .fieldMapping("appName", "app.name")
            .aggregationFunction("average", "avg")
            .eventType("Transaction", EventTypeMapping.of(QueryType.LOGS))
            .build();
    QueryTranslator translator =
        Guice.createInjector(
                Modules.override(new QueryTranslatorModule(TranslatorTestUtils.defaultConfig()))
                    .with(binder -> binder.bind(MappingTables.class).toInstance(mappingTables)))
            .getInstance(QueryTranslator.class);

    ConversionResult result =
        translator.convert("SELECT average(duration) FROM Transaction WHERE appName = 'x'");

    assertEquals(
        "fetch logs\n| filter app.name == 'x'\n| summarize avg(duration)",
        result.getConvertedQuery());
    assertEquals(Map.of("appName", "app.name"), result.getFieldMappingsApplied());
  }
}
