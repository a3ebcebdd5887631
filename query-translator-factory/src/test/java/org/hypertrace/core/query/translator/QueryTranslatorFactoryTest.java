package org.hypertrace.core.query.translator;

import static org.junit.jupiter.api.Assertions.assertEquals;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigFactory;
import java.util.List;
import java.util.stream.Collectors;
import org.hypertrace.core.query.translator.api.Confidence;
import org.hypertrace.core.query.translator.api.ConversionResult;
import org.hypertrace.core.query.translator.api.QueryTranslator;
import org.junit.jupiter.api.Test;

class QueryTranslatorFactoryTest {

  @Test
  void buildsTranslatorFromDefaultConfig() {
    QueryTranslator translator = QueryTranslatorFactory.fromDefaultConfig().buildTranslator();

    ConversionResult result =
        translator.convert("SELECT uniqueCount(userId) FROM Transaction SINCE 1 hour ago");

    assertEquals(
        "timeseries builtin:service.response.time, from:now()-1h\n"
            + "| summarize countDistinct(userId)",
        result.getConvertedQuery());
    assertEquals(Confidence.HIGH, result.getConfidence());
  }

  @Test
  void appliesConfigOverrides() {
    Config config =
        ConfigFactory.parseString("query.translator.mappings.fields.userId = \"usr.id\"")
            .withFallback(ConfigFactory.load());
    QueryTranslator translator = QueryTranslatorFactory.fromConfig(config).buildTranslator();

    assertEquals(
        "fetch logs\n| filter usr.id == 'u-1'",
        translator.convert("SELECT * FROM Log WHERE userId = 'u-1'").getConvertedQuery());
  }

  @Test
  void buildsBatchService() {
    List<ConversionResult> results =
        QueryTranslatorFactory.fromDefaultConfig()
            .buildService()
            .translateAll(
                List.of(
                    "SELECT count(*) FROM Transaction COMPARE WITH 1 day ago",
                    "SELECT count(*) FROM Log"))
            .blockingGet();

    assertEquals(
        List.of(Confidence.LOW, Confidence.HIGH),
        results.stream().map(ConversionResult::getConfidence).collect(Collectors.toList()));
  }
}
