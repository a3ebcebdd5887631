package org.hypertrace.core.query.translator.mapping;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.List;
import java.util.Optional;
import org.hypertrace.core.query.translator.ConversionContext;
import org.hypertrace.core.query.translator.TranslatorTestUtils;
import org.hypertrace.core.query.translator.api.ParsedQuery;
import org.junit.jupiter.api.Test;

class FunctionMapperTest {
  private final FunctionMapper functionMapper =
      new FunctionMapper(TranslatorTestUtils.defaultMappingTables());
  private final ConversionContext context = new ConversionContext(ParsedQuery.builder().build());

  @Test
  void mapsKnownFunctions() {
    assertEquals(Optional.of("avg"), functionMapper.mapFunction("average", context));
    assertEquals(Optional.of("countDistinct"), functionMapper.mapFunction("uniqueCount", context));
    assertEquals(Optional.of("last"), functionMapper.mapFunction("LATEST", context));
    assertTrue(context.getManualReviewItems().isEmpty());
  }

  @Test
  void unsupportedFunctionsNeedManualReview() {
    assertEquals(Optional.empty(), functionMapper.mapFunction("funnel", context));
    assertEquals(
        List.of("Aggregation 'funnel' is not supported in DQL and needs manual conversion"),
        context.getManualReviewItems());
  }

  @Test
  void unknownFunctionsNeedManualReview() {
    assertEquals(Optional.empty(), functionMapper.mapFunction("cardinality", context));
    assertEquals(
        List.of(
            "Aggregation 'cardinality' has no known DQL equivalent and needs manual conversion"),
        context.getManualReviewItems());
  }
}
