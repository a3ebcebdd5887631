package org.hypertrace.core.query.translator.api;

import java.util.List;
import java.util.Map;
import lombok.Builder;
import lombok.NonNull;
import lombok.Singular;
import lombok.Value;

/** Outcome of translating one source query. */
@Value
@Builder
public class ConversionResult {
  @NonNull String originalQuery;
  @NonNull String convertedQuery;
  @NonNull QueryType queryType;
  @NonNull Confidence confidence;
  @NonNull @Singular List<String> warnings;
  @NonNull @Singular List<String> manualReviewItems;

  /** Source field to target field, in the order the mappings were first applied. */
  @NonNull
  @Singular("fieldMappingApplied")
  Map<String, String> fieldMappingsApplied;

  public boolean needsManualReview() {
    return !manualReviewItems.isEmpty();
  }
}
