package org.hypertrace.core.query.translator.mapping;

import java.util.Optional;
import javax.inject.Inject;
import org.hypertrace.core.query.translator.ConversionContext;

/** Maps NRQL aggregation functions to their DQL counterparts. */
public class FunctionMapper {
  /** Appended to a function emitted verbatim because it has no DQL equivalent. */
  public static final String UNMAPPED_MARKER = "/* unmapped */";

  private final MappingTables mappingTables;

  @Inject
  public FunctionMapper(MappingTables mappingTables) {
    this.mappingTables = mappingTables;
  }

  /**
   * Returns the DQL function name, or empty after recording a manual review item when the function
   * is unsupported or unknown.
   */
  public Optional<String> mapFunction(String functionName, ConversionContext context) {
    if (mappingTables.isUnsupportedAggregationFunction(functionName)) {
      context.addManualReviewItem(
          String.format(
              "Aggregation '%s' is not supported in DQL and needs manual conversion",
              functionName));
      return Optional.empty();
    }
    Optional<String> target = mappingTables.findAggregationFunction(functionName);
    if (target.isEmpty()) {
      context.addManualReviewItem(
          String.format(
              "Aggregation '%s' has no known DQL equivalent and needs manual conversion",
              functionName));
    }
    return target;
  }
}
