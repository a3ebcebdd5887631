package org.hypertrace.core.query.translator.mapping;

import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableSet;
import java.util.Map;
import java.util.Optional;
import lombok.Builder;
import lombok.NonNull;
import lombok.Singular;
import lombok.Value;

/**
 * Read-only lookup tables driving the translation. Built once from configuration and shared by
 * every conversion; lookups never mutate the tables.
 */
@Value
@Builder
public class MappingTables {
  /** NRQL attribute name to DQL field name. */
  @NonNull @Singular ImmutableMap<String, String> fieldMappings;

  /** NRQL aggregation function to DQL function name. */
  @NonNull @Singular ImmutableMap<String, String> aggregationFunctions;

  /** NRQL aggregation functions known to have no DQL equivalent. */
  @NonNull @Singular ImmutableSet<String> unsupportedAggregationFunctions;

  @NonNull @Singular ImmutableMap<String, EventTypeMapping> eventTypes;

  /** Literal SINCE/UNTIL phrase to a DQL duration such as {@code 1h}. */
  @NonNull @Singular ImmutableMap<String, String> timePhrases;

  /** Exact match first, then a case insensitive match in table order. */
  public Optional<String> findFieldMapping(String field) {
    String exact = fieldMappings.get(field);
    if (exact != null) {
      return Optional.of(exact);
    }
    return findIgnoringCase(fieldMappings, field);
  }

  public Optional<String> findAggregationFunction(String functionName) {
    return findIgnoringCase(aggregationFunctions, functionName);
  }

  public boolean isUnsupportedAggregationFunction(String functionName) {
    return unsupportedAggregationFunctions.stream()
        .anyMatch(unsupported -> unsupported.equalsIgnoreCase(functionName));
  }

  public Optional<EventTypeMapping> findEventType(String eventType) {
    return findIgnoringCase(eventTypes, eventType);
  }

  public Optional<String> findTimePhrase(String phrase) {
    return findIgnoringCase(timePhrases, phrase);
  }

  private static <V> Optional<V> findIgnoringCase(Map<String, V> table, String key) {
    return table.entrySet().stream()
        .filter(entry -> entry.getKey().equalsIgnoreCase(key))
        .map(Map.Entry::getValue)
        .findFirst();
  }
}
