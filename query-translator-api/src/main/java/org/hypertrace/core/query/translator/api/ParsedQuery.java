package org.hypertrace.core.query.translator.api;

import java.util.List;
import java.util.Optional;
import lombok.Builder;
import lombok.NonNull;
import lombok.Singular;
import lombok.Value;

/**
 * Clauses extracted from a source query. Every clause is optional; an empty value means the clause
 * was not present in the input, never that it was present but blank.
 */
@Value
@Builder(toBuilder = true)
public class ParsedQuery {
  public static final String TIMESERIES_AUTO = "AUTO";

  @NonNull @Builder.Default Optional<String> select = Optional.empty();
  @NonNull @Singular List<Selection> selections;
  @NonNull @Builder.Default Optional<String> from = Optional.empty();
  @NonNull @Singular List<String> eventTypes;
  @NonNull @Builder.Default Optional<String> where = Optional.empty();
  @NonNull @Singular List<String> facets;
  @NonNull @Builder.Default Optional<String> since = Optional.empty();
  @NonNull @Builder.Default Optional<String> until = Optional.empty();
  @NonNull @Builder.Default Optional<Integer> limit = Optional.empty();

  /** Bucket size such as {@code "5 minutes"}, or {@link #TIMESERIES_AUTO}. */
  @NonNull @Builder.Default Optional<String> timeseries = Optional.empty();

  @NonNull @Builder.Default Optional<String> compareWith = Optional.empty();
  @NonNull @Builder.Default Optional<String> orderBy = Optional.empty();

  public boolean hasAggregations() {
    return selections.stream()
        .anyMatch(selection -> selection.getSelectionCase() == Selection.SelectionCase.AGGREGATION);
  }

  /** The event type driving classification, the first one named in the FROM clause. */
  public Optional<String> getPrimaryEventType() {
    return eventTypes.isEmpty() ? Optional.empty() : Optional.of(eventTypes.get(0));
  }
}
