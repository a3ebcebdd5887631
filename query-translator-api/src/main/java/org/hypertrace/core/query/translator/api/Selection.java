package org.hypertrace.core.query.translator.api;

import java.util.Optional;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.NonNull;
import lombok.Value;

/** A single item of a SELECT clause. */
public interface Selection {

  SelectionCase getSelectionCase();

  enum SelectionCase {
    ALL_FIELDS,
    BARE_EXPRESSION,
    AGGREGATION
  }

  /** The {@code *} selector. */
  @Value
  @AllArgsConstructor(access = AccessLevel.PRIVATE)
  class AllFields implements Selection {
    public static final AllFields INSTANCE = new AllFields();

    @Override
    public SelectionCase getSelectionCase() {
      return SelectionCase.ALL_FIELDS;
    }
  }

  @Value
  class BareExpression implements Selection {
    @NonNull String text;

    @Override
    public SelectionCase getSelectionCase() {
      return SelectionCase.BARE_EXPRESSION;
    }
  }

  /**
   * A function application such as {@code average(duration) AS avgDuration}. The field expression
   * is kept as written, so {@code percentile(duration, 95)} carries {@code "duration, 95"}.
   */
  @Value
  class Aggregation implements Selection {
    @NonNull String functionName;
    @NonNull String fieldExpression;
    @NonNull Optional<String> alias;

    @Override
    public SelectionCase getSelectionCase() {
      return SelectionCase.AGGREGATION;
    }
  }
}
