package org.hypertrace.core.query.translator.mapping;

import java.util.Optional;
import lombok.NonNull;
import lombok.Value;
import org.hypertrace.core.query.translator.api.QueryType;

/** Target domain of an NRQL event type, optionally narrowed to a built-in DQL metric. */
@Value
public class EventTypeMapping {
  @NonNull QueryType domain;
  @NonNull Optional<String> metricKey;

  public static EventTypeMapping of(QueryType domain) {
    return new EventTypeMapping(domain, Optional.empty());
  }

  public static EventTypeMapping of(QueryType domain, String metricKey) {
    return new EventTypeMapping(domain, Optional.of(metricKey));
  }
}
