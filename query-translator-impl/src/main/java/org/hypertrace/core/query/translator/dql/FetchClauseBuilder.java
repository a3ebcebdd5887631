package org.hypertrace.core.query.translator.dql;

import java.util.Optional;
import javax.inject.Inject;
import org.hypertrace.core.query.translator.ConversionContext;
import org.hypertrace.core.query.translator.api.ParsedQuery;

/**
 * Renders the data source of the pipeline together with its time frame. This stage always
 * produces a fragment, which keeps the converted query non-empty.
 */
class FetchClauseBuilder implements DqlClauseBuilder {
  static final String FETCH_LOGS = "fetch logs";
  static final String FETCH_SPANS = "fetch spans";
  static final String FETCH_SERVICES = "fetch dt.entity.service";
  static final String FETCH_BIZEVENTS = "fetch bizevents";
  private static final String TIMESERIES_COMMAND = "timeseries ";
  private static final String UNTIL_NOW = "now";

  private final TimeRangeConverter timeRangeConverter;

  @Inject
  FetchClauseBuilder(TimeRangeConverter timeRangeConverter) {
    this.timeRangeConverter = timeRangeConverter;
  }

  @Override
  public Optional<String> build(ConversionContext context) {
    StringBuilder fetch = new StringBuilder(dataSource(context));
    ParsedQuery parsedQuery = context.getParsedQuery();
    parsedQuery
        .getSince()
        .flatMap(since -> convertTimePhrase(since, context))
        .ifPresent(duration -> fetch.append(", from:now()-").append(duration));
    parsedQuery
        .getUntil()
        .filter(until -> !until.equalsIgnoreCase(UNTIL_NOW))
        .flatMap(until -> convertTimePhrase(until, context))
        .ifPresent(duration -> fetch.append(", to:now()-").append(duration));
    return Optional.of(fetch.toString());
  }

  @Override
  public int getPriority() {
    return 0;
  }

  private String dataSource(ConversionContext context) {
    switch (context.getQueryType()) {
      case LOGS:
        return FETCH_LOGS;
      case TRACES:
        return FETCH_SPANS;
      case METRICS:
        return context.getMetricKey().map(key -> TIMESERIES_COMMAND + key).orElse(FETCH_SERVICES);
      case EVENTS:
      case UNKNOWN:
      default:
        return FETCH_BIZEVENTS;
    }
  }

  private Optional<String> convertTimePhrase(String phrase, ConversionContext context) {
    Optional<String> duration = timeRangeConverter.convertRelativeTime(phrase);
    if (duration.isEmpty()) {
      context.addWarning("Could not convert time range: " + phrase);
    }
    return duration;
  }
}
