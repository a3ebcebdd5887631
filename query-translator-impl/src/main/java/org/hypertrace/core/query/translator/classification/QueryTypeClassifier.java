package org.hypertrace.core.query.translator.classification;

import java.util.Locale;
import java.util.Optional;
import java.util.Set;
import javax.inject.Inject;
import org.hypertrace.core.query.translator.ConversionContext;
import org.hypertrace.core.query.translator.api.ParsedQuery;
import org.hypertrace.core.query.translator.api.QueryType;
import org.hypertrace.core.query.translator.mapping.EventTypeMapping;
import org.hypertrace.core.query.translator.mapping.MappingTables;

/**
 * Decides which DQL data domain a query reads from, based on the event type named in its FROM
 * clause. The generic log, span and metric types are recognized before the event type table is
 * consulted.
 */
public class QueryTypeClassifier {
  private static final Set<String> LOG_TYPES = Set.of("log", "logs");
  private static final Set<String> TRACE_TYPES = Set.of("span", "spans", "distributedtrace");
  private static final Set<String> METRIC_TYPES = Set.of("metric", "metrics");

  private final MappingTables mappingTables;

  @Inject
  public QueryTypeClassifier(MappingTables mappingTables) {
    this.mappingTables = mappingTables;
  }

  public void classify(ConversionContext context) {
    ParsedQuery parsedQuery = context.getParsedQuery();
    Optional<String> primaryEventType = parsedQuery.getPrimaryEventType();
    if (primaryEventType.isEmpty()) {
      context.addManualReviewItem(
          "No FROM clause found; the DQL data source must be chosen manually");
      context.setClassification(QueryType.UNKNOWN, Optional.empty());
      return;
    }
    String eventType = primaryEventType.get();
    if (parsedQuery.getEventTypes().size() > 1) {
      context.addWarning(
          String.format(
              "Multiple event types in FROM (%s); only '%s' was translated",
              String.join(", ", parsedQuery.getEventTypes()),
              eventType));
    }

    String lowerCaseType = eventType.toLowerCase(Locale.ROOT);
    if (LOG_TYPES.contains(lowerCaseType)) {
      context.setClassification(QueryType.LOGS, Optional.empty());
    } else if (TRACE_TYPES.contains(lowerCaseType)) {
      context.setClassification(QueryType.TRACES, Optional.empty());
    } else if (METRIC_TYPES.contains(lowerCaseType)) {
      context.setClassification(QueryType.METRICS, Optional.empty());
    } else {
      Optional<EventTypeMapping> mapping = mappingTables.findEventType(eventType);
      if (mapping.isPresent()) {
        context.setClassification(mapping.get().getDomain(), mapping.get().getMetricKey());
      } else {
        context.addWarning(
            String.format(
                "Event type '%s' mapped to generic events bucket (bizevents) - verify",
                eventType));
        context.setClassification(QueryType.EVENTS, Optional.empty());
      }
    }
  }
}
