package org.hypertrace.core.query.translator.api;

/** Data domain a translated query reads from. */
public enum QueryType {
  METRICS,
  LOGS,
  TRACES,
  EVENTS,
  UNKNOWN
}
