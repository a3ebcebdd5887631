package org.hypertrace.core.query.translator;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.hypertrace.core.query.translator.api.ParsedQuery;
import org.hypertrace.core.query.translator.api.QueryType;

/**
 * Holds the state of a single conversion: the parsed query, its classification and the
 * diagnostics collected by each stage. A context is created per call and never shared.
 */
public class ConversionContext {

  private final ParsedQuery parsedQuery;
  private final List<String> warnings = new ArrayList<>();
  private final List<String> manualReviewItems = new ArrayList<>();
  // first mapping recorded for a source field wins
  private final Map<String, String> fieldMappingsApplied = new LinkedHashMap<>();
  private QueryType queryType = QueryType.UNKNOWN;
  private Optional<String> metricKey = Optional.empty();

  public ConversionContext(ParsedQuery parsedQuery) {
    this.parsedQuery = parsedQuery;
  }

  public ParsedQuery getParsedQuery() {
    return parsedQuery;
  }

  public QueryType getQueryType() {
    return queryType;
  }

  /** Built-in metric the event type resolves to, when the classifier found one. */
  public Optional<String> getMetricKey() {
    return metricKey;
  }

  public void setClassification(QueryType queryType, Optional<String> metricKey) {
    this.queryType = queryType;
    this.metricKey = metricKey;
  }

  public void addWarning(String warning) {
    warnings.add(warning);
  }

  public void addManualReviewItem(String item) {
    manualReviewItems.add(item);
  }

  public void recordFieldMapping(String sourceField, String targetField) {
    fieldMappingsApplied.putIfAbsent(sourceField, targetField);
  }

  public List<String> getWarnings() {
    return Collections.unmodifiableList(warnings);
  }

  public List<String> getManualReviewItems() {
    return Collections.unmodifiableList(manualReviewItems);
  }

  public Map<String, String> getFieldMappingsApplied() {
    return Collections.unmodifiableMap(fieldMappingsApplied);
  }
}
