package org.hypertrace.core.query.translator.dql;

import static org.hypertrace.core.query.translator.mapping.FunctionMapper.UNMAPPED_MARKER;

import com.google.common.base.Joiner;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Collectors;
import javax.inject.Inject;
import org.hypertrace.core.query.translator.ConversionContext;
import org.hypertrace.core.query.translator.api.ParsedQuery;
import org.hypertrace.core.query.translator.api.Selection;
import org.hypertrace.core.query.translator.api.Selection.Aggregation;
import org.hypertrace.core.query.translator.api.Selection.BareExpression;
import org.hypertrace.core.query.translator.mapping.ExpressionConverter;
import org.hypertrace.core.query.translator.mapping.FieldMapper;
import org.hypertrace.core.query.translator.mapping.FunctionMapper;
import org.hypertrace.core.query.translator.parse.SelectParser;
import org.hypertrace.core.query.translator.parse.TopLevelSplitter;

/**
 * Renders aggregations and FACET grouping as a {@code summarize} stage, or as {@code
 * makeTimeseries} when the query asks for a TIMESERIES. Queries selecting plain fields without a
 * FACET have no aggregation stage at all.
 */
class SummarizeClauseBuilder implements DqlClauseBuilder {
  private static final String SUMMARIZE = "summarize";
  private static final String MAKE_TIMESERIES = "makeTimeseries";
  private static final String COUNT = "count";
  private static final String PERCENTILE = "percentile";
  private static final String FILTER = "filter";
  private static final String DEFAULT_PERCENTILE = "95";
  private static final Pattern WHERE_CONDITION =
      Pattern.compile("^WHERE\\s+(.+)$", Pattern.CASE_INSENSITIVE | Pattern.DOTALL);
  private static final Pattern SIMPLE_ALIAS = Pattern.compile("[A-Za-z_][A-Za-z0-9_]*");

  private final FunctionMapper functionMapper;
  private final FieldMapper fieldMapper;
  private final ExpressionConverter expressionConverter;
  private final TimeRangeConverter timeRangeConverter;
  private final SelectParser selectParser = new SelectParser();
  private final Joiner joiner = Joiner.on(", ").skipNulls();

  @Inject
  SummarizeClauseBuilder(
      FunctionMapper functionMapper,
      FieldMapper fieldMapper,
      ExpressionConverter expressionConverter,
      TimeRangeConverter timeRangeConverter) {
    this.functionMapper = functionMapper;
    this.fieldMapper = fieldMapper;
    this.expressionConverter = expressionConverter;
    this.timeRangeConverter = timeRangeConverter;
  }

  @Override
  public Optional<String> build(ConversionContext context) {
    ParsedQuery parsedQuery = context.getParsedQuery();
    List<Aggregation> aggregations =
        parsedQuery.getSelections().stream()
            .filter(
                selection -> selection.getSelectionCase() == Selection.SelectionCase.AGGREGATION)
            .map(Aggregation.class::cast)
            .collect(Collectors.toUnmodifiableList());
    if (aggregations.isEmpty() && parsedQuery.getFacets().isEmpty()) {
      return Optional.empty();
    }

    if (!aggregations.isEmpty()) {
      parsedQuery.getSelections().stream()
          .filter(
              selection -> selection.getSelectionCase() == Selection.SelectionCase.BARE_EXPRESSION)
          .map(BareExpression.class::cast)
          .forEach(
              bare ->
                  context.addWarning(
                      String.format(
                          "Selection '%s' is not an aggregation and was dropped from %s",
                          bare.getText(), SUMMARIZE)));
    }

    List<String> renderedAggregations = new ArrayList<>();
    aggregations.forEach(
        aggregation -> renderedAggregations.addAll(renderAggregation(aggregation, context)));

    boolean timeseries = parsedQuery.getTimeseries().isPresent() && !aggregations.isEmpty();
    if (parsedQuery.getTimeseries().isPresent() && aggregations.isEmpty()) {
      context.addWarning("TIMESERIES without aggregation functions was ignored");
    }

    StringBuilder builder = new StringBuilder(timeseries ? MAKE_TIMESERIES : SUMMARIZE);
    if (!renderedAggregations.isEmpty()) {
      builder.append(' ').append(joiner.join(renderedAggregations));
    }
    if (!parsedQuery.getFacets().isEmpty()) {
      builder
          .append(renderedAggregations.isEmpty() ? " " : ", ")
          .append("by: {")
          .append(joiner.join(renderFacets(parsedQuery.getFacets(), context)))
          .append('}');
    }
    if (timeseries) {
      renderInterval(parsedQuery.getTimeseries().get(), context)
          .ifPresent(interval -> builder.append(", interval:").append(interval));
    }
    return Optional.of(builder.toString());
  }

  @Override
  public int getPriority() {
    return 20;
  }

  private List<String> renderAggregation(Aggregation aggregation, ConversionContext context) {
    String functionName = aggregation.getFunctionName();
    String lowerCaseName = functionName.toLowerCase(Locale.ROOT);
    if (PERCENTILE.equals(lowerCaseName)) {
      return renderPercentiles(aggregation, context);
    }
    if (FILTER.equals(lowerCaseName)) {
      return List.of(withAlias(aggregation, renderFilter(aggregation, context)));
    }

    Optional<String> target = functionMapper.mapFunction(functionName, context);
    String expression;
    if (target.isPresent() && COUNT.equals(target.get())) {
      expression = "count()";
    } else if (target.isPresent()) {
      expression = target.get() + "(" + convertArguments(aggregation, context) + ")";
    } else {
      expression =
          functionName + "(" + convertArguments(aggregation, context) + ") " + UNMAPPED_MARKER;
    }
    return List.of(withAlias(aggregation, expression));
  }

  /**
   * {@code percentile(duration, 95, 99)} yields one DQL percentile per requested value. An alias is
   * suffixed with each value, {@code AS p} becoming {@code p_95} and {@code p_99}.
   */
  private List<String> renderPercentiles(Aggregation aggregation, ConversionContext context) {
    List<String> arguments = TopLevelSplitter.split(aggregation.getFieldExpression());
    if (arguments.isEmpty()) {
      context.addManualReviewItem(
          String.format("percentile(%s) names no field", aggregation.getFieldExpression()));
      return List.of(withAlias(aggregation, "percentile() " + UNMAPPED_MARKER));
    }
    String field = expressionConverter.convert(arguments.get(0), context);
    List<String> values = new ArrayList<>(arguments.subList(1, arguments.size()));
    if (values.isEmpty()) {
      context.addWarning(
          String.format(
              "percentile(%s) has no percentile value; defaulting to %s",
              aggregation.getFieldExpression(), DEFAULT_PERCENTILE));
      values.add(DEFAULT_PERCENTILE);
    }
    if (values.size() == 1) {
      return List.of(withAlias(aggregation, "percentile(" + field + ", " + values.get(0) + ")"));
    }
    return values.stream()
        .map(
            value ->
                aggregation
                    .getAlias()
                    .map(alias -> quoteAlias(alias + "_" + value) + " = ")
                    .orElse("")
                    + "percentile("
                    + field
                    + ", "
                    + value
                    + ")")
        .collect(Collectors.toUnmodifiableList());
  }

  /**
   * {@code filter(count(*), WHERE condition)} is a conditional count. Any other filtered
   * aggregation is left for manual conversion.
   */
  private String renderFilter(Aggregation aggregation, ConversionContext context) {
    List<String> arguments = TopLevelSplitter.split(aggregation.getFieldExpression());
    if (arguments.size() == 2) {
      Selection inner = selectParser.parseSelection(arguments.get(0));
      Matcher condition = WHERE_CONDITION.matcher(arguments.get(1));
      if (condition.matches() && isCount(inner)) {
        return "countIf(" + expressionConverter.convert(condition.group(1), context) + ")";
      }
    }
    context.addManualReviewItem(
        String.format(
            "filter(%s) needs manual conversion; only filter(count(*), WHERE ...) is translated",
            aggregation.getFieldExpression()));
    return FILTER + "(" + aggregation.getFieldExpression() + ") " + UNMAPPED_MARKER;
  }

  private boolean isCount(Selection selection) {
    if (selection.getSelectionCase() != Selection.SelectionCase.AGGREGATION) {
      return false;
    }
    String functionName = ((Aggregation) selection).getFunctionName();
    return COUNT.equalsIgnoreCase(functionName);
  }

  private String convertArguments(Aggregation aggregation, ConversionContext context) {
    String fieldExpression = aggregation.getFieldExpression();
    if (fieldExpression.isEmpty() || "*".equals(fieldExpression)) {
      return fieldExpression;
    }
    return expressionConverter.convert(fieldExpression, context);
  }

  private List<String> renderFacets(List<String> facets, ConversionContext context) {
    return facets.stream()
        .map(facet -> renderFacet(facet, context))
        .collect(Collectors.toUnmodifiableList());
  }

  private String renderFacet(String facet, ConversionContext context) {
    if (facet.contains("(")) {
      context.addManualReviewItem(
          String.format("FACET expression '%s' needs manual conversion", facet));
      return facet;
    }
    String unquoted = TopLevelSplitter.unquote(facet);
    String mapped = fieldMapper.mapField(unquoted, context);
    return mapped.equals(unquoted) ? facet : mapped;
  }

  private Optional<String> renderInterval(String bucket, ConversionContext context) {
    if (ParsedQuery.TIMESERIES_AUTO.equals(bucket)) {
      return Optional.empty();
    }
    Optional<String> interval = timeRangeConverter.convertDuration(bucket);
    if (interval.isEmpty()) {
      context.addWarning("Could not convert TIMESERIES interval: " + bucket);
    }
    return interval;
  }

  private String withAlias(Aggregation aggregation, String expression) {
    return aggregation
        .getAlias()
        .map(alias -> quoteAlias(alias) + " = " + expression)
        .orElse(expression);
  }

  private String quoteAlias(String alias) {
    return SIMPLE_ALIAS.matcher(alias).matches() ? alias : "`" + alias + "`";
  }
}
