package org.hypertrace.core.query.translator.parse;

import java.util.Arrays;
import java.util.EnumMap;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Collectors;
import javax.inject.Inject;
import org.hypertrace.core.query.translator.api.ParsedQuery;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Splits a normalized NRQL query into its clauses.
 *
 * <p>Each clause is located by its own search, running from its keyword up to the next clause
 * keyword or the end of the query, so clauses may appear in any order. Searches run over a masked
 * copy of the query in which quoted text and parenthesized arguments are blanked out; keywords
 * inside {@code 'since yesterday'} or {@code filter(count(*), WHERE ...)} therefore never end a
 * clause. Clause text is then sliced from the unmasked query.
 */
public class ClauseExtractor {
  private static final Logger LOG = LoggerFactory.getLogger(ClauseExtractor.class);

  private static final char MASK = '_';
  // Dotted attribute segments such as email.from are not clause keywords.
  private static final String KEYWORD_START = "(?<![\\w.])";
  private static final String KEYWORD_END = "(?![\\w.])";
  private static final Pattern LEADING_INTEGER = Pattern.compile("^(\\d+)\\b");

  enum Clause {
    SELECT("SELECT"),
    FROM("FROM"),
    WHERE("WHERE"),
    FACET("FACET"),
    SINCE("SINCE"),
    UNTIL("UNTIL"),
    LIMIT("LIMIT"),
    TIMESERIES("TIMESERIES"),
    COMPARE_WITH("COMPARE\\s+WITH"),
    ORDER_BY("ORDER\\s+BY");

    private final String keywordRegex;

    Clause(String keywordRegex) {
      this.keywordRegex = keywordRegex;
    }
  }

  private final Map<Clause, Pattern> clausePatterns;
  private final SelectParser selectParser;

  @Inject
  public ClauseExtractor(SelectParser selectParser) {
    this.selectParser = selectParser;
    this.clausePatterns = new EnumMap<>(Clause.class);
    for (Clause clause : Clause.values()) {
      String stopKeywords =
          Arrays.stream(Clause.values())
              .filter(other -> other != clause)
              .map(other -> other.keywordRegex)
              .collect(Collectors.joining("|"));
      this.clausePatterns.put(
          clause,
          Pattern.compile(
              KEYWORD_START
                  + clause.keywordRegex
                  + KEYWORD_END
                  + "(.*?)(?="
                  + KEYWORD_START
                  + "(?:"
                  + stopKeywords
                  + ")"
                  + KEYWORD_END
                  + "|$)",
              Pattern.CASE_INSENSITIVE | Pattern.DOTALL));
    }
  }

  public ClauseExtractor() {
    this(new SelectParser());
  }

  public ParsedQuery extract(String normalizedQuery) {
    String masked = mask(normalizedQuery);
    ParsedQuery.ParsedQueryBuilder builder = ParsedQuery.builder();

    Optional<String> select = find(Clause.SELECT, normalizedQuery, masked);
    builder.select(select);
    select.ifPresent(text -> builder.selections(selectParser.parse(text)));

    Optional<String> from = find(Clause.FROM, normalizedQuery, masked);
    builder.from(from);
    from.ifPresent(
        text ->
            builder.eventTypes(
                TopLevelSplitter.split(text).stream()
                    .map(TopLevelSplitter::unquote)
                    .collect(Collectors.toUnmodifiableList())));

    builder.where(find(Clause.WHERE, normalizedQuery, masked));
    find(Clause.FACET, normalizedQuery, masked)
        .ifPresent(text -> builder.facets(TopLevelSplitter.split(text)));
    builder.since(find(Clause.SINCE, normalizedQuery, masked));
    builder.until(find(Clause.UNTIL, normalizedQuery, masked));
    builder.limit(find(Clause.LIMIT, normalizedQuery, masked).flatMap(this::parseLimit));
    builder.compareWith(find(Clause.COMPARE_WITH, normalizedQuery, masked));
    builder.orderBy(find(Clause.ORDER_BY, normalizedQuery, masked));

    Matcher timeseries = clausePatterns.get(Clause.TIMESERIES).matcher(masked);
    if (timeseries.find()) {
      String bucket = slice(normalizedQuery, timeseries);
      builder.timeseries(
          Optional.of(
              bucket.isEmpty() || bucket.equalsIgnoreCase(ParsedQuery.TIMESERIES_AUTO)
                  ? ParsedQuery.TIMESERIES_AUTO
                  : bucket));
    }

    ParsedQuery parsedQuery = builder.build();
    if (LOG.isDebugEnabled()) {
      LOG.debug("Extracted clauses from [{}]: {}", normalizedQuery, parsedQuery);
    }
    return parsedQuery;
  }

  private Optional<String> find(Clause clause, String query, String masked) {
    Matcher matcher = clausePatterns.get(clause).matcher(masked);
    if (!matcher.find()) {
      return Optional.empty();
    }
    String text = slice(query, matcher);
    return text.isEmpty() ? Optional.empty() : Optional.of(text);
  }

  private String slice(String query, Matcher matcher) {
    return query.substring(matcher.start(1), matcher.end(1)).trim();
  }

  private Optional<Integer> parseLimit(String limitText) {
    Matcher matcher = LEADING_INTEGER.matcher(limitText);
    if (!matcher.find()) {
      LOG.debug("Ignoring non numeric LIMIT [{}]", limitText);
      return Optional.empty();
    }
    try {
      return Optional.of(Integer.parseInt(matcher.group(1)));
    } catch (NumberFormatException e) {
      LOG.debug("Ignoring out of range LIMIT [{}]", limitText, e);
      return Optional.empty();
    }
  }

  /**
   * Same length copy of the query with the contents of quoted text and of parentheses replaced.
   * Quote characters and the outermost parentheses are kept.
   */
  static String mask(String query) {
    char[] masked = query.toCharArray();
    int depth = 0;
    char quote = 0;
    for (int i = 0; i < masked.length; i++) {
      char c = masked[i];
      if (quote != 0) {
        if (c == '\\' && i + 1 < masked.length) {
          masked[i] = MASK;
          masked[++i] = MASK;
        } else if (c == quote) {
          quote = 0;
          if (depth > 0) {
            masked[i] = MASK;
          }
        } else {
          masked[i] = MASK;
        }
        continue;
      }
      if (c == '\'' || c == '"' || c == '`') {
        quote = c;
        if (depth > 0) {
          masked[i] = MASK;
        }
      } else if (c == '(') {
        if (depth > 0) {
          masked[i] = MASK;
        }
        depth++;
      } else if (c == ')') {
        depth = Math.max(0, depth - 1);
        if (depth > 0) {
          masked[i] = MASK;
        }
      } else if (depth > 0) {
        masked[i] = MASK;
      }
    }
    return new String(masked);
  }
}
