package org.hypertrace.core.query.translator.dql;

import java.util.Locale;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import javax.inject.Inject;
import org.hypertrace.core.query.translator.mapping.MappingTables;

/**
 * Converts NRQL relative time phrases such as {@code 3 hours ago} into DQL durations such as
 * {@code 3h}. Weeks and months are expressed in days.
 */
public class TimeRangeConverter {
  private static final String UNITS = "(second|minute|hour|day|week|month)s?";
  private static final Pattern RELATIVE_TIME =
      Pattern.compile("^(\\d+)\\s+" + UNITS + "\\s+ago$", Pattern.CASE_INSENSITIVE);
  private static final Pattern DURATION =
      Pattern.compile("^(\\d+)\\s+" + UNITS + "$", Pattern.CASE_INSENSITIVE);
  private static final int DAYS_PER_WEEK = 7;
  private static final int DAYS_PER_MONTH = 30;

  private final MappingTables mappingTables;

  @Inject
  public TimeRangeConverter(MappingTables mappingTables) {
    this.mappingTables = mappingTables;
  }

  /**
   * Converts a phrase like {@code 1 hour ago}. The literal phrase table is checked before the
   * numeric pattern.
   */
  public Optional<String> convertRelativeTime(String phrase) {
    String normalized = phrase.trim();
    Optional<String> literal = mappingTables.findTimePhrase(normalized);
    if (literal.isPresent()) {
      return literal;
    }
    return convert(RELATIVE_TIME.matcher(normalized));
  }

  /** Converts a bucket size like {@code 5 minutes}, as used by TIMESERIES. */
  public Optional<String> convertDuration(String duration) {
    return convert(DURATION.matcher(duration.trim()));
  }

  private Optional<String> convert(Matcher matcher) {
    if (!matcher.matches()) {
      return Optional.empty();
    }
    String unit = matcher.group(2).toLowerCase(Locale.ROOT);
    try {
      long value = Long.parseLong(matcher.group(1));
      switch (unit) {
        case "week":
          return Optional.of(Math.multiplyExact(value, DAYS_PER_WEEK) + "d");
        case "month":
          return Optional.of(Math.multiplyExact(value, DAYS_PER_MONTH) + "d");
        default:
          return Optional.of(value + unit.substring(0, 1));
      }
    } catch (NumberFormatException | ArithmeticException e) {
      // Amounts that do not fit a long duration cannot be expressed in DQL.
      return Optional.empty();
    }
  }
}
