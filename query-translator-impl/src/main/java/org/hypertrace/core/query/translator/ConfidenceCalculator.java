package org.hypertrace.core.query.translator;

import org.hypertrace.core.query.translator.api.Confidence;

/**
 * Rates a conversion from its diagnostics alone. Any manual review item outweighs the number of
 * warnings.
 */
public class ConfidenceCalculator {
  private static final int MAX_WARNINGS_FOR_MEDIUM = 2;

  private ConfidenceCalculator() {}

  public static Confidence calculate(int warningCount, int manualReviewCount) {
    if (manualReviewCount > 0) {
      return Confidence.LOW;
    }
    if (warningCount > MAX_WARNINGS_FOR_MEDIUM) {
      return Confidence.LOW;
    }
    if (warningCount > 0) {
      return Confidence.MEDIUM;
    }
    return Confidence.HIGH;
  }
}
