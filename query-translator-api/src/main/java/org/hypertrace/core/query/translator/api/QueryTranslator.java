package org.hypertrace.core.query.translator.api;

/**
 * Translates NRQL queries into DQL. Implementations are stateless between calls and may be shared
 * across threads.
 */
public interface QueryTranslator {

  /**
   * Converts a single query. Never throws for malformed input: anything that cannot be translated
   * is reported through the warnings and manual review items of the result.
   */
  ConversionResult convert(String query);
}
