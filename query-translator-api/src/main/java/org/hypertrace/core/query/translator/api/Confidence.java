package org.hypertrace.core.query.translator.api;

/**
 * How far a translated query can be trusted without a human looking at it. Callers use this to
 * decide whether a converted query is safe to use unmodified.
 */
public enum Confidence {
  HIGH,
  MEDIUM,
  LOW
}
