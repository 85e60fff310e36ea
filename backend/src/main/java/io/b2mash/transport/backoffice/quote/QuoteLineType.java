package io.b2mash.transport.backoffice.quote;

/**
 * Kind of quote line. CALCULATED lines come from the pricing engine, GROUP lines bundle children
 * or a date range, MANUAL lines are free-form fees that never become missions.
 */
public enum QuoteLineType {
  CALCULATED,
  GROUP,
  MANUAL
}
