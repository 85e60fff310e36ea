package io.b2mash.transport.backoffice.quote;

public enum PricingMode {
  FIXED_GRID,
  DYNAMIC
}
