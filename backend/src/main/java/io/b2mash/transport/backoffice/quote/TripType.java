package io.b2mash.transport.backoffice.quote;

import java.util.EnumSet;
import java.util.Set;

public enum TripType {
  TRANSFER,
  EXCURSION,
  DISPO,
  OFF_GRID,
  STAY;

  private static final Set<TripType> SPAWNABLE = EnumSet.of(TRANSFER, DISPO);

  /** Trip types whose lines are turned into missions. Returns a fresh mutable copy. */
  public static Set<TripType> spawnable() {
    return EnumSet.copyOf(SPAWNABLE);
  }
}
