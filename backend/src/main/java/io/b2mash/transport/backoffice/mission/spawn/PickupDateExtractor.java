package io.b2mash.transport.backoffice.mission.spawn;

import java.time.Clock;
import java.time.Instant;
import org.springframework.stereotype.Component;

/**
 * Timestamp a candidate is ordered by: the start of its day for a date-range day, otherwise the
 * line's own {@code pickupAt}, then the quote's, then the current time.
 */
@Component
public class PickupDateExtractor {

  private final Clock clock;

  public PickupDateExtractor(Clock clock) {
    this.clock = clock;
  }

  public Instant extract(SpawnCandidate candidate) {
    if (candidate.isDay()) {
      return candidate.day().dayStart();
    }
    if (candidate.overrides().pickupAt() != null) {
      return candidate.overrides().pickupAt();
    }
    if (candidate.quote().getPickupAt() != null) {
      return candidate.quote().getPickupAt();
    }
    return clock.instant();
  }
}
