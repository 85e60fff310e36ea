package io.b2mash.transport.backoffice.mission.spawn;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.function.Function;

/** Orders candidates of a whole order by pickup time. Ties keep their collection order. */
public final class ChronologicalSorter {

  private ChronologicalSorter() {}

  public static List<ScheduledCandidate> sort(
      List<SpawnCandidate> candidates, Function<SpawnCandidate, Instant> pickupTime) {
    var scheduled = new ArrayList<ScheduledCandidate>(candidates.size());
    for (SpawnCandidate candidate : candidates) {
      scheduled.add(new ScheduledCandidate(candidate, pickupTime.apply(candidate)));
    }
    // List.sort is stable
    scheduled.sort(Comparator.comparing(ScheduledCandidate::pickupAt));
    return List.copyOf(scheduled);
  }
}
