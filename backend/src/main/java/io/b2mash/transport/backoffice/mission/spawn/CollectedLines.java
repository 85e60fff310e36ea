package io.b2mash.transport.backoffice.mission.spawn;

import io.b2mash.transport.backoffice.mission.event.SpawnGroupSkippedEvent.SkipReason;
import io.b2mash.transport.backoffice.quote.Quote;
import io.b2mash.transport.backoffice.quote.QuoteLine;
import java.util.List;

/** Output of {@link LineCollector}: candidates in collection order and the skipped groups. */
public record CollectedLines(List<SpawnCandidate> candidates, List<SkippedGroup> skippedGroups) {

  public record SkippedGroup(Quote quote, QuoteLine group, SkipReason reason, String detail) {}

  public boolean isEmpty() {
    return candidates.isEmpty();
  }
}
