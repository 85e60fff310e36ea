package io.b2mash.transport.backoffice.mission.event;

import java.time.Instant;
import java.util.UUID;

/** Published when a GROUP line produces no missions because it cannot be expanded. */
public record SpawnGroupSkippedEvent(
    UUID groupLineId,
    String groupLabel,
    UUID orderId,
    UUID quoteId,
    SkipReason reason,
    String detail,
    String organizationId,
    Instant occurredAt) {

  public enum SkipReason {
    /** GROUP with neither children nor a date range. */
    NO_CHILDREN_OR_RANGE,
    /** GROUP whose date range is incomplete, unparseable or inverted. */
    INVALID_DATE_RANGE
  }
}
