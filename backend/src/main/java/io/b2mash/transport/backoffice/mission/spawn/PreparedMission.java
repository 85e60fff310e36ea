package io.b2mash.transport.backoffice.mission.spawn;

import java.time.Instant;
import java.util.Map;
import java.util.UUID;

/**
 * A fully resolved mission row, ready to insert. {@code sourceData} is the snapshot stored in the
 * mission's {@code source_data} column.
 */
public record PreparedMission(
    UUID id,
    String organizationId,
    UUID orderId,
    UUID quoteId,
    UUID quoteLineId,
    UUID groupLineId,
    int dedupeSlot,
    String ref,
    Instant startAt,
    Instant endAt,
    boolean internal,
    String notes,
    Map<String, Object> sourceData) {}
