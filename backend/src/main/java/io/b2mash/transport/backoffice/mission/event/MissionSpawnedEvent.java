package io.b2mash.transport.backoffice.mission.event;

import java.time.Instant;
import java.util.UUID;

/**
 * Published once per mission created by a spawn run, a manual spawn or an internal mission. Fired
 * inside the writing transaction.
 */
public record MissionSpawnedEvent(
    UUID missionId,
    String ref,
    UUID orderId,
    UUID quoteId,
    UUID quoteLineId,
    UUID groupLineId,
    Instant startAt,
    SpawnOrigin origin,
    String organizationId,
    Instant occurredAt) {}
