package io.b2mash.transport.backoffice.mission.spawn;

import java.time.Instant;
import java.util.UUID;

/** Input of an internal mission. {@code vehicleCategoryId} and {@code notes} are optional. */
public record CreateInternalParams(
    UUID orderId,
    String organizationId,
    String label,
    Instant startAt,
    UUID vehicleCategoryId,
    String notes) {}
