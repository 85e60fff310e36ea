package io.b2mash.transport.backoffice.mission.spawn;

import java.time.Instant;
import java.util.UUID;

public record SpawnManualParams(
    UUID quoteLineId,
    UUID orderId,
    String organizationId,
    Instant startAt,
    UUID vehicleCategoryId,
    String notes) {}
