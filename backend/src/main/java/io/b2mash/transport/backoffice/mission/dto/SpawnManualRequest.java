package io.b2mash.transport.backoffice.mission.dto;

import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;
import java.time.Instant;
import java.util.UUID;

public record SpawnManualRequest(
    @NotNull UUID quoteLineId,
    @NotNull Instant startAt,
    @NotNull UUID vehicleCategoryId,
    @Size(max = 2000) String notes) {}
