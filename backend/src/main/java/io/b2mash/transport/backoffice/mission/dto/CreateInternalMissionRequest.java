package io.b2mash.transport.backoffice.mission.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;
import java.time.Instant;
import java.util.UUID;

public record CreateInternalMissionRequest(
    @NotBlank @Size(max = 255) String label,
    @NotNull Instant startAt,
    UUID vehicleCategoryId,
    @Size(max = 2000) String notes) {}
