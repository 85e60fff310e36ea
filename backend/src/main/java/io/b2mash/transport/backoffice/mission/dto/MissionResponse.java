package io.b2mash.transport.backoffice.mission.dto;

import io.b2mash.transport.backoffice.mission.Mission;
import io.b2mash.transport.backoffice.mission.MissionStatus;
import java.time.Instant;
import java.util.Map;
import java.util.UUID;

public record MissionResponse(
    UUID id,
    UUID orderId,
    UUID quoteId,
    UUID quoteLineId,
    String ref,
    MissionStatus status,
    Instant startAt,
    Instant endAt,
    boolean isInternal,
    String notes,
    Map<String, Object> sourceData,
    Instant createdAt) {

  public static MissionResponse from(Mission mission) {
    return new MissionResponse(
        mission.getId(),
        mission.getOrderId(),
        mission.getQuoteId(),
        mission.getQuoteLineId(),
        mission.getRef(),
        mission.getStatus(),
        mission.getStartAt(),
        mission.getEndAt(),
        mission.isInternal(),
        mission.getNotes(),
        mission.getSourceData(),
        mission.getCreatedAt());
  }
}
