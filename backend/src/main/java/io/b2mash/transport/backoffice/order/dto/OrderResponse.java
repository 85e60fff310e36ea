package io.b2mash.transport.backoffice.order.dto;

import io.b2mash.transport.backoffice.mission.dto.MissionResponse;
import io.b2mash.transport.backoffice.order.Order;
import io.b2mash.transport.backoffice.order.OrderStatus;
import java.time.Instant;
import java.util.List;
import java.util.UUID;

/** Order after a status change, with the missions the change spawned (usually empty). */
public record OrderResponse(
    UUID id,
    String reference,
    OrderStatus status,
    Instant updatedAt,
    List<MissionResponse> spawnedMissions) {

  public static OrderResponse from(Order order, List<MissionResponse> spawnedMissions) {
    return new OrderResponse(
        order.getId(),
        order.getReference(),
        order.getStatus(),
        order.getUpdatedAt(),
        spawnedMissions);
  }
}
