package io.b2mash.transport.backoffice.order;

import io.b2mash.transport.backoffice.mission.dto.MissionResponse;
import io.b2mash.transport.backoffice.multitenancy.TenantContext;
import io.b2mash.transport.backoffice.order.dto.OrderResponse;
import io.b2mash.transport.backoffice.order.dto.TransitionStatusRequest;
import jakarta.validation.Valid;
import java.util.UUID;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PatchMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/orders")
public class OrderController {

  private final OrderService orderService;

  public OrderController(OrderService orderService) {
    this.orderService = orderService;
  }

  @PatchMapping("/{orderId}/status")
  public ResponseEntity<OrderResponse> transitionStatus(
      @PathVariable UUID orderId, @Valid @RequestBody TransitionStatusRequest request) {
    String organizationId = TenantContext.requireOrganizationId();
    var transition = orderService.transitionStatus(orderId, organizationId, request.status());
    var missions = transition.spawnedMissions().stream().map(MissionResponse::from).toList();
    return ResponseEntity.ok(OrderResponse.from(transition.order(), missions));
  }
}
