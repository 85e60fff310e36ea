package io.b2mash.transport.backoffice.order;

import io.b2mash.transport.backoffice.audit.AuditEventBuilder;
import io.b2mash.transport.backoffice.audit.AuditService;
import io.b2mash.transport.backoffice.config.SpawnProperties;
import io.b2mash.transport.backoffice.exception.InvalidStateException;
import io.b2mash.transport.backoffice.exception.ResourceNotFoundException;
import io.b2mash.transport.backoffice.mission.Mission;
import io.b2mash.transport.backoffice.mission.spawn.SpawnService;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.support.TransactionTemplate;

@Service
public class OrderService {

  private static final Logger log = LoggerFactory.getLogger(OrderService.class);

  private final OrderRepository orderRepository;
  private final SpawnService spawnService;
  private final AuditService auditService;
  private final SpawnProperties spawnProperties;
  private final TransactionTemplate txTemplate;

  public OrderService(
      OrderRepository orderRepository,
      SpawnService spawnService,
      AuditService auditService,
      SpawnProperties spawnProperties,
      PlatformTransactionManager txManager) {
    this.orderRepository = orderRepository;
    this.spawnService = spawnService;
    this.auditService = auditService;
    this.spawnProperties = spawnProperties;
    this.txTemplate = new TransactionTemplate(txManager);
  }

  /**
   * Moves an order to {@code target}. Requesting the current status is a no-op. Entering CONFIRMED
   * spawns the order's missions first, so a spawn failure leaves the order in its previous status.
   *
   * @throws ResourceNotFoundException if the order does not exist in {@code organizationId}
   * @throws InvalidStateException if the transition is not allowed
   */
  public OrderTransition transitionStatus(
      UUID orderId, String organizationId, OrderStatus target) {
    Order order = requireOrder(orderId, organizationId);
    OrderStatus current = order.getStatus();
    if (current == target) {
      log.debug("Order {} already in status {}", orderId, target);
      return new OrderTransition(order, List.of());
    }
    if (!current.canTransitionTo(target)) {
      throw new InvalidStateException(
          "Invalid order status", "Invalid transition from " + current + " to " + target);
    }

    List<Mission> spawned =
        target == OrderStatus.CONFIRMED && spawnProperties.autoSpawnOnConfirm()
            ? spawnService.execute(orderId, organizationId)
            : List.of();

    Order saved =
        txTemplate.execute(
            status -> {
              Order fresh = requireOrder(orderId, organizationId);
              if (fresh.getStatus() == target) {
                return fresh;
              }
              OrderStatus previous = fresh.getStatus();
              fresh.transitionTo(target);
              Order result = orderRepository.save(fresh);
              auditService.log(
                  AuditEventBuilder.builder()
                      .eventType("order.status_changed")
                      .entityType("order")
                      .entityId(orderId)
                      .organizationId(organizationId)
                      .details(
                          Map.of(
                              "order_id", orderId.toString(),
                              "from", previous.name(),
                              "to", target.name(),
                              "missions_spawned", spawned.size()))
                      .build());
              return result;
            });

    log.info(
        "Order {} moved from {} to {} ({} missions spawned)",
        order.getReference(),
        current,
        target,
        spawned.size());
    return new OrderTransition(saved, spawned);
  }

  private Order requireOrder(UUID orderId, String organizationId) {
    return orderRepository
        .findByIdAndOrganizationId(orderId, organizationId)
        .orElseThrow(() -> new ResourceNotFoundException("Order", orderId));
  }
}
