package io.b2mash.transport.backoffice.audit;

import io.b2mash.transport.backoffice.multitenancy.TenantContext;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RestController;

@RestController
public class AuditEventController {

  private final AuditService auditService;

  public AuditEventController(AuditService auditService) {
    this.auditService = auditService;
  }

  @GetMapping("/api/orders/{orderId}/spawn-audit")
  public ResponseEntity<List<AuditEventResponse>> listSpawnAudit(@PathVariable UUID orderId) {
    String organizationId = TenantContext.requireOrganizationId();
    var events = auditService.findForOrder(organizationId, orderId);
    return ResponseEntity.ok(events.stream().map(AuditEventResponse::from).toList());
  }

  // --- DTO ---

  public record AuditEventResponse(
      UUID id,
      String eventType,
      String entityType,
      UUID entityId,
      UUID orderId,
      String actorType,
      String source,
      Map<String, Object> details,
      Instant occurredAt) {

    public static AuditEventResponse from(AuditEvent event) {
      return new AuditEventResponse(
          event.getId(),
          event.getEventType(),
          event.getEntityType(),
          event.getEntityId(),
          event.getOrderId(),
          event.getActorType(),
          event.getSource(),
          event.getDetails(),
          event.getOccurredAt());
    }
  }
}
