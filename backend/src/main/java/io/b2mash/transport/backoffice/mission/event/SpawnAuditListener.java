package io.b2mash.transport.backoffice.mission.event;

import io.b2mash.transport.backoffice.audit.AuditEventBuilder;
import io.b2mash.transport.backoffice.audit.AuditService;
import java.util.LinkedHashMap;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

/**
 * Writes spawn events to the audit trail. Mission-created rows join the writer's transaction and
 * roll back with it; skip rows get a transaction of their own.
 */
@Component
public class SpawnAuditListener {

  private static final Logger log = LoggerFactory.getLogger(SpawnAuditListener.class);

  private final AuditService auditService;

  public SpawnAuditListener(AuditService auditService) {
    this.auditService = auditService;
  }

  @EventListener
  public void onMissionSpawned(MissionSpawnedEvent event) {
    var details = new LinkedHashMap<String, Object>();
    details.put("order_id", event.orderId().toString());
    details.put("quote_id", event.quoteId().toString());
    putIfPresent(details, "quote_line_id", event.quoteLineId());
    putIfPresent(details, "group_line_id", event.groupLineId());
    putIfPresent(details, "ref", event.ref());
    details.put("start_at", event.startAt().toString());
    details.put("origin", event.origin().name());

    auditService.log(
        AuditEventBuilder.builder()
            .eventType("mission.spawned")
            .entityType("mission")
            .entityId(event.missionId())
            .organizationId(event.organizationId())
            .details(details)
            .build());
  }

  @EventListener
  @Transactional
  public void onGroupSkipped(SpawnGroupSkippedEvent event) {
    log.debug("Auditing skipped group {} of order {}", event.groupLineId(), event.orderId());
    var details = new LinkedHashMap<String, Object>();
    details.put("order_id", event.orderId().toString());
    details.put("quote_id", event.quoteId().toString());
    putIfPresent(details, "group_label", event.groupLabel());
    details.put("reason", event.reason().name());
    putIfPresent(details, "detail", event.detail());

    auditService.log(
        AuditEventBuilder.builder()
            .eventType("mission.group_skipped")
            .entityType("quote_line")
            .entityId(event.groupLineId())
            .organizationId(event.organizationId())
            .details(details)
            .build());
  }

  private static void putIfPresent(Map<String, Object> details, String key, Object value) {
    if (value != null) {
      details.put(key, value.toString());
    }
  }
}
