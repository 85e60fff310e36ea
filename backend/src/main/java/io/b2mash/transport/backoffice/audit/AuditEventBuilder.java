package io.b2mash.transport.backoffice.audit;

import java.util.Map;
import java.util.UUID;
import org.springframework.web.context.request.RequestContextHolder;
import org.springframework.web.context.request.ServletRequestAttributes;

/**
 * Builder that constructs an {@link AuditEventRecord}. Every event is recorded with actor type
 * "SYSTEM". Source is "API" inside an HTTP request and "INTERNAL" otherwise.
 *
 * <p>Required fields: {@code eventType}, {@code entityType}, {@code entityId}, {@code
 * organizationId}.
 *
 * <pre>{@code
 * AuditEventRecord record = AuditEventBuilder.builder()
 *     .eventType("mission.spawned")
 *     .entityType("mission")
 *     .entityId(missionId)
 *     .organizationId(organizationId)
 *     .details(Map.of("ref", ref))
 *     .build();
 * }</pre>
 */
public class AuditEventBuilder {

  private static final String ACTOR_TYPE = "SYSTEM";

  private String eventType;
  private String entityType;
  private UUID entityId;
  private String organizationId;
  private Map<String, Object> details;

  private AuditEventBuilder() {}

  /** Creates a new builder instance. */
  public static AuditEventBuilder builder() {
    return new AuditEventBuilder();
  }

  public AuditEventBuilder eventType(String eventType) {
    this.eventType = eventType;
    return this;
  }

  public AuditEventBuilder entityType(String entityType) {
    this.entityType = entityType;
    return this;
  }

  public AuditEventBuilder entityId(UUID entityId) {
    this.entityId = entityId;
    return this;
  }

  public AuditEventBuilder organizationId(String organizationId) {
    this.organizationId = organizationId;
    return this;
  }

  public AuditEventBuilder details(Map<String, Object> details) {
    this.details = details;
    return this;
  }

  public AuditEventRecord build() {
    if (eventType == null || entityType == null || entityId == null || organizationId == null) {
      throw new IllegalStateException(
          "eventType, entityType, entityId and organizationId are required");
    }
    String source =
        RequestContextHolder.getRequestAttributes() instanceof ServletRequestAttributes
            ? "API"
            : "INTERNAL";
    return new AuditEventRecord(
        eventType, entityType, entityId, organizationId, ACTOR_TYPE, source, details);
  }
}
