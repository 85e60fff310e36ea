package io.b2mash.transport.backoffice.audit;

import java.util.Map;
import java.util.UUID;

/**
 * Non-JPA DTO passed to {@link AuditService#log(AuditEventRecord)} for recording audit events.
 * Constructed by {@link AuditEventBuilder}.
 *
 * @param eventType free-form event type following {@code {entity}.{action}} convention
 * @param entityType the kind of entity being audited (e.g., "mission", "quote_line")
 * @param entityId ID of the affected entity (not a FK -- entity may be deleted later)
 * @param organizationId owning organization
 * @param actorType USER or SYSTEM
 * @param source origin of the action: API or INTERNAL
 * @param details key facts as JSONB; nullable
 */
public record AuditEventRecord(
    String eventType,
    String entityType,
    UUID entityId,
    String organizationId,
    String actorType,
    String source,
    Map<String, Object> details) {}
