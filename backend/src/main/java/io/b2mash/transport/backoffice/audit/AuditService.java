package io.b2mash.transport.backoffice.audit;

import java.util.List;
import java.util.UUID;

/** Records and queries audit events. Queries are always scoped to one organization. */
public interface AuditService {

  /**
   * Records a single audit event within the current transaction. If the enclosing transaction rolls
   * back, the audit event is also rolled back (no REQUIRES_NEW).
   *
   * @param record the audit event data to persist
   */
  void log(AuditEventRecord record);

  /** Audit trail of an order, newest first. */
  List<AuditEvent> findForOrder(String organizationId, UUID orderId);
}
