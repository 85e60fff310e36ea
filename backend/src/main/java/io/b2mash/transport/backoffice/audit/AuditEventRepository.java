package io.b2mash.transport.backoffice.audit;

import java.util.List;
import java.util.UUID;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

public interface AuditEventRepository extends JpaRepository<AuditEvent, UUID> {

  /**
   * Finds audit events for an order using the JSONB details->>'order_id' field, newest first.
   * Uses the expression index idx_audit_order.
   */
  @Query(
      value =
          """
          SELECT * FROM audit_events
          WHERE organization_id = :organizationId
            AND (details->>'order_id') = CAST(:orderId AS TEXT)
          ORDER BY occurred_at DESC
          """,
      nativeQuery = true)
  List<AuditEvent> findByOrganizationIdAndOrderId(
      @Param("organizationId") String organizationId, @Param("orderId") UUID orderId);
}
