package io.b2mash.transport.backoffice.mission;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import java.time.Instant;
import java.util.Map;
import java.util.UUID;
import org.hibernate.annotations.Immutable;
import org.hibernate.annotations.JdbcTypeCode;
import org.hibernate.type.SqlTypes;

/**
 * Operational unit produced from a quote line. Rows are inserted by {@code MissionBulkWriter}
 * through native SQL and read back through JPA; this side never updates them.
 *
 * <p>{@code quoteLineId} is null for internal missions. {@code dedupeSlot} is 0 for single-line
 * missions and the 1-based day index for date-range day missions.
 */
@Entity
@Immutable
@Table(name = "missions")
public class Mission {

  @Id private UUID id;

  @Column(name = "organization_id", nullable = false, length = 64)
  private String organizationId;

  @Column(name = "order_id", nullable = false)
  private UUID orderId;

  @Column(name = "quote_id", nullable = false)
  private UUID quoteId;

  @Column(name = "quote_line_id")
  private UUID quoteLineId;

  @Column(name = "dedupe_slot", nullable = false)
  private int dedupeSlot;

  @Column(name = "ref", length = 80)
  private String ref;

  @Enumerated(EnumType.STRING)
  @Column(name = "status", nullable = false, length = 20)
  private MissionStatus status;

  @Column(name = "start_at", nullable = false)
  private Instant startAt;

  @Column(name = "end_at")
  private Instant endAt;

  @Column(name = "is_internal", nullable = false)
  private boolean internal;

  @Column(name = "notes", columnDefinition = "TEXT")
  private String notes;

  @JdbcTypeCode(SqlTypes.JSON)
  @Column(name = "source_data", nullable = false, columnDefinition = "jsonb")
  private Map<String, Object> sourceData;

  @Column(name = "created_at", nullable = false)
  private Instant createdAt;

  protected Mission() {}

  public UUID getId() {
    return id;
  }

  public String getOrganizationId() {
    return organizationId;
  }

  public UUID getOrderId() {
    return orderId;
  }

  public UUID getQuoteId() {
    return quoteId;
  }

  public UUID getQuoteLineId() {
    return quoteLineId;
  }

  public int getDedupeSlot() {
    return dedupeSlot;
  }

  public String getRef() {
    return ref;
  }

  public MissionStatus getStatus() {
    return status;
  }

  public Instant getStartAt() {
    return startAt;
  }

  public Instant getEndAt() {
    return endAt;
  }

  public boolean isInternal() {
    return internal;
  }

  public String getNotes() {
    return notes;
  }

  public Map<String, Object> getSourceData() {
    return sourceData;
  }

  public Instant getCreatedAt() {
    return createdAt;
  }
}
