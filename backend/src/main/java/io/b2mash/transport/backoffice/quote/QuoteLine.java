package io.b2mash.transport.backoffice.quote;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import java.math.BigDecimal;
import java.time.Instant;
import java.util.HashMap;
import java.util.Map;
import java.util.UUID;
import org.hibernate.annotations.JdbcTypeCode;
import org.hibernate.type.SqlTypes;

/**
 * Node of a quote's line tree. {@code parentId} is null for top-level lines. {@code sourceData} is
 * the per-line override bag read through {@link LineOverrides}.
 */
@Entity
@Table(name = "quote_lines")
public class QuoteLine {

  @Id
  @GeneratedValue(strategy = GenerationType.UUID)
  private UUID id;

  @Column(name = "quote_id", nullable = false)
  private UUID quoteId;

  @Column(name = "parent_id")
  private UUID parentId;

  @Enumerated(EnumType.STRING)
  @Column(name = "type", nullable = false, length = 20)
  private QuoteLineType type;

  @Column(name = "dispatchable", nullable = false)
  private boolean dispatchable = true;

  @Column(name = "label", nullable = false, length = 500)
  private String label;

  @Column(name = "description", columnDefinition = "TEXT")
  private String description;

  @JdbcTypeCode(SqlTypes.JSON)
  @Column(name = "source_data", columnDefinition = "jsonb")
  private Map<String, Object> sourceData = new HashMap<>();

  @Column(name = "sort_order", nullable = false)
  private int sortOrder;

  @Column(name = "total_price", precision = 12, scale = 2)
  private BigDecimal totalPrice;

  @Column(name = "created_at", nullable = false, updatable = false)
  private Instant createdAt;

  protected QuoteLine() {}

  public QuoteLine(UUID quoteId, UUID parentId, QuoteLineType type, String label, int sortOrder) {
    this.quoteId = quoteId;
    this.parentId = parentId;
    this.type = type;
    this.label = label;
    this.sortOrder = sortOrder;
    this.createdAt = Instant.now();
  }

  public UUID getId() {
    return id;
  }

  public UUID getQuoteId() {
    return quoteId;
  }

  public UUID getParentId() {
    return parentId;
  }

  public QuoteLineType getType() {
    return type;
  }

  public boolean isDispatchable() {
    return dispatchable;
  }

  public void setDispatchable(boolean dispatchable) {
    this.dispatchable = dispatchable;
  }

  public String getLabel() {
    return label;
  }

  public String getDescription() {
    return description;
  }

  public void setDescription(String description) {
    this.description = description;
  }

  public Map<String, Object> getSourceData() {
    return sourceData;
  }

  public void setSourceData(Map<String, Object> sourceData) {
    this.sourceData = sourceData != null ? new HashMap<>(sourceData) : new HashMap<>();
  }

  public int getSortOrder() {
    return sortOrder;
  }

  public BigDecimal getTotalPrice() {
    return totalPrice;
  }

  public void setTotalPrice(BigDecimal totalPrice) {
    this.totalPrice = totalPrice;
  }

  public Instant getCreatedAt() {
    return createdAt;
  }
}
