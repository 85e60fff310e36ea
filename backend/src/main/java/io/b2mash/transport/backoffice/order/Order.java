package io.b2mash.transport.backoffice.order;

import io.b2mash.transport.backoffice.exception.InvalidStateException;
import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import jakarta.persistence.Version;
import java.time.Instant;
import java.util.UUID;

/**
 * Billing and operational aggregate for one or more quotes. The {@code reference} (e.g.
 * "ORD-2026-001") prefixes the refs of every mission spawned from the order, so it must not change
 * once missions exist.
 */
@Entity
@Table(name = "orders")
public class Order {

  @Id
  @GeneratedValue(strategy = GenerationType.UUID)
  private UUID id;

  @Column(name = "organization_id", nullable = false, length = 64)
  private String organizationId;

  @Column(name = "reference", nullable = false, length = 50)
  private String reference;

  @Enumerated(EnumType.STRING)
  @Column(name = "status", nullable = false, length = 20)
  private OrderStatus status = OrderStatus.DRAFT;

  @Column(name = "notes", columnDefinition = "TEXT")
  private String notes;

  @Version
  @Column(name = "version", nullable = false)
  private long version;

  @Column(name = "created_at", nullable = false, updatable = false)
  private Instant createdAt;

  @Column(name = "updated_at", nullable = false)
  private Instant updatedAt;

  protected Order() {}

  public Order(String organizationId, String reference) {
    this.organizationId = organizationId;
    this.reference = reference;
    this.createdAt = Instant.now();
    this.updatedAt = Instant.now();
  }

  /**
   * Moves the order to {@code target}.
   *
   * @throws InvalidStateException if the state machine does not allow the transition
   */
  public void transitionTo(OrderStatus target) {
    if (status.isTerminal()) {
      throw new InvalidStateException(
          "Invalid order status", "Cannot transition from terminal state " + status);
    }
    if (!status.canTransitionTo(target)) {
      throw new InvalidStateException(
          "Invalid order status", "Invalid transition from " + status + " to " + target);
    }
    this.status = target;
    this.updatedAt = Instant.now();
  }

  public UUID getId() {
    return id;
  }

  public String getOrganizationId() {
    return organizationId;
  }

  public String getReference() {
    return reference;
  }

  public OrderStatus getStatus() {
    return status;
  }

  public String getNotes() {
    return notes;
  }

  public void setNotes(String notes) {
    this.notes = notes;
    this.updatedAt = Instant.now();
  }

  public long getVersion() {
    return version;
  }

  public Instant getCreatedAt() {
    return createdAt;
  }

  public Instant getUpdatedAt() {
    return updatedAt;
  }
}
