package io.b2mash.transport.backoffice.vehicle;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import java.time.Instant;
import java.util.UUID;

@Entity
@Table(name = "vehicle_categories")
public class VehicleCategory {

  @Id
  @GeneratedValue(strategy = GenerationType.UUID)
  private UUID id;

  @Column(name = "organization_id", nullable = false, length = 64)
  private String organizationId;

  @Column(name = "name", nullable = false, length = 255)
  private String name;

  @Column(name = "code", nullable = false, length = 50)
  private String code;

  @Column(name = "max_passengers", nullable = false)
  private int maxPassengers;

  @Column(name = "created_at", nullable = false, updatable = false)
  private Instant createdAt;

  protected VehicleCategory() {}

  public VehicleCategory(String organizationId, String name, String code, int maxPassengers) {
    this.organizationId = organizationId;
    this.name = name;
    this.code = code;
    this.maxPassengers = maxPassengers;
    this.createdAt = Instant.now();
  }

  public UUID getId() {
    return id;
  }

  public String getOrganizationId() {
    return organizationId;
  }

  public String getName() {
    return name;
  }

  public String getCode() {
    return code;
  }

  public int getMaxPassengers() {
    return maxPassengers;
  }

  public Instant getCreatedAt() {
    return createdAt;
  }
}
