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
import java.util.UUID;

/**
 * Commercial header of a trip. Every field is the fallback for the lines beneath the quote when a
 * line carries no override of its own.
 */
@Entity
@Table(name = "quotes")
public class Quote {

  @Id
  @GeneratedValue(strategy = GenerationType.UUID)
  private UUID id;

  @Column(name = "organization_id", nullable = false, length = 64)
  private String organizationId;

  @Column(name = "order_id", nullable = false)
  private UUID orderId;

  @Enumerated(EnumType.STRING)
  @Column(name = "trip_type", nullable = false, length = 20)
  private TripType tripType;

  @Enumerated(EnumType.STRING)
  @Column(name = "pricing_mode", nullable = false, length = 20)
  private PricingMode pricingMode;

  @Column(name = "pickup_at")
  private Instant pickupAt;

  @Column(name = "estimated_end_at")
  private Instant estimatedEndAt;

  @Column(name = "pickup_address", length = 500)
  private String pickupAddress;

  @Column(name = "pickup_latitude", precision = 10, scale = 7)
  private BigDecimal pickupLatitude;

  @Column(name = "pickup_longitude", precision = 10, scale = 7)
  private BigDecimal pickupLongitude;

  @Column(name = "dropoff_address", length = 500)
  private String dropoffAddress;

  @Column(name = "dropoff_latitude", precision = 10, scale = 7)
  private BigDecimal dropoffLatitude;

  @Column(name = "dropoff_longitude", precision = 10, scale = 7)
  private BigDecimal dropoffLongitude;

  @Column(name = "passenger_count", nullable = false)
  private int passengerCount;

  @Column(name = "luggage_count", nullable = false)
  private int luggageCount;

  @Column(name = "vehicle_category_id")
  private UUID vehicleCategoryId;

  @Column(name = "is_round_trip", nullable = false)
  private boolean roundTrip;

  @Column(name = "created_at", nullable = false, updatable = false)
  private Instant createdAt;

  protected Quote() {}

  public Quote(
      String organizationId,
      UUID orderId,
      TripType tripType,
      PricingMode pricingMode,
      Instant pickupAt,
      UUID vehicleCategoryId) {
    this.organizationId = organizationId;
    this.orderId = orderId;
    this.tripType = tripType;
    this.pricingMode = pricingMode;
    this.pickupAt = pickupAt;
    this.vehicleCategoryId = vehicleCategoryId;
    this.createdAt = Instant.now();
  }

  public void setPickup(String address, BigDecimal latitude, BigDecimal longitude) {
    this.pickupAddress = address;
    this.pickupLatitude = latitude;
    this.pickupLongitude = longitude;
  }

  public void setDropoff(String address, BigDecimal latitude, BigDecimal longitude) {
    this.dropoffAddress = address;
    this.dropoffLatitude = latitude;
    this.dropoffLongitude = longitude;
  }

  public void setPassengers(int passengerCount, int luggageCount) {
    this.passengerCount = passengerCount;
    this.luggageCount = luggageCount;
  }

  public void setEstimatedEndAt(Instant estimatedEndAt) {
    this.estimatedEndAt = estimatedEndAt;
  }

  public void setRoundTrip(boolean roundTrip) {
    this.roundTrip = roundTrip;
  }

  public void setCreatedAt(Instant createdAt) {
    this.createdAt = createdAt;
  }

  public UUID getId() {
    return id;
  }

  public String getOrganizationId() {
    return organizationId;
  }

  public UUID getOrderId() {
    return orderId;
  }

  public TripType getTripType() {
    return tripType;
  }

  public PricingMode getPricingMode() {
    return pricingMode;
  }

  public Instant getPickupAt() {
    return pickupAt;
  }

  public Instant getEstimatedEndAt() {
    return estimatedEndAt;
  }

  public String getPickupAddress() {
    return pickupAddress;
  }

  public BigDecimal getPickupLatitude() {
    return pickupLatitude;
  }

  public BigDecimal getPickupLongitude() {
    return pickupLongitude;
  }

  public String getDropoffAddress() {
    return dropoffAddress;
  }

  public BigDecimal getDropoffLatitude() {
    return dropoffLatitude;
  }

  public BigDecimal getDropoffLongitude() {
    return dropoffLongitude;
  }

  public int getPassengerCount() {
    return passengerCount;
  }

  public int getLuggageCount() {
    return luggageCount;
  }

  public UUID getVehicleCategoryId() {
    return vehicleCategoryId;
  }

  public boolean isRoundTrip() {
    return roundTrip;
  }

  public Instant getCreatedAt() {
    return createdAt;
  }
}
