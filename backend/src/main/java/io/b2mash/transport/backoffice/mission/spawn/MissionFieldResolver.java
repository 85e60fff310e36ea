package io.b2mash.transport.backoffice.mission.spawn;

import io.b2mash.transport.backoffice.order.Order;
import io.b2mash.transport.backoffice.quote.LineOverrides;
import io.b2mash.transport.backoffice.quote.Quote;
import io.b2mash.transport.backoffice.quote.QuoteLine;
import java.time.Clock;
import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.UUID;
import org.springframework.stereotype.Component;

/**
 * Builds mission rows and their {@code sourceData} snapshots. Each field takes the line's override
 * when present, otherwise the quote's value, otherwise null.
 *
 * <p>End time: line {@code estimatedEndAt}, then line {@code dropoffAt}, then quote {@code
 * estimatedEndAt}. Date-range days have no end time.
 */
@Component
public class MissionFieldResolver {

  private final Clock clock;

  public MissionFieldResolver(Clock clock) {
    this.clock = clock;
  }

  /** Row for the {@code sequenceIndex}-th (1-based) mission of an automatic run. */
  public PreparedMission resolve(
      Order order,
      ScheduledCandidate scheduled,
      String ref,
      int sequenceIndex,
      int totalMissions,
      OrderLineTree tree) {
    SpawnCandidate candidate = scheduled.candidate();
    Quote quote = candidate.quote();
    QuoteLine line = candidate.line();
    LineOverrides overrides = candidate.overrides();

    UUID vehicleCategoryId = first(overrides.vehicleCategoryId(), quote.getVehicleCategoryId());
    String vehicleCategoryName =
        first(overrides.vehicleCategoryName(), tree.vehicleCategoryName(vehicleCategoryId));

    Map<String, Object> snapshot =
        baseSnapshot(quote, overrides, vehicleCategoryId, vehicleCategoryName);
    putLine(snapshot, line);
    snapshot.put("groupLineId", text(candidate.groupLineId()));
    if (candidate.isDay()) {
      DayExpansion day = candidate.day();
      snapshot.put("groupLabel", line.getLabel());
      snapshot.put("dayIndex", day.dayIndex());
      snapshot.put("totalDays", day.totalDays());
      snapshot.put("dayDate", day.dayStart().toString());
    }
    putTrip(snapshot, quote, overrides);
    snapshot.put("sequenceIndex", sequenceIndex);
    snapshot.put("totalMissionsInOrder", totalMissions);
    snapshot.put("spawnedAt", clock.instant().toString());

    Instant endAt = candidate.isDay() ? null : endAt(quote, overrides);
    return new PreparedMission(
        UUID.randomUUID(),
        order.getOrganizationId(),
        order.getId(),
        quote.getId(),
        line.getId(),
        candidate.groupLineId(),
        candidate.dedupeSlot(),
        ref,
        scheduled.pickupAt(),
        endAt,
        false,
        null,
        Collections.unmodifiableMap(snapshot));
  }

  /**
   * Row for a line spawned by hand with a caller-chosen start time and vehicle category. The end
   * time is left open: the quote's estimate belongs to the quoted pickup, not the chosen start.
   */
  public PreparedMission resolveManual(
      Order order,
      Quote quote,
      QuoteLine line,
      Instant startAt,
      UUID vehicleCategoryId,
      String vehicleCategoryName,
      String notes) {
    LineOverrides overrides = LineOverrides.from(line.getSourceData());

    Map<String, Object> snapshot =
        baseSnapshot(quote, overrides, vehicleCategoryId, vehicleCategoryName);
    putLine(snapshot, line);
    snapshot.put("lineType", line.getType().name());
    putTrip(snapshot, quote, overrides);
    snapshot.put("manuallySpawned", true);
    snapshot.put("spawnedAt", clock.instant().toString());

    return new PreparedMission(
        UUID.randomUUID(),
        order.getOrganizationId(),
        order.getId(),
        quote.getId(),
        line.getId(),
        null,
        0,
        null,
        startAt,
        null,
        false,
        notes,
        Collections.unmodifiableMap(snapshot));
  }

  /** Row for a non-billable mission that belongs to no quote line. */
  public PreparedMission resolveInternal(
      Order order,
      Quote quote,
      String label,
      Instant startAt,
      UUID vehicleCategoryId,
      String vehicleCategoryName,
      String notes) {
    Instant now = clock.instant();
    Map<String, Object> snapshot = new LinkedHashMap<>();
    snapshot.put("isInternal", true);
    snapshot.put("label", label);
    snapshot.put("vehicleCategoryId", text(vehicleCategoryId));
    snapshot.put("vehicleCategoryName", vehicleCategoryName);
    snapshot.put("createdAt", now.toString());
    snapshot.put("createdBy", "internal-task");

    return new PreparedMission(
        UUID.randomUUID(),
        order.getOrganizationId(),
        order.getId(),
        quote.getId(),
        null,
        null,
        0,
        null,
        startAt,
        null,
        true,
        notes,
        Collections.unmodifiableMap(snapshot));
  }

  static Instant endAt(Quote quote, LineOverrides overrides) {
    if (overrides.estimatedEndAt() != null) {
      return overrides.estimatedEndAt();
    }
    if (overrides.dropoffAt() != null) {
      return overrides.dropoffAt();
    }
    return quote.getEstimatedEndAt();
  }

  private static Map<String, Object> baseSnapshot(
      Quote quote,
      LineOverrides overrides,
      UUID vehicleCategoryId,
      String vehicleCategoryName) {
    Map<String, Object> snapshot = new LinkedHashMap<>();
    snapshot.put("pickupAddress", first(overrides.pickupAddress(), quote.getPickupAddress()));
    snapshot.put("pickupLatitude", first(overrides.pickupLatitude(), quote.getPickupLatitude()));
    snapshot.put(
        "pickupLongitude", first(overrides.pickupLongitude(), quote.getPickupLongitude()));
    snapshot.put("dropoffAddress", first(overrides.dropoffAddress(), quote.getDropoffAddress()));
    snapshot.put(
        "dropoffLatitude", first(overrides.dropoffLatitude(), quote.getDropoffLatitude()));
    snapshot.put(
        "dropoffLongitude", first(overrides.dropoffLongitude(), quote.getDropoffLongitude()));
    snapshot.put("passengerCount", first(overrides.passengerCount(), quote.getPassengerCount()));
    snapshot.put("luggageCount", first(overrides.luggageCount(), quote.getLuggageCount()));
    snapshot.put("vehicleCategoryId", text(vehicleCategoryId));
    snapshot.put("vehicleCategoryName", vehicleCategoryName);
    return snapshot;
  }

  private static void putLine(Map<String, Object> snapshot, QuoteLine line) {
    snapshot.put("lineLabel", line.getLabel());
    snapshot.put("lineDescription", line.getDescription());
    snapshot.put(
        "lineSourceData",
        line.getSourceData() == null || line.getSourceData().isEmpty()
            ? null
            : Collections.unmodifiableMap(new LinkedHashMap<>(line.getSourceData())));
    snapshot.put("lineTotalPrice", line.getTotalPrice());
  }

  private static void putTrip(Map<String, Object> snapshot, Quote quote, LineOverrides overrides) {
    snapshot.put("tripType", first(overrides.tripType(), quote.getTripType().name()));
    snapshot.put(
        "pricingMode",
        first(
            overrides.pricingMode(),
            quote.getPricingMode() != null ? quote.getPricingMode().name() : null));
    snapshot.put("isRoundTrip", first(overrides.roundTrip(), quote.isRoundTrip()));
  }

  private static <T> T first(T lineValue, T quoteValue) {
    return lineValue != null ? lineValue : quoteValue;
  }

  private static String text(UUID id) {
    return id != null ? id.toString() : null;
  }
}
