package io.b2mash.transport.backoffice.quote;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.format.DateTimeParseException;
import java.util.Map;
import java.util.UUID;

/**
 * Typed view of a quote line's {@code sourceData} override bag. Every field is null when the line
 * does not override it. Blank strings and values that do not parse to the expected type count as
 * absent, so the quote default applies.
 */
public record LineOverrides(
    String pickupAddress,
    BigDecimal pickupLatitude,
    BigDecimal pickupLongitude,
    String dropoffAddress,
    BigDecimal dropoffLatitude,
    BigDecimal dropoffLongitude,
    Integer passengerCount,
    Integer luggageCount,
    UUID vehicleCategoryId,
    String vehicleCategoryName,
    String tripType,
    String pricingMode,
    Boolean roundTrip,
    Instant pickupAt,
    Instant estimatedEndAt,
    Instant dropoffAt,
    String startDate,
    String endDate) {

  private static final LineOverrides NONE =
      new LineOverrides(
          null, null, null, null, null, null, null, null, null, null, null, null, null, null, null,
          null, null, null);

  public static LineOverrides none() {
    return NONE;
  }

  public static LineOverrides from(Map<String, Object> sourceData) {
    if (sourceData == null || sourceData.isEmpty()) {
      return NONE;
    }
    return new LineOverrides(
        text(sourceData.get("pickupAddress")),
        decimal(sourceData.get("pickupLatitude")),
        decimal(sourceData.get("pickupLongitude")),
        text(sourceData.get("dropoffAddress")),
        decimal(sourceData.get("dropoffLatitude")),
        decimal(sourceData.get("dropoffLongitude")),
        integer(sourceData.get("passengerCount")),
        integer(sourceData.get("luggageCount")),
        uuid(sourceData.get("vehicleCategoryId")),
        text(sourceData.get("vehicleCategoryName")),
        text(sourceData.get("tripType")),
        text(sourceData.get("pricingMode")),
        bool(sourceData.get("isRoundTrip")),
        instant(sourceData.get("pickupAt")),
        instant(sourceData.get("estimatedEndAt")),
        instant(sourceData.get("dropoffAt")),
        text(sourceData.get("startDate")),
        text(sourceData.get("endDate")));
  }

  /** True when either bound of a {@code {startDate, endDate}} range is present. */
  public boolean hasDateRange() {
    return startDate != null || endDate != null;
  }

  private static String text(Object value) {
    if (value == null) {
      return null;
    }
    String text = value.toString();
    return text.isBlank() ? null : text;
  }

  private static BigDecimal decimal(Object value) {
    if (value instanceof BigDecimal decimal) {
      return decimal;
    }
    if (value instanceof Number number) {
      return new BigDecimal(number.toString());
    }
    String text = text(value);
    if (text == null) {
      return null;
    }
    try {
      return new BigDecimal(text.trim());
    } catch (NumberFormatException e) {
      return null;
    }
  }

  // non-integral or out-of-int-range counts are absent
  private static Integer integer(Object value) {
    BigDecimal decimal = decimal(value);
    if (decimal == null) {
      return null;
    }
    try {
      return decimal.intValueExact();
    } catch (ArithmeticException e) {
      return null;
    }
  }

  private static Boolean bool(Object value) {
    if (value instanceof Boolean flag) {
      return flag;
    }
    String text = text(value);
    if (text == null) {
      return null;
    }
    return switch (text.trim().toLowerCase()) {
      case "true" -> Boolean.TRUE;
      case "false" -> Boolean.FALSE;
      default -> null;
    };
  }

  private static UUID uuid(Object value) {
    String text = text(value);
    if (text == null) {
      return null;
    }
    try {
      return UUID.fromString(text.trim());
    } catch (IllegalArgumentException e) {
      return null;
    }
  }

  /** Accepts an ISO instant ("...Z") or an ISO date-time with offset. */
  static Instant instant(Object value) {
    String text = text(value);
    if (text == null) {
      return null;
    }
    try {
      return Instant.parse(text.trim());
    } catch (DateTimeParseException e) {
      try {
        return OffsetDateTime.parse(text.trim()).toInstant();
      } catch (DateTimeParseException ignored) {
        return null;
      }
    }
  }
}
