package io.b2mash.transport.backoffice.quote;

import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.ZoneId;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.List;

/** Inclusive calendar-day range of a date-range GROUP line. */
public record DateRange(LocalDate start, LocalDate end) {

  public DateRange {
    if (start == null || end == null) {
      throw new IllegalArgumentException("Date range requires both a start and an end date");
    }
    if (end.isBefore(start)) {
      throw new IllegalArgumentException(
          "Date range end " + end + " is before its start " + start);
    }
  }

  /**
   * Parses the raw bounds of a range. Each bound is either a calendar date ({@code 2026-03-01}) or
   * an ISO date-time, which is converted to its calendar day in {@code zone}.
   *
   * @throws IllegalArgumentException if a bound is missing or unparseable, or the range is inverted
   */
  public static DateRange parse(String startDate, String endDate, ZoneId zone) {
    return new DateRange(toDate(startDate, zone), toDate(endDate, zone));
  }

  /** Every calendar day of the range, in order. */
  public List<LocalDate> days() {
    var days = new ArrayList<LocalDate>();
    for (LocalDate day = start; !day.isAfter(end); day = day.plusDays(1)) {
      days.add(day);
    }
    return days;
  }

  private static LocalDate toDate(String value, ZoneId zone) {
    if (value == null || value.isBlank()) {
      return null;
    }
    String text = value.trim();
    try {
      return LocalDate.parse(text);
    } catch (DateTimeParseException notADate) {
      Instant instant = LineOverrides.instant(text);
      if (instant != null) {
        return instant.atZone(zone).toLocalDate();
      }
      try {
        return LocalDateTime.parse(text).toLocalDate();
      } catch (DateTimeParseException e) {
        throw new IllegalArgumentException("Unparseable date '" + value + "'", e);
      }
    }
  }
}
