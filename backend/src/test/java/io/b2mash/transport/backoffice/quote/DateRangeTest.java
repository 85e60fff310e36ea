package io.b2mash.transport.backoffice.quote;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.time.LocalDate;
import java.time.ZoneId;
import java.time.ZoneOffset;
import org.junit.jupiter.api.Test;

class DateRangeTest {

  @Test
  void parse_calendarDates_listsEveryDayInclusive() {
    var range = DateRange.parse("2026-02-27", "2026-03-02", ZoneOffset.UTC);

    assertThat(range.days())
        .containsExactly(
            LocalDate.of(2026, 2, 27),
            LocalDate.of(2026, 2, 28),
            LocalDate.of(2026, 3, 1),
            LocalDate.of(2026, 3, 2));
  }

  @Test
  void parse_singleDay_givesOneDay() {
    assertThat(DateRange.parse("2026-03-10", "2026-03-10", ZoneOffset.UTC).days()).hasSize(1);
  }

  @Test
  void parse_isoInstants_useCalendarDayInZone() {
    var range =
        DateRange.parse(
            "2026-03-09T23:30:00Z", "2026-03-10T10:00:00Z", ZoneId.of("Europe/Paris"));

    assertThat(range.start()).isEqualTo(LocalDate.of(2026, 3, 10));
    assertThat(range.end()).isEqualTo(LocalDate.of(2026, 3, 10));
  }

  @Test
  void parse_localDateTime_isAccepted() {
    var range = DateRange.parse("2026-03-10T08:00:00", "2026-03-11T08:00:00", ZoneOffset.UTC);

    assertThat(range.days()).hasSize(2);
  }

  @Test
  void parse_invertedRange_isRejected() {
    assertThatThrownBy(() -> DateRange.parse("2026-03-12", "2026-03-10", ZoneOffset.UTC))
        .isInstanceOf(IllegalArgumentException.class)
        .hasMessageContaining("before");
  }

  @Test
  void parse_missingBound_isRejected() {
    assertThatThrownBy(() -> DateRange.parse("2026-03-12", null, ZoneOffset.UTC))
        .isInstanceOf(IllegalArgumentException.class);
    assertThatThrownBy(() -> DateRange.parse("  ", "2026-03-12", ZoneOffset.UTC))
        .isInstanceOf(IllegalArgumentException.class);
  }

  @Test
  void parse_garbage_isRejected() {
    assertThatThrownBy(() -> DateRange.parse("tomorrow", "2026-03-12", ZoneOffset.UTC))
        .isInstanceOf(IllegalArgumentException.class)
        .hasMessageContaining("tomorrow");
  }
}
