package io.b2mash.transport.backoffice.mission.spawn;

import static io.b2mash.transport.backoffice.mission.spawn.SpawnFixtures.line;
import static io.b2mash.transport.backoffice.mission.spawn.SpawnFixtures.order;
import static io.b2mash.transport.backoffice.mission.spawn.SpawnFixtures.quote;
import static org.assertj.core.api.Assertions.assertThat;

import io.b2mash.transport.backoffice.order.Order;
import io.b2mash.transport.backoffice.quote.QuoteLineType;
import io.b2mash.transport.backoffice.quote.TripType;
import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.Map;
import org.junit.jupiter.api.Test;

class PickupDateExtractorTest {

  private static final Instant NOW = Instant.parse("2026-02-01T12:00:00Z");

  private final PickupDateExtractor extractor =
      new PickupDateExtractor(Clock.fixed(NOW, ZoneOffset.UTC));
  private final Order order = order("ORD-2026-002");

  @Test
  void linePickupOverride_winsOverQuote() {
    var quote = quote(order, TripType.TRANSFER, Instant.parse("2026-03-10T08:00:00Z"));
    var line =
        line(
            quote,
            null,
            QuoteLineType.CALCULATED,
            "Return",
            0,
            Map.of("pickupAt", "2026-03-14T17:30:00Z"));

    assertThat(extractor.extract(SpawnCandidate.single(quote, line, null)))
        .isEqualTo(Instant.parse("2026-03-14T17:30:00Z"));
  }

  @Test
  void offsetDateTimeOverride_isAccepted() {
    var quote = quote(order, TripType.TRANSFER, null);
    var line =
        line(
            quote,
            null,
            QuoteLineType.CALCULATED,
            "Return",
            0,
            Map.of("pickupAt", "2026-03-14T18:30:00+01:00"));

    assertThat(extractor.extract(SpawnCandidate.single(quote, line, null)))
        .isEqualTo(Instant.parse("2026-03-14T17:30:00Z"));
  }

  @Test
  void withoutOverride_fallsBackToQuotePickup() {
    var quote = quote(order, TripType.TRANSFER, Instant.parse("2026-03-10T08:00:00Z"));
    var line = line(quote, QuoteLineType.CALCULATED, "Outbound", 0);

    assertThat(extractor.extract(SpawnCandidate.single(quote, line, null)))
        .isEqualTo(Instant.parse("2026-03-10T08:00:00Z"));
  }

  @Test
  void unparseableOverride_isIgnored() {
    var quote = quote(order, TripType.TRANSFER, Instant.parse("2026-03-10T08:00:00Z"));
    var line =
        line(quote, null, QuoteLineType.CALCULATED, "Outbound", 0, Map.of("pickupAt", "soon"));

    assertThat(extractor.extract(SpawnCandidate.single(quote, line, null)))
        .isEqualTo(Instant.parse("2026-03-10T08:00:00Z"));
  }

  @Test
  void withoutAnyPickup_usesClock() {
    var quote = quote(order, TripType.DISPO, null);
    var line = line(quote, QuoteLineType.CALCULATED, "Standby", 0);

    assertThat(extractor.extract(SpawnCandidate.single(quote, line, null))).isEqualTo(NOW);
  }

  @Test
  void dayCandidate_usesStartOfDay() {
    var quote = quote(order, TripType.DISPO, Instant.parse("2026-03-10T08:00:00Z"));
    var group =
        line(
            quote,
            null,
            QuoteLineType.GROUP,
            "Disposal",
            0,
            Map.of(
                "startDate", "2026-03-11", "endDate", "2026-03-12",
                "pickupAt", "2026-03-10T09:00:00Z"));
    var day =
        new DayExpansion(1, 2, LocalDate.of(2026, 3, 11), Instant.parse("2026-03-11T00:00:00Z"));

    assertThat(extractor.extract(SpawnCandidate.day(quote, group, day)))
        .isEqualTo(Instant.parse("2026-03-11T00:00:00Z"));
  }
}
