package io.b2mash.transport.backoffice.mission.spawn;

import io.b2mash.transport.backoffice.quote.LineOverrides;
import io.b2mash.transport.backoffice.quote.Quote;
import io.b2mash.transport.backoffice.quote.QuoteLine;
import java.util.UUID;

/**
 * A line that will become one mission. For a date-range day, {@code line} is the GROUP itself and
 * {@code day} is set; every day of a range shares the GROUP's id as dedupe key.
 *
 * @param groupLineId enclosing GROUP, or null for a top-level CALCULATED line
 * @param dedupeSlot 0 for a single line, the day index for a date-range day
 */
public record SpawnCandidate(
    Quote quote,
    QuoteLine line,
    LineOverrides overrides,
    UUID groupLineId,
    DayExpansion day,
    int dedupeSlot) {

  static SpawnCandidate single(Quote quote, QuoteLine line, UUID groupLineId) {
    return new SpawnCandidate(
        quote, line, LineOverrides.from(line.getSourceData()), groupLineId, null, 0);
  }

  static SpawnCandidate day(Quote quote, QuoteLine group, DayExpansion day) {
    return new SpawnCandidate(
        quote,
        group,
        LineOverrides.from(group.getSourceData()),
        group.getId(),
        day,
        day.dayIndex());
  }

  /** Quote line id the mission is recorded against. */
  public UUID dedupeKey() {
    return line.getId();
  }

  public boolean isDay() {
    return day != null;
  }
}
