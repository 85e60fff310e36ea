package io.b2mash.transport.backoffice.mission.spawn;

import java.time.Instant;
import java.time.LocalDate;

/** One calendar day of a date-range GROUP. {@code dayIndex} is 1-based. */
public record DayExpansion(int dayIndex, int totalDays, LocalDate date, Instant dayStart) {}
