package io.b2mash.transport.backoffice.mission.spawn;

import java.time.Instant;

public record ScheduledCandidate(SpawnCandidate candidate, Instant pickupAt) {}
