package io.b2mash.transport.backoffice.mission.spawn;

import java.util.Collection;
import java.util.Set;
import java.util.UUID;

/**
 * Quote lines of an order that already have a mission. A line in this set is never spawned again,
 * so a run interrupted earlier resumes with the lines still missing.
 */
public final class SpawnedLineGuard {

  private static final SpawnedLineGuard EMPTY = new SpawnedLineGuard(Set.of());

  private final Set<UUID> spawnedLineIds;

  private SpawnedLineGuard(Set<UUID> spawnedLineIds) {
    this.spawnedLineIds = spawnedLineIds;
  }

  public static SpawnedLineGuard of(Collection<UUID> spawnedLineIds) {
    return spawnedLineIds.isEmpty() ? EMPTY : new SpawnedLineGuard(Set.copyOf(spawnedLineIds));
  }

  public boolean isSpawned(UUID quoteLineId) {
    return spawnedLineIds.contains(quoteLineId);
  }

  public int size() {
    return spawnedLineIds.size();
  }
}
