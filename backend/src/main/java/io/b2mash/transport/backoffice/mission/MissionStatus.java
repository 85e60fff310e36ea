package io.b2mash.transport.backoffice.mission;

/** Dispatch status of a mission. Spawning only ever writes PENDING. */
public enum MissionStatus {
  PENDING,
  ASSIGNED,
  IN_PROGRESS,
  COMPLETED,
  CANCELLED
}
