package io.b2mash.transport.backoffice.mission.event;

public enum SpawnOrigin {
  AUTOMATIC,
  MANUAL,
  INTERNAL
}
