package io.b2mash.transport.backoffice.mission.dto;

import java.util.List;

public record SpawnResultResponse(int createdCount, List<MissionResponse> missions) {

  public static SpawnResultResponse of(List<MissionResponse> missions) {
    return new SpawnResultResponse(missions.size(), missions);
  }
}
