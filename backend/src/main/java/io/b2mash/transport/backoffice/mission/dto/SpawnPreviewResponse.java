package io.b2mash.transport.backoffice.mission.dto;

import io.b2mash.transport.backoffice.quote.TripType;
import java.util.Set;

public record SpawnPreviewResponse(
    boolean hasMissions, int eligibleLineCount, Set<TripType> spawnableTripTypes) {}
