package io.b2mash.transport.backoffice.order;

import io.b2mash.transport.backoffice.mission.Mission;
import java.util.List;

/** Result of a status change: the saved order and the missions spawned on the way. */
public record OrderTransition(Order order, List<Mission> spawnedMissions) {}
