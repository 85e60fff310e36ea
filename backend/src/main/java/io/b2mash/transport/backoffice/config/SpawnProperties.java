package io.b2mash.transport.backoffice.config;

import java.time.ZoneId;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Configuration for mission spawning.
 *
 * @param zone time zone used to turn date-range days into start-of-day instants
 * @param refPadWidth minimum digits of the sequence suffix in mission refs ("ORD-2026-001-01")
 * @param autoSpawnOnConfirm whether confirming an order spawns its missions
 */
@ConfigurationProperties(prefix = "spawn")
public record SpawnProperties(ZoneId zone, int refPadWidth, boolean autoSpawnOnConfirm) {

  public SpawnProperties {
    if (zone == null) {
      zone = ZoneId.of("UTC");
    }
    if (refPadWidth < 1) {
      refPadWidth = 2;
    }
  }
}
