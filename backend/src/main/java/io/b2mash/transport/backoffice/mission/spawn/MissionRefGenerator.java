package io.b2mash.transport.backoffice.mission.spawn;

import io.b2mash.transport.backoffice.config.SpawnProperties;
import org.springframework.stereotype.Component;

/**
 * Builds mission refs from the order reference and the mission's position in the sorted batch,
 * e.g. "ORD-2026-001-01". Numbering starts at 1 on every run.
 */
@Component
public class MissionRefGenerator {

  private final int padWidth;

  public MissionRefGenerator(SpawnProperties properties) {
    this.padWidth = properties.refPadWidth();
  }

  /**
   * @param position 0-based position in the chronologically sorted batch
   */
  public String refFor(String orderReference, int position) {
    if (position < 0) {
      throw new IllegalArgumentException("position must not be negative: " + position);
    }
    String sequence = String.valueOf(position + 1);
    if (sequence.length() < padWidth) {
      sequence = "0".repeat(padWidth - sequence.length()) + sequence;
    }
    return orderReference + "-" + sequence;
  }
}
