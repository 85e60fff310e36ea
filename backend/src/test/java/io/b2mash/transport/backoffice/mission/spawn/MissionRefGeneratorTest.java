package io.b2mash.transport.backoffice.mission.spawn;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.b2mash.transport.backoffice.config.SpawnProperties;
import java.time.ZoneOffset;
import org.junit.jupiter.api.Test;

class MissionRefGeneratorTest {

  private final MissionRefGenerator generator =
      new MissionRefGenerator(new SpawnProperties(ZoneOffset.UTC, 2, true));

  @Test
  void refFor_padsPositionToTwoDigits() {
    assertThat(generator.refFor("ORD-2026-001", 0)).isEqualTo("ORD-2026-001-01");
    assertThat(generator.refFor("ORD-2026-001", 8)).isEqualTo("ORD-2026-001-09");
    assertThat(generator.refFor("ORD-2026-001", 9)).isEqualTo("ORD-2026-001-10");
  }

  @Test
  void refFor_growsBeyondPadWidth() {
    assertThat(generator.refFor("ORD-2026-001", 99)).isEqualTo("ORD-2026-001-100");
  }

  @Test
  void refFor_honoursConfiguredWidth() {
    var wide = new MissionRefGenerator(new SpawnProperties(ZoneOffset.UTC, 4, true));

    assertThat(wide.refFor("ORD-7", 11)).isEqualTo("ORD-7-0012");
  }

  @Test
  void refFor_rejectsNegativePosition() {
    assertThatThrownBy(() -> generator.refFor("ORD-1", -1))
        .isInstanceOf(IllegalArgumentException.class);
  }
}
