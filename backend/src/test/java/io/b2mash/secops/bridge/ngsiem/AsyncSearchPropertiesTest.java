package io.b2mash.secops.bridge.ngsiem;

import static org.assertj.core.api.Assertions.assertThatThrownBy;

import org.junit.jupiter.api.Test;

class AsyncSearchPropertiesTest {

  @Test
  void rejectsZeroPollInterval() {
    assertThatThrownBy(() -> new AsyncSearchProperties(0, 300))
        .isInstanceOf(IllegalArgumentException.class)
        .hasMessageContaining("poll-interval-seconds");
  }

  @Test
  void rejectsNegativeTimeout() {
    assertThatThrownBy(() -> new AsyncSearchProperties(5, -1))
        .isInstanceOf(IllegalArgumentException.class)
        .hasMessageContaining("timeout-seconds");
  }
}
