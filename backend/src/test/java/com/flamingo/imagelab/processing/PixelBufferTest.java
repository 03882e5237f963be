package com.flamingo.imagelab.processing;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import org.junit.jupiter.api.Test;

class PixelBufferTest {

  @Test
  void shouldAcceptImage_atPixelLimit() {
    assertThat(PixelBuffer.withinPixelLimit(1 << 13, 1 << 13)).isTrue();
    assertThat(PixelBuffer.withinPixelLimit(1 << 13, (1 << 13) + 1)).isFalse();
  }

  @Test
  void shouldRejectShape_whenSampleCountWouldOverflowInt() {
    assertThat(PixelBuffer.withinPixelLimit(Integer.MAX_VALUE, Integer.MAX_VALUE)).isFalse();

    assertThatThrownBy(() -> PixelBuffer.blank(50_000, 50_000, PixelBuffer.RGB))
        .isInstanceOf(IllegalArgumentException.class)
        .hasMessageContaining("exceeds the limit");
  }

  @Test
  void shouldRejectNonPositiveDimensions() {
    assertThat(PixelBuffer.withinPixelLimit(0, 10)).isFalse();
    assertThatThrownBy(() -> PixelBuffer.blank(0, 10, PixelBuffer.GRAY))
        .isInstanceOf(IllegalArgumentException.class);
  }
}
