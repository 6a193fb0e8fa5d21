package com.scholary.videonotes.subtitle;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

import org.junit.jupiter.api.Test;

class TimecodesTest {

  @Test
  void parse_shouldAcceptHoursMinutesSeconds() {
    assertThat(Timecodes.parse("01:01:01")).isEqualTo(3661.0);
  }

  @Test
  void parse_shouldAcceptMinutesSeconds() {
    assertThat(Timecodes.parse("01:05")).isEqualTo(65.0);
  }

  @Test
  void parse_shouldAcceptBareSeconds() {
    assertThat(Timecodes.parse("42")).isEqualTo(42.0);
  }

  @Test
  void parse_shouldAcceptSrtCommaDecimals() {
    assertThat(Timecodes.parse("00:00:01,500")).isCloseTo(1.5, within(1e-9));
    assertThat(Timecodes.parse("00:02.250")).isCloseTo(2.25, within(1e-9));
  }

  @Test
  void parse_shouldRejectGarbage() {
    assertThatThrownBy(() -> Timecodes.parse("abc"))
        .isInstanceOf(IllegalArgumentException.class)
        .hasMessageContaining("Invalid timecode");
    assertThatThrownBy(() -> Timecodes.parse("1:2:3:4"))
        .isInstanceOf(IllegalArgumentException.class);
    assertThatThrownBy(() -> Timecodes.parse(" ")).isInstanceOf(IllegalArgumentException.class);
  }

  @Test
  void toClock_shouldZeroPadAndTruncate() {
    assertThat(Timecodes.toClock(0)).isEqualTo("00:00:00");
    assertThat(Timecodes.toClock(65.9)).isEqualTo("00:01:05");
    assertThat(Timecodes.toClock(3661)).isEqualTo("01:01:01");
  }
}
