package com.scholary.videonotes.subtitle;

/** Parsing and formatting of clock-style timecodes. */
public final class Timecodes {

  private Timecodes() {}

  /**
   * Parse a timecode into seconds.
   *
   * <p>Accepts {@code HH:MM:SS}, {@code MM:SS} and {@code SS}, each part optionally fractional.
   * A comma is accepted as the decimal separator (SRT style).
   *
   * @param timecode the timecode to parse
   * @return the number of seconds
   * @throws IllegalArgumentException if the timecode is not in a supported format
   */
  public static double parse(String timecode) {
    if (timecode == null || timecode.isBlank()) {
      throw new IllegalArgumentException("Timecode is blank");
    }
    String[] parts = timecode.trim().replace(',', '.').split(":");
    if (parts.length > 3) {
      throw new IllegalArgumentException("Invalid timecode format: " + timecode);
    }
    double seconds = 0;
    for (String part : parts) {
      double value;
      try {
        value = Double.parseDouble(part);
      } catch (NumberFormatException e) {
        throw new IllegalArgumentException("Invalid timecode format: " + timecode, e);
      }
      if (value < 0 || Double.isNaN(value) || Double.isInfinite(value)) {
        throw new IllegalArgumentException("Invalid timecode format: " + timecode);
      }
      seconds = seconds * 60 + value;
    }
    return seconds;
  }

  /** Format seconds as a zero-padded {@code HH:MM:SS} clock, truncating fractions. */
  public static String toClock(double seconds) {
    long total = (long) Math.floor(Math.max(0, seconds));
    return String.format("%02d:%02d:%02d", total / 3600, (total % 3600) / 60, total % 60);
  }
}
