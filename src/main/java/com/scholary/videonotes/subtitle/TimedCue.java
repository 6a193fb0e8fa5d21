package com.scholary.videonotes.subtitle;

/**
 * One timed subtitle entry.
 *
 * <p>Times are in seconds with fractional precision. A cue always has a positive duration; the
 * parser drops anything else before constructing one.
 */
public record TimedCue(double startSeconds, double endSeconds, String text) {

  public TimedCue {
    if (startSeconds < 0) {
      throw new IllegalArgumentException("Start time cannot be negative");
    }
    if (endSeconds <= startSeconds) {
      throw new IllegalArgumentException("End time must be > start time");
    }
    if (text == null) {
      throw new IllegalArgumentException("Cue text cannot be null");
    }
  }

  public double duration() {
    return endSeconds - startSeconds;
  }

  /** Prompt form of the cue: {@code [HH:MM:SS] text}. */
  public String serialize() {
    return "[" + Timecodes.toClock(startSeconds) + "] " + text;
  }
}
