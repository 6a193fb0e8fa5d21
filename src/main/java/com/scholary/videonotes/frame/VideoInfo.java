package com.scholary.videonotes.frame;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Basic properties of a video stream.
 *
 * <p>{@code totalFrames} is estimated from duration and frame rate when the container does not
 * report it.
 */
public record VideoInfo(
    double durationSeconds, double fps, int width, int height, long totalFrames) {

  /** Duration as zero-padded {@code HH:MM:SS}. */
  @JsonProperty("durationFormatted")
  public String durationFormatted() {
    long total = (long) Math.floor(durationSeconds);
    return String.format("%02d:%02d:%02d", total / 3600, (total % 3600) / 60, total % 60);
  }

  /** Time of the last decodable frame, one frame before the end. */
  public double lastFrameSeconds() {
    double frameDuration = fps > 0 ? 1.0 / fps : 0.1;
    return Math.max(0, durationSeconds - frameDuration);
  }
}
