package com.scholary.videonotes.moment;

/**
 * A model-proposed candidate for a note: where in the video, what to call it, what to say.
 *
 * <p>{@code content} is markdown.
 */
public record Moment(double seconds, String title, String content) {

  public Moment {
    if (seconds < 0 || Double.isNaN(seconds)) {
      throw new IllegalArgumentException("Moment time must be a non-negative number");
    }
    if (title == null || title.isBlank()) {
      throw new IllegalArgumentException("Moment title cannot be blank");
    }
    if (content == null) {
      content = "";
    }
  }
}
