package com.scholary.videonotes.subtitle;

import java.util.List;

/**
 * A group of consecutive cues submitted to the language model together.
 *
 * <p>The chunk covers the time range from its first cue's start to its last cue's end. Its
 * serialized form never exceeds {@code charBudget} characters.
 */
public record TranscriptChunk(int index, List<TimedCue> cues, int charBudget) {

  public TranscriptChunk {
    if (cues == null || cues.isEmpty()) {
      throw new IllegalArgumentException("A chunk needs at least one cue");
    }
    if (charBudget <= 0) {
      throw new IllegalArgumentException("Char budget must be positive");
    }
    cues = List.copyOf(cues);
  }

  public double startSeconds() {
    return cues.get(0).startSeconds();
  }

  public double endSeconds() {
    return cues.get(cues.size() - 1).endSeconds();
  }

  /**
   * Check if a time point falls within this chunk's cue range, widened by a tolerance.
   *
   * @param seconds the time to check
   * @param toleranceSeconds slack allowed on either side
   * @return true if the time is within [start - tolerance, end + tolerance]
   */
  public boolean covers(double seconds, double toleranceSeconds) {
    return seconds >= startSeconds() - toleranceSeconds
        && seconds <= endSeconds() + toleranceSeconds;
  }

  /**
   * Serialize the cues for the prompt, one {@code [HH:MM:SS] text} line per cue.
   *
   * <p>Only a chunk holding a single oversized cue can hit the budget here; its text is cut at
   * the budget.
   */
  public String serialize() {
    StringBuilder sb = new StringBuilder();
    for (TimedCue cue : cues) {
      if (sb.length() > 0) {
        sb.append('\n');
      }
      sb.append(cue.serialize());
    }
    if (sb.length() > charBudget) {
      sb.setLength(charBudget);
    }
    return sb.toString();
  }
}
