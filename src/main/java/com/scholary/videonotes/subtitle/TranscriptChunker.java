package com.scholary.videonotes.subtitle;

import java.util.ArrayList;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Folds ordered cues into chunks bounded by a character budget.
 *
 * <p>Boundaries fall only between cues, never inside one, so every chunk boundary lines up with
 * the transcript's own sentence-level structure. Every cue lands in exactly one chunk, in order.
 */
public class TranscriptChunker {

  private static final Logger LOGGER = LoggerFactory.getLogger(TranscriptChunker.class);

  /**
   * Group cues into chunks.
   *
   * <p>Greedy: a cue joins the current chunk if the chunk's serialized length stays within the
   * budget, otherwise it starts a new chunk. A cue that alone exceeds the budget gets a chunk of
   * its own.
   *
   * @param cues ordered cues
   * @param charBudget maximum serialized length of a chunk
   * @return the chunks, in cue order
   */
  public List<TranscriptChunk> chunk(List<TimedCue> cues, int charBudget) {
    if (charBudget <= 0) {
      throw new IllegalArgumentException("Char budget must be positive");
    }

    List<TranscriptChunk> chunks = new ArrayList<>();
    List<TimedCue> current = new ArrayList<>();
    int currentLength = 0;

    for (TimedCue cue : cues) {
      int cueLength = cue.serialize().length();
      // +1 for the newline joining it to the previous cue
      int lengthWithCue = current.isEmpty() ? cueLength : currentLength + 1 + cueLength;

      if (!current.isEmpty() && lengthWithCue > charBudget) {
        chunks.add(new TranscriptChunk(chunks.size(), current, charBudget));
        current = new ArrayList<>();
        lengthWithCue = cueLength;
      }

      if (cueLength > charBudget) {
        LOGGER.warn(
            "Cue at {}s is {} chars, over the {} char budget; it will be truncated in the prompt",
            cue.startSeconds(),
            cueLength,
            charBudget);
      }

      current.add(cue);
      currentLength = lengthWithCue;
    }

    if (!current.isEmpty()) {
      chunks.add(new TranscriptChunk(chunks.size(), current, charBudget));
    }

    LOGGER.info(
        "Folded {} cues into {} chunks (budget {} chars)", cues.size(), chunks.size(), charBudget);
    return chunks;
  }
}
