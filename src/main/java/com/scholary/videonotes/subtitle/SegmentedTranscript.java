package com.scholary.videonotes.subtitle;

import java.util.List;

/** Output of the segmenter: detected format, all cues, and the chunks covering them. */
public record SegmentedTranscript(
    SubtitleFormat format, List<TimedCue> cues, List<TranscriptChunk> chunks) {

  public SegmentedTranscript {
    cues = List.copyOf(cues);
    chunks = List.copyOf(chunks);
  }

  public boolean isEmpty() {
    return cues.isEmpty();
  }
}
