package com.scholary.videonotes.pipeline;

import com.scholary.videonotes.note.NoteNode;
import com.scholary.videonotes.subtitle.SubtitleFormat;
import java.util.List;

/**
 * Output of a synthesis run.
 *
 * @param runId unique run id, also the name of the run's frame directory
 * @param notes notes ascending by seconds
 * @param partial true when some work was cut short and notes may be missing or image-less
 * @param timedOut true when the run deadline fired
 * @param diagnostics counters for the run
 */
public record SynthesisResult(
    String runId,
    List<NoteNode> notes,
    boolean partial,
    boolean timedOut,
    Diagnostics diagnostics) {

  public SynthesisResult {
    notes = List.copyOf(notes);
  }

  /** Run diagnostics. */
  public record Diagnostics(
      SubtitleFormat subtitleFormat,
      int cueCount,
      int chunkCount,
      int failedChunks,
      int cachedChunks,
      int momentCount,
      int failedFrames,
      int degradedFrames,
      double videoDurationSeconds,
      long elapsedMillis,
      PipelineState finalState) {}
}
