package com.scholary.videonotes.api;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.scholary.videonotes.note.NoteNode;
import com.scholary.videonotes.pipeline.PipelineError;
import com.scholary.videonotes.pipeline.SynthesisResult;
import java.util.List;

/**
 * Response of a synthesis request.
 *
 * <p>Either {@code success} with the notes, or a failure with an empty {@code data} array and
 * the error. {@code partial} and {@code timedOut} are only present on success.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record AnalyzeResponse(
    boolean success,
    List<NoteNode> data,
    Boolean partial,
    Boolean timedOut,
    String runId,
    PipelineError error) {

  public static AnalyzeResponse ok(SynthesisResult result) {
    return new AnalyzeResponse(
        true, result.notes(), result.partial(), result.timedOut(), result.runId(), null);
  }

  public static AnalyzeResponse failure(PipelineError error) {
    return new AnalyzeResponse(false, List.of(), null, null, null, error);
  }
}
