package com.scholary.videonotes.api;

import com.scholary.videonotes.pipeline.PipelineError;
import com.scholary.videonotes.pipeline.PipelineState;
import com.scholary.videonotes.pipeline.SynthesisResult;

/**
 * Response for job status query.
 *
 * <p>Shows the current state of an async job and includes the result if completed.
 */
public record JobStatusResponse(
    String jobId,
    Status status,
    PipelineState phase,
    Integer progress,
    SynthesisResult result,
    PipelineError error) {

  public enum Status {
    PENDING,
    PROCESSING,
    COMPLETED,
    FAILED
  }
}
