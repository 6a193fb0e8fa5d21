package com.scholary.videonotes.job;

import com.scholary.videonotes.api.JobStatusResponse.Status;
import com.scholary.videonotes.pipeline.PipelineError;
import com.scholary.videonotes.pipeline.PipelineState;
import com.scholary.videonotes.pipeline.SynthesisRequest;
import com.scholary.videonotes.pipeline.SynthesisResult;
import java.time.Instant;

/**
 * Represents an async synthesis job.
 *
 * <p>Tracks the job's state, progress, and result. Stored in memory using Caffeine cache. Updated
 * from the worker thread and read from request threads, hence the volatile fields.
 */
public class SynthesisJob {

  private final String jobId;
  private final SynthesisRequest request;
  private final Instant createdAt;

  private volatile Status status;
  private volatile PipelineState phase;
  private volatile int progress; // 0-100
  private volatile SynthesisResult result;
  private volatile PipelineError error;

  public SynthesisJob(String jobId, SynthesisRequest request) {
    this.jobId = jobId;
    this.request = request;
    this.createdAt = Instant.now();
    this.status = Status.PENDING;
    this.progress = 0;
  }

  public String getJobId() {
    return jobId;
  }

  public SynthesisRequest getRequest() {
    return request;
  }

  public Instant getCreatedAt() {
    return createdAt;
  }

  public Status getStatus() {
    return status;
  }

  public void setStatus(Status status) {
    this.status = status;
  }

  public PipelineState getPhase() {
    return phase;
  }

  public int getProgress() {
    return progress;
  }

  /** Record progress; never moves backwards. */
  public void updateProgress(PipelineState phase, int progress) {
    this.phase = phase;
    this.progress = Math.max(this.progress, Math.min(100, progress));
  }

  public SynthesisResult getResult() {
    return result;
  }

  public void complete(SynthesisResult result) {
    this.result = result;
    this.progress = 100;
    this.phase = PipelineState.DONE;
    this.status = Status.COMPLETED;
  }

  public PipelineError getError() {
    return error;
  }

  public void fail(PipelineError error) {
    this.error = error;
    this.phase = PipelineState.FAILED;
    this.status = Status.FAILED;
  }
}
