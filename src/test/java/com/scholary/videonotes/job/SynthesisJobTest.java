package com.scholary.videonotes.job;

import static org.assertj.core.api.Assertions.assertThat;

import com.scholary.videonotes.api.JobStatusResponse.Status;
import com.scholary.videonotes.llm.ModelConfig;
import com.scholary.videonotes.moment.NoteStyle;
import com.scholary.videonotes.pipeline.ErrorCode;
import com.scholary.videonotes.pipeline.PipelineError;
import com.scholary.videonotes.pipeline.PipelineState;
import com.scholary.videonotes.pipeline.SynthesisRequest;
import com.scholary.videonotes.pipeline.SynthesisResult;
import java.nio.file.Path;
import java.util.List;
import org.junit.jupiter.api.Test;

class SynthesisJobTest {

  static SynthesisRequest request() {
    return new SynthesisRequest(
        Path.of("/videos/talk.mp4"),
        "[00:01] hello",
        NoteStyle.PROFESSIONAL,
        new ModelConfig("sk-test", null, "gpt-4o-mini"));
  }

  @Test
  void newJob_shouldBePending() {
    SynthesisJob job = new SynthesisJob("job-1", request());

    assertThat(job.getStatus()).isEqualTo(Status.PENDING);
    assertThat(job.getProgress()).isZero();
    assertThat(job.getPhase()).isNull();
    assertThat(job.getCreatedAt()).isNotNull();
  }

  @Test
  void updateProgress_shouldNeverMoveBackwards() {
    SynthesisJob job = new SynthesisJob("job-1", request());

    job.updateProgress(PipelineState.EXTRACTING, 40);
    job.updateProgress(PipelineState.FRAME_RESOLVING, 35);

    assertThat(job.getPhase()).isEqualTo(PipelineState.FRAME_RESOLVING);
    assertThat(job.getProgress()).isEqualTo(40);
  }

  @Test
  void complete_shouldStoreResult() {
    SynthesisJob job = new SynthesisJob("job-1", request());
    SynthesisResult result = new SynthesisResult("run-1", List.of(), false, false, null);

    job.complete(result);

    assertThat(job.getStatus()).isEqualTo(Status.COMPLETED);
    assertThat(job.getPhase()).isEqualTo(PipelineState.DONE);
    assertThat(job.getProgress()).isEqualTo(100);
    assertThat(job.getResult()).isSameAs(result);
  }

  @Test
  void fail_shouldKeepProgressAndStoreError() {
    SynthesisJob job = new SynthesisJob("job-1", request());
    job.updateProgress(PipelineState.EXTRACTING, 25);

    job.fail(new PipelineError(ErrorCode.PIPELINE_TIMEOUT, "too slow"));

    assertThat(job.getStatus()).isEqualTo(Status.FAILED);
    assertThat(job.getPhase()).isEqualTo(PipelineState.FAILED);
    assertThat(job.getProgress()).isEqualTo(25);
    assertThat(job.getError().code()).isEqualTo(ErrorCode.PIPELINE_TIMEOUT);
  }
}
