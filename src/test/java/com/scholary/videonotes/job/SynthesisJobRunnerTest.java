package com.scholary.videonotes.job;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

import com.scholary.videonotes.api.JobStatusResponse.Status;
import com.scholary.videonotes.pipeline.ErrorCode;
import com.scholary.videonotes.pipeline.PipelineException;
import com.scholary.videonotes.pipeline.PipelineOrchestrator;
import com.scholary.videonotes.pipeline.PipelineState;
import com.scholary.videonotes.pipeline.ProgressListener;
import com.scholary.videonotes.pipeline.SynthesisResult;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class SynthesisJobRunnerTest {

  private PipelineOrchestrator orchestrator;
  private JobRepository repository;
  private SynthesisJobRunner runner;
  private SynthesisJob job;

  @BeforeEach
  void setUp() {
    orchestrator = mock(PipelineOrchestrator.class);
    repository = new JobRepository(10, 5);
    runner = new SynthesisJobRunner(orchestrator, repository);
    job = new SynthesisJob("job-1", SynthesisJobTest.request());
  }

  @Test
  void run_shouldCompleteJobAndForwardProgress() {
    SynthesisResult result = new SynthesisResult("run-1", List.of(), false, false, null);
    when(orchestrator.synthesize(eq(job.getRequest()), any(ProgressListener.class)))
        .thenAnswer(
            invocation -> {
              ProgressListener listener = invocation.getArgument(1);
              listener.onProgress(PipelineState.EXTRACTING, 42);
              assertThat(job.getStatus()).isEqualTo(Status.PROCESSING);
              assertThat(job.getProgress()).isEqualTo(42);
              return result;
            });

    runner.run(job);

    assertThat(job.getStatus()).isEqualTo(Status.COMPLETED);
    assertThat(job.getResult()).isSameAs(result);
    assertThat(repository.findById("job-1")).containsSame(job);
  }

  @Test
  void run_shouldRecordPipelineError() {
    when(orchestrator.synthesize(eq(job.getRequest()), any(ProgressListener.class)))
        .thenThrow(new PipelineException(ErrorCode.NO_USABLE_CONTENT, "nothing found"));

    runner.run(job);

    assertThat(job.getStatus()).isEqualTo(Status.FAILED);
    assertThat(job.getError().code()).isEqualTo(ErrorCode.NO_USABLE_CONTENT);
    assertThat(job.getError().message()).isEqualTo("nothing found");
  }

  @Test
  void run_shouldRecordUnexpectedErrorAsInternal() {
    when(orchestrator.synthesize(eq(job.getRequest()), any(ProgressListener.class)))
        .thenThrow(new IllegalStateException("boom"));

    runner.run(job);

    assertThat(job.getStatus()).isEqualTo(Status.FAILED);
    assertThat(job.getError().code()).isEqualTo(ErrorCode.INTERNAL_ERROR);
  }
}
