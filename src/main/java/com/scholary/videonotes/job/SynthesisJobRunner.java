package com.scholary.videonotes.job;

import com.scholary.videonotes.api.JobStatusResponse.Status;
import com.scholary.videonotes.pipeline.ErrorCode;
import com.scholary.videonotes.pipeline.PipelineError;
import com.scholary.videonotes.pipeline.PipelineException;
import com.scholary.videonotes.pipeline.PipelineOrchestrator;
import com.scholary.videonotes.pipeline.SynthesisResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.Async;
import org.springframework.stereotype.Service;

/**
 * Runs synthesis jobs in the background.
 *
 * <p>Lives in its own bean so calls from the controller go through the async proxy. The job status
 * is updated as processing progresses.
 */
@Service
public class SynthesisJobRunner {

  private static final Logger LOGGER = LoggerFactory.getLogger(SynthesisJobRunner.class);

  private final PipelineOrchestrator orchestrator;
  private final JobRepository jobRepository;

  public SynthesisJobRunner(PipelineOrchestrator orchestrator, JobRepository jobRepository) {
    this.orchestrator = orchestrator;
    this.jobRepository = jobRepository;
  }

  /** Process a job on the {@code taskExecutor} pool. */
  @Async("taskExecutor")
  public void run(SynthesisJob job) {
    LOGGER.info("Starting async processing for job: {}", job.getJobId());

    try {
      job.setStatus(Status.PROCESSING);
      jobRepository.save(job);

      SynthesisResult result = orchestrator.synthesize(job.getRequest(), job::updateProgress);

      job.complete(result);
      jobRepository.save(job);
      LOGGER.info(
          "Completed async processing for job: {} ({} notes)",
          job.getJobId(),
          result.notes().size());

    } catch (PipelineException e) {
      LOGGER.warn("Job {} failed: {} {}", job.getJobId(), e.getCode(), e.getMessage());
      job.fail(e.toError());
      jobRepository.save(job);
    } catch (RuntimeException e) {
      LOGGER.error("Async processing failed for job: {}", job.getJobId(), e);
      job.fail(new PipelineError(ErrorCode.INTERNAL_ERROR, e.getMessage()));
      jobRepository.save(job);
    }
  }
}
