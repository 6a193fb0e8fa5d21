package com.scholary.videonotes.api;

import com.scholary.videonotes.job.JobRepository;
import com.scholary.videonotes.job.SynthesisJob;
import com.scholary.videonotes.job.SynthesisJobRunner;
import com.scholary.videonotes.llm.LlmProperties;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * REST API for asynchronous synthesis jobs.
 *
 * <p>Long videos can take minutes to process; clients start a job and poll its status.
 */
@RestController
@RequestMapping("/api/jobs")
@Tag(name = "Jobs", description = "Asynchronous note synthesis")
public class JobController {

  private static final Logger LOGGER = LoggerFactory.getLogger(JobController.class);

  private final JobRepository jobRepository;
  private final SynthesisJobRunner jobRunner;
  private final LlmProperties llmProperties;

  public JobController(
      JobRepository jobRepository, SynthesisJobRunner jobRunner, LlmProperties llmProperties) {
    this.jobRepository = jobRepository;
    this.jobRunner = jobRunner;
    this.llmProperties = llmProperties;
  }

  /** Start asynchronous synthesis job. */
  @PostMapping
  @Operation(
      summary = "Start synthesis",
      description = "Start asynchronous synthesis job and return job ID for status polling")
  public ResponseEntity<AsyncJobResponse> startJob(@Valid @RequestBody AnalyzeRequest request) {
    String jobId = UUID.randomUUID().toString();
    SynthesisJob job = new SynthesisJob(jobId, request.toSynthesisRequest(llmProperties));
    jobRepository.save(job);
    LOGGER.info("Created async synthesis job: {} ({})", jobId, request);

    jobRunner.run(job);

    return ResponseEntity.accepted().body(new AsyncJobResponse(jobId));
  }

  /**
   * Get job status.
   *
   * <p>Returns the current state of an async job. If the job is completed, includes the notes.
   */
  @GetMapping("/{id}")
  @Operation(summary = "Get job status", description = "Check the status of a synthesis job")
  public ResponseEntity<JobStatusResponse> getJobStatus(@PathVariable String id) {
    return jobRepository
        .findById(id)
        .map(
            job ->
                ResponseEntity.ok(
                    new JobStatusResponse(
                        job.getJobId(),
                        job.getStatus(),
                        job.getPhase(),
                        job.getProgress(),
                        job.getResult(),
                        job.getError())))
        .orElse(ResponseEntity.notFound().build());
  }
}
