package com.scholary.videonotes.api;

import com.scholary.videonotes.frame.FrameDecodeException;
import com.scholary.videonotes.frame.VideoInfo;
import com.scholary.videonotes.frame.VideoProbeService;
import com.scholary.videonotes.llm.LlmProperties;
import com.scholary.videonotes.pipeline.ErrorCode;
import com.scholary.videonotes.pipeline.PipelineError;
import com.scholary.videonotes.pipeline.PipelineException;
import com.scholary.videonotes.pipeline.PipelineOrchestrator;
import com.scholary.videonotes.pipeline.SynthesisResult;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

/**
 * REST API for note synthesis.
 *
 * <p>Provides endpoints for:
 *
 * <ul>
 *   <li>Synchronous synthesis (blocks until the notes are ready or the run deadline passes)
 *   <li>Video metadata lookup
 * </ul>
 */
@RestController
@Tag(name = "Notes", description = "Video note synthesis API")
public class NotesController {

  private static final Logger LOGGER = LoggerFactory.getLogger(NotesController.class);

  private final PipelineOrchestrator orchestrator;
  private final VideoProbeService probeService;
  private final LlmProperties llmProperties;

  public NotesController(
      PipelineOrchestrator orchestrator,
      VideoProbeService probeService,
      LlmProperties llmProperties) {
    this.orchestrator = orchestrator;
    this.probeService = probeService;
    this.llmProperties = llmProperties;
  }

  /**
   * Synthesize illustrated notes.
   *
   * <p>Fatal pipeline errors are returned as {@code success: false} with HTTP 422; partial results
   * are still a success.
   */
  @PostMapping("/analyze_video")
  @Operation(
      summary = "Synthesize notes from a video and its subtitles",
      description =
          "Segment the subtitles, ask the language model for visually informative moments, "
              + "extract a sharp frame for each and return the ordered notes.")
  public ResponseEntity<AnalyzeResponse> analyzeVideo(@Valid @RequestBody AnalyzeRequest request) {
    LOGGER.info("Analyze request: {}", request);
    try {
      SynthesisResult result = orchestrator.synthesize(request.toSynthesisRequest(llmProperties));
      return ResponseEntity.ok(AnalyzeResponse.ok(result));
    } catch (PipelineException e) {
      LOGGER.warn("Synthesis failed: {} {}", e.getCode(), e.getMessage());
      return ResponseEntity.status(HttpStatus.UNPROCESSABLE_ENTITY)
          .body(AnalyzeResponse.failure(e.toError()));
    }
  }

  /** Get basic properties of a video file. */
  @GetMapping("/video_info")
  @Operation(summary = "Get video info", description = "Duration, frame rate and size of a video")
  public ResponseEntity<?> videoInfo(@RequestParam("path") String path) {
    Path videoFile = Paths.get(path);
    if (!Files.isRegularFile(videoFile)) {
      return ResponseEntity.badRequest()
          .body(
              AnalyzeResponse.failure(
                  new PipelineError(ErrorCode.INVALID_REQUEST, "Video file not found: " + path)));
    }
    try {
      VideoInfo info = probeService.probe(videoFile);
      return ResponseEntity.ok(info);
    } catch (FrameDecodeException e) {
      LOGGER.warn("Failed to probe {}: {}", path, e.getMessage());
      return ResponseEntity.status(HttpStatus.UNPROCESSABLE_ENTITY)
          .body(
              AnalyzeResponse.failure(
                  new PipelineError(ErrorCode.FRAME_DECODE_FAILURE, e.getMessage())));
    }
  }
}
