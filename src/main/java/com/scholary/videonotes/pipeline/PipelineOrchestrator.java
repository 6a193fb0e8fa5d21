package com.scholary.videonotes.pipeline;

import com.scholary.videonotes.config.PipelineProperties;
import com.scholary.videonotes.frame.FailureReason;
import com.scholary.videonotes.frame.FrameDecoderFactory;
import com.scholary.videonotes.frame.FrameDecoderPool;
import com.scholary.videonotes.frame.FrameDecodeException;
import com.scholary.videonotes.frame.FrameExtractionEngine;
import com.scholary.videonotes.frame.FrameResult;
import com.scholary.videonotes.frame.VideoProbeService;
import com.scholary.videonotes.logging.StructuredLogger;
import com.scholary.videonotes.moment.ChunkMoments;
import com.scholary.videonotes.moment.ChunkOutcome;
import com.scholary.videonotes.moment.KeyMomentExtractor;
import com.scholary.videonotes.moment.Moment;
import com.scholary.videonotes.note.InlineTimestampMarkers;
import com.scholary.videonotes.note.MomentFrames;
import com.scholary.videonotes.note.NoteAssembler;
import com.scholary.videonotes.note.NoteNode;
import com.scholary.videonotes.subtitle.SegmentedTranscript;
import com.scholary.videonotes.subtitle.SubtitleSegmenter;
import com.scholary.videonotes.subtitle.TranscriptChunk;
import com.scholary.videonotes.subtitle.UnsupportedFormatException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.core.task.TaskRejectedException;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;
import org.springframework.stereotype.Service;

/**
 * Runs the note synthesis pipeline for one video.
 *
 * <p>Phases:
 *
 * <ol>
 *   <li>PARSING: probe the video and segment the subtitles into chunks
 *   <li>EXTRACTING: ask the model for key moments, one task per chunk on the model pool
 *   <li>FRAME_RESOLVING: find a sharp still for every moment, one task per moment on the frame
 *       pool
 *   <li>ASSEMBLING: pair moments with frames into ordered notes
 * </ol>
 *
 * <p>Chunk and frame failures are absorbed; the run only fails when nothing usable is left. A
 * run deadline bounds the whole pipeline: when it fires, outstanding work is cancelled and the
 * moments produced so far are returned as a partial result.
 */
@Service
public class PipelineOrchestrator {

  private static final Logger LOGGER = LoggerFactory.getLogger(PipelineOrchestrator.class);
  private final StructuredLogger structuredLogger = new StructuredLogger(LOGGER);

  private final SubtitleSegmenter segmenter;
  private final KeyMomentExtractor momentExtractor;
  private final FrameExtractionEngine frameEngine;
  private final FrameDecoderFactory decoderFactory;
  private final VideoProbeService probeService;
  private final NoteAssembler noteAssembler;
  private final ThreadPoolTaskExecutor modelExecutor;
  private final ThreadPoolTaskExecutor frameExecutor;
  private final PipelineProperties properties;
  private final Path outputDir;

  public PipelineOrchestrator(
      SubtitleSegmenter segmenter,
      KeyMomentExtractor momentExtractor,
      FrameExtractionEngine frameEngine,
      FrameDecoderFactory decoderFactory,
      VideoProbeService probeService,
      NoteAssembler noteAssembler,
      @Qualifier("modelExecutor") ThreadPoolTaskExecutor modelExecutor,
      @Qualifier("frameExecutor") ThreadPoolTaskExecutor frameExecutor,
      PipelineProperties properties) {
    this.segmenter = segmenter;
    this.momentExtractor = momentExtractor;
    this.frameEngine = frameEngine;
    this.decoderFactory = decoderFactory;
    this.probeService = probeService;
    this.noteAssembler = noteAssembler;
    this.modelExecutor = modelExecutor;
    this.frameExecutor = frameExecutor;
    this.properties = properties;
    this.outputDir = Paths.get(properties.outputDir());
  }

  /** Run the pipeline without progress reporting. */
  public SynthesisResult synthesize(SynthesisRequest request) {
    return synthesize(request, ProgressListener.NONE);
  }

  /**
   * Run the pipeline.
   *
   * @param request video, subtitles, style and model settings
   * @param listener receives phase and progress updates
   * @return the notes, possibly partial
   * @throws PipelineException if no note can be produced
   */
  public SynthesisResult synthesize(SynthesisRequest request, ProgressListener listener) {
    String runId = UUID.randomUUID().toString();
    StructuredLogger.setRunContext(runId);
    long startTime = System.currentTimeMillis();
    long deadline = System.nanoTime() + TimeUnit.SECONDS.toNanos(properties.timeoutSeconds());

    try {
      LOGGER.info(
          "Starting synthesis: video={}, style={}, {}",
          request.videoPath(),
          request.style(),
          request.modelConfig());

      // Phase 1: parse
      enter(PipelineState.PARSING, listener, "video=" + request.videoPath().getFileName());
      if (!Files.isRegularFile(request.videoPath())) {
        throw new PipelineException(
            ErrorCode.INVALID_REQUEST, "Video file not found: " + request.videoPath());
      }
      double duration = probeDuration(request.videoPath());
      SegmentedTranscript transcript = segment(request.subtitleText(), duration);

      // Phase 2: key moments
      enter(
          PipelineState.EXTRACTING,
          listener,
          transcript.cues().size() + " cues in " + transcript.chunks().size() + " chunks");
      ExtractionPhase extraction =
          extractMoments(request, transcript, duration, deadline, listener);
      List<Moment> moments = momentExtractor.merge(extraction.results);
      LOGGER.info(
          "Merged {} moments from {} chunks ({} failed)",
          moments.size(),
          extraction.results.size(),
          extraction.failedChunks());
      LOGGER.info(
          "{} chunks answered from cache, {}",
          extraction.cachedChunks(),
          momentExtractor.cacheStats());

      if (moments.isEmpty()) {
        if (extraction.timedOut) {
          throw new PipelineException(
              ErrorCode.PIPELINE_TIMEOUT,
              "Run exceeded " + properties.timeoutSeconds() + "s before any moment was found");
        }
        throw new PipelineException(
            ErrorCode.NO_USABLE_CONTENT,
            extraction.failedChunks() == extraction.results.size()
                ? "Key moment extraction failed for every chunk"
                : "The model found no key moments in the transcript");
      }

      // Phase 3: frames
      enter(PipelineState.FRAME_RESOLVING, listener, moments.size() + " moments");
      Path runDir = outputDir.resolve(runId);
      FramePhase frames =
          resolveFrames(request.videoPath(), moments, runDir, deadline, listener);

      // Phase 4: assemble
      enter(PipelineState.ASSEMBLING, listener, frames.items.size() + " notes");
      List<NoteNode> notes = noteAssembler.assemble(frames.items);

      boolean timedOut = extraction.timedOut || frames.timedOut;
      boolean partial = timedOut || extraction.failedChunks() > 0;
      SynthesisResult.Diagnostics diagnostics =
          new SynthesisResult.Diagnostics(
              transcript.format(),
              transcript.cues().size(),
              transcript.chunks().size(),
              extraction.failedChunks(),
              extraction.cachedChunks(),
              moments.size(),
              frames.failed,
              frames.degraded,
              duration,
              System.currentTimeMillis() - startTime,
              PipelineState.DONE);

      enter(PipelineState.DONE, listener, notes.size() + " notes");
      LOGGER.info(
          "Synthesis completed: {} notes, {} without image, {} degraded, partial={}, timedOut={}",
          notes.size(),
          frames.failed,
          frames.degraded,
          partial,
          timedOut);

      return new SynthesisResult(runId, notes, partial, timedOut, diagnostics);

    } catch (PipelineException e) {
      listener.onProgress(PipelineState.FAILED, PipelineState.FAILED.progressFloor());
      structuredLogger.logPhase(PipelineState.FAILED.name(), e.getCode() + ": " + e.getMessage());
      throw e;
    } finally {
      StructuredLogger.clearRunContext();
    }
  }

  private void enter(PipelineState state, ProgressListener listener, String detail) {
    structuredLogger.logPhase(state.name(), detail);
    listener.onProgress(state, state.progressFloor());
  }

  /** Video duration, or 0 when the video cannot be probed. Frame work reports the details. */
  private double probeDuration(Path videoPath) {
    try {
      return probeService.probe(videoPath).durationSeconds();
    } catch (FrameDecodeException e) {
      LOGGER.warn("Could not probe {}: {}", videoPath, e.getMessage());
      return 0.0;
    }
  }

  private SegmentedTranscript segment(String subtitleText, double duration) {
    SegmentedTranscript transcript;
    try {
      transcript = segmenter.segment(subtitleText, duration);
    } catch (UnsupportedFormatException e) {
      throw new PipelineException(ErrorCode.UNSUPPORTED_FORMAT, e.getMessage(), e);
    }
    if (transcript.isEmpty()) {
      throw new PipelineException(
          ErrorCode.NO_USABLE_CONTENT, "Subtitles contain no usable cues");
    }
    LOGGER.info(
        "Parsed {} subtitles: {} cues, {} chunks",
        transcript.format(),
        transcript.cues().size(),
        transcript.chunks().size());
    return transcript;
  }

  private ExtractionPhase extractMoments(
      SynthesisRequest request,
      SegmentedTranscript transcript,
      double duration,
      long deadline,
      ProgressListener listener) {

    List<TranscriptChunk> chunks = transcript.chunks();
    List<Future<ChunkMoments>> futures = new ArrayList<>(chunks.size());
    for (TranscriptChunk chunk : chunks) {
      try {
        futures.add(
            modelExecutor.submit(
                () ->
                    momentExtractor.extract(
                        chunk, request.style(), request.modelConfig(), duration)));
      } catch (TaskRejectedException e) {
        LOGGER.warn("Model pool rejected chunk {}: {}", chunk.index(), e.getMessage());
        futures.add(null);
      }
    }

    ExtractionPhase phase = new ExtractionPhase();
    int floor = PipelineState.EXTRACTING.progressFloor();
    int span = PipelineState.FRAME_RESOLVING.progressFloor() - floor;
    for (int i = 0; i < chunks.size(); i++) {
      int chunkIndex = chunks.get(i).index();
      Future<ChunkMoments> future = futures.get(i);
      if (future == null) {
        phase.results.add(
            ChunkMoments.failed(chunkIndex, ChunkOutcome.UNAVAILABLE, "Rejected by model pool"));
        continue;
      }
      // Past the deadline this only collects chunks that already finished.
      try {
        phase.results.add(awaitUntil(future, deadline));
      } catch (TimeoutException e) {
        if (!phase.timedOut) {
          LOGGER.warn("Run deadline reached while extracting chunk {}, cancelling", chunkIndex);
        }
        phase.timedOut = true;
        future.cancel(true);
        phase.results.add(
            ChunkMoments.failed(chunkIndex, ChunkOutcome.CANCELLED, "Run deadline exceeded"));
      } catch (ExecutionException e) {
        Throwable cause = e.getCause() != null ? e.getCause() : e;
        structuredLogger.logChunkFailed(
            chunkIndex, cause.getClass().getSimpleName(), cause.getMessage());
        phase.results.add(
            ChunkMoments.failed(chunkIndex, ChunkOutcome.UNAVAILABLE, cause.getMessage()));
      }
      listener.onProgress(
          PipelineState.EXTRACTING, floor + span * (i + 1) / chunks.size());
    }
    return phase;
  }

  private FramePhase resolveFrames(
      Path videoPath,
      List<Moment> moments,
      Path runDir,
      long deadline,
      ProgressListener listener) {

    int poolSize = Math.min(properties.effectiveFrameConcurrency(), moments.size());
    FramePhase phase = new FramePhase();

    try (FrameDecoderPool pool = new FrameDecoderPool(decoderFactory, videoPath, poolSize)) {
      List<Future<MomentFrames>> futures = new ArrayList<>(moments.size());
      for (int i = 0; i < moments.size(); i++) {
        int momentIndex = i;
        Moment moment = moments.get(i);
        try {
          futures.add(
              frameExecutor.submit(() -> resolveMoment(pool, momentIndex, moment, runDir)));
        } catch (TaskRejectedException e) {
          LOGGER.warn("Frame pool rejected moment {}: {}", momentIndex, e.getMessage());
          futures.add(null);
        }
      }

      int floor = PipelineState.FRAME_RESOLVING.progressFloor();
      int span = PipelineState.ASSEMBLING.progressFloor() - floor;
      for (int i = 0; i < moments.size(); i++) {
        Moment moment = moments.get(i);
        Future<MomentFrames> future = futures.get(i);
        MomentFrames item;
        if (future == null) {
          item = withoutImage(moment, FailureReason.REJECTED, "Rejected by frame pool");
        } else {
          try {
            item = awaitUntil(future, deadline);
          } catch (TimeoutException e) {
            if (!phase.timedOut) {
              LOGGER.warn("Run deadline reached while resolving frame {}, cancelling", i);
            }
            phase.timedOut = true;
            future.cancel(true);
            item = withoutImage(moment, FailureReason.CANCELLED, "Run deadline exceeded");
          } catch (ExecutionException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            LOGGER.warn("Frame task for moment {} failed: {}", i, cause.getMessage(), cause);
            item = withoutImage(moment, FailureReason.TASK_FAILED, cause.getMessage());
          }
        }
        phase.add(item);
        listener.onProgress(
            PipelineState.FRAME_RESOLVING, floor + span * (i + 1) / moments.size());
      }
    }
    return phase;
  }

  private MomentFrames resolveMoment(
      FrameDecoderPool pool, int momentIndex, Moment moment, Path runDir)
      throws InterruptedException {
    try (FrameDecoderPool.Lease lease = pool.acquire()) {
      FrameResult main =
          frameEngine.extract(
              lease.decoder(), moment.seconds(), runDir.resolve(frameFileName(momentIndex)));
      logFrame(momentIndex, moment.seconds(), main);

      Map<String, FrameResult> inline = new LinkedHashMap<>();
      if (properties.frames().inlineFrames()) {
        // [5:00], [05:00] and [00:05:00] share one frame
        Map<Double, FrameResult> bySeconds = new HashMap<>();
        for (String marker : InlineTimestampMarkers.find(moment.content())) {
          if (Thread.currentThread().isInterrupted()) {
            inline.put(marker, new FrameResult.Failure(FailureReason.CANCELLED, "Cancelled"));
            continue;
          }
          double seconds;
          try {
            seconds = InlineTimestampMarkers.seconds(marker);
          } catch (IllegalArgumentException e) {
            LOGGER.debug("Ignoring unparseable inline marker [{}]", marker);
            continue;
          }
          FrameResult result = bySeconds.get(seconds);
          if (result == null) {
            result =
                frameEngine.extract(
                    lease.decoder(),
                    seconds,
                    runDir.resolve(inlineFrameFileName(momentIndex, bySeconds.size() + 1)));
            bySeconds.put(seconds, result);
            if (!result.isSuccess()) {
              LOGGER.debug(
                  "No inline frame for [{}] in moment {}: {}", marker, momentIndex, result);
            }
          }
          inline.put(marker, result);
        }
      }
      return new MomentFrames(moment, main, inline);
    }
  }

  private void logFrame(int momentIndex, double seconds, FrameResult result) {
    if (result instanceof FrameResult.Success success) {
      structuredLogger.logFrameResolved(
          momentIndex,
          seconds,
          success.degraded() ? "DEGRADED" : "SHARP",
          success.offsetSeconds(),
          success.sharpness());
    } else if (result instanceof FrameResult.Failure failure) {
      structuredLogger.logFrameResolved(momentIndex, seconds, failure.reason().name(), 0, 0);
      LOGGER.warn(
          "{} for moment {} at {}s: {} ({})",
          ErrorCode.FRAME_DECODE_FAILURE,
          momentIndex,
          seconds,
          failure.reason(),
          failure.detail());
    }
  }

  static String frameFileName(int momentIndex) {
    return "frame_" + momentIndex + ".jpg";
  }

  static String inlineFrameFileName(int momentIndex, int markerNumber) {
    return "frame_" + momentIndex + "_" + markerNumber + ".jpg";
  }

  private static MomentFrames withoutImage(Moment moment, FailureReason reason, String detail) {
    return new MomentFrames(moment, new FrameResult.Failure(reason, detail));
  }

  /**
   * Wait for a task until the run deadline.
   *
   * @throws TimeoutException if the deadline passes first, or the waiting thread is interrupted
   */
  private static <T> T awaitUntil(Future<T> future, long deadline)
      throws TimeoutException, ExecutionException {
    long remaining = deadline - System.nanoTime();
    try {
      if (remaining <= 0) {
        if (future.isDone()) {
          return future.get();
        }
        throw new TimeoutException("Run deadline exceeded");
      }
      return future.get(remaining, TimeUnit.NANOSECONDS);
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      throw new TimeoutException("Interrupted while waiting for pipeline task");
    }
  }

  private static final class ExtractionPhase {
    private final List<ChunkMoments> results = new ArrayList<>();
    private boolean timedOut;

    int failedChunks() {
      return (int) results.stream().filter(r -> r.outcome().isFailure()).count();
    }

    int cachedChunks() {
      return (int) results.stream().filter(r -> r.outcome() == ChunkOutcome.CACHED).count();
    }
  }

  private static final class FramePhase {
    private final List<MomentFrames> items = new ArrayList<>();
    private boolean timedOut;
    private int failed;
    private int degraded;

    void add(MomentFrames item) {
      items.add(item);
      if (item.frame() instanceof FrameResult.Success success) {
        if (success.degraded()) {
          degraded++;
        }
      } else {
        failed++;
      }
    }
  }
}
