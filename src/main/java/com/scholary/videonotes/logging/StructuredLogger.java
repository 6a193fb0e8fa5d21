package com.scholary.videonotes.logging;

import org.slf4j.Logger;
import org.slf4j.MDC;

/**
 * Utility for structured logging with MDC (Mapped Diagnostic Context).
 *
 * <p>Provides methods to log pipeline events with structured fields that can be queried in a log
 * search backend.
 */
public class StructuredLogger {

  public static final String RUN_ID = "runId";

  private final Logger logger;

  public StructuredLogger(Logger logger) {
    this.logger = logger;
  }

  /** Log pipeline phase transition. */
  public void logPhase(String phase, String detail) {
    try {
      MDC.put("event_type", "pipeline_phase");
      MDC.put("phase", phase);

      logger.info("Pipeline phase: {} ({})", phase, detail);
    } finally {
      clearEventFields();
    }
  }

  /** Log chunk started event. */
  public void logChunkStarted(int chunkIndex, double start, double end, int chars) {
    try {
      MDC.put("event_type", "chunk_started");
      MDC.put("chunk_index", String.valueOf(chunkIndex));
      MDC.put("start", String.valueOf(start));
      MDC.put("end", String.valueOf(end));
      MDC.put("chars", String.valueOf(chars));

      logger.debug(
          "Chunk started: index={}, range=[{}-{}], chars={}", chunkIndex, start, end, chars);
    } finally {
      clearEventFields();
    }
  }

  /** Log chunk finished event. */
  public void logChunkFinished(int chunkIndex, int moments, int discarded, long elapsedMs) {
    try {
      MDC.put("event_type", "chunk_finished");
      MDC.put("chunk_index", String.valueOf(chunkIndex));
      MDC.put("moments", String.valueOf(moments));
      MDC.put("discarded", String.valueOf(discarded));
      MDC.put("elapsedMs", String.valueOf(elapsedMs));

      logger.debug(
          "Chunk finished: index={}, moments={}, discarded={}, elapsed={}ms",
          chunkIndex,
          moments,
          discarded,
          elapsedMs);
    } finally {
      clearEventFields();
    }
  }

  /** Log model retry event. */
  public void logModelRetry(
      int chunkIndex, int attempt, int maxRetries, String errorType, String message) {
    try {
      MDC.put("event_type", "model_retry");
      MDC.put("chunk_index", String.valueOf(chunkIndex));
      MDC.put("attempt", String.valueOf(attempt));
      MDC.put("maxRetries", String.valueOf(maxRetries));
      MDC.put("errorType", errorType);

      logger.warn(
          "Model retry: chunk={}, attempt={}/{}, error={}, message={}",
          chunkIndex,
          attempt,
          maxRetries,
          errorType,
          message);
    } finally {
      clearEventFields();
    }
  }

  /** Log chunk failure event. The chunk contributes no moments. */
  public void logChunkFailed(int chunkIndex, String errorType, String message) {
    try {
      MDC.put("event_type", "chunk_failed");
      MDC.put("chunk_index", String.valueOf(chunkIndex));
      MDC.put("errorType", errorType);

      logger.warn(
          "Chunk failed: chunk={}, error={}, message={}", chunkIndex, errorType, message);
    } finally {
      clearEventFields();
    }
  }

  /** Log frame resolution event. */
  public void logFrameResolved(
      int momentIndex, double seconds, String outcome, double offsetSeconds, double sharpness) {
    try {
      MDC.put("event_type", "frame_resolved");
      MDC.put("moment_index", String.valueOf(momentIndex));
      MDC.put("seconds", String.valueOf(seconds));
      MDC.put("outcome", outcome);
      MDC.put("offsetSeconds", String.valueOf(offsetSeconds));
      MDC.put("sharpness", String.valueOf(sharpness));

      logger.debug(
          "Frame resolved: moment={}, at={}s, outcome={}, offset={}s, sharpness={}",
          momentIndex,
          seconds,
          outcome,
          offsetSeconds,
          sharpness);
    } finally {
      clearEventFields();
    }
  }

  /** Set run context in MDC. */
  public static void setRunContext(String runId) {
    MDC.put(RUN_ID, runId);
  }

  /** Clear run context from MDC. */
  public static void clearRunContext() {
    MDC.remove(RUN_ID);
  }

  /** Clear event-specific fields from MDC. */
  private void clearEventFields() {
    MDC.remove("event_type");
    MDC.remove("phase");
    MDC.remove("chunk_index");
    MDC.remove("start");
    MDC.remove("end");
    MDC.remove("chars");
    MDC.remove("moments");
    MDC.remove("discarded");
    MDC.remove("elapsedMs");
    MDC.remove("attempt");
    MDC.remove("maxRetries");
    MDC.remove("errorType");
    MDC.remove("moment_index");
    MDC.remove("seconds");
    MDC.remove("outcome");
    MDC.remove("offsetSeconds");
    MDC.remove("sharpness");
  }
}
