package com.scholary.videonotes.frame;

import com.scholary.videonotes.config.PipelineProperties;
import com.scholary.videonotes.config.PipelineProperties.FrameProperties;
import java.nio.file.Path;
import java.util.HashSet;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

/**
 * Resolves a moment's timestamp to a sharp, representative still.
 *
 * <p>Search strategy:
 *
 * <ol>
 *   <li>Clamp the target into the decodable range
 *   <li>Decode the target; accept it if it clears the sharpness threshold
 *   <li>Otherwise sample symmetric windows around the target, doubling the half-width from the
 *       initial window up to the maximum radius. Within a window, nearer offsets come first and
 *       the later side is tried before the earlier one
 *   <li>Stop after the first window that produced a sharp frame and keep the sharpest frame seen
 *   <li>If nothing cleared the threshold, keep the sharpest frame anyway, marked degraded
 * </ol>
 *
 * <p>The engine is stateless; the caller owns the decoder handle.
 */
@Component
public class FrameExtractionEngine {

  private static final Logger LOGGER = LoggerFactory.getLogger(FrameExtractionEngine.class);
  private static final double EPSILON = 1e-9;

  private final FrameProperties properties;
  private final FrameWriter writer;

  @Autowired
  public FrameExtractionEngine(PipelineProperties properties) {
    this(properties.frames());
  }

  public FrameExtractionEngine(FrameProperties properties) {
    this.properties = properties;
    this.writer = new FrameWriter(properties.jpegQuality());
  }

  /**
   * Find and persist the frame for a moment.
   *
   * @param decoder exclusively held decode handle
   * @param targetSeconds the moment's timestamp
   * @param outputFile where to write the JPEG
   * @return success with the written file, or the reason no frame could be produced
   */
  public FrameResult extract(FrameDecoder decoder, double targetSeconds, Path outputFile) {
    try {
      Search search = search(decoder, targetSeconds);
      if (search.best == null) {
        FrameDecodeException failure =
            search.failure != null
                ? search.failure
                : new FrameDecodeException(
                    FailureReason.SEEK_OUT_OF_RANGE,
                    String.format("No frame decodable near %.3fs", targetSeconds));
        return FrameResult.failure(failure);
      }

      Path written = writer.write(search.best.image(), outputFile);
      boolean degraded = search.bestScore < properties.sharpnessThreshold();
      double offset = round(search.best.seconds() - targetSeconds);
      if (degraded) {
        LOGGER.debug(
            "No sharp frame within {}s of {}s, keeping best score {}",
            properties.maxSearchRadiusSeconds(),
            targetSeconds,
            search.bestScore);
      }
      return new FrameResult.Success(written, search.bestScore, offset, degraded);
    } catch (FrameDecodeException e) {
      return FrameResult.failure(e);
    }
  }

  private Search search(FrameDecoder decoder, double targetSeconds) {
    VideoInfo info = decoder.videoInfo();
    double radius = properties.maxSearchRadiusSeconds();
    boolean durationKnown = info.durationSeconds() > 0;

    boolean beyondEnd = durationKnown && targetSeconds > info.durationSeconds() + radius;
    if (targetSeconds < -radius || beyondEnd) {
      throw new FrameDecodeException(
          FailureReason.SEEK_OUT_OF_RANGE,
          String.format(
              "Target %.3fs outside video of %.3fs", targetSeconds, info.durationSeconds()));
    }

    double upper = durationKnown ? info.lastFrameSeconds() : Double.MAX_VALUE;
    double center = round(Math.min(Math.max(targetSeconds, 0.0), upper));

    Search search = new Search();
    search.sample(decoder, center);
    if (search.isSharp()) {
      return search;
    }

    double step = properties.sampleIntervalSeconds();
    double halfWidth = Math.min(properties.initialWindowSeconds(), radius);
    while (true) {
      for (int k = 1; k * step <= halfWidth + EPSILON; k++) {
        double offset = k * step;
        for (double candidate : new double[] {center + offset, center - offset}) {
          double seconds = round(candidate);
          if (seconds >= 0 && seconds <= upper) {
            search.sample(decoder, seconds);
          }
        }
      }
      if (search.isSharp() || halfWidth >= radius - EPSILON) {
        return search;
      }
      halfWidth = Math.min(halfWidth * 2, radius);
    }
  }

  private static double round(double seconds) {
    return Math.round(seconds * 1_000_000d) / 1_000_000d;
  }

  /** Accumulates samples for one target. */
  private final class Search {
    private final Set<Double> visited = new HashSet<>();
    private DecodedFrame best;
    private double bestScore = -1;
    private FrameDecodeException failure;

    void sample(FrameDecoder decoder, double seconds) {
      if (!visited.add(seconds)) {
        return;
      }
      if (Thread.currentThread().isInterrupted()) {
        throw new FrameDecodeException(FailureReason.CANCELLED, "Frame search cancelled");
      }
      try {
        DecodedFrame frame = decoder.decodeAt(seconds);
        double score = SharpnessScorer.score(frame.image());
        if (score > bestScore) {
          best = frame;
          bestScore = score;
        }
      } catch (FrameDecodeException e) {
        if (e.getReason().affectsWholeVideo()) {
          throw e;
        }
        // Prefer a concrete decoder error over a plain out-of-range seek
        if (failure == null || failure.getReason() == FailureReason.SEEK_OUT_OF_RANGE) {
          failure = e;
        }
        LOGGER.debug("Sample at {}s failed: {}", seconds, e.getMessage());
      }
    }

    boolean isSharp() {
      return best != null && bestScore >= properties.sharpnessThreshold();
    }
  }
}
