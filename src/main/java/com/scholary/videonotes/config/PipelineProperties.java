package com.scholary.videonotes.config;

import jakarta.validation.Valid;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import jakarta.validation.constraints.PositiveOrZero;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Configuration properties for the note synthesis pipeline.
 *
 * <p>The sharpness threshold and the minimum moment separation are policy values that depend on
 * the source material. They live here so they can be calibrated per deployment.
 */
@ConfigurationProperties(prefix = "pipeline")
@Validated
public record PipelineProperties(
    @Valid @NotNull SegmenterProperties segmenter,
    @Valid @NotNull MomentProperties moments,
    @Valid @NotNull FrameProperties frames,
    @NotBlank String outputDir,
    @Positive long timeoutSeconds,
    @Positive int modelConcurrency,
    @PositiveOrZero int frameConcurrency,
    @Positive int executorQueueSize) {

  public record SegmenterProperties(
      @Positive int chunkCharBudget,
      boolean wholeDocumentFallback,
      @Positive double plainLineTailSeconds) {}

  public record MomentProperties(
      @Positive double minSeparationSeconds,
      @PositiveOrZero double rangeToleranceSeconds) {}

  public record FrameProperties(
      @PositiveOrZero double sharpnessThreshold,
      @Positive double initialWindowSeconds,
      @Positive double maxSearchRadiusSeconds,
      @Positive double sampleIntervalSeconds,
      @Positive @DecimalMax("1.0") float jpegQuality,
      boolean inlineFrames) {}

  /** Frame pool size, falling back to the number of available cores. */
  public int effectiveFrameConcurrency() {
    return frameConcurrency > 0 ? frameConcurrency : Runtime.getRuntime().availableProcessors();
  }
}
