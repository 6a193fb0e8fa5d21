package com.scholary.videonotes.api;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.scholary.videonotes.llm.LlmProperties;
import com.scholary.videonotes.llm.ModelConfig;
import com.scholary.videonotes.moment.NoteStyle;
import com.scholary.videonotes.pipeline.SynthesisRequest;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import java.nio.file.Paths;

/**
 * Request for synthesizing notes from a video and its subtitles.
 *
 * <p>Field names follow the desktop client's snake_case contract. {@code style}, {@code base_url}
 * and {@code model} are optional and fall back to configured defaults.
 */
public record AnalyzeRequest(
    @JsonProperty("video_path") @NotBlank String videoPath,
    @JsonProperty("subtitle_text") @NotNull String subtitleText,
    @JsonProperty("api_key") @NotBlank String apiKey,
    @JsonProperty("style") String style,
    @JsonProperty("base_url") String baseUrl,
    @JsonProperty("model") String model) {

  /**
   * Build the pipeline request.
   *
   * @throws IllegalArgumentException if the style is unknown
   */
  public SynthesisRequest toSynthesisRequest(LlmProperties defaults) {
    String resolvedModel = model == null || model.isBlank() ? defaults.defaultModel() : model;
    String resolvedBaseUrl = baseUrl == null || baseUrl.isBlank() ? null : baseUrl;
    return new SynthesisRequest(
        Paths.get(videoPath),
        subtitleText,
        NoteStyle.fromValue(style),
        new ModelConfig(apiKey, resolvedBaseUrl, resolvedModel));
  }

  /** Keep the key out of logs. */
  @Override
  public String toString() {
    return "AnalyzeRequest[videoPath=" + videoPath + ", style=" + style + ", model=" + model + "]";
  }
}
