package com.scholary.videonotes.pipeline;

import com.scholary.videonotes.llm.ModelConfig;
import com.scholary.videonotes.moment.NoteStyle;
import java.nio.file.Path;
import java.util.Objects;

/**
 * Input of one synthesis run.
 *
 * @param videoPath the video to take frames from
 * @param subtitleText raw subtitle text in any supported format
 * @param style tone of the generated content
 * @param modelConfig language model endpoint and credentials
 */
public record SynthesisRequest(
    Path videoPath, String subtitleText, NoteStyle style, ModelConfig modelConfig) {

  public SynthesisRequest {
    Objects.requireNonNull(videoPath, "videoPath");
    Objects.requireNonNull(modelConfig, "modelConfig");
    subtitleText = subtitleText == null ? "" : subtitleText;
    style = style == null ? NoteStyle.PROFESSIONAL : style;
  }
}
