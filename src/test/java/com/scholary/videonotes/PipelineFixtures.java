package com.scholary.videonotes;

import com.scholary.videonotes.config.PipelineProperties;
import com.scholary.videonotes.config.PipelineProperties.FrameProperties;
import com.scholary.videonotes.config.PipelineProperties.MomentProperties;
import com.scholary.videonotes.config.PipelineProperties.SegmenterProperties;
import com.scholary.videonotes.llm.LlmProperties;
import java.nio.file.Path;

/** Property sets shared by tests. */
public final class PipelineFixtures {

  private PipelineFixtures() {}

  public static SegmenterProperties segmenter(int chunkCharBudget) {
    return new SegmenterProperties(chunkCharBudget, true, 5.0);
  }

  public static MomentProperties moments() {
    return new MomentProperties(5.0, 2.0);
  }

  public static FrameProperties frames() {
    return new FrameProperties(100.0, 0.5, 3.0, 0.1, 0.9f, true);
  }

  public static PipelineProperties pipeline(Path outputDir) {
    return pipeline(outputDir, 600, frames());
  }

  public static PipelineProperties pipeline(
      Path outputDir, long timeoutSeconds, FrameProperties frames) {
    return new PipelineProperties(
        segmenter(12000), moments(), frames, outputDir.toString(), timeoutSeconds, 2, 2, 100);
  }

  public static LlmProperties llm(String baseUrl) {
    return new LlmProperties(baseUrl, "gpt-4o-mini", 2, 5, 3, 1, 5, 0.3, 1024);
  }
}
