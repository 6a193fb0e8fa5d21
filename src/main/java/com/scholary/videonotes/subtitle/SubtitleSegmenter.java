package com.scholary.videonotes.subtitle;

import com.scholary.videonotes.config.PipelineProperties;
import com.scholary.videonotes.config.PipelineProperties.SegmenterProperties;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

/**
 * Turns raw subtitle text into chunks ready for the language model.
 *
 * <p>Pure transform: parse, then fold into budget-bounded chunks.
 */
@Component
public class SubtitleSegmenter {

  private final SubtitleParser parser;
  private final TranscriptChunker chunker;
  private final int chunkCharBudget;

  @Autowired
  public SubtitleSegmenter(PipelineProperties properties) {
    this(properties.segmenter());
  }

  public SubtitleSegmenter(SegmenterProperties properties) {
    this.parser =
        new SubtitleParser(properties.wholeDocumentFallback(), properties.plainLineTailSeconds());
    this.chunker = new TranscriptChunker();
    this.chunkCharBudget = properties.chunkCharBudget();
  }

  /**
   * Parse and chunk subtitle text.
   *
   * @param subtitleText raw subtitle text
   * @param fallbackDurationSeconds video duration for whole-document mode, non-positive if unknown
   * @return the segmented transcript (no chunks if no cue survived parsing)
   * @throws UnsupportedFormatException if the text cannot be parsed
   */
  public SegmentedTranscript segment(String subtitleText, double fallbackDurationSeconds) {
    ParsedSubtitles parsed = parser.parse(subtitleText, fallbackDurationSeconds);
    return new SegmentedTranscript(
        parsed.format(), parsed.cues(), chunker.chunk(parsed.cues(), chunkCharBudget));
  }
}
