package com.scholary.videonotes.subtitle;

import java.util.List;

/** Result of parsing subtitle text: the detected format and the ordered cues. */
public record ParsedSubtitles(SubtitleFormat format, List<TimedCue> cues) {

  public ParsedSubtitles {
    cues = List.copyOf(cues);
  }
}
