package com.scholary.videonotes.subtitle;

/** Subtitle input formats recognised by the parser. */
public enum SubtitleFormat {
  /** SubRip: numbered cue blocks with {@code HH:MM:SS,mmm --> HH:MM:SS,mmm} timings. */
  SRT,

  /** WebVTT: a {@code WEBVTT} header followed by cue blocks. */
  WEBVTT,

  /** One cue per line, each line starting with a timestamp. */
  TIMESTAMPED_LINES,

  /** Plain text without timing, accepted only as a single whole-document cue. */
  WHOLE_DOCUMENT
}
