package com.scholary.videonotes.subtitle;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Parses raw subtitle text into ordered, non-overlapping cues.
 *
 * <p>The format is auto-detected:
 *
 * <ol>
 *   <li>A {@code WEBVTT} header selects WebVTT cue blocks
 *   <li>Any {@code -->} timing line selects SRT cue blocks
 *   <li>A first line starting with a timestamp selects timestamped lines
 *   <li>Anything else is untimed text, accepted only in whole-document mode
 * </ol>
 *
 * <p>Untimed text is never spread over synthetic, evenly spaced times. Malformed and zero-duration
 * cues are dropped rather than failing the parse.
 */
public class SubtitleParser {

  private static final Logger LOGGER = LoggerFactory.getLogger(SubtitleParser.class);

  private static final String TIME = "((?:\\d{1,3}:)?\\d{1,2}:\\d{2}(?:[.,]\\d{1,3})?)";

  // Example: 00:01:02,500 --> 00:01:05,000 align:start position:10%
  private static final Pattern CUE_TIMING_PATTERN =
      Pattern.compile("^\\s*" + TIME + "\\s*-->\\s*" + TIME + ".*$");

  // Example: [00:01:02] text, 01:02 - text, 1:02:03.5 | text
  private static final Pattern TIMESTAMPED_LINE_PATTERN =
      Pattern.compile("^\\s*\\[?" + TIME + "\\]?(?:\\s*[-|:\u2013]\\s*|\\s+|$)(.*)$");

  private static final Pattern MARKUP_PATTERN = Pattern.compile("<[^>]*>|\\{\\\\[^}]*\\}");
  private static final Pattern WHITESPACE_PATTERN = Pattern.compile("\\s+");

  private final boolean wholeDocumentFallback;
  private final double plainLineTailSeconds;

  public SubtitleParser(boolean wholeDocumentFallback, double plainLineTailSeconds) {
    if (plainLineTailSeconds <= 0) {
      throw new IllegalArgumentException("Plain line tail must be positive");
    }
    this.wholeDocumentFallback = wholeDocumentFallback;
    this.plainLineTailSeconds = plainLineTailSeconds;
  }

  /**
   * Parse subtitle text.
   *
   * @param rawText the subtitle text in any supported format
   * @param fallbackDurationSeconds duration used for whole-document mode, or a non-positive value
   *     if unknown
   * @return the detected format and the ordered cues (possibly empty if every cue was malformed)
   * @throws UnsupportedFormatException if the text is blank or untimed without a usable fallback
   */
  public ParsedSubtitles parse(String rawText, double fallbackDurationSeconds) {
    String text = normalize(rawText);
    if (text.isEmpty()) {
      throw new UnsupportedFormatException("Subtitle text is empty");
    }

    String[] lines = text.split("\n", -1);
    SubtitleFormat format = detectFormat(lines);
    LOGGER.debug("Detected subtitle format: {}", format);

    List<TimedCue> raw =
        switch (format) {
          case WEBVTT, SRT -> parseCueBlocks(lines);
          case TIMESTAMPED_LINES -> parseTimestampedLines(lines);
          case WHOLE_DOCUMENT -> parseWholeDocument(text, fallbackDurationSeconds);
        };

    List<TimedCue> cues = normalizeOrder(raw);
    LOGGER.info("Parsed {} cues from {} subtitles", cues.size(), format);
    return new ParsedSubtitles(format, cues);
  }

  private static String normalize(String rawText) {
    if (rawText == null) {
      return "";
    }
    String text = rawText;
    if (text.startsWith("\uFEFF")) {
      text = text.substring(1);
    }
    return text.replace("\r\n", "\n").replace('\r', '\n').strip();
  }

  private static SubtitleFormat detectFormat(String[] lines) {
    if (lines[0].strip().startsWith("WEBVTT")) {
      return SubtitleFormat.WEBVTT;
    }
    for (String line : lines) {
      if (CUE_TIMING_PATTERN.matcher(line).matches()) {
        return SubtitleFormat.SRT;
      }
    }
    if (TIMESTAMPED_LINE_PATTERN.matcher(lines[0]).matches()) {
      return SubtitleFormat.TIMESTAMPED_LINES;
    }
    // A title or speaker header may precede the timed lines
    int nonBlank = 0;
    int timed = 0;
    for (String line : lines) {
      if (line.isBlank()) {
        continue;
      }
      nonBlank++;
      if (TIMESTAMPED_LINE_PATTERN.matcher(line).matches()) {
        timed++;
      }
    }
    if (timed > 0 && timed * 2 >= nonBlank) {
      return SubtitleFormat.TIMESTAMPED_LINES;
    }
    return SubtitleFormat.WHOLE_DOCUMENT;
  }

  /** SRT and WebVTT share the block layout: optional identifier, timing line, text lines. */
  private List<TimedCue> parseCueBlocks(String[] lines) {
    List<TimedCue> cues = new ArrayList<>();
    List<String> block = new ArrayList<>();
    for (String line : lines) {
      if (line.isBlank()) {
        addCueBlock(block, cues);
        block.clear();
      } else {
        block.add(line);
      }
    }
    addCueBlock(block, cues);
    return cues;
  }

  private void addCueBlock(List<String> block, List<TimedCue> cues) {
    if (block.isEmpty() || block.get(0).startsWith("NOTE") || block.get(0).startsWith("STYLE")) {
      return;
    }
    for (int i = 0; i < block.size(); i++) {
      Matcher timing = CUE_TIMING_PATTERN.matcher(block.get(i));
      if (!timing.matches()) {
        continue;
      }
      String text = cleanText(String.join(" ", block.subList(i + 1, block.size())));
      try {
        addCue(cues, Timecodes.parse(timing.group(1)), Timecodes.parse(timing.group(2)), text);
      } catch (IllegalArgumentException e) {
        LOGGER.debug("Dropping malformed cue timing '{}': {}", block.get(i), e.getMessage());
      }
      return;
    }
    LOGGER.debug("Dropping block without timing line: {}", block.get(0));
  }

  /** Each line's cue lasts until the next line starts; the last one gets the configured tail. */
  private List<TimedCue> parseTimestampedLines(String[] lines) {
    List<Double> starts = new ArrayList<>();
    List<StringBuilder> texts = new ArrayList<>();
    for (String line : lines) {
      if (line.isBlank()) {
        continue;
      }
      Matcher matcher = TIMESTAMPED_LINE_PATTERN.matcher(line);
      double start = -1;
      if (matcher.matches()) {
        try {
          start = Timecodes.parse(matcher.group(1));
        } catch (IllegalArgumentException e) {
          LOGGER.debug("Unparseable line timestamp '{}': {}", line, e.getMessage());
        }
      }
      if (start >= 0) {
        starts.add(start);
        texts.add(new StringBuilder(matcher.group(2)));
      } else if (!texts.isEmpty()) {
        // Continuation of the previous line's text
        texts.get(texts.size() - 1).append(' ').append(line.strip());
      } else {
        LOGGER.debug("Skipping untimed header line: {}", line);
      }
    }

    List<TimedCue> cues = new ArrayList<>();
    for (int i = 0; i < starts.size(); i++) {
      double start = starts.get(i);
      double end = i + 1 < starts.size() ? starts.get(i + 1) : start + plainLineTailSeconds;
      addCue(cues, start, end, cleanText(texts.get(i).toString()));
    }
    return cues;
  }

  private List<TimedCue> parseWholeDocument(String text, double fallbackDurationSeconds) {
    if (!wholeDocumentFallback) {
      throw new UnsupportedFormatException(
          "Subtitle text has no recognisable timing (expected SRT, WebVTT or timestamped lines)");
    }
    if (!(fallbackDurationSeconds > 0)) {
      throw new UnsupportedFormatException(
          "Untimed subtitle text needs a known video duration for whole-document mode");
    }
    List<TimedCue> cues = new ArrayList<>();
    addCue(cues, 0.0, fallbackDurationSeconds, cleanText(text));
    return cues;
  }

  private static void addCue(List<TimedCue> cues, double start, double end, String text) {
    if (text.isEmpty() || end <= start) {
      LOGGER.debug("Dropping empty or zero-duration cue at {}s", start);
      return;
    }
    cues.add(new TimedCue(start, end, text));
  }

  /** Sort by start and clip each cue so it begins no earlier than the previous one ends. */
  private static List<TimedCue> normalizeOrder(List<TimedCue> cues) {
    List<TimedCue> sorted = new ArrayList<>(cues);
    sorted.sort(Comparator.comparingDouble(TimedCue::startSeconds));

    List<TimedCue> result = new ArrayList<>(sorted.size());
    double previousEnd = 0.0;
    for (TimedCue cue : sorted) {
      double start = Math.max(cue.startSeconds(), previousEnd);
      if (cue.endSeconds() <= start) {
        LOGGER.debug("Dropping cue swallowed by its predecessor at {}s", cue.startSeconds());
        continue;
      }
      result.add(
          start == cue.startSeconds() ? cue : new TimedCue(start, cue.endSeconds(), cue.text()));
      previousEnd = cue.endSeconds();
    }
    return result;
  }

  private static String cleanText(String text) {
    String stripped = MARKUP_PATTERN.matcher(text).replaceAll("");
    return WHITESPACE_PATTERN.matcher(stripped).replaceAll(" ").strip();
  }
}
