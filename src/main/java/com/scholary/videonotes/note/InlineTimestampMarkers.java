package com.scholary.videonotes.note;

import com.scholary.videonotes.subtitle.Timecodes;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Finds and replaces {@code [MM:SS]} / {@code [HH:MM:SS]} markers in note content.
 *
 * <p>The model may reference additional screen states inside a note's content. Each marker whose
 * frame was extracted becomes a markdown image on its own paragraph.
 */
public final class InlineTimestampMarkers {

  private static final Pattern MARKER = Pattern.compile("\\[(\\d{1,2}:\\d{2}(?::\\d{2})?)]");

  private InlineTimestampMarkers() {}

  /** Distinct markers in order of first appearance, without brackets. */
  public static List<String> find(String content) {
    Set<String> markers = new LinkedHashSet<>();
    Matcher matcher = MARKER.matcher(content);
    while (matcher.find()) {
      markers.add(matcher.group(1));
    }
    return new ArrayList<>(markers);
  }

  /** Time in seconds of a marker returned by {@link #find}. */
  public static double seconds(String marker) {
    return Timecodes.parse(marker);
  }

  /**
   * Replace markers that have a frame with {@code ![marker](file:///path)}.
   *
   * @param content note content
   * @param frames marker to written frame; markers without an entry are left as they are
   */
  public static String replace(String content, Map<String, Path> frames) {
    if (frames.isEmpty()) {
      return content;
    }
    Matcher matcher = MARKER.matcher(content);
    StringBuilder result = new StringBuilder();
    while (matcher.find()) {
      String marker = matcher.group(1);
      Path frame = frames.get(marker);
      String replacement =
          frame != null
              ? "\n\n![" + marker + "](" + fileUri(frame) + ")\n\n"
              : matcher.group(0);
      matcher.appendReplacement(result, Matcher.quoteReplacement(replacement));
    }
    matcher.appendTail(result);
    return result.toString();
  }

  /** Absolute path with forward slashes. */
  static String normalizedPath(Path path) {
    return path.toAbsolutePath().normalize().toString().replace('\\', '/');
  }

  static String fileUri(Path path) {
    String normalized = normalizedPath(path);
    return "file:///" + (normalized.startsWith("/") ? normalized.substring(1) : normalized);
  }
}
