package com.scholary.videonotes.note;

/** Formats note times for display: {@code M:SS}, or {@code H:MM:SS} from one hour on. */
public final class TimestampFormatter {

  private TimestampFormatter() {}

  public static String format(double seconds) {
    long total = (long) Math.floor(Math.max(0, seconds));
    long hours = total / 3600;
    long minutes = (total % 3600) / 60;
    long secs = total % 60;
    if (hours > 0) {
      return String.format("%d:%02d:%02d", hours, minutes, secs);
    }
    return String.format("%d:%02d", minutes, secs);
  }
}
