package com.scholary.videonotes.note;

import com.scholary.videonotes.frame.FrameResult;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import org.springframework.stereotype.Component;

/**
 * Turns moments and their frames into the final, ordered note list.
 *
 * <p>Pure: the same input always yields the same notes, ids included.
 */
@Component
public class NoteAssembler {

  public List<NoteNode> assemble(List<MomentFrames> items) {
    List<MomentFrames> sorted = new ArrayList<>(items);
    sorted.sort(Comparator.comparingDouble(item -> item.moment().seconds()));

    List<NoteNode> notes = new ArrayList<>(sorted.size());
    for (int position = 0; position < sorted.size(); position++) {
      notes.add(toNote(position, sorted.get(position)));
    }
    return List.copyOf(notes);
  }

  private NoteNode toNote(int position, MomentFrames item) {
    double seconds = item.moment().seconds();
    String imagePath = "";
    if (item.frame() instanceof FrameResult.Success success) {
      imagePath = InlineTimestampMarkers.normalizedPath(success.path());
    }

    Map<String, Path> inline = new HashMap<>();
    item.inlineFrames()
        .forEach(
            (marker, result) -> {
              if (result instanceof FrameResult.Success success) {
                inline.put(marker, success.path());
              }
            });

    return new NoteNode(
        noteId(position, seconds),
        TimestampFormatter.format(seconds),
        seconds,
        item.moment().title(),
        InlineTimestampMarkers.replace(item.moment().content(), inline),
        imagePath,
        false);
  }

  static String noteId(int position, double seconds) {
    return "note-" + position + "-" + Math.round(seconds * 1000);
  }
}
