package com.scholary.videonotes.note;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * One illustrated note.
 *
 * @param id deterministic id, {@code note-<position>-<milliseconds>}
 * @param timestamp display time, e.g. {@code 1:05}
 * @param seconds moment time in seconds
 * @param title short heading
 * @param content explanatory text, possibly with inline markdown images
 * @param imagePath absolute path of the still with forward slashes, or empty when none
 * @param edited whether the user changed the note; always false on creation
 */
public record NoteNode(
    String id,
    String timestamp,
    double seconds,
    String title,
    String content,
    String imagePath,
    @JsonProperty("isEdited") boolean edited) {

  public boolean hasImage() {
    return !imagePath.isEmpty();
  }
}
