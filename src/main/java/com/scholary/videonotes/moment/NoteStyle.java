package com.scholary.videonotes.moment;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import java.util.Locale;

/**
 * Writing style for generated note content.
 *
 * <p>The style only changes the tone of the {@code content} the model writes. It never changes
 * which moments are selected.
 */
public enum NoteStyle {
  PROFESSIONAL("Rigorous technical-documentation tone: precise, concise, no filler."),
  BLOG("Relaxed, readable blog tone: use analogies and examples where they help."),
  TUTORIAL("Step-by-step tutorial tone: explain each concept and action in detail.");

  private final String directive;

  NoteStyle(String directive) {
    this.directive = directive;
  }

  public String directive() {
    return directive;
  }

  @JsonValue
  public String value() {
    return name().toLowerCase(Locale.ROOT);
  }

  /**
   * Resolve a style name case-insensitively.
   *
   * @param value the style name, or null/blank for the default
   * @return the style, {@link #PROFESSIONAL} when no value is given
   * @throws IllegalArgumentException if the name is not a known style
   */
  @JsonCreator
  public static NoteStyle fromValue(String value) {
    if (value == null || value.isBlank()) {
      return PROFESSIONAL;
    }
    try {
      return valueOf(value.strip().toUpperCase(Locale.ROOT));
    } catch (IllegalArgumentException e) {
      throw new IllegalArgumentException(
          "Unknown style '" + value + "', expected professional, blog or tutorial", e);
    }
  }
}
