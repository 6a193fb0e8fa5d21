package com.scholary.videonotes.moment;

import com.scholary.videonotes.llm.ChatMessage;
import com.scholary.videonotes.subtitle.Timecodes;
import com.scholary.videonotes.subtitle.TranscriptChunk;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/** Builds the conversations sent to the model for moment extraction. */
public final class MomentPrompts {

  static final String SCHEMA =
      "[{\"timestamp\": \"HH:MM:SS\", \"title\": \"string\", \"content\": \"markdown string\"}]";

  private MomentPrompts() {}

  /**
   * System instruction: the fixed task plus the style directive.
   *
   * @param style tone of the generated content
   * @param minSeparationSeconds spacing the model should keep between moments
   */
  public static String systemPrompt(NoteStyle style, double minSeparationSeconds) {
    return """
        # Role
        You are an expert video editor and technical writer. You read video subtitles and pick \
        the moments worth capturing as screenshots for an illustrated set of notes.

        # Goal
        Find the moments with high visual information value: a diagram being drawn, code being \
        typed or changed, a menu or UI state change, a key slide, the final result being shown.

        # Rules
        1. Skip greetings, self-introductions, filler and stretches where nothing new is on screen.
        2. Favour action moments ("click", "select", "type", "open", "as you can see").
        3. Describe what the screen shows at that moment, not just what the speaker says.
        4. Keep moments at least %s seconds apart; of two closer ones keep the more representative.
        5. Only use timestamps inside the transcript excerpt you are given.

        # Output style
        %s

        # Output format
        Reply with a JSON array only, no markdown code fences and no other text:
        %s
        - timestamp: a time that occurs in the excerpt, formatted HH:MM:SS
        - title: a short section title (3-10 words)
        - content: 50-200 words of markdown describing what is shown and the steps taken
        - entries in chronological order
        """
        .formatted(
            String.format(Locale.ROOT, "%.1f", minSeparationSeconds), style.directive(), SCHEMA);
  }

  /** User message carrying one chunk of the transcript. */
  public static String userPrompt(TranscriptChunk chunk) {
    return "Analyse this excerpt of the video subtitles (covering "
        + Timecodes.toClock(chunk.startSeconds())
        + " to "
        + Timecodes.toClock(Math.ceil(chunk.endSeconds()))
        + "):\n\n"
        + chunk.serialize();
  }

  /** Initial conversation for a chunk. */
  public static List<ChatMessage> conversation(
      TranscriptChunk chunk, NoteStyle style, double minSeparationSeconds) {
    List<ChatMessage> messages = new ArrayList<>();
    messages.add(ChatMessage.system(systemPrompt(style, minSeparationSeconds)));
    messages.add(ChatMessage.user(userPrompt(chunk)));
    return messages;
  }

  /**
   * Conversation for the single corrective retry: the original one, the rejected reply, and an
   * instruction naming the schema.
   */
  public static List<ChatMessage> correction(
      List<ChatMessage> original, String rejectedReply, String problem) {
    List<ChatMessage> messages = new ArrayList<>(original);
    messages.add(ChatMessage.assistant(rejectedReply == null ? "" : rejectedReply));
    messages.add(
        ChatMessage.user(
            "Your previous reply could not be used ("
                + problem
                + "). Return valid structured output matching this schema exactly, as a bare "
                + "JSON array with no other text: "
                + SCHEMA));
    return messages;
  }
}
