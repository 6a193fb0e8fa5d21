package com.scholary.videonotes.moment;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.scholary.videonotes.subtitle.Timecodes;
import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;

/**
 * Parses and validates a model reply into moments.
 *
 * <p>Accepted shapes: a JSON array of moment objects, or an object holding such an array under
 * {@code moments}. Markdown code fences and text around the JSON are tolerated. Each element needs
 * a time (a {@code timestamp} string such as {@code 00:01:23}, or numeric {@code seconds}) and a
 * non-blank {@code title}. A missing {@code content} falls back to the title.
 *
 * <p>Any schema violation rejects the whole reply so the caller can ask for a corrected one.
 */
public class MomentResponseParser {

  private static final Pattern FENCE_PATTERN = Pattern.compile("```[a-zA-Z]*");

  private final ObjectMapper objectMapper;

  public MomentResponseParser(ObjectMapper objectMapper) {
    this.objectMapper = objectMapper;
  }

  /**
   * Parse a reply.
   *
   * @param reply raw model reply
   * @return the moments in reply order
   * @throws MalformedModelResponseException if the reply does not match the schema
   */
  public List<Moment> parse(String reply) {
    JsonNode root = readJson(reply);
    JsonNode array = root.isObject() ? root.path("moments") : root;
    if (!array.isArray()) {
      throw new MalformedModelResponseException("Expected a JSON array of moments");
    }

    List<Moment> moments = new ArrayList<>();
    for (int i = 0; i < array.size(); i++) {
      moments.add(toMoment(array.get(i), i));
    }
    return moments;
  }

  private JsonNode readJson(String reply) {
    if (reply == null || reply.isBlank()) {
      throw new MalformedModelResponseException("Empty reply");
    }
    String cleaned = FENCE_PATTERN.matcher(reply).replaceAll("").strip();

    int arrayStart = cleaned.indexOf('[');
    int objectStart = cleaned.indexOf('{');
    int start;
    char closing;
    if (arrayStart >= 0 && (objectStart < 0 || arrayStart < objectStart)) {
      start = arrayStart;
      closing = ']';
    } else if (objectStart >= 0) {
      start = objectStart;
      closing = '}';
    } else {
      throw new MalformedModelResponseException("No JSON found in reply");
    }
    int end = cleaned.lastIndexOf(closing);
    if (end < start) {
      throw new MalformedModelResponseException("Unterminated JSON in reply");
    }

    try {
      return objectMapper.readTree(cleaned.substring(start, end + 1));
    } catch (JsonProcessingException e) {
      throw new MalformedModelResponseException(
          "Reply is not valid JSON: " + e.getOriginalMessage(), e);
    }
  }

  private static Moment toMoment(JsonNode node, int position) {
    if (!node.isObject()) {
      throw new MalformedModelResponseException("Element " + position + " is not an object");
    }

    double seconds = readSeconds(node, position);
    String title = node.path("title").asText("").strip();
    if (title.isEmpty()) {
      throw new MalformedModelResponseException("Element " + position + " has no title");
    }
    String content = node.path("content").asText("").strip();
    if (content.isEmpty()) {
      content = title;
    }
    return new Moment(seconds, title, content);
  }

  private static double readSeconds(JsonNode node, int position) {
    JsonNode seconds = node.get("seconds");
    if (seconds != null && seconds.isNumber()) {
      return checkTime(seconds.asDouble(), position);
    }

    JsonNode timestamp = node.get("timestamp");
    if (timestamp != null && timestamp.isNumber()) {
      return checkTime(timestamp.asDouble(), position);
    }
    if (timestamp != null && timestamp.isTextual()) {
      String text = timestamp.asText().strip();
      if (text.startsWith("[") && text.endsWith("]")) {
        text = text.substring(1, text.length() - 1);
      }
      try {
        return Timecodes.parse(text);
      } catch (IllegalArgumentException e) {
        throw new MalformedModelResponseException(
            "Element " + position + " has an invalid timestamp: " + timestamp.asText(), e);
      }
    }
    throw new MalformedModelResponseException("Element " + position + " has no timestamp");
  }

  private static double checkTime(double seconds, int position) {
    if (seconds < 0 || Double.isNaN(seconds) || Double.isInfinite(seconds)) {
      throw new MalformedModelResponseException(
          "Element " + position + " has an invalid time: " + seconds);
    }
    return seconds;
  }
}
