package com.scholary.videonotes.moment;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.fasterxml.jackson.databind.ObjectMapper;
import java.util.List;
import org.junit.jupiter.api.Test;

class MomentResponseParserTest {

  private final MomentResponseParser parser = new MomentResponseParser(new ObjectMapper());

  @Test
  void parse_shouldReadPlainArray() {
    List<Moment> moments =
        parser.parse(
            "[{\"timestamp\": \"00:01:05\", \"title\": \"Open settings\", \"content\": \"Menu\"},"
                + " {\"timestamp\": \"02:10\", \"title\": \"Save\", \"content\": \"Done\"}]");

    assertThat(moments)
        .containsExactly(
            new Moment(65.0, "Open settings", "Menu"), new Moment(130.0, "Save", "Done"));
  }

  @Test
  void parse_shouldStripCodeFencesAndSurroundingText() {
    String reply =
        "Here are the moments:\n```json\n"
            + "[{\"timestamp\": \"[00:00:30]\", \"title\": \"Diagram\", \"content\": \"Boxes\"}]\n"
            + "```\nHope this helps!";

    assertThat(parser.parse(reply)).containsExactly(new Moment(30.0, "Diagram", "Boxes"));
  }

  @Test
  void parse_shouldAcceptObjectWithMomentsArray() {
    String reply = "{\"moments\": [{\"seconds\": 12.5, \"title\": \"Code\", \"content\": \"x\"}]}";

    assertThat(parser.parse(reply)).containsExactly(new Moment(12.5, "Code", "x"));
  }

  @Test
  void parse_shouldDefaultBlankContentToTitle() {
    List<Moment> moments = parser.parse("[{\"timestamp\": \"00:00:03\", \"title\": \"Intro\"}]");

    assertThat(moments.get(0).content()).isEqualTo("Intro");
  }

  @Test
  void parse_shouldAcceptEmptyArray() {
    assertThat(parser.parse("[]")).isEmpty();
  }

  @Test
  void parse_shouldRejectMissingTitle() {
    assertThatThrownBy(() -> parser.parse("[{\"timestamp\": \"00:00:03\", \"content\": \"c\"}]"))
        .isInstanceOf(MalformedModelResponseException.class)
        .hasMessageContaining("title");
  }

  @Test
  void parse_shouldRejectBadTimestamp() {
    assertThatThrownBy(() -> parser.parse("[{\"timestamp\": \"soon\", \"title\": \"t\"}]"))
        .isInstanceOf(MalformedModelResponseException.class)
        .hasMessageContaining("timestamp");
  }

  @Test
  void parse_shouldRejectProse() {
    assertThatThrownBy(() -> parser.parse("I could not find any moments."))
        .isInstanceOf(MalformedModelResponseException.class);
  }

  @Test
  void parse_shouldRejectTruncatedJson() {
    assertThatThrownBy(() -> parser.parse("[{\"timestamp\": \"00:00:03\", \"title\": \"t\"}"))
        .isInstanceOf(MalformedModelResponseException.class);
  }

  @Test
  void parse_shouldRejectObjectWithoutMoments() {
    assertThatThrownBy(() -> parser.parse("{\"notes\": []}"))
        .isInstanceOf(MalformedModelResponseException.class)
        .hasMessageContaining("array");
  }
}
