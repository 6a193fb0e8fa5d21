package com.scholary.videonotes.note;

import static org.assertj.core.api.Assertions.assertThat;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.scholary.videonotes.frame.FailureReason;
import com.scholary.videonotes.frame.FrameResult;
import com.scholary.videonotes.moment.Moment;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class NoteAssemblerTest {

  @TempDir Path tempDir;

  private final NoteAssembler assembler = new NoteAssembler();

  private FrameResult success(String name) {
    return new FrameResult.Success(tempDir.resolve(name), 250.0, 0.0, false);
  }

  @Test
  void assemble_shouldSortBySecondsWithUniqueIds() {
    List<MomentFrames> items =
        List.of(
            new MomentFrames(new Moment(65, "Second", "b"), success("frame_1.jpg")),
            new MomentFrames(new Moment(3661, "Third", "c"), success("frame_2.jpg")),
            new MomentFrames(new Moment(0, "First", "a"), success("frame_0.jpg")));

    List<NoteNode> notes = assembler.assemble(items);

    assertThat(notes).extracting(NoteNode::title).containsExactly("First", "Second", "Third");
    assertThat(notes).extracting(NoteNode::timestamp).containsExactly("0:00", "1:05", "1:01:01");
    assertThat(notes)
        .extracting(NoteNode::id)
        .containsExactly("note-0-0", "note-1-65000", "note-2-3661000");
    assertThat(notes.stream().map(NoteNode::id).collect(Collectors.toSet())).hasSize(3);
    assertThat(notes).noneMatch(NoteNode::edited);
  }

  @Test
  void assemble_shouldBeIdempotent() {
    List<MomentFrames> items =
        List.of(
            new MomentFrames(new Moment(12.5, "A", "a"), success("frame_0.jpg")),
            new MomentFrames(new Moment(40, "B", "b"), success("frame_1.jpg")));

    assertThat(assembler.assemble(items)).isEqualTo(assembler.assemble(items));
  }

  @Test
  void assemble_shouldUseEmptyImagePathForFailedFrames() {
    List<NoteNode> notes =
        assembler.assemble(
            List.of(
                new MomentFrames(
                    new Moment(5, "No frame", "c"),
                    new FrameResult.Failure(FailureReason.CODEC_ERROR, "bad"))));

    assertThat(notes.get(0).imagePath()).isEmpty();
    assertThat(notes.get(0).hasImage()).isFalse();
  }

  @Test
  void assemble_shouldUseAbsoluteForwardSlashPath() {
    NoteNode note =
        assembler
            .assemble(List.of(new MomentFrames(new Moment(5, "T", "c"), success("frame_0.jpg"))))
            .get(0);

    String expected = tempDir.resolve("frame_0.jpg").toAbsolutePath().toString();
    assertThat(note.imagePath()).isEqualTo(expected.replace('\\', '/'));
    assertThat(note.imagePath()).doesNotContain("\\");
  }

  @Test
  void assemble_shouldReplaceResolvedInlineMarkers() {
    Moment moment = new Moment(30, "Build", "Run the build [00:45] and check [00:50].");
    MomentFrames item =
        new MomentFrames(
            moment,
            success("frame_0.jpg"),
            Map.of(
                "00:45", success("frame_0_1.jpg"),
                "00:50", new FrameResult.Failure(FailureReason.SEEK_OUT_OF_RANGE, "eof")));

    String content = assembler.assemble(List.of(item)).get(0).content();

    assertThat(content).contains("![00:45](file:///").contains("frame_0_1.jpg)");
    assertThat(content).contains("[00:50]").doesNotContain("![00:50]");
  }

  @Test
  void noteNode_shouldSerializeClientFieldNames() throws Exception {
    NoteNode note = new NoteNode("note-0-0", "0:00", 0, "T", "c", "", false);

    JsonNode json = new ObjectMapper().valueToTree(note);

    assertThat(json.has("isEdited")).isTrue();
    assertThat(json.has("imagePath")).isTrue();
    assertThat(json.has("edited")).isFalse();
  }
}
