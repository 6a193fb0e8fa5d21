package com.scholary.videonotes.subtitle;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.util.ArrayList;
import java.util.List;
import org.junit.jupiter.api.Test;

class TranscriptChunkerTest {

  private final TranscriptChunker chunker = new TranscriptChunker();

  @Test
  void chunk_shouldBeLossless() {
    List<TimedCue> cues = new ArrayList<>();
    for (int i = 0; i < 200; i++) {
      cues.add(new TimedCue(i * 3.0, i * 3.0 + 2.5, "cue number " + i + " with some words"));
    }

    List<TranscriptChunk> chunks = chunker.chunk(cues, 500);

    List<TimedCue> rejoined = new ArrayList<>();
    chunks.forEach(chunk -> rejoined.addAll(chunk.cues()));
    assertThat(rejoined).isEqualTo(cues);
    assertThat(chunks).hasSizeGreaterThan(1);
    for (int i = 0; i < chunks.size(); i++) {
      assertThat(chunks.get(i).index()).isEqualTo(i);
    }
  }

  @Test
  void chunk_shouldRespectBudget() {
    List<TimedCue> cues = new ArrayList<>();
    for (int i = 0; i < 50; i++) {
      cues.add(new TimedCue(i, i + 1.0, "x".repeat(i % 7 + 10)));
    }

    for (TranscriptChunk chunk : chunker.chunk(cues, 120)) {
      assertThat(chunk.serialize().length()).isLessThanOrEqualTo(120);
    }
  }

  @Test
  void chunk_shouldGiveOversizedCueItsOwnChunk() {
    List<TimedCue> cues =
        List.of(
            new TimedCue(0, 1, "short"),
            new TimedCue(1, 2, "y".repeat(300)),
            new TimedCue(2, 3, "after"));

    List<TranscriptChunk> chunks = chunker.chunk(cues, 100);

    assertThat(chunks).hasSize(3);
    assertThat(chunks.get(1).cues()).containsExactly(cues.get(1));
    assertThat(chunks.get(1).serialize()).hasSize(100);
  }

  @Test
  void chunk_shouldPackEverythingIntoOneChunkWhenItFits() {
    List<TimedCue> cues =
        List.of(new TimedCue(0, 4, "one"), new TimedCue(4, 8, "two"), new TimedCue(8, 12, "three"));

    List<TranscriptChunk> chunks = chunker.chunk(cues, 12000);

    assertThat(chunks).hasSize(1);
    assertThat(chunks.get(0).startSeconds()).isEqualTo(0.0);
    assertThat(chunks.get(0).endSeconds()).isEqualTo(12.0);
    assertThat(chunks.get(0).serialize())
        .isEqualTo("[00:00:00] one\n[00:00:04] two\n[00:00:08] three");
  }

  @Test
  void chunk_shouldReturnNoChunksForNoCues() {
    assertThat(chunker.chunk(List.of(), 100)).isEmpty();
  }

  @Test
  void chunk_shouldRejectNonPositiveBudget() {
    assertThatThrownBy(() -> chunker.chunk(List.of(), 0))
        .isInstanceOf(IllegalArgumentException.class);
  }

  @Test
  void covers_shouldApplyTolerance() {
    TranscriptChunk chunk = new TranscriptChunk(0, List.of(new TimedCue(10, 20, "a")), 100);

    assertThat(chunk.covers(9.0, 2.0)).isTrue();
    assertThat(chunk.covers(7.0, 2.0)).isFalse();
    assertThat(chunk.covers(22.0, 2.0)).isTrue();
    assertThat(chunk.covers(22.5, 2.0)).isFalse();
  }
}
