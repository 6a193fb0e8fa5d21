package com.scholary.videonotes.moment;

import static org.assertj.core.api.Assertions.assertThat;

import java.util.List;
import org.junit.jupiter.api.Test;

class MomentMergerTest {

  private final MomentMerger merger = new MomentMerger(5.0);

  @Test
  void deduplicate_shouldCollapseMomentsCloserThanSeparation() {
    Moment first = new Moment(10.0, "First", "a");
    Moment second = new Moment(10.8, "Second", "b");

    assertThat(merger.deduplicate(List.of(first, second))).containsExactly(first);
  }

  @Test
  void deduplicate_shouldKeepMomentsAtExactSeparation() {
    Moment first = new Moment(10.0, "First", "a");
    Moment second = new Moment(15.0, "Second", "b");

    assertThat(merger.deduplicate(List.of(second, first))).containsExactly(first, second);
  }

  @Test
  void deduplicate_shouldCompareAgainstLastKeptMoment() {
    // 13 is dropped as a duplicate of 10; 16 is 6s from 10 and survives
    List<Moment> moments =
        List.of(new Moment(10, "a", ""), new Moment(13, "b", ""), new Moment(16, "c", ""));

    assertThat(merger.deduplicate(moments)).extracting(Moment::title).containsExactly("a", "c");
  }

  @Test
  void merge_shouldPreferEarlierChunkOnEqualSeconds() {
    ChunkMoments later =
        new ChunkMoments(1, List.of(new Moment(30, "from chunk 1", "")), 0, ChunkOutcome.OK, null);
    ChunkMoments earlier =
        new ChunkMoments(0, List.of(new Moment(30, "from chunk 0", "")), 0, ChunkOutcome.OK, null);

    List<Moment> merged = merger.merge(List.of(later, earlier));

    assertThat(merged).extracting(Moment::title).containsExactly("from chunk 0");
  }

  @Test
  void merge_shouldSortAcrossChunksAndSkipFailedOnes() {
    ChunkMoments chunk0 =
        new ChunkMoments(
            0,
            List.of(new Moment(40, "late", ""), new Moment(5, "early", "")),
            0,
            ChunkOutcome.OK,
            null);
    ChunkMoments chunk1 = ChunkMoments.failed(1, ChunkOutcome.MALFORMED, "bad");
    ChunkMoments chunk2 =
        new ChunkMoments(2, List.of(new Moment(20, "middle", "")), 0, ChunkOutcome.CACHED, null);

    assertThat(merger.merge(List.of(chunk2, chunk1, chunk0)))
        .extracting(Moment::title)
        .containsExactly("early", "middle", "late");
  }
}
