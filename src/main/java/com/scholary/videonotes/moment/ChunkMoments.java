package com.scholary.videonotes.moment;

import java.util.List;

/**
 * Moments extracted from one chunk, already bounded to the chunk's cue range.
 *
 * @param chunkIndex the chunk these came from
 * @param moments accepted moments in reply order
 * @param discarded number of moments dropped as outside the chunk range or video length
 * @param outcome how extraction ended; failed chunks carry no moments
 * @param error failure description, null on success
 */
public record ChunkMoments(
    int chunkIndex, List<Moment> moments, int discarded, ChunkOutcome outcome, String error) {

  public ChunkMoments {
    moments = List.copyOf(moments);
  }

  public static ChunkMoments failed(int chunkIndex, ChunkOutcome outcome, String error) {
    return new ChunkMoments(chunkIndex, List.of(), 0, outcome, error);
  }
}
