package com.scholary.videonotes.moment;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Merges per-chunk moments into one ordered, deduplicated list.
 *
 * <p>Moments are sorted by time; the sort is stable, so on equal times the earlier chunk's moment
 * comes first. A moment closer than the minimum separation to the last kept moment is a duplicate
 * and is dropped.
 */
public class MomentMerger {

  private static final Logger LOGGER = LoggerFactory.getLogger(MomentMerger.class);

  private final double minSeparationSeconds;

  public MomentMerger(double minSeparationSeconds) {
    if (minSeparationSeconds < 0) {
      throw new IllegalArgumentException("Minimum separation cannot be negative");
    }
    this.minSeparationSeconds = minSeparationSeconds;
  }

  /**
   * Merge chunk results.
   *
   * @param chunkResults results in chunk order
   * @return merged moments ascending by seconds
   */
  public List<Moment> merge(List<ChunkMoments> chunkResults) {
    List<ChunkMoments> ordered = new ArrayList<>(chunkResults);
    ordered.sort(Comparator.comparingInt(ChunkMoments::chunkIndex));

    List<Moment> all = new ArrayList<>();
    for (ChunkMoments result : ordered) {
      all.addAll(result.moments());
    }
    return deduplicate(all);
  }

  /**
   * Sort and drop near-duplicates from a flat list.
   *
   * @param moments moments in preference order
   * @return moments ascending by seconds with no two closer than the minimum separation
   */
  public List<Moment> deduplicate(List<Moment> moments) {
    List<Moment> sorted = new ArrayList<>(moments);
    sorted.sort(Comparator.comparingDouble(Moment::seconds));

    List<Moment> kept = new ArrayList<>();
    for (Moment moment : sorted) {
      if (!kept.isEmpty()
          && moment.seconds() - kept.get(kept.size() - 1).seconds() < minSeparationSeconds) {
        LOGGER.debug(
            "Dropping duplicate moment at {}s ('{}'), too close to {}s",
            moment.seconds(),
            moment.title(),
            kept.get(kept.size() - 1).seconds());
        continue;
      }
      kept.add(moment);
    }

    LOGGER.info(
        "Merged {} candidate moments into {} (min separation {}s)",
        moments.size(),
        kept.size(),
        minSeparationSeconds);
    return kept;
  }
}
