package com.scholary.videonotes.moment;

/** How a single chunk's extraction ended. */
public enum ChunkOutcome {
  /** The model answered with valid moments (possibly none). */
  OK,

  /** Answered from the moment cache without calling the model. */
  CACHED,

  /** Both the first reply and the corrected reply failed validation. */
  MALFORMED,

  /** The model could not be reached after retries, or refused the credentials. */
  UNAVAILABLE,

  /** The run was cancelled before the chunk finished. */
  CANCELLED;

  public boolean isFailure() {
    return this == MALFORMED || this == UNAVAILABLE || this == CANCELLED;
  }
}
