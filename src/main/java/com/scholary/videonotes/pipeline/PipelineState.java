package com.scholary.videonotes.pipeline;

/**
 * Phases of one synthesis run. Transitions only move forward; a run ends in {@link #DONE} or
 * {@link #FAILED}.
 */
public enum PipelineState {
  PARSING(5),
  EXTRACTING(10),
  FRAME_RESOLVING(60),
  ASSEMBLING(95),
  DONE(100),
  FAILED(100);

  private final int progressFloor;

  PipelineState(int progressFloor) {
    this.progressFloor = progressFloor;
  }

  /** Progress percentage reached when the phase starts. */
  public int progressFloor() {
    return progressFloor;
  }

  public boolean isTerminal() {
    return this == DONE || this == FAILED;
  }
}
