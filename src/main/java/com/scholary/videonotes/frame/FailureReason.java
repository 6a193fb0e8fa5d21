package com.scholary.videonotes.frame;

/** Why no frame could be produced for a moment. */
public enum FailureReason {
  /** The video file does not exist. */
  VIDEO_NOT_FOUND,

  /** The file exists but is not a decodable video (corrupt, wrong container). */
  UNREADABLE_VIDEO,

  /** The requested time lies outside the video. */
  SEEK_OUT_OF_RANGE,

  /** The decoder failed on the stream. */
  CODEC_ERROR,

  /** A frame was decoded but could not be written to the output directory. */
  WRITE_FAILED,

  /** The run was cancelled while the frame was being resolved. */
  CANCELLED,

  /** The frame pool was saturated and refused the task. */
  REJECTED,

  /** The frame task ended with an unexpected exception. */
  TASK_FAILED;

  /** Failures that will repeat for every timestamp of the same video. */
  public boolean affectsWholeVideo() {
    return this == VIDEO_NOT_FOUND || this == UNREADABLE_VIDEO || this == CANCELLED;
  }
}
