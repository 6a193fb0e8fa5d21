package com.scholary.videonotes.frame;

import java.nio.file.Path;

/** Outcome of resolving the frame for one moment. */
public interface FrameResult {

  /**
   * A frame was written.
   *
   * @param path the JPEG file
   * @param sharpness Laplacian variance of the kept frame
   * @param offsetSeconds kept frame time minus requested time
   * @param degraded true when no frame in the search radius cleared the sharpness threshold
   */
  record Success(Path path, double sharpness, double offsetSeconds, boolean degraded)
      implements FrameResult {}

  /** No frame could be produced; the note is kept without an image. */
  record Failure(FailureReason reason, String detail) implements FrameResult {}

  static FrameResult failure(FrameDecodeException e) {
    return new Failure(e.getReason(), e.getMessage());
  }

  default boolean isSuccess() {
    return this instanceof Success;
  }
}
