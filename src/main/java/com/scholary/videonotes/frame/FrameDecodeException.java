package com.scholary.videonotes.frame;

/**
 * Exception thrown when a video cannot be probed or a frame cannot be decoded.
 *
 * <p>Scoped to a single moment: the engine turns it into a failed frame result and the note is
 * kept without an image.
 */
public class FrameDecodeException extends RuntimeException {

  private final FailureReason reason;

  public FrameDecodeException(FailureReason reason, String message) {
    super(message);
    this.reason = reason;
  }

  public FrameDecodeException(FailureReason reason, String message, Throwable cause) {
    super(message, cause);
    this.reason = reason;
  }

  public FailureReason getReason() {
    return reason;
  }
}
