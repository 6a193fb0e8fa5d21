package com.scholary.videonotes.frame;

/**
 * A decode handle over one video file.
 *
 * <p>Handles are not thread-safe: concurrent seeks on one handle give undefined frames. Each
 * worker checks out its own handle from a {@link FrameDecoderPool}.
 */
public interface FrameDecoder extends AutoCloseable {

  /**
   * Probe the video.
   *
   * @return stream properties
   * @throws FrameDecodeException if the video cannot be opened
   */
  VideoInfo videoInfo();

  /**
   * Seek to a time and decode the frame shown there.
   *
   * @param seconds target time
   * @return the decoded frame
   * @throws FrameDecodeException if nothing can be decoded at that time
   */
  DecodedFrame decodeAt(double seconds);

  @Override
  void close();
}
