package com.scholary.videonotes.frame;

import java.nio.file.Path;

/** Opens decode handles. */
public interface FrameDecoderFactory {

  /**
   * Open a new, exclusively owned decode handle.
   *
   * @param videoFile the video to decode
   * @return the handle
   */
  FrameDecoder open(Path videoFile);
}
