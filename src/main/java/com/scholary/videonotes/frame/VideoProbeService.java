package com.scholary.videonotes.frame;

import java.nio.file.Path;
import org.springframework.stereotype.Service;

/** Reads basic video properties without extracting any frame. */
@Service
public class VideoProbeService {

  private final FrameDecoderFactory decoderFactory;

  public VideoProbeService(FrameDecoderFactory decoderFactory) {
    this.decoderFactory = decoderFactory;
  }

  /**
   * Probe a video file.
   *
   * @throws FrameDecodeException if the file is missing or not a readable video
   */
  public VideoInfo probe(Path videoFile) {
    try (FrameDecoder decoder = decoderFactory.open(videoFile)) {
      return decoder.videoInfo();
    }
  }
}
