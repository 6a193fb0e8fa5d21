package com.scholary.videonotes.frame;

import com.fasterxml.jackson.databind.ObjectMapper;
import java.nio.file.Path;
import org.springframework.stereotype.Component;

/** Opens ffmpeg-backed decode handles. */
@Component
public class FfmpegFrameDecoderFactory implements FrameDecoderFactory {

  private final FfmpegProperties properties;
  private final ObjectMapper objectMapper;

  public FfmpegFrameDecoderFactory(FfmpegProperties properties, ObjectMapper objectMapper) {
    this.properties = properties;
    this.objectMapper = objectMapper;
  }

  @Override
  public FrameDecoder open(Path videoFile) {
    return new FfmpegFrameDecoder(videoFile, properties, objectMapper);
  }
}
