package com.scholary.videonotes.frame;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.awt.image.BufferedImage;
import java.nio.file.Path;
import javax.imageio.ImageIO;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class FrameWriterTest {

  @TempDir Path tempDir;

  @Test
  void write_shouldCreateDirectoriesAndReadableJpeg() throws Exception {
    Path target = tempDir.resolve("run-1").resolve("frame_0.jpg");

    new FrameWriter(0.9f).write(FakeFrameDecoder.checkerboard(40), target);

    BufferedImage written = ImageIO.read(target.toFile());
    assertThat(written.getWidth()).isEqualTo(64);
    assertThat(written.getHeight()).isEqualTo(48);
  }

  @Test
  void write_shouldConvertImagesWithAlpha() throws Exception {
    BufferedImage argb = new BufferedImage(10, 10, BufferedImage.TYPE_INT_ARGB);
    Path target = tempDir.resolve("alpha.jpg");

    new FrameWriter(0.5f).write(argb, target);

    assertThat(ImageIO.read(target.toFile())).isNotNull();
  }

  @Test
  void constructor_shouldRejectInvalidQuality() {
    assertThatThrownBy(() -> new FrameWriter(0f)).isInstanceOf(IllegalArgumentException.class);
    assertThatThrownBy(() -> new FrameWriter(1.5f)).isInstanceOf(IllegalArgumentException.class);
  }
}
