package com.scholary.videonotes.frame;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

import java.awt.image.BufferedImage;
import org.junit.jupiter.api.Test;

class SharpnessScorerTest {

  @Test
  void score_shouldBeZeroForFlatImage() {
    assertThat(SharpnessScorer.score(FakeFrameDecoder.flat())).isEqualTo(0.0);
  }

  @Test
  void score_shouldBeZeroForLinearGradient() {
    BufferedImage gradient = new BufferedImage(50, 50, BufferedImage.TYPE_INT_RGB);
    for (int y = 0; y < 50; y++) {
      for (int x = 0; x < 50; x++) {
        int v = x * 4;
        gradient.setRGB(x, y, (v << 16) | (v << 8) | v);
      }
    }

    assertThat(SharpnessScorer.score(gradient)).isCloseTo(0.0, within(1e-6));
  }

  @Test
  void score_shouldGrowWithEdgeContrast() {
    double soft = SharpnessScorer.score(FakeFrameDecoder.checkerboard(1));
    double crisp = SharpnessScorer.score(FakeFrameDecoder.checkerboard(50));

    assertThat(soft).isCloseTo(64.0, within(0.5));
    assertThat(crisp).isGreaterThan(100.0).isGreaterThan(soft);
  }

  @Test
  void score_shouldBeZeroForTinyImages() {
    assertThat(SharpnessScorer.score(new BufferedImage(2, 2, BufferedImage.TYPE_INT_RGB)))
        .isEqualTo(0.0);
  }
}
