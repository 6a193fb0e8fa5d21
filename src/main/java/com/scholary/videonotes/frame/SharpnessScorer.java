package com.scholary.videonotes.frame;

import java.awt.image.BufferedImage;

/**
 * Scores image sharpness as the variance of the Laplacian of the luminance channel.
 *
 * <p>Uses the 4-neighbour kernel {@code [0 1 0; 1 -4 1; 0 1 0]} over interior pixels. Flat or
 * motion-blurred frames score low; frames with crisp edges (text, diagrams, UI) score high. A
 * threshold around 100 separates the two for typical screen recordings.
 */
public final class SharpnessScorer {

  private SharpnessScorer() {}

  /**
   * Compute the sharpness score.
   *
   * @param image the decoded frame
   * @return Laplacian variance, 0 for images smaller than 3x3
   */
  public static double score(BufferedImage image) {
    int width = image.getWidth();
    int height = image.getHeight();
    if (width < 3 || height < 3) {
      return 0.0;
    }

    double[] luma = luminance(image, width, height);

    long count = 0;
    double sum = 0;
    double sumSquares = 0;
    for (int y = 1; y < height - 1; y++) {
      int row = y * width;
      for (int x = 1; x < width - 1; x++) {
        int i = row + x;
        double laplacian =
            luma[i - width] + luma[i + width] + luma[i - 1] + luma[i + 1] - 4 * luma[i];
        sum += laplacian;
        sumSquares += laplacian * laplacian;
        count++;
      }
    }

    double mean = sum / count;
    return sumSquares / count - mean * mean;
  }

  private static double[] luminance(BufferedImage image, int width, int height) {
    int[] rgb = image.getRGB(0, 0, width, height, null, 0, width);
    double[] luma = new double[rgb.length];
    for (int i = 0; i < rgb.length; i++) {
      int pixel = rgb[i];
      int r = (pixel >> 16) & 0xFF;
      int g = (pixel >> 8) & 0xFF;
      int b = pixel & 0xFF;
      // ITU-R BT.601, same weights as OpenCV's BGR2GRAY
      luma[i] = 0.299 * r + 0.587 * g + 0.114 * b;
    }
    return luma;
  }
}
