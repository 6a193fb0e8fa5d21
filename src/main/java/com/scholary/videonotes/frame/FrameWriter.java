package com.scholary.videonotes.frame;

import java.awt.Graphics2D;
import java.awt.image.BufferedImage;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Iterator;
import javax.imageio.IIOImage;
import javax.imageio.ImageIO;
import javax.imageio.ImageWriteParam;
import javax.imageio.ImageWriter;
import javax.imageio.stream.ImageOutputStream;

/** Writes frames as JPEG files. */
public class FrameWriter {

  private final float quality;

  /** @param quality JPEG quality in (0, 1] */
  public FrameWriter(float quality) {
    if (quality <= 0 || quality > 1) {
      throw new IllegalArgumentException("JPEG quality must be in (0, 1]: " + quality);
    }
    this.quality = quality;
  }

  /**
   * Write the image, creating parent directories as needed.
   *
   * @throws FrameDecodeException with {@link FailureReason#WRITE_FAILED} on any I/O error
   */
  public Path write(BufferedImage image, Path target) {
    try {
      Path parent = target.toAbsolutePath().getParent();
      if (parent != null) {
        Files.createDirectories(parent);
      }

      Iterator<ImageWriter> writers = ImageIO.getImageWritersByFormatName("jpeg");
      if (!writers.hasNext()) {
        throw new FrameDecodeException(FailureReason.WRITE_FAILED, "No JPEG writer available");
      }
      ImageWriter writer = writers.next();
      ImageWriteParam param = writer.getDefaultWriteParam();
      param.setCompressionMode(ImageWriteParam.MODE_EXPLICIT);
      param.setCompressionQuality(quality);

      Files.deleteIfExists(target);
      try (ImageOutputStream output = ImageIO.createImageOutputStream(target.toFile())) {
        if (output == null) {
          throw new FrameDecodeException(
              FailureReason.WRITE_FAILED, "Cannot open output stream for " + target);
        }
        writer.setOutput(output);
        writer.write(null, new IIOImage(toRgb(image), null, null), param);
      } finally {
        writer.dispose();
      }
      return target;
    } catch (IOException e) {
      throw new FrameDecodeException(FailureReason.WRITE_FAILED, "Failed to write " + target, e);
    }
  }

  // The JPEG writer rejects images with an alpha channel
  private static BufferedImage toRgb(BufferedImage image) {
    if (image.getType() == BufferedImage.TYPE_INT_RGB) {
      return image;
    }
    BufferedImage rgb =
        new BufferedImage(image.getWidth(), image.getHeight(), BufferedImage.TYPE_INT_RGB);
    Graphics2D graphics = rgb.createGraphics();
    try {
      graphics.drawImage(image, 0, 0, null);
    } finally {
      graphics.dispose();
    }
    return rgb;
  }
}
