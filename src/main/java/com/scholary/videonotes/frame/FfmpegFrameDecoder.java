package com.scholary.videonotes.frame;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.awt.image.BufferedImage;
import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Locale;
import java.util.concurrent.TimeUnit;
import javax.imageio.ImageIO;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Decodes single frames by running ffmpeg.
 *
 * <p>Probing uses {@code ffprobe} with JSON output. Decoding seeks with {@code -ss} placed before
 * {@code -i}; ffmpeg jumps to the nearest keyframe and decodes forward to the exact time, then
 * pipes one PNG frame to stdout.
 *
 * <p>The probe result is cached on the handle, which is why a handle must not be shared between
 * threads.
 */
public class FfmpegFrameDecoder implements FrameDecoder {

  private static final Logger LOGGER = LoggerFactory.getLogger(FfmpegFrameDecoder.class);

  private final Path videoFile;
  private final FfmpegProperties properties;
  private final ObjectMapper objectMapper;

  private VideoInfo videoInfo;

  public FfmpegFrameDecoder(
      Path videoFile, FfmpegProperties properties, ObjectMapper objectMapper) {
    this.videoFile = videoFile;
    this.properties = properties;
    this.objectMapper = objectMapper;
  }

  @Override
  public VideoInfo videoInfo() {
    if (videoInfo == null) {
      videoInfo = probe();
    }
    return videoInfo;
  }

  @Override
  public DecodedFrame decodeAt(double seconds) {
    requireVideoFile();
    if (Thread.currentThread().isInterrupted()) {
      throw new FrameDecodeException(FailureReason.CANCELLED, "Decode cancelled");
    }

    // -ss before -i: fast keyframe seek, then exact decode up to the target
    // -frames:v 1: a single frame
    // -f image2pipe -vcodec png -: PNG bytes on stdout
    List<String> command =
        List.of(
            properties.ffmpegPath(),
            "-v", "error",
            "-ss", String.format(Locale.ROOT, "%.3f", seconds),
            "-i", videoFile.toString(),
            "-frames:v", "1",
            "-f", "image2pipe",
            "-vcodec", "png",
            "-");

    ProcessResult result = run(command);
    if (result.exitCode() != 0) {
      throw new FrameDecodeException(
          classify(result.stderr()),
          String.format("ffmpeg exited with code %d at %.3fs: %s", result.exitCode(), seconds,
              result.stderr().strip()));
    }
    if (result.stdout().length == 0) {
      throw new FrameDecodeException(
          FailureReason.SEEK_OUT_OF_RANGE, String.format("No frame decoded at %.3fs", seconds));
    }

    try {
      BufferedImage image = ImageIO.read(new ByteArrayInputStream(result.stdout()));
      if (image == null) {
        throw new FrameDecodeException(
            FailureReason.CODEC_ERROR, String.format("Unreadable frame data at %.3fs", seconds));
      }
      return new DecodedFrame(seconds, image);
    } catch (IOException e) {
      throw new FrameDecodeException(
          FailureReason.CODEC_ERROR, String.format("Unreadable frame data at %.3fs", seconds), e);
    }
  }

  @Override
  public void close() {
    // Each decode is its own ffmpeg process; nothing stays open between calls
    videoInfo = null;
  }

  private VideoInfo probe() {
    requireVideoFile();

    List<String> command =
        List.of(
            properties.ffprobePath(),
            "-v", "error",
            "-select_streams", "v:0",
            "-show_entries", "stream=width,height,r_frame_rate,nb_frames:format=duration",
            "-of", "json",
            videoFile.toString());

    ProcessResult result = run(command);
    if (result.exitCode() != 0) {
      throw new FrameDecodeException(
          FailureReason.UNREADABLE_VIDEO,
          "ffprobe failed with exit code " + result.exitCode() + ": " + result.stderr().strip());
    }

    try {
      JsonNode root = objectMapper.readTree(result.stdout());
      JsonNode stream = root.path("streams").path(0);
      if (stream.isMissingNode()) {
        throw new FrameDecodeException(
            FailureReason.UNREADABLE_VIDEO, "No video stream in " + videoFile.getFileName());
      }
      double duration = Double.parseDouble(root.path("format").path("duration").asText("0"));
      double fps = parseFrameRate(stream.path("r_frame_rate").asText("0/1"));
      long frames = stream.path("nb_frames").asLong(0);
      if (frames <= 0) {
        frames = Math.round(duration * fps);
      }
      VideoInfo info =
          new VideoInfo(
              duration, fps, stream.path("width").asInt(0), stream.path("height").asInt(0), frames);
      LOGGER.info(
          "Probed {}: duration={}s, fps={}, size={}x{}",
          videoFile.getFileName(),
          info.durationSeconds(),
          info.fps(),
          info.width(),
          info.height());
      return info;
    } catch (IOException | NumberFormatException e) {
      throw new FrameDecodeException(
          FailureReason.UNREADABLE_VIDEO, "Failed to parse ffprobe output", e);
    }
  }

  private void requireVideoFile() {
    if (!Files.isRegularFile(videoFile)) {
      throw new FrameDecodeException(
          FailureReason.VIDEO_NOT_FOUND, "Video file not found: " + videoFile);
    }
  }

  /**
   * Run a command with stdout and stderr captured in temp files.
   *
   * <p>Nothing reads a pipe while the process runs, so {@code waitFor} with a timeout is the only
   * blocking call and an interrupt stops the wait. The process is killed on every early exit.
   */
  private ProcessResult run(List<String> command) {
    LOGGER.debug("Executing: {}", String.join(" ", command));
    Path stdoutFile = null;
    Path stderrFile = null;
    Process process = null;
    try {
      stdoutFile = Files.createTempFile("ffmpeg-", ".out");
      stderrFile = Files.createTempFile("ffmpeg-", ".err");
      process =
          new ProcessBuilder(command)
              .redirectOutput(stdoutFile.toFile())
              .redirectError(stderrFile.toFile())
              .start();
      if (!process.waitFor(properties.decodeTimeoutSeconds(), TimeUnit.SECONDS)) {
        throw new FrameDecodeException(
            FailureReason.CODEC_ERROR,
            "ffmpeg timed out after " + properties.decodeTimeoutSeconds() + "s");
      }
      return new ProcessResult(
          process.exitValue(),
          Files.readAllBytes(stdoutFile),
          new String(Files.readAllBytes(stderrFile), StandardCharsets.UTF_8));
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      throw new FrameDecodeException(FailureReason.CANCELLED, "Decode interrupted", e);
    } catch (IOException e) {
      throw new FrameDecodeException(FailureReason.CODEC_ERROR, "Failed to run ffmpeg", e);
    } finally {
      if (process != null && process.isAlive()) {
        process.destroyForcibly();
      }
      deleteQuietly(stdoutFile);
      deleteQuietly(stderrFile);
    }
  }

  private static void deleteQuietly(Path file) {
    if (file == null) {
      return;
    }
    try {
      Files.deleteIfExists(file);
    } catch (IOException e) {
      LOGGER.debug("Could not delete temp file {}: {}", file, e.getMessage());
    }
  }

  static FailureReason classify(String stderr) {
    String lower = stderr.toLowerCase(Locale.ROOT);
    if (lower.contains("no such file")) {
      return FailureReason.VIDEO_NOT_FOUND;
    }
    if (lower.contains("invalid data found") || lower.contains("moov atom not found")) {
      return FailureReason.UNREADABLE_VIDEO;
    }
    return FailureReason.CODEC_ERROR;
  }

  static double parseFrameRate(String rate) {
    String[] parts = rate.split("/");
    try {
      double numerator = Double.parseDouble(parts[0]);
      double denominator = parts.length > 1 ? Double.parseDouble(parts[1]) : 1.0;
      return denominator > 0 ? numerator / denominator : 0.0;
    } catch (NumberFormatException e) {
      return 0.0;
    }
  }

  private record ProcessResult(int exitCode, byte[] stdout, String stderr) {}
}
