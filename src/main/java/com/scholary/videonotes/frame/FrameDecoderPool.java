package com.scholary.videonotes.frame;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.BlockingQueue;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * A fixed set of decode handles over one video, shared by the frame workers of a run.
 *
 * <p>A worker holds a handle exclusively for the lifetime of its {@link Lease}:
 *
 * <pre>{@code
 * try (FrameDecoderPool.Lease lease = pool.acquire()) {
 *   engine.extract(lease.decoder(), seconds, target);
 * }
 * }</pre>
 *
 * <p>Handles are opened lazily, so a pool sized above the number of moments opens no more
 * handles than are used concurrently.
 */
public class FrameDecoderPool implements AutoCloseable {

  private static final Logger LOGGER = LoggerFactory.getLogger(FrameDecoderPool.class);

  private final FrameDecoderFactory factory;
  private final Path videoFile;
  private final int capacity;
  private final BlockingQueue<FrameDecoder> idle;
  private final List<FrameDecoder> opened = new ArrayList<>();
  private boolean closed;

  public FrameDecoderPool(FrameDecoderFactory factory, Path videoFile, int capacity) {
    if (capacity <= 0) {
      throw new IllegalArgumentException("Pool capacity must be positive: " + capacity);
    }
    this.factory = factory;
    this.videoFile = videoFile;
    this.capacity = capacity;
    this.idle = new ArrayBlockingQueue<>(capacity);
  }

  /**
   * Check out a handle, blocking until one is free.
   *
   * @throws InterruptedException if interrupted while waiting
   * @throws IllegalStateException if the pool is closed
   */
  public Lease acquire() throws InterruptedException {
    FrameDecoder decoder = idle.poll();
    if (decoder == null) {
      decoder = openIfBelowCapacity();
    }
    if (decoder == null) {
      decoder = idle.take();
    }
    return new Lease(decoder);
  }

  private synchronized FrameDecoder openIfBelowCapacity() {
    if (closed) {
      throw new IllegalStateException("Decoder pool is closed");
    }
    if (opened.size() >= capacity) {
      return null;
    }
    FrameDecoder decoder = factory.open(videoFile);
    opened.add(decoder);
    LOGGER.debug("Opened decoder {}/{} for {}", opened.size(), capacity, videoFile.getFileName());
    return decoder;
  }

  private synchronized void release(FrameDecoder decoder) {
    if (closed) {
      decoder.close();
      return;
    }
    idle.offer(decoder);
  }

  /** Number of handles opened so far. */
  public synchronized int openedCount() {
    return opened.size();
  }

  /** Number of handles waiting to be checked out. */
  public int idleCount() {
    return idle.size();
  }

  @Override
  public synchronized void close() {
    if (closed) {
      return;
    }
    closed = true;
    FrameDecoder decoder;
    while ((decoder = idle.poll()) != null) {
      decoder.close();
    }
    LOGGER.debug("Closed decoder pool for {} ({} handles)", videoFile.getFileName(), opened.size());
  }

  /** Exclusive use of one handle; closing the lease returns it to the pool. */
  public final class Lease implements AutoCloseable {

    private final FrameDecoder decoder;
    private boolean returned;

    private Lease(FrameDecoder decoder) {
      this.decoder = decoder;
    }

    public FrameDecoder decoder() {
      if (returned) {
        throw new IllegalStateException("Lease already returned");
      }
      return decoder;
    }

    @Override
    public void close() {
      if (!returned) {
        returned = true;
        release(decoder);
      }
    }
  }
}
