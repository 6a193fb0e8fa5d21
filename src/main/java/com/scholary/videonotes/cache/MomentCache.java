package com.scholary.videonotes.cache;

import com.scholary.videonotes.moment.Moment;
import com.scholary.videonotes.moment.NoteStyle;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;
import java.util.List;
import java.util.Optional;

/**
 * Cache for the moments extracted from a transcript chunk.
 *
 * <p>When the same transcript is synthesized again (for example after a timeout, or with a
 * different video cut), chunks that already produced valid moments are answered from here instead
 * of calling the model again.
 *
 * <p>Cache keys are based on: model + base URL + style + a digest of the chunk's prompt text.
 */
public interface MomentCache {

  /**
   * Store a chunk's moments.
   *
   * @param cacheKey unique key for the chunk
   * @param moments the bounded moments extracted from it
   */
  void put(String cacheKey, List<Moment> moments);

  /**
   * Retrieve a chunk's cached moments.
   *
   * @param cacheKey unique key for the chunk
   * @return the cached moments, or empty if not found
   */
  Optional<List<Moment>> get(String cacheKey);

  /** Size and hit-rate summary for logging. */
  String getStats();

  /**
   * Generate a cache key for a chunk.
   *
   * @param model the model name
   * @param baseUrl the endpoint, null for the default
   * @param style the note style
   * @param chunkText the chunk's serialized prompt text
   * @return a unique cache key
   */
  static String generateKey(String model, String baseUrl, NoteStyle style, String chunkText) {
    try {
      MessageDigest digest = MessageDigest.getInstance("SHA-256");
      String hash =
          HexFormat.of().formatHex(digest.digest(chunkText.getBytes(StandardCharsets.UTF_8)));
      return String.format(
          "%s:%s:%s:%s", model, baseUrl == null ? "default" : baseUrl, style.value(), hash);
    } catch (NoSuchAlgorithmException e) {
      throw new IllegalStateException("SHA-256 not available", e);
    }
  }
}
