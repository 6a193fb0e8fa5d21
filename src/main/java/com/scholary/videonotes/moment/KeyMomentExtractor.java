package com.scholary.videonotes.moment;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.scholary.videonotes.cache.MomentCache;
import com.scholary.videonotes.config.PipelineProperties;
import com.scholary.videonotes.llm.ChatMessage;
import com.scholary.videonotes.llm.LanguageModelClient;
import com.scholary.videonotes.llm.ModelConfig;
import com.scholary.videonotes.llm.ModelUnavailableException;
import com.scholary.videonotes.logging.StructuredLogger;
import com.scholary.videonotes.subtitle.TranscriptChunk;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Asks the language model for the visually informative moments of each transcript chunk.
 *
 * <p>Per chunk:
 *
 * <ol>
 *   <li>Answer from the moment cache if this chunk was already extracted with the same settings
 *   <li>Send the task instruction, style directive and chunk text
 *   <li>Validate the reply; on failure, retry once with a corrective instruction
 *   <li>Discard moments outside the chunk's cue range or past the end of the video
 * </ol>
 *
 * <p>Failures stay scoped to the chunk: a malformed or unavailable model yields an empty
 * contribution with a failure outcome, never an exception.
 */
@Component
public class KeyMomentExtractor {

  private static final Logger LOGGER = LoggerFactory.getLogger(KeyMomentExtractor.class);
  private final StructuredLogger structuredLogger = new StructuredLogger(LOGGER);

  private final LanguageModelClient modelClient;
  private final MomentCache momentCache;
  private final MomentResponseParser responseParser;
  private final MomentMerger merger;
  private final double minSeparationSeconds;
  private final double rangeToleranceSeconds;

  public KeyMomentExtractor(
      LanguageModelClient modelClient,
      MomentCache momentCache,
      ObjectMapper objectMapper,
      PipelineProperties properties) {
    this.modelClient = modelClient;
    this.momentCache = momentCache;
    this.responseParser = new MomentResponseParser(objectMapper);
    this.minSeparationSeconds = properties.moments().minSeparationSeconds();
    this.rangeToleranceSeconds = properties.moments().rangeToleranceSeconds();
    this.merger = new MomentMerger(minSeparationSeconds);
  }

  /**
   * Extract the moments of one chunk.
   *
   * @param chunk the transcript chunk
   * @param style tone for the generated content
   * @param config model endpoint and credentials
   * @param videoDurationSeconds video length for bounding moments, non-positive if unknown
   * @return the chunk's bounded moments and outcome
   */
  public ChunkMoments extract(
      TranscriptChunk chunk, NoteStyle style, ModelConfig config, double videoDurationSeconds) {
    String chunkText = chunk.serialize();
    structuredLogger.logChunkStarted(
        chunk.index(), chunk.startSeconds(), chunk.endSeconds(), chunkText.length());
    long startTime = System.currentTimeMillis();

    String cacheKey = MomentCache.generateKey(config.model(), config.baseUrl(), style, chunkText);
    Optional<List<Moment>> cached = momentCache.get(cacheKey);
    if (cached.isPresent()) {
      LOGGER.info("Chunk {} answered from cache ({} moments)", chunk.index(), cached.get().size());
      return bound(chunk, cached.get(), videoDurationSeconds, ChunkOutcome.CACHED);
    }

    List<Moment> proposed;
    try {
      proposed = requestMoments(chunk, style, config);
    } catch (MalformedModelResponseException e) {
      structuredLogger.logChunkFailed(chunk.index(), "MalformedModelResponse", e.getMessage());
      return ChunkMoments.failed(chunk.index(), ChunkOutcome.MALFORMED, e.getMessage());
    } catch (ModelUnavailableException e) {
      if (Thread.currentThread().isInterrupted()) {
        LOGGER.info("Chunk {} cancelled while waiting for the model", chunk.index());
        return ChunkMoments.failed(chunk.index(), ChunkOutcome.CANCELLED, e.getMessage());
      }
      structuredLogger.logChunkFailed(chunk.index(), "ModelUnavailable", e.getMessage());
      return ChunkMoments.failed(chunk.index(), ChunkOutcome.UNAVAILABLE, e.getMessage());
    }

    ChunkMoments result = bound(chunk, proposed, videoDurationSeconds, ChunkOutcome.OK);
    momentCache.put(cacheKey, result.moments());

    structuredLogger.logChunkFinished(
        chunk.index(),
        result.moments().size(),
        result.discarded(),
        System.currentTimeMillis() - startTime);
    return result;
  }

  /**
   * Merge the results of all chunks into one ordered, deduplicated list.
   *
   * @param chunkResults per-chunk results
   * @return moments ascending by seconds
   */
  public List<Moment> merge(List<ChunkMoments> chunkResults) {
    return merger.merge(chunkResults);
  }

  /** Moment cache summary, logged once per run. */
  public String cacheStats() {
    return momentCache.getStats();
  }

  private List<Moment> requestMoments(TranscriptChunk chunk, NoteStyle style, ModelConfig config) {
    List<ChatMessage> conversation =
        MomentPrompts.conversation(chunk, style, minSeparationSeconds);
    String reply = modelClient.complete(config, conversation, chunk.index());
    try {
      return responseParser.parse(reply);
    } catch (MalformedModelResponseException first) {
      LOGGER.warn(
          "Chunk {} reply rejected ({}), retrying with corrective instruction",
          chunk.index(),
          first.getMessage());
      if (Thread.currentThread().isInterrupted()) {
        throw new ModelUnavailableException("Cancelled before corrective retry");
      }
      List<ChatMessage> corrective =
          MomentPrompts.correction(conversation, reply, first.getMessage());
      String correctedReply = modelClient.complete(config, corrective, chunk.index());
      try {
        return responseParser.parse(correctedReply);
      } catch (MalformedModelResponseException second) {
        throw new MalformedModelResponseException(
            "Reply still malformed after corrective retry: " + second.getMessage(), second);
      }
    }
  }

  /** Keep moments inside the chunk's range (and the video); count the rest as hallucinations. */
  private ChunkMoments bound(
      TranscriptChunk chunk,
      List<Moment> moments,
      double videoDurationSeconds,
      ChunkOutcome outcome) {
    List<Moment> kept = new ArrayList<>();
    int discarded = 0;
    for (Moment moment : moments) {
      boolean inChunk = chunk.covers(moment.seconds(), rangeToleranceSeconds);
      boolean inVideo = videoDurationSeconds <= 0 || moment.seconds() <= videoDurationSeconds;
      if (inChunk && inVideo) {
        kept.add(moment);
      } else {
        discarded++;
        LOGGER.debug(
            "Discarding moment at {}s outside chunk {} range [{}-{}] or video length {}s",
            moment.seconds(),
            chunk.index(),
            chunk.startSeconds(),
            chunk.endSeconds(),
            videoDurationSeconds);
      }
    }
    if (discarded > 0) {
      LOGGER.info("Chunk {}: discarded {} out-of-range moments", chunk.index(), discarded);
    }
    return new ChunkMoments(chunk.index(), kept, discarded, outcome, null);
  }
}
