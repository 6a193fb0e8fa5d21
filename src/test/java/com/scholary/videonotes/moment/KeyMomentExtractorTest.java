package com.scholary.videonotes.moment;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.scholary.videonotes.PipelineFixtures;
import com.scholary.videonotes.cache.InMemoryMomentCache;
import com.scholary.videonotes.llm.ChatMessage;
import com.scholary.videonotes.llm.LanguageModelClient;
import com.scholary.videonotes.llm.ModelConfig;
import com.scholary.videonotes.llm.ModelUnavailableException;
import com.scholary.videonotes.subtitle.TimedCue;
import com.scholary.videonotes.subtitle.TranscriptChunk;
import java.nio.file.Path;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Captor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class KeyMomentExtractorTest {

  private static final ModelConfig CONFIG = new ModelConfig("sk-test", null, "gpt-4o-mini");
  private static final String VALID_REPLY =
      "[{\"timestamp\": \"00:00:05\", \"title\": \"Open editor\", \"content\": \"The IDE\"}]";

  @Mock private LanguageModelClient modelClient;
  @Captor private ArgumentCaptor<List<ChatMessage>> conversationCaptor;

  private KeyMomentExtractor extractor;
  private TranscriptChunk chunk;

  @BeforeEach
  void setUp() {
    extractor =
        new KeyMomentExtractor(
            modelClient,
            new InMemoryMomentCache(100, 1),
            new ObjectMapper(),
            PipelineFixtures.pipeline(Path.of("frames")));
    chunk =
        new TranscriptChunk(
            0,
            List.of(new TimedCue(0, 10, "open the editor"), new TimedCue(10, 30, "type code")),
            12000);
  }

  @Test
  void extract_shouldReturnModelMoments() {
    when(modelClient.complete(any(), anyList(), anyInt())).thenReturn(VALID_REPLY);

    ChunkMoments result = extractor.extract(chunk, NoteStyle.PROFESSIONAL, CONFIG, 0);

    assertThat(result.outcome()).isEqualTo(ChunkOutcome.OK);
    assertThat(result.moments()).containsExactly(new Moment(5, "Open editor", "The IDE"));
  }

  @Test
  void extract_shouldRecoverWithCorrectiveRetry() {
    when(modelClient.complete(any(), anyList(), anyInt()))
        .thenReturn("Sure! Here you go: moments at 5s", VALID_REPLY);

    ChunkMoments result = extractor.extract(chunk, NoteStyle.BLOG, CONFIG, 0);

    assertThat(result.outcome()).isEqualTo(ChunkOutcome.OK);
    assertThat(result.moments()).hasSize(1);

    verify(modelClient, times(2)).complete(any(), conversationCaptor.capture(), anyInt());
    List<ChatMessage> corrective = conversationCaptor.getAllValues().get(1);
    assertThat(corrective).hasSize(4);
    assertThat(corrective.get(2).role()).isEqualTo("assistant");
    assertThat(corrective.get(3).content()).contains(MomentPrompts.SCHEMA);
  }

  @Test
  void extract_shouldAbsorbTwoMalformedReplies() {
    when(modelClient.complete(any(), anyList(), anyInt())).thenReturn("nope", "still nope");

    ChunkMoments result = extractor.extract(chunk, NoteStyle.PROFESSIONAL, CONFIG, 0);

    assertThat(result.outcome()).isEqualTo(ChunkOutcome.MALFORMED);
    assertThat(result.moments()).isEmpty();
    assertThat(result.error()).contains("corrective retry");
  }

  @Test
  void extract_shouldAbsorbUnavailableModel() {
    when(modelClient.complete(any(), anyList(), anyInt()))
        .thenThrow(new ModelUnavailableException("Model call failed after 3 attempts"));

    ChunkMoments result = extractor.extract(chunk, NoteStyle.PROFESSIONAL, CONFIG, 0);

    assertThat(result.outcome()).isEqualTo(ChunkOutcome.UNAVAILABLE);
    assertThat(result.moments()).isEmpty();
  }

  @Test
  void extract_shouldDiscardMomentsOutsideChunkRange() {
    when(modelClient.complete(any(), anyList(), anyInt()))
        .thenReturn(
            "[{\"timestamp\": \"00:00:20\", \"title\": \"In range\"},"
                + " {\"timestamp\": \"00:05:00\", \"title\": \"Hallucinated\"}]");

    ChunkMoments result = extractor.extract(chunk, NoteStyle.PROFESSIONAL, CONFIG, 0);

    assertThat(result.moments()).extracting(Moment::title).containsExactly("In range");
    assertThat(result.discarded()).isEqualTo(1);
  }

  @Test
  void extract_shouldDiscardMomentsPastVideoEnd() {
    when(modelClient.complete(any(), anyList(), anyInt()))
        .thenReturn(
            "[{\"timestamp\": \"00:00:05\", \"title\": \"Early\"},"
                + " {\"timestamp\": \"00:00:25\", \"title\": \"After end\"}]");

    ChunkMoments result = extractor.extract(chunk, NoteStyle.PROFESSIONAL, CONFIG, 20.0);

    assertThat(result.moments()).extracting(Moment::title).containsExactly("Early");
  }

  @Test
  void extract_shouldAnswerRepeatedChunkFromCache() {
    when(modelClient.complete(any(), anyList(), anyInt())).thenReturn(VALID_REPLY);

    extractor.extract(chunk, NoteStyle.PROFESSIONAL, CONFIG, 0);
    ChunkMoments second = extractor.extract(chunk, NoteStyle.PROFESSIONAL, CONFIG, 0);

    assertThat(second.outcome()).isEqualTo(ChunkOutcome.CACHED);
    assertThat(second.moments()).hasSize(1);
    verify(modelClient, times(1)).complete(any(), anyList(), anyInt());
    assertThat(extractor.cacheStats()).contains("size=1").contains("hitRate=50");
  }

  @Test
  void extract_shouldNotCacheAcrossStyles() {
    when(modelClient.complete(any(), anyList(), anyInt())).thenReturn(VALID_REPLY);

    extractor.extract(chunk, NoteStyle.PROFESSIONAL, CONFIG, 0);
    ChunkMoments tutorial = extractor.extract(chunk, NoteStyle.TUTORIAL, CONFIG, 0);

    assertThat(tutorial.outcome()).isEqualTo(ChunkOutcome.OK);
    verify(modelClient, times(2)).complete(any(), anyList(), anyInt());
  }

  @Test
  void extract_shouldNotCacheFailures() {
    when(modelClient.complete(any(), anyList(), anyInt()))
        .thenReturn("bad", "bad again", VALID_REPLY);

    ChunkMoments first = extractor.extract(chunk, NoteStyle.PROFESSIONAL, CONFIG, 0);
    ChunkMoments second = extractor.extract(chunk, NoteStyle.PROFESSIONAL, CONFIG, 0);

    assertThat(first.outcome()).isEqualTo(ChunkOutcome.MALFORMED);
    assertThat(second.outcome()).isEqualTo(ChunkOutcome.OK);
  }
}
