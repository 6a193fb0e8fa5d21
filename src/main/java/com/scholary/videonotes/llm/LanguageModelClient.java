package com.scholary.videonotes.llm;

import java.util.List;

/**
 * Interface for chat-style language model providers.
 *
 * <p>This abstraction allows us to swap providers, or stub the model in tests, without changing
 * the moment extraction logic.
 */
public interface LanguageModelClient {

  /**
   * Send a conversation and return the assistant's reply text.
   *
   * @param config endpoint, credentials and model for this call
   * @param messages the conversation, system message first
   * @param chunkIndex index of the transcript chunk this call serves, for logging
   * @return the raw reply text
   * @throws ModelUnavailableException if the model cannot be reached after retries
   */
  String complete(ModelConfig config, List<ChatMessage> messages, int chunkIndex);
}
