package com.scholary.videonotes.llm;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.scholary.videonotes.logging.StructuredLogger;
import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpRequest.BodyPublishers;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ThreadLocalRandom;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * HTTP client for OpenAI-compatible chat-completions endpoints.
 *
 * <p>Handles request building, response parsing, and retrying transient failures (I/O errors,
 * timeouts, HTTP 408/429/5xx) with exponential backoff and jitter. Authentication and other client
 * errors fail on the first attempt.
 *
 * <p>Uses the Java 11+ HttpClient directly: every call may target a different base URL and key,
 * which a single pre-configured client abstraction would get in the way of.
 */
@Component
public class OpenAiChatClient implements LanguageModelClient {

  private static final Logger LOGGER = LoggerFactory.getLogger(OpenAiChatClient.class);
  private final StructuredLogger structuredLogger = new StructuredLogger(LOGGER);

  private final HttpClient httpClient;
  private final LlmProperties properties;
  private final ObjectMapper objectMapper;

  public OpenAiChatClient(LlmProperties properties, ObjectMapper objectMapper) {
    this.properties = properties;
    this.objectMapper = objectMapper;

    this.httpClient =
        HttpClient.newBuilder()
            .connectTimeout(Duration.ofSeconds(properties.connectTimeout()))
            .build();

    LOGGER.info(
        "Initialized chat client: defaultBaseUrl={}, maxRetries={}",
        properties.defaultBaseUrl(),
        properties.maxRetries());
  }

  @Override
  public String complete(ModelConfig config, List<ChatMessage> messages, int chunkIndex) {
    int attempt = 0;
    Exception lastException = null;

    while (attempt < properties.maxRetries()) {
      try {
        return attemptComplete(config, messages);
      } catch (RetryableStatusException | IOException e) {
        lastException = e;
        attempt++;
        if (attempt < properties.maxRetries()) {
          long backoffMs = backoffMillis(attempt);
          structuredLogger.logModelRetry(
              chunkIndex,
              attempt,
              properties.maxRetries(),
              e.getClass().getSimpleName(),
              e.getMessage());
          sleep(backoffMs);
        }
      } catch (InterruptedException e) {
        Thread.currentThread().interrupt();
        throw new ModelUnavailableException("Model call interrupted", e);
      }
    }

    int status =
        lastException instanceof RetryableStatusException retryable ? retryable.statusCode : -1;
    throw new ModelUnavailableException(
        String.format("Model call failed after %d attempts", properties.maxRetries()),
        status,
        lastException);
  }

  /**
   * Attempt a single chat-completions request.
   *
   * @throws IOException if the request fails in transit
   * @throws RetryableStatusException if the endpoint answered with a retryable status
   * @throws InterruptedException if the calling thread is interrupted
   */
  private String attemptComplete(ModelConfig config, List<ChatMessage> messages)
      throws IOException, RetryableStatusException, InterruptedException {

    Map<String, Object> body = new LinkedHashMap<>();
    body.put("model", config.model());
    body.put("messages", messages);
    body.put("temperature", properties.temperature());
    body.put("max_tokens", properties.maxTokens());

    HttpRequest request =
        HttpRequest.newBuilder()
            .uri(URI.create(resolveBaseUrl(config) + "/chat/completions"))
            .timeout(Duration.ofSeconds(properties.readTimeout()))
            .header("Content-Type", "application/json")
            .header("Authorization", "Bearer " + config.apiKey())
            .POST(BodyPublishers.ofByteArray(objectMapper.writeValueAsBytes(body)))
            .build();

    LOGGER.debug("Sending chat request to {} (model={})", request.uri(), config.model());

    HttpResponse<String> response = httpClient.send(request, HttpResponse.BodyHandlers.ofString());
    int status = response.statusCode();

    if (status == 408 || status == 429 || status >= 500) {
      throw new RetryableStatusException(status, response.body());
    }
    if (status != 200) {
      throw new ModelUnavailableException(
          String.format(
              "Model endpoint returned status %d: %s", status, abbreviate(response.body())),
          status,
          null);
    }

    JsonNode content = objectMapper.readTree(response.body()).path("choices").path(0)
        .path("message").path("content");
    if (!content.isTextual()) {
      throw new ModelUnavailableException(
          "Model response has no message content: " + abbreviate(response.body()), status, null);
    }
    return content.asText();
  }

  private String resolveBaseUrl(ModelConfig config) {
    String baseUrl =
        config.baseUrl() == null || config.baseUrl().isBlank()
            ? properties.defaultBaseUrl()
            : config.baseUrl().strip();
    return baseUrl.endsWith("/") ? baseUrl.substring(0, baseUrl.length() - 1) : baseUrl;
  }

  private long backoffMillis(int attempt) {
    long initial = properties.initialBackoffMillis();
    long exponential = initial << Math.min(attempt - 1, 20);
    long jitter = ThreadLocalRandom.current().nextLong(initial + 1);
    return Math.min(exponential + jitter, properties.maxBackoffMillis());
  }

  private static void sleep(long millis) {
    try {
      Thread.sleep(millis);
    } catch (InterruptedException ie) {
      Thread.currentThread().interrupt();
      throw new ModelUnavailableException("Model call interrupted during backoff", ie);
    }
  }

  private static String abbreviate(String text) {
    if (text == null) {
      return "";
    }
    return text.length() <= 300 ? text : text.substring(0, 300) + "...";
  }

  /** Signals a status code worth retrying. */
  private static final class RetryableStatusException extends Exception {

    private final int statusCode;

    RetryableStatusException(int statusCode, String body) {
      super(String.format("Model endpoint returned status %d: %s", statusCode, abbreviate(body)));
      this.statusCode = statusCode;
    }
  }
}
