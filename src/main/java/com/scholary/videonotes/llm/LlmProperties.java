package com.scholary.videonotes.llm;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Positive;
import jakarta.validation.constraints.PositiveOrZero;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Configuration properties for the language model client.
 *
 * <p>Credentials and the model name come with each request; these only control defaults,
 * timeouts and retries.
 */
@ConfigurationProperties(prefix = "llm")
@Validated
public record LlmProperties(
    @NotBlank String defaultBaseUrl,
    @NotBlank String defaultModel,
    @Positive int connectTimeout,
    @Positive int readTimeout,
    @Positive int maxRetries,
    @Positive long initialBackoffMillis,
    @Positive long maxBackoffMillis,
    @PositiveOrZero double temperature,
    @Positive int maxTokens) {}
