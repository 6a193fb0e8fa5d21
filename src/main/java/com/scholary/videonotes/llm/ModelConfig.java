package com.scholary.videonotes.llm;

/**
 * Per-call language model settings.
 *
 * <p>Passed explicitly with every synthesis run so concurrent runs can target different endpoints
 * without shared state. {@code baseUrl} may be null to use the configured default.
 */
public record ModelConfig(String apiKey, String baseUrl, String model) {

  public ModelConfig {
    if (apiKey == null || apiKey.isBlank()) {
      throw new IllegalArgumentException("API key is required");
    }
    if (model == null || model.isBlank()) {
      throw new IllegalArgumentException("Model name is required");
    }
  }

  /** Hide the key when the config ends up in logs. */
  @Override
  public String toString() {
    return "ModelConfig[baseUrl=" + baseUrl + ", model=" + model + "]";
  }
}
