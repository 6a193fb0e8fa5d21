package com.scholary.videonotes.llm;

/**
 * Exception thrown when the language model cannot be reached or refuses the request.
 *
 * <p>Covers network failures, rate limiting and authentication errors, after retries have been
 * exhausted where retrying makes sense.
 */
public class ModelUnavailableException extends RuntimeException {

  private final int statusCode;

  public ModelUnavailableException(String message) {
    this(message, -1, null);
  }

  public ModelUnavailableException(String message, Throwable cause) {
    this(message, -1, cause);
  }

  public ModelUnavailableException(String message, int statusCode, Throwable cause) {
    super(message, cause);
    this.statusCode = statusCode;
  }

  /** HTTP status of the last response, or -1 if none was received. */
  public int getStatusCode() {
    return statusCode;
  }
}
