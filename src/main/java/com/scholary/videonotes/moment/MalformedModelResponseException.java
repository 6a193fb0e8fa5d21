package com.scholary.videonotes.moment;

/**
 * Exception thrown when a model reply does not match the expected moment schema.
 *
 * <p>Scoped to one transcript chunk. The extractor retries once with a corrective instruction and
 * then drops the chunk's contribution; it never aborts the run.
 */
public class MalformedModelResponseException extends RuntimeException {

  public MalformedModelResponseException(String message) {
    super(message);
  }

  public MalformedModelResponseException(String message, Throwable cause) {
    super(message, cause);
  }
}
