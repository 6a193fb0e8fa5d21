package com.scholary.videonotes.pipeline;

/**
 * Exception thrown when a synthesis run cannot produce any note.
 *
 * <p>Chunk- and moment-scoped failures never surface as this exception; they are downgraded and
 * logged.
 */
public class PipelineException extends RuntimeException {

  private final ErrorCode code;

  public PipelineException(ErrorCode code, String message) {
    super(message);
    this.code = code;
  }

  public PipelineException(ErrorCode code, String message, Throwable cause) {
    super(message, cause);
    this.code = code;
  }

  public ErrorCode getCode() {
    return code;
  }

  public PipelineError toError() {
    return new PipelineError(code, getMessage());
  }
}
