package com.scholary.videonotes.subtitle;

/**
 * Exception thrown when subtitle text cannot be parsed into timed cues.
 *
 * <p>Raised for blank input and for untimed text when the whole-document fallback is off.
 */
public class UnsupportedFormatException extends RuntimeException {

  public UnsupportedFormatException(String message) {
    super(message);
  }

  public UnsupportedFormatException(String message, Throwable cause) {
    super(message, cause);
  }
}
