package com.scholary.videonotes.pipeline;

/** Error codes reported to callers and used to tag downgraded failures in logs. */
public enum ErrorCode {
  /** Subtitle text matches no known format. */
  UNSUPPORTED_FORMAT,

  /** The model's reply failed validation twice for a chunk. */
  MALFORMED_MODEL_RESPONSE,

  /** The model could not be reached for a chunk. */
  MODEL_UNAVAILABLE,

  /** No frame could be produced for a moment. */
  FRAME_DECODE_FAILURE,

  /** The run exceeded its deadline before producing any moment. */
  PIPELINE_TIMEOUT,

  /** Nothing to turn into notes: no cues, or no moments survived extraction. */
  NO_USABLE_CONTENT,

  /** The request itself is unusable, e.g. the video file does not exist. */
  INVALID_REQUEST,

  /** Unexpected failure outside the pipeline's error handling. */
  INTERNAL_ERROR
}
