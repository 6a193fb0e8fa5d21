package com.scholary.videonotes.pipeline;

/** A fatal run error as reported to callers. */
public record PipelineError(ErrorCode code, String message) {}
