package com.scholary.videonotes.pipeline;

/** Receives run progress; used by async jobs to report status. */
@FunctionalInterface
public interface ProgressListener {

  ProgressListener NONE = (state, percent) -> {};

  void onProgress(PipelineState state, int percent);
}
