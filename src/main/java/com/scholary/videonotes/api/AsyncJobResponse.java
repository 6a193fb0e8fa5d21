package com.scholary.videonotes.api;

/**
 * Response for an async synthesis request.
 *
 * <p>Returns a job ID that can be used to poll {@code /api/jobs/{id}}.
 */
public record AsyncJobResponse(String jobId) {}
