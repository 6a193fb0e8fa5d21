package com.scholary.videonotes.api;

import com.scholary.videonotes.pipeline.ErrorCode;
import com.scholary.videonotes.pipeline.PipelineError;
import java.util.stream.Collectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.MissingServletRequestParameterException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

/** Maps request validation failures to {@code 400} responses in the synthesis error format. */
@RestControllerAdvice
public class ApiExceptionHandler {

  private static final Logger LOGGER = LoggerFactory.getLogger(ApiExceptionHandler.class);

  @ExceptionHandler(MethodArgumentNotValidException.class)
  public ResponseEntity<AnalyzeResponse> handleValidation(MethodArgumentNotValidException ex) {
    String message =
        ex.getBindingResult().getFieldErrors().stream()
            .map(error -> error.getField() + " " + error.getDefaultMessage())
            .collect(Collectors.joining(", "));
    return badRequest(message);
  }

  @ExceptionHandler(HttpMessageNotReadableException.class)
  public ResponseEntity<AnalyzeResponse> handleUnreadable(HttpMessageNotReadableException ex) {
    return badRequest("Malformed request body: " + ex.getMostSpecificCause().getMessage());
  }

  @ExceptionHandler(MissingServletRequestParameterException.class)
  public ResponseEntity<AnalyzeResponse> handleMissingParameter(
      MissingServletRequestParameterException ex) {
    return badRequest(ex.getMessage());
  }

  @ExceptionHandler(IllegalArgumentException.class)
  public ResponseEntity<AnalyzeResponse> handleIllegalArgument(IllegalArgumentException ex) {
    return badRequest(ex.getMessage());
  }

  private static ResponseEntity<AnalyzeResponse> badRequest(String message) {
    LOGGER.warn("Rejected request: {}", message);
    return ResponseEntity.badRequest()
        .body(AnalyzeResponse.failure(new PipelineError(ErrorCode.INVALID_REQUEST, message)));
  }
}
