package com.mindthread.backend.common.exception;

import com.mindthread.backend.thread.service.FocusNotFoundException;
import com.mindthread.backend.thread.service.ThreadContextBuildException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ProblemDetail;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.validation.BindException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

@Slf4j
@RestControllerAdvice
public class GlobalExceptionHandler {

  @ExceptionHandler(Exception.class)
  public ResponseEntity<ProblemDetail> handleUnexpectedException(Exception ex) {
    log.error("Unhandled exception", ex);
    ProblemDetail problem = ProblemDetail.forStatus(HttpStatus.INTERNAL_SERVER_ERROR);
    problem.setTitle("Unexpected error");
    problem.setDetail("An unexpected error occurred. Please retry later.");
    return ResponseEntity.internalServerError().body(problem);
  }

  @ExceptionHandler(FocusNotFoundException.class)
  public ResponseEntity<ProblemDetail> handleFocusNotFound(FocusNotFoundException ex) {
    ProblemDetail problem = ProblemDetail.forStatus(HttpStatus.NOT_FOUND);
    problem.setTitle("Snippet not found");
    problem.setDetail(ex.getMessage());
    problem.setProperty("snippetId", ex.getSnippetId());
    return ResponseEntity.status(HttpStatus.NOT_FOUND).body(problem);
  }

  @ExceptionHandler(ThreadContextBuildException.class)
  public ResponseEntity<ProblemDetail> handleBuildFailure(ThreadContextBuildException ex) {
    ProblemDetail problem = ProblemDetail.forStatus(HttpStatus.SERVICE_UNAVAILABLE);
    problem.setTitle("Thread unavailable");
    problem.setDetail(ex.getMessage());
    problem.setProperty("retryable", true);
    problem.setProperty("failures", ex.getFailures());
    return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE).body(problem);
  }

  @ExceptionHandler({
    MethodArgumentNotValidException.class,
    BindException.class,
    HttpMessageNotReadableException.class,
    MethodArgumentTypeMismatchException.class
  })
  public ResponseEntity<ProblemDetail> handleValidationErrors(Exception ex) {
    ProblemDetail problem = ProblemDetail.forStatus(HttpStatus.BAD_REQUEST);
    problem.setTitle("Validation failed");
    problem.setDetail(resolveValidationMessage(ex));
    return ResponseEntity.badRequest().body(problem);
  }

  private String resolveValidationMessage(Exception ex) {
    if (ex instanceof BindException bindException) {
      return bindException
          .getBindingResult()
          .getFieldErrors()
          .stream()
          .findFirst()
          .map(error -> error.getDefaultMessage() != null ? error.getDefaultMessage() : "Invalid request payload")
          .orElse("Invalid request payload");
    }
    if (ex instanceof MethodArgumentTypeMismatchException mismatch) {
      return "Invalid value for parameter '" + mismatch.getName() + "'";
    }
    return "Invalid request payload";
  }
}
