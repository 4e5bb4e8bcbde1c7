package com.mindthread.backend.thread.service;

import com.mindthread.backend.thread.domain.AxisFailure;
import java.util.List;

/** A thread context could not be built. Carries every axis that failed before the build aborted. */
public class ThreadContextBuildException extends RuntimeException {

  private final List<AxisFailure> failures;

  public ThreadContextBuildException(String message, List<AxisFailure> failures, Throwable cause) {
    super(message, cause);
    this.failures = failures != null ? List.copyOf(failures) : List.of();
  }

  public List<AxisFailure> getFailures() {
    return failures;
  }
}
