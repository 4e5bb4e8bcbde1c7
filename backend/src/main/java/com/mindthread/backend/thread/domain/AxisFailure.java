package com.mindthread.backend.thread.domain;

public record AxisFailure(RelationAxis axis, Reason reason, String message) {

  public enum Reason {
    QUERY_FAILED,
    TIMED_OUT,
    STORE_UNAVAILABLE
  }
}
