package com.mindthread.backend.thread.domain;

import java.time.Instant;
import java.util.List;

public record ThreadMeta(
    Instant loadedAt,
    boolean hasMoreUpstream,
    boolean hasMoreDownstream,
    boolean hasMoreLateral,
    List<AxisFailure> failures) {

  public ThreadMeta {
    failures = failures != null ? List.copyOf(failures) : List.of();
  }
}
