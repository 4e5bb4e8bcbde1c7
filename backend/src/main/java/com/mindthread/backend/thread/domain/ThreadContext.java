package com.mindthread.backend.thread.domain;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.mindthread.backend.snippet.domain.Snippet;
import java.util.Objects;

/**
 * Hub-and-spoke view around a focus snippet: what led to it, what followed from it and what
 * resembles it. Built fresh per request and never mutated.
 */
public record ThreadContext(
    Snippet focus,
    DirectionalGroup upstream,
    DirectionalGroup downstream,
    LateralGroup lateral,
    ThreadMeta meta) {

  public ThreadContext {
    Objects.requireNonNull(focus, "focus");
    Objects.requireNonNull(upstream, "upstream");
    Objects.requireNonNull(downstream, "downstream");
    Objects.requireNonNull(lateral, "lateral");
    Objects.requireNonNull(meta, "meta");
  }

  @JsonIgnore
  public boolean isComplete() {
    return meta.failures().isEmpty();
  }
}
