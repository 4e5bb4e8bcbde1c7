package com.mindthread.backend.thread.domain;

import com.mindthread.backend.snippet.domain.Snippet;
import java.util.List;

/** Lateral spoke with a coarse similarity score in {@code [0, 1]}. */
public record LateralGroup(List<Snippet> nodes, double similarity) {

  public static final double SAME_CLUSTER = 0.7d;
  public static final double SAME_TYPE = 0.4d;
  public static final double NONE = 0.0d;

  public LateralGroup {
    nodes = nodes != null ? List.copyOf(nodes) : List.of();
    if (similarity < 0.0d || similarity > 1.0d) {
      throw new IllegalArgumentException("Similarity out of range: " + similarity);
    }
  }

  public static LateralGroup unresolved() {
    return new LateralGroup(List.of(), NONE);
  }
}
