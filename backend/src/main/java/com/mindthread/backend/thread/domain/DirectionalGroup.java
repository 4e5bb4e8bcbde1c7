package com.mindthread.backend.thread.domain;

import com.mindthread.backend.snippet.domain.Snippet;
import java.util.List;

/**
 * Upstream or downstream spoke. {@code relation} is {@code null} only when the axis failed to
 * resolve.
 */
public record DirectionalGroup(List<Snippet> nodes, RelationKind relation) {

  public DirectionalGroup {
    nodes = nodes != null ? List.copyOf(nodes) : List.of();
  }

  public static DirectionalGroup unresolved() {
    return new DirectionalGroup(List.of(), null);
  }
}
