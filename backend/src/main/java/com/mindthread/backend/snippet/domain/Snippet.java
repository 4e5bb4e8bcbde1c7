package com.mindthread.backend.snippet.domain;

import com.fasterxml.jackson.annotation.JsonIgnore;
import java.util.Objects;
import org.springframework.util.StringUtils;

/**
 * Captured thought. The timestamp (epoch millis) is the only ordering key; the cluster label is an
 * opaque tag assigned by an external classifier and may be absent.
 */
public record Snippet(long id, long timestamp, String content, String type, String clusterLabel) {

  public static final String NOTE_TYPE = "note";
  public static final String GOAL_TYPE = "goal";

  public Snippet {
    Objects.requireNonNull(type, "type");
    content = content != null ? content : "";
  }

  public static Snippet of(long id, long timestamp, String type) {
    return new Snippet(id, timestamp, "", type, null);
  }

  @JsonIgnore
  public boolean hasClusterLabel() {
    return StringUtils.hasText(clusterLabel);
  }

  public Snippet withClusterLabel(String label) {
    return new Snippet(id, timestamp, content, type, label);
  }
}
