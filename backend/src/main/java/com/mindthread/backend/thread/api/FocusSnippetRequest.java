package com.mindthread.backend.thread.api;

import com.mindthread.backend.snippet.domain.Snippet;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.PositiveOrZero;
import jakarta.validation.constraints.Size;

public record FocusSnippetRequest(
    @NotNull(message = "id is required") Long id,
    @NotNull(message = "timestamp is required") @PositiveOrZero Long timestamp,
    @Size(max = 4000) String content,
    @NotBlank(message = "type must not be blank") @Size(max = 32) String type,
    @Size(max = 128) String clusterLabel) {

  public Snippet toSnippet() {
    return new Snippet(id, timestamp, content, type.trim(), clusterLabel);
  }
}
