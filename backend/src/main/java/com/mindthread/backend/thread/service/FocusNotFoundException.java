package com.mindthread.backend.thread.service;

public class FocusNotFoundException extends RuntimeException {

  private final long snippetId;

  public FocusNotFoundException(long snippetId) {
    super("Snippet " + snippetId + " not found");
    this.snippetId = snippetId;
  }

  public long getSnippetId() {
    return snippetId;
  }
}
