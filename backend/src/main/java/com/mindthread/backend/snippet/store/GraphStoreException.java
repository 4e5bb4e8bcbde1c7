package com.mindthread.backend.snippet.store;

/** Base type for failures raised by a {@link GraphStore} adapter. */
public class GraphStoreException extends RuntimeException {

  public GraphStoreException(String message) {
    super(message);
  }

  public GraphStoreException(String message, Throwable cause) {
    super(message, cause);
  }
}
