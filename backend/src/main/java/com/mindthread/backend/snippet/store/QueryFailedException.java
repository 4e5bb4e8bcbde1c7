package com.mindthread.backend.snippet.store;

/** A single query failed while the store itself stayed reachable. */
public class QueryFailedException extends GraphStoreException {

  public QueryFailedException(String message) {
    super(message);
  }

  public QueryFailedException(String message, Throwable cause) {
    super(message, cause);
  }
}
