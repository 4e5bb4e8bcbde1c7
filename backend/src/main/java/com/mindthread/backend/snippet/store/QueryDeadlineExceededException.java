package com.mindthread.backend.snippet.store;

public class QueryDeadlineExceededException extends GraphStoreException {

  public QueryDeadlineExceededException(String message) {
    super(message);
  }

  public QueryDeadlineExceededException(String message, Throwable cause) {
    super(message, cause);
  }
}
