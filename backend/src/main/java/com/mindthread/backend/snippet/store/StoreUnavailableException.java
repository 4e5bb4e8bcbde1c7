package com.mindthread.backend.snippet.store;

/** The store cannot serve any query, e.g. no connection could be obtained. */
public class StoreUnavailableException extends GraphStoreException {

  public StoreUnavailableException(String message, Throwable cause) {
    super(message, cause);
  }
}
