package com.scholary.video.summarizer.store;

/**
 * Exception thrown when a result cannot be stored.
 *
 * <p>Not fatal to a run: the caller already holds a valid summary, so completion is still reported
 * with a warning.
 */
public class PersistenceException extends RuntimeException {

  public PersistenceException(String message) {
    super(message);
  }

  public PersistenceException(String message, Throwable cause) {
    super(message, cause);
  }
}
