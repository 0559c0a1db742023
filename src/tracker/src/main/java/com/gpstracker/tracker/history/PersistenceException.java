package com.gpstracker.tracker.history;

/**
 * Raised when the history store cannot be reached or a statement fails.
 *
 * <p>Swallowed on the write path; surfaced as HTTP 500 on history reads.
 */
public class PersistenceException extends RuntimeException {
  public PersistenceException(String message, Throwable cause) {
    super(message, cause);
  }
}
