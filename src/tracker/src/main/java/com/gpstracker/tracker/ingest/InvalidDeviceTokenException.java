package com.gpstracker.tracker.ingest;

/**
 * Raised when a submission does not carry the shared device token.
 *
 * <p>Mapped to HTTP 401 by the API exception handler.
 */
public class InvalidDeviceTokenException extends RuntimeException {
  public InvalidDeviceTokenException() {
    super("Invalid device token");
  }
}
