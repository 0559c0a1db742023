package com.gpstracker.tracker.ingest;

/**
 * Raised when an inbound payload cannot be turned into a position record.
 *
 * <p>Mapped to HTTP 400 by the API exception handler; dropped with a log line on MQTT.
 */
public class ValidationException extends RuntimeException {
  /**
   * Creates a validation exception with a client-facing message.
   *
   * @param message validation error description
   */
  public ValidationException(String message) {
    super(message);
  }
}
