package com.gpstracker.tracker.stream;

import java.io.IOException;

/**
 * Transport-side endpoint of one live viewer connection.
 *
 * <p>Owned by the transport layer; the broadcaster only references it while the viewer is
 * subscribed. Implementations must tolerate {@link #ping()} being called concurrently with
 * {@link #send(String)}.
 */
public interface SubscriberSink {
  /** Stable identifier used in log lines. */
  String id();

  void send(String payload) throws IOException;

  /** Sends a liveness ping; the answer is reported through {@link PositionBroadcaster#markAlive}. */
  void ping() throws IOException;

  boolean isOpen();

  void close() throws IOException;
}
