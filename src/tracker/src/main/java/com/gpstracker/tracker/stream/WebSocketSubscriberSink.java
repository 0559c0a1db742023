package com.gpstracker.tracker.stream;

import java.io.IOException;
import java.nio.ByteBuffer;
import org.springframework.web.socket.CloseStatus;
import org.springframework.web.socket.PingMessage;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketSession;
import org.springframework.web.socket.handler.ConcurrentWebSocketSessionDecorator;

/**
 * {@link SubscriberSink} backed by a Spring WebSocket session.
 *
 * <p>The session is wrapped in {@link ConcurrentWebSocketSessionDecorator} so pings from the
 * liveness check can overlap with update delivery; a send that exceeds the time or buffer limit
 * fails and the broadcaster drops the subscriber.
 */
final class WebSocketSubscriberSink implements SubscriberSink {
  private static final ByteBuffer EMPTY = ByteBuffer.allocate(0);

  private final WebSocketSession session;

  WebSocketSubscriberSink(WebSocketSession session, int sendTimeLimitMs, int bufferSizeLimit) {
    this.session = new ConcurrentWebSocketSessionDecorator(session, sendTimeLimitMs, bufferSizeLimit);
  }

  @Override
  public String id() {
    return session.getId();
  }

  @Override
  public void send(String payload) throws IOException {
    session.sendMessage(new TextMessage(payload));
  }

  @Override
  public void ping() throws IOException {
    session.sendMessage(new PingMessage(EMPTY.duplicate()));
  }

  @Override
  public boolean isOpen() {
    return session.isOpen();
  }

  @Override
  public void close() throws IOException {
    if (session.isOpen()) {
      session.close(CloseStatus.SESSION_NOT_RELIABLE);
    }
  }
}
