package com.gpstracker.tracker.stream;

import com.gpstracker.tracker.config.TrackerProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import org.springframework.web.socket.CloseStatus;
import org.springframework.web.socket.PongMessage;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketSession;
import org.springframework.web.socket.handler.TextWebSocketHandler;

/**
 * WebSocket endpoint for live map viewers.
 *
 * <p>Each connection becomes one broadcaster subscription for its whole lifetime. Viewers only
 * listen; text frames they send are ignored.
 */
@Component
public class PositionStreamHandler extends TextWebSocketHandler {
  static final String SUBSCRIPTION_ATTRIBUTE = "tracker.subscription";

  private static final Logger log = LoggerFactory.getLogger(PositionStreamHandler.class);

  private final PositionBroadcaster broadcaster;
  private final TrackerProperties.Stream settings;

  public PositionStreamHandler(PositionBroadcaster broadcaster, TrackerProperties properties) {
    this.broadcaster = broadcaster;
    this.settings = properties.getStream();
  }

  @Override
  public void afterConnectionEstablished(WebSocketSession session) {
    SubscriberSink sink = new WebSocketSubscriberSink(
        session, settings.getSendTimeLimitMs(), settings.getSendBufferSizeLimit());
    Subscription subscription = broadcaster.subscribe(sink);
    session.getAttributes().put(SUBSCRIPTION_ATTRIBUTE, subscription);
    log.info("WebSocket client connected from {}", session.getRemoteAddress());
  }

  @Override
  protected void handleTextMessage(WebSocketSession session, TextMessage message) {
    log.trace("Ignoring inbound message on session {}", session.getId());
  }

  @Override
  protected void handlePongMessage(WebSocketSession session, PongMessage message) {
    broadcaster.markAlive(subscription(session));
  }

  @Override
  public void handleTransportError(WebSocketSession session, Throwable exception) {
    log.debug("WebSocket transport error on session {}: {}", session.getId(), exception.getMessage());
    broadcaster.unsubscribe(subscription(session));
  }

  @Override
  public void afterConnectionClosed(WebSocketSession session, CloseStatus status) {
    broadcaster.unsubscribe(subscription(session));
    log.info("WebSocket client disconnected ({})", status.getCode());
  }

  private static Subscription subscription(WebSocketSession session) {
    Object value = session.getAttributes().get(SUBSCRIPTION_ATTRIBUTE);
    return value instanceof Subscription subscription ? subscription : null;
  }
}
