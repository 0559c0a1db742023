package com.gpstracker.tracker.config;

import com.gpstracker.tracker.stream.PositionStreamHandler;
import java.util.List;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.socket.config.annotation.EnableWebSocket;
import org.springframework.web.socket.config.annotation.WebSocketConfigurer;
import org.springframework.web.socket.config.annotation.WebSocketHandlerRegistry;

/**
 * Registers the raw WebSocket endpoint that streams positions to viewers.
 *
 * <p>Origins follow the API CORS allowlist; with no allowlist any origin may connect.
 */
@Configuration
@EnableWebSocket
public class WebSocketConfig implements WebSocketConfigurer {
  private final PositionStreamHandler handler;
  private final TrackerProperties properties;

  public WebSocketConfig(PositionStreamHandler handler, TrackerProperties properties) {
    this.handler = handler;
    this.properties = properties;
  }

  @Override
  public void registerWebSocketHandlers(WebSocketHandlerRegistry registry) {
    List<String> allowedOrigins = properties.getApi().getCors().getAllowedOrigins().stream()
        .filter(origin -> origin != null && !origin.isBlank())
        .toList();
    if (allowedOrigins.isEmpty()) {
      registry.addHandler(handler, properties.getStream().getPath()).setAllowedOriginPatterns("*");
      return;
    }
    registry
        .addHandler(handler, properties.getStream().getPath())
        .setAllowedOrigins(allowedOrigins.toArray(String[]::new));
  }
}
