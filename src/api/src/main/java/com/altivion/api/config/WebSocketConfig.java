package com.altivion.api.config;

import com.altivion.api.realtime.SignalWebSocketHandler;
import java.util.List;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.socket.config.annotation.EnableWebSocket;
import org.springframework.web.socket.config.annotation.WebSocketConfigurer;
import org.springframework.web.socket.config.annotation.WebSocketHandlerRegistry;

/**
 * Registers the real-time signal channel.
 *
 * <p>The handshake accepts the same origins as the REST CORS allowlist; with no allowlist any
 * origin may connect.
 */
@Configuration
@EnableWebSocket
public class WebSocketConfig implements WebSocketConfigurer {
  private final SignalWebSocketHandler handler;
  private final AltivionProperties properties;

  public WebSocketConfig(SignalWebSocketHandler handler, AltivionProperties properties) {
    this.handler = handler;
    this.properties = properties;
  }

  @Override
  public void registerWebSocketHandlers(WebSocketHandlerRegistry registry) {
    List<String> allowedOrigins = WebConfig.allowedOrigins(properties);
    if (allowedOrigins.isEmpty()) {
      registry.addHandler(handler, properties.getWebSocket().getPath()).setAllowedOriginPatterns("*");
      return;
    }
    registry
        .addHandler(handler, properties.getWebSocket().getPath())
        .setAllowedOrigins(allowedOrigins.toArray(String[]::new));
  }
}
