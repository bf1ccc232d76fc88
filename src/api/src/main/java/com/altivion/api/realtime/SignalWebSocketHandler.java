package com.altivion.api.realtime;

import com.altivion.api.config.AltivionProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import org.springframework.web.socket.CloseStatus;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketSession;
import org.springframework.web.socket.handler.ConcurrentWebSocketSessionDecorator;
import org.springframework.web.socket.handler.TextWebSocketHandler;

/**
 * WebSocket endpoint for live signal viewers.
 *
 * <p>The channel is push-only: client frames are read as keepalives and ignored. Each session is
 * registered behind a {@link ConcurrentWebSocketSessionDecorator} so a stalled viewer exceeds
 * its own send limits instead of holding up the broadcast sweep.
 */
@Component
public class SignalWebSocketHandler extends TextWebSocketHandler {
  private static final Logger log = LoggerFactory.getLogger(SignalWebSocketHandler.class);

  private final SubscriberRegistry registry;
  private final AltivionProperties properties;

  public SignalWebSocketHandler(SubscriberRegistry registry, AltivionProperties properties) {
    this.registry = registry;
    this.properties = properties;
  }

  @Override
  public void afterConnectionEstablished(WebSocketSession session) {
    AltivionProperties.WebSocket settings = properties.getWebSocket();
    registry.connect(new ConcurrentWebSocketSessionDecorator(
        session, settings.getSendTimeLimitMs(), settings.getBufferSizeLimitBytes()));
    log.info("WebSocket viewer connected: {} (active={})", session.getId(), registry.size());
  }

  @Override
  protected void handleTextMessage(WebSocketSession session, TextMessage message) {
    // keepalive only
  }

  @Override
  public void handleTransportError(WebSocketSession session, Throwable exception) {
    registry.disconnect(session);
    log.debug("WebSocket transport error for {}", session.getId(), exception);
  }

  @Override
  public void afterConnectionClosed(WebSocketSession session, CloseStatus status) {
    registry.disconnect(session);
    log.info("WebSocket viewer disconnected: {} ({}, active={})", session.getId(), status, registry.size());
  }
}
