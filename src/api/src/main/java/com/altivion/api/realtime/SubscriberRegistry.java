package com.altivion.api.realtime;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import org.springframework.web.socket.CloseStatus;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketSession;

/**
 * Live set of WebSocket viewers and the fan-out over it.
 *
 * <p>The lock guards membership only. A broadcast sends to a snapshot taken under the lock, so
 * a stalled peer never blocks membership changes or other broadcasts; per-session ordering and
 * send limits are left to the {@link org.springframework.web.socket.handler.ConcurrentWebSocketSessionDecorator}
 * each session is registered behind. Sessions that fail a send are removed after the sweep
 * that detected them.
 */
@Component
public class SubscriberRegistry {
  private static final Logger log = LoggerFactory.getLogger(SubscriberRegistry.class);

  private final Object lock = new Object();
  private final Map<String, WebSocketSession> sessions = new LinkedHashMap<>();
  private final Counter deliveredCounter;
  private final Counter droppedCounter;

  public SubscriberRegistry(MeterRegistry meterRegistry) {
    this.deliveredCounter = meterRegistry.counter("altivion.broadcast.delivered");
    this.droppedCounter = meterRegistry.counter("altivion.broadcast.dropped_subscribers");
    meterRegistry.gauge("altivion.subscribers.active", this, SubscriberRegistry::size);
  }

  /**
   * Adds a session whose handshake has completed.
   *
   * @param session open session, usually a concurrent decorator around the raw session
   */
  public void connect(WebSocketSession session) {
    synchronized (lock) {
      sessions.put(session.getId(), session);
    }
    log.debug("Subscriber {} connected", session.getId());
  }

  /**
   * Removes a session; removing an unknown session is a no-op.
   *
   * @param session session to remove
   */
  public void disconnect(WebSocketSession session) {
    WebSocketSession removed;
    synchronized (lock) {
      removed = sessions.remove(session.getId());
    }
    if (removed != null) {
      log.debug("Subscriber {} disconnected", session.getId());
    }
  }

  /**
   * Sends {@code payload} to every current subscriber.
   *
   * <p>Delivery failures are local to the failing subscriber and never raised to the caller.
   *
   * @param payload JSON text frame
   * @return number of successful deliveries
   */
  public int broadcast(String payload) {
    TextMessage message = new TextMessage(payload);
    List<WebSocketSession> members;
    synchronized (lock) {
      members = new ArrayList<>(sessions.values());
    }

    List<WebSocketSession> dead = new ArrayList<>();
    int delivered = 0;
    for (WebSocketSession session : members) {
      if (!session.isOpen()) {
        dead.add(session);
        continue;
      }
      try {
        session.sendMessage(message);
        delivered++;
      } catch (Exception ex) {
        dead.add(session);
        log.debug("Delivery to subscriber {} failed: {}", session.getId(), rootCauseSummary(ex));
      }
    }

    if (!dead.isEmpty()) {
      synchronized (lock) {
        for (WebSocketSession session : dead) {
          sessions.remove(session.getId(), session);
        }
      }
      for (WebSocketSession session : dead) {
        closeQuietly(session);
      }
    }
    deliveredCounter.increment(delivered);
    droppedCounter.increment(dead.size());
    return delivered;
  }

  /**
   * Returns the current membership size.
   *
   * @return number of registered subscribers
   */
  public int size() {
    synchronized (lock) {
      return sessions.size();
    }
  }

  private static void closeQuietly(WebSocketSession session) {
    if (!session.isOpen()) {
      return;
    }
    try {
      session.close(CloseStatus.SESSION_NOT_RELIABLE);
    } catch (Exception ex) {
      log.debug("Closing dead subscriber {} failed: {}", session.getId(), rootCauseSummary(ex));
    }
  }

  private static String rootCauseSummary(Throwable error) {
    Throwable current = error;
    while (current.getCause() != null && current.getCause() != current) {
      current = current.getCause();
    }
    String message = current.getMessage();
    if (message == null || message.isBlank()) {
      return current.getClass().getSimpleName();
    }
    return current.getClass().getSimpleName() + ": " + message;
  }
}
