package com.altivion.api.realtime;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.doAnswer;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.lenient;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.io.IOException;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.web.socket.CloseStatus;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketMessage;
import org.springframework.web.socket.WebSocketSession;
import org.springframework.web.socket.handler.ConcurrentWebSocketSessionDecorator;

@ExtendWith(MockitoExtension.class)
class SubscriberRegistryTest {

  @Mock private WebSocketSession first;
  @Mock private WebSocketSession second;
  @Mock private WebSocketSession broken;

  private SimpleMeterRegistry meterRegistry;
  private SubscriberRegistry registry;

  @BeforeEach
  void setUp() {
    meterRegistry = new SimpleMeterRegistry();
    registry = new SubscriberRegistry(meterRegistry);
    lenient().when(first.getId()).thenReturn("s1");
    lenient().when(second.getId()).thenReturn("s2");
    lenient().when(broken.getId()).thenReturn("s3");
    lenient().when(first.isOpen()).thenReturn(true);
    lenient().when(second.isOpen()).thenReturn(true);
  }

  @Test
  void broadcast_deliversSamePayloadToEverySubscriber() throws Exception {
    registry.connect(first);
    registry.connect(second);

    int delivered = registry.broadcast("{\"sn\":\"D1\"}");

    assertEquals(2, delivered);
    ArgumentCaptor<TextMessage> captor = ArgumentCaptor.forClass(TextMessage.class);
    verify(first).sendMessage(captor.capture());
    assertEquals("{\"sn\":\"D1\"}", captor.getValue().getPayload());
    verify(second).sendMessage(any(TextMessage.class));
    assertEquals(2.0, meterRegistry.get("altivion.subscribers.active").gauge().value());
  }

  @Test
  void broadcast_dropsFailingSubscriberAndKeepsOthers() throws Exception {
    when(broken.isOpen()).thenReturn(true, false);
    doThrow(new IOException("Broken pipe")).when(broken).sendMessage(any(WebSocketMessage.class));
    registry.connect(first);
    registry.connect(broken);
    registry.connect(second);

    int delivered = registry.broadcast("a");

    assertEquals(2, delivered);
    assertEquals(2, registry.size());
    assertEquals(1.0, meterRegistry.get("altivion.broadcast.dropped_subscribers").counter().count());

    registry.broadcast("b");
    verify(broken, times(1)).sendMessage(any(WebSocketMessage.class));
    verify(first, times(2)).sendMessage(any(WebSocketMessage.class));
  }

  @Test
  void broadcast_closesFailedSessionThatIsStillOpen() throws Exception {
    when(broken.isOpen()).thenReturn(true);
    doThrow(new IllegalStateException("buffer limit exceeded"))
        .when(broken).sendMessage(any(WebSocketMessage.class));
    registry.connect(broken);

    assertEquals(0, registry.broadcast("a"));

    verify(broken).close(CloseStatus.SESSION_NOT_RELIABLE);
    assertEquals(0, registry.size());
  }

  @Test
  void broadcast_skipsAndRemovesSessionsAlreadyClosed() throws Exception {
    when(broken.isOpen()).thenReturn(false);
    registry.connect(first);
    registry.connect(broken);

    assertEquals(1, registry.broadcast("a"));

    verify(broken, never()).sendMessage(any(WebSocketMessage.class));
    assertEquals(1, registry.size());
  }

  @Test
  void broadcast_withNoSubscribersDeliversNothing() {
    assertEquals(0, registry.broadcast("a"));
  }

  @Test
  void broadcast_stalledPeerHitsSendLimitWithoutBlockingOtherBroadcasts() throws Exception {
    CountDownLatch sendStarted = new CountDownLatch(1);
    when(broken.isOpen()).thenReturn(true);
    doAnswer(invocation -> {
      sendStarted.countDown();
      Thread.sleep(3_000);
      return null;
    }).when(broken).sendMessage(any(WebSocketMessage.class));
    registry.connect(new ConcurrentWebSocketSessionDecorator(broken, 100, 1024));
    registry.connect(first);

    ExecutorService stalledSender = Executors.newSingleThreadExecutor();
    try {
      Future<Integer> stalled = stalledSender.submit(() -> registry.broadcast("a"));
      assertTrue(sendStarted.await(2, TimeUnit.SECONDS));
      Thread.sleep(200);

      long startedAt = System.nanoTime();
      int delivered = registry.broadcast("b");
      long waitedMs = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - startedAt);

      assertTrue(waitedMs < 1_000, "second broadcast waited " + waitedMs + " ms");
      assertEquals(1, delivered);
      assertEquals(1, registry.size());
      verify(first).sendMessage(new TextMessage("b"));
      stalled.get(5, TimeUnit.SECONDS);
    } finally {
      stalledSender.shutdownNow();
    }
  }

  @Test
  void disconnect_isIdempotent() {
    registry.connect(first);

    registry.disconnect(first);
    registry.disconnect(first);
    registry.disconnect(second);

    assertEquals(0, registry.size());
  }
}
