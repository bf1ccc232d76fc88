package com.altivion.api.realtime;

import com.altivion.api.config.AltivionProperties;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Relay from the store's notification channel to the WebSocket viewers.
 *
 * <p>This component:
 * <ul>
 *   <li>opens a fresh notification session and subscribes to the configured channel</li>
 *   <li>forwards every payload verbatim to {@link SubscriberRegistry#broadcast(String)}</li>
 *   <li>on any failure drops the session, waits a fixed delay and reconnects</li>
 * </ul>
 *
 * <p>The loop only ends when the process shuts down. At most one loop runs at a time: the
 * {@code running} flag is claimed before the loop is submitted and released when it exits.
 */
@Component
public class SignalNotificationListener {
  private static final Logger LOGGER = LoggerFactory.getLogger(SignalNotificationListener.class);

  /** Lifecycle of the relay loop. */
  public enum State {
    IDLE,
    CONNECTING,
    SUBSCRIBED,
    FAILED
  }

  private final NotificationChannel channel;
  private final SubscriberRegistry registry;
  private final AltivionProperties properties;
  private final ExecutorService executor;
  private final AtomicBoolean running = new AtomicBoolean(false);
  private final Counter relayedCounter;
  private final Counter failureCounter;
  private volatile State state = State.IDLE;

  public SignalNotificationListener(
      NotificationChannel channel,
      SubscriberRegistry registry,
      AltivionProperties properties,
      MeterRegistry meterRegistry) {
    this.channel = channel;
    this.registry = registry;
    this.properties = properties;
    this.executor = Executors.newSingleThreadExecutor(runnable -> {
      Thread thread = new Thread(runnable, "signal-listener");
      thread.setDaemon(true);
      return thread;
    });
    this.relayedCounter = meterRegistry.counter("altivion.listener.relayed");
    this.failureCounter = meterRegistry.counter("altivion.listener.failures");
  }

  /** Starts the relay after Spring context initialization when enabled. */
  @PostConstruct
  public void startIfEnabled() {
    if (!properties.getListener().isEnabled()) {
      LOGGER.info("Signal notification listener disabled");
      return;
    }
    start();
  }

  /**
   * Starts the relay loop unless one is already running.
   *
   * @return {@code true} when a new loop was submitted, {@code false} when one is active
   */
  public boolean start() {
    if (!running.compareAndSet(false, true)) {
      LOGGER.debug("Signal notification listener already running");
      return false;
    }
    try {
      executor.submit(this::runLoop);
    } catch (RejectedExecutionException ex) {
      running.set(false);
      throw ex;
    }
    return true;
  }

  /** Stops the relay loop and waits briefly for a clean shutdown. */
  @PreDestroy
  public void stop() {
    executor.shutdownNow();
    try {
      executor.awaitTermination(5, TimeUnit.SECONDS);
    } catch (InterruptedException ignored) {
      Thread.currentThread().interrupt();
    }
  }

  public State state() {
    return state;
  }

  public boolean isRunning() {
    return running.get();
  }

  private void runLoop() {
    AltivionProperties.Listener settings = properties.getListener();
    try {
      while (!Thread.currentThread().isInterrupted()) {
        state = State.CONNECTING;
        try (NotificationSession session = channel.open()) {
          session.listen(settings.getChannel());
          state = State.SUBSCRIBED;
          LOGGER.info("Listening for signal notifications on channel '{}'", settings.getChannel());
          consume(session, settings.getPollTimeout());
        } catch (Exception ex) {
          if (isInterruptedShutdown(ex)) {
            Thread.currentThread().interrupt();
            LOGGER.debug("Signal notification listener interrupted during shutdown");
            return;
          }
          state = State.FAILED;
          failureCounter.increment();
          LOGGER.warn(
              "Signal notification listener failed, reconnecting in {} ms",
              settings.getRetryDelay().toMillis(),
              ex);
          if (!pause(settings.getRetryDelay())) {
            return;
          }
        }
      }
    } finally {
      state = State.IDLE;
      running.set(false);
    }
  }

  private void consume(NotificationSession session, Duration pollTimeout) throws Exception {
    while (!Thread.currentThread().isInterrupted()) {
      List<String> payloads = session.poll(pollTimeout);
      for (String payload : payloads) {
        registry.broadcast(payload);
        relayedCounter.increment();
      }
    }
  }

  private static boolean pause(Duration delay) {
    try {
      Thread.sleep(Math.max(0L, delay.toMillis()));
      return true;
    } catch (InterruptedException ex) {
      Thread.currentThread().interrupt();
      return false;
    }
  }

  private static boolean isInterruptedShutdown(Throwable ex) {
    Throwable current = ex;
    while (current != null) {
      if (current instanceof InterruptedException) {
        return true;
      }
      current = current.getCause();
    }
    return Thread.currentThread().isInterrupted();
  }
}
