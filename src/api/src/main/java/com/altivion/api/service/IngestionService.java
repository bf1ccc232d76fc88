package com.altivion.api.service;

import com.altivion.api.api.BadRequestException;
import com.altivion.api.model.BroadcastMessage;
import com.altivion.api.model.IngestResponse;
import com.altivion.api.model.Signal;
import com.altivion.api.realtime.SubscriberRegistry;
import com.altivion.api.store.SignalStore;
import com.altivion.api.store.StoreException;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import java.time.Clock;
import java.time.Instant;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Write-then-broadcast orchestration behind {@code POST /ingest}.
 *
 * <p>The batch is committed first; only after a successful commit is every row pushed to the
 * WebSocket viewers. A failed write broadcasts nothing.
 */
@Service
public class IngestionService {
  private static final Logger log = LoggerFactory.getLogger(IngestionService.class);

  private final SignalStore store;
  private final SubscriberRegistry registry;
  private final ObjectMapper objectMapper;
  private final Clock clock;
  private final Counter requestCounter;
  private final Counter rowCounter;
  private final Counter failureCounter;

  public IngestionService(
      SignalStore store,
      SubscriberRegistry registry,
      ObjectMapper objectMapper,
      Clock clock,
      MeterRegistry meterRegistry) {
    this.store = store;
    this.registry = registry;
    this.objectMapper = objectMapper;
    this.clock = clock;
    this.requestCounter = meterRegistry.counter("altivion.ingest.requests");
    this.rowCounter = meterRegistry.counter("altivion.ingest.rows");
    this.failureCounter = meterRegistry.counter("altivion.ingest.failures");
  }

  /**
   * Persists a batch of signals and fans each row out to live viewers.
   *
   * @param payload parsed signals in request order
   * @return inserted count, equal to the payload size
   */
  public IngestResponse ingest(List<Signal> payload) {
    if (payload == null || payload.isEmpty()) {
      throw new BadRequestException("Empty payload.");
    }
    requestCounter.increment();

    Instant now = clock.instant();
    List<Signal> rows = payload.stream()
        .map(signal -> signal.withDefaultTimestamp(now))
        .toList();

    try {
      store.insertBatch(rows);
    } catch (StoreException ex) {
      failureCounter.increment();
      throw ex;
    }
    rowCounter.increment(rows.size());

    int delivered = 0;
    for (Signal row : rows) {
      String message = toJson(BroadcastMessage.from(row));
      if (message != null) {
        delivered += registry.broadcast(message);
      }
    }
    log.debug("Ingested {} signal(s), {} deliveries", rows.size(), delivered);
    return new IngestResponse(rows.size());
  }

  private String toJson(BroadcastMessage message) {
    try {
      return objectMapper.writeValueAsString(message);
    } catch (JsonProcessingException ex) {
      log.warn("Failed to serialize broadcast for sn={}", message.sn(), ex);
      return null;
    }
  }
}
