package com.altivion.api.store;

import com.altivion.api.config.AltivionProperties;
import com.altivion.api.model.BroadcastMessage;
import com.altivion.api.model.Signal;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.util.List;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.ResultSetExtractor;
import org.springframework.stereotype.Component;

/**
 * Publishes the last row of each committed batch on the PostgreSQL notification channel.
 *
 * <p>Only the tail row is announced; the direct broadcast in the ingestion path covers every
 * row.
 */
@Component
public class PgNotifyCommitHook implements SignalCommitHook {
  private static final String NOTIFY_SQL = "SELECT pg_notify(?, ?)";

  private final JdbcTemplate jdbcTemplate;
  private final ObjectMapper objectMapper;
  private final AltivionProperties properties;

  public PgNotifyCommitHook(
      JdbcTemplate jdbcTemplate,
      ObjectMapper objectMapper,
      AltivionProperties properties) {
    this.jdbcTemplate = jdbcTemplate;
    this.objectMapper = objectMapper;
    this.properties = properties;
  }

  @Override
  public void afterCommit(List<Signal> batch) {
    if (batch.isEmpty()) {
      return;
    }
    Signal last = batch.get(batch.size() - 1);
    String payload;
    try {
      payload = objectMapper.writeValueAsString(BroadcastMessage.from(last));
    } catch (JsonProcessingException ex) {
      throw new IllegalStateException("failed to serialize notification payload", ex);
    }
    jdbcTemplate.query(
        NOTIFY_SQL,
        (ResultSetExtractor<Void>) rs -> null,
        properties.getListener().getChannel(),
        payload);
  }
}
