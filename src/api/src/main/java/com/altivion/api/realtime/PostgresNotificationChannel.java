package com.altivion.api.realtime;

import com.altivion.api.config.AltivionProperties;
import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.SQLException;
import java.sql.Statement;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Properties;
import java.util.regex.Pattern;
import org.postgresql.PGConnection;
import org.postgresql.PGNotification;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.jdbc.DataSourceProperties;
import org.springframework.stereotype.Component;

/**
 * PostgreSQL {@code LISTEN/NOTIFY} implementation of {@link NotificationChannel}.
 *
 * <p>Each {@link #open()} creates a dedicated JDBC connection outside the Hikari pool, so a
 * long-lived subscription never holds a pooled connection and a failed one is simply dropped.
 * An idle subscription is validated periodically: a half-open socket keeps returning empty
 * polls and would otherwise never surface as a failure.
 */
@Component
public class PostgresNotificationChannel implements NotificationChannel {
  private static final Pattern CHANNEL_NAME = Pattern.compile("^[A-Za-z_][A-Za-z0-9_]{0,62}$");

  private final DataSourceProperties dataSourceProperties;
  private final AltivionProperties properties;

  public PostgresNotificationChannel(
      DataSourceProperties dataSourceProperties, AltivionProperties properties) {
    this.dataSourceProperties = dataSourceProperties;
    this.properties = properties;
  }

  @Override
  public NotificationSession open() throws SQLException {
    Connection connection = DriverManager.getConnection(
        dataSourceProperties.determineUrl(), connectionProperties(dataSourceProperties));
    try {
      connection.setAutoCommit(true);
      AltivionProperties.Listener settings = properties.getListener();
      return new PgSession(
          connection,
          connection.unwrap(PGConnection.class),
          settings.getValidationInterval(),
          settings.getValidationTimeout());
    } catch (SQLException ex) {
      connection.close();
      throw ex;
    }
  }

  static Properties connectionProperties(DataSourceProperties dataSourceProperties) {
    Properties connectionProperties = new Properties();
    String username = dataSourceProperties.determineUsername();
    String password = dataSourceProperties.determinePassword();
    if (username != null) {
      connectionProperties.setProperty("user", username);
    }
    if (password != null) {
      connectionProperties.setProperty("password", password);
    }
    connectionProperties.setProperty("tcpKeepAlive", "true");
    connectionProperties.setProperty("ApplicationName", "altivion-signal-listener");
    return connectionProperties;
  }

  static final class PgSession implements NotificationSession {
    private static final Logger log = LoggerFactory.getLogger(PgSession.class);

    private final Connection connection;
    private final PGConnection pgConnection;
    private final long validationIntervalNanos;
    private final int validationTimeoutSeconds;
    private long lastActivityNanos = System.nanoTime();

    PgSession(
        Connection connection,
        PGConnection pgConnection,
        Duration validationInterval,
        Duration validationTimeout) {
      this.connection = connection;
      this.pgConnection = pgConnection;
      this.validationIntervalNanos = validationInterval.toNanos();
      this.validationTimeoutSeconds = (int) Math.max(1L, validationTimeout.toSeconds());
    }

    @Override
    public void listen(String channel) throws SQLException {
      // LISTEN takes an identifier, not a bind parameter.
      if (channel == null || !CHANNEL_NAME.matcher(channel).matches()) {
        throw new IllegalArgumentException("invalid notification channel name: " + channel);
      }
      try (Statement statement = connection.createStatement()) {
        statement.execute("LISTEN " + channel);
      }
      lastActivityNanos = System.nanoTime();
    }

    @Override
    public List<String> poll(Duration timeout) throws SQLException {
      int timeoutMs = (int) Math.max(1L, Math.min(Integer.MAX_VALUE, timeout.toMillis()));
      PGNotification[] notifications = pgConnection.getNotifications(timeoutMs);
      if (notifications == null || notifications.length == 0) {
        validateIfIdle();
        return List.of();
      }
      lastActivityNanos = System.nanoTime();
      List<String> payloads = new ArrayList<>(notifications.length);
      for (PGNotification notification : notifications) {
        payloads.add(notification.getParameter());
      }
      return payloads;
    }

    private void validateIfIdle() throws SQLException {
      long now = System.nanoTime();
      if (now - lastActivityNanos < validationIntervalNanos) {
        return;
      }
      if (!connection.isValid(validationTimeoutSeconds)) {
        throw new SQLException("notification connection failed validation after idle period");
      }
      lastActivityNanos = now;
    }

    @Override
    public void close() {
      try {
        connection.close();
      } catch (SQLException ex) {
        log.debug("Closing notification connection failed", ex);
      }
    }
  }
}
