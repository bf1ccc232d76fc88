package com.altivion.api.realtime;

import java.sql.SQLException;
import java.time.Duration;
import java.util.List;

/** One live connection to the store's notification facility. */
public interface NotificationSession extends AutoCloseable {
  /**
   * Subscribes this session to a channel.
   *
   * @param channel channel name
   * @throws SQLException when the subscribe command fails
   */
  void listen(String channel) throws SQLException;

  /**
   * Waits up to {@code timeout} for notifications.
   *
   * @param timeout maximum wait
   * @return received payloads in arrival order, empty when none arrived
   * @throws SQLException when the connection is broken
   */
  List<String> poll(Duration timeout) throws SQLException;

  @Override
  void close();
}
