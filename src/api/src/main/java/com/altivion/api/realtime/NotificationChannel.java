package com.altivion.api.realtime;

import java.sql.SQLException;

/** Source of fresh subscriptions to the store's publish/subscribe facility. */
@FunctionalInterface
public interface NotificationChannel {
  /**
   * Opens a new, dedicated connection to the notification facility.
   *
   * @return an unsubscribed session owned by the caller
   * @throws SQLException when the connection cannot be established
   */
  NotificationSession open() throws SQLException;
}
