package com.altivion.api.service;

import com.altivion.api.config.AltivionProperties;
import com.altivion.api.liveness.LivenessTracker;
import com.altivion.api.model.DashboardStatsResponse;
import com.altivion.api.store.SignalStore;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import org.springframework.stereotype.Service;

/**
 * Builds the KPI payload for the dashboard cards.
 *
 * <p>Sensor counts come from the store; node liveness comes from the in-memory
 * {@link LivenessTracker} using the configured liveness window.
 */
@Service
public class DashboardStatsService {
  static final String TODAY_UNIQUE_UASIDS_SQL =
      "SELECT COUNT(DISTINCT uasid) AS count FROM drone_signals "
          + "WHERE uasid IS NOT NULL AND ts >= date_trunc('day', now())";

  static final String ONLINE_DRONES_SQL =
      "SELECT COUNT(DISTINCT sn) AS count FROM drone_signals "
          + "WHERE ts > now() - (? * INTERVAL '1 minute')";

  private final SignalStore store;
  private final LivenessTracker livenessTracker;
  private final AltivionProperties properties;
  private final Clock clock;
  private final Instant startedAt;

  public DashboardStatsService(
      SignalStore store,
      LivenessTracker livenessTracker,
      AltivionProperties properties,
      Clock clock) {
    this.store = store;
    this.livenessTracker = livenessTracker;
    this.properties = properties;
    this.clock = clock;
    this.startedAt = clock.instant();
  }

  /**
   * Computes the dashboard KPIs.
   *
   * @param minutesOnlineWindow window in which a sensor counts as online
   * @return KPI payload
   */
  public DashboardStatsResponse stats(int minutesOnlineWindow) {
    Instant now = clock.instant();
    long todayUnique = count(store.query(TODAY_UNIQUE_UASIDS_SQL));
    long onlineDrones = count(store.query(ONLINE_DRONES_SQL, minutesOnlineWindow));
    Duration livenessWindow = Duration.ofSeconds(properties.getNodes().getOnlineWindowSeconds());

    return new DashboardStatsResponse(
        Duration.between(startedAt, now).getSeconds(),
        todayUnique,
        onlineDrones,
        livenessTracker.activeCount(livenessWindow, now),
        properties.getNodes().getTotal(),
        now.toString());
  }

  private static long count(List<Map<String, Object>> rows) {
    if (rows.isEmpty()) {
      return 0L;
    }
    Object value = rows.get(0).get("count");
    return value instanceof Number number ? number.longValue() : 0L;
  }
}
