package com.altivion.api.service;

import com.altivion.api.model.Bbox;
import com.altivion.api.model.LatestPosition;
import com.altivion.api.model.SensorTrack;
import com.altivion.api.model.TrackPoint;
import com.altivion.api.store.SignalStore;
import java.sql.Timestamp;
import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.springframework.stereotype.Service;

/**
 * Read-only projections over {@code drone_signals} used by the map.
 *
 * <p>Only rows with a position fix (latitude and longitude present) are returned. Time windows
 * are evaluated against the database clock.
 */
@Service
public class SignalQueryService {
  static final String LATEST_SQL =
      "SELECT DISTINCT ON (sn) sn, ts, lat, lon, height_m, speed_h_mps, direction_deg "
          + "FROM drone_signals "
          + "WHERE ts > now() - (? * INTERVAL '1 minute') "
          + "AND lat IS NOT NULL AND lon IS NOT NULL "
          + "ORDER BY sn, ts DESC";

  static final String LATEST_IN_VIEW_SQL =
      "WITH latest AS (" + LATEST_SQL + ") "
          + "SELECT * FROM latest "
          + "WHERE lat BETWEEN ? AND ? AND lon BETWEEN ? AND ?";

  static final String TRACKS_SQL =
      "SELECT sn, ts, lat, lon FROM drone_signals "
          + "WHERE ts > now() - (? * INTERVAL '1 minute') "
          + "AND lat IS NOT NULL AND lon IS NOT NULL "
          + "ORDER BY sn, ts ASC "
          + "LIMIT ?";

  static final String TRACKS_WINDOW_SQL =
      "SELECT sn, ts, lat, lon FROM drone_signals "
          + "WHERE ts BETWEEN ? AND ? "
          + "AND lat IS NOT NULL AND lon IS NOT NULL "
          + "ORDER BY sn, ts ASC "
          + "LIMIT ?";

  static final String TRACKS_WINDOW_BY_SN_SQL =
      "SELECT sn, ts, lat, lon FROM drone_signals "
          + "WHERE ts BETWEEN ? AND ? "
          + "AND lat IS NOT NULL AND lon IS NOT NULL "
          + "AND sn = ? "
          + "ORDER BY sn, ts ASC "
          + "LIMIT ?";

  private final SignalStore store;

  public SignalQueryService(SignalStore store) {
    this.store = store;
  }

  /**
   * Returns the most recent positioned report of every sensor seen in the window.
   *
   * @param minutes trailing window
   * @return one entry per sensor
   */
  public List<LatestPosition> latest(int minutes) {
    return store.query(LATEST_SQL, minutes).stream()
        .map(SignalQueryService::toLatestPosition)
        .toList();
  }

  /**
   * Same as {@link #latest(int)}, restricted to a map viewport.
   *
   * @param bbox normalized viewport
   * @param minutes trailing window
   * @return one entry per sensor whose latest position lies inside the viewport
   */
  public List<LatestPosition> latestInView(Bbox bbox, int minutes) {
    return store.query(
            LATEST_IN_VIEW_SQL,
            minutes,
            bbox.minLat(),
            bbox.maxLat(),
            bbox.minLon(),
            bbox.maxLon())
        .stream()
        .map(SignalQueryService::toLatestPosition)
        .toList();
  }

  /**
   * Returns recent positions grouped per sensor.
   *
   * @param minutes trailing window
   * @param maxPoints cap on the total number of points across all sensors
   * @return tracks in ascending time order
   */
  public List<SensorTrack> tracks(int minutes, int maxPoints) {
    return groupBySensor(store.query(TRACKS_SQL, minutes, maxPoints));
  }

  /**
   * Returns positions between two instants grouped per sensor, for replay.
   *
   * @param from inclusive lower bound
   * @param to inclusive upper bound
   * @param sn optional single-sensor filter
   * @param maxPoints cap on the total number of points across all sensors
   * @return tracks in ascending time order
   */
  public List<SensorTrack> tracksWindow(Instant from, Instant to, String sn, int maxPoints) {
    OffsetDateTime lower = OffsetDateTime.ofInstant(from, ZoneOffset.UTC);
    OffsetDateTime upper = OffsetDateTime.ofInstant(to, ZoneOffset.UTC);
    List<Map<String, Object>> rows = sn == null
        ? store.query(TRACKS_WINDOW_SQL, lower, upper, maxPoints)
        : store.query(TRACKS_WINDOW_BY_SN_SQL, lower, upper, sn, maxPoints);
    return groupBySensor(rows);
  }

  static List<SensorTrack> groupBySensor(List<Map<String, Object>> rows) {
    Map<String, List<TrackPoint>> grouped = new LinkedHashMap<>();
    for (Map<String, Object> row : rows) {
      grouped.computeIfAbsent((String) row.get("sn"), ignored -> new ArrayList<>())
          .add(new TrackPoint(toInstant(row.get("ts")), toDouble(row.get("lat")), toDouble(row.get("lon"))));
    }
    List<SensorTrack> tracks = new ArrayList<>(grouped.size());
    grouped.forEach((sn, points) -> tracks.add(new SensorTrack(sn, points)));
    return tracks;
  }

  private static LatestPosition toLatestPosition(Map<String, Object> row) {
    return new LatestPosition(
        (String) row.get("sn"),
        toInstant(row.get("ts")),
        toDouble(row.get("lat")),
        toDouble(row.get("lon")),
        toDouble(row.get("height_m")),
        toDouble(row.get("speed_h_mps")),
        toInteger(row.get("direction_deg")));
  }

  static Instant toInstant(Object value) {
    if (value == null) {
      return null;
    }
    if (value instanceof Instant instant) {
      return instant;
    }
    if (value instanceof Timestamp timestamp) {
      return timestamp.toInstant();
    }
    if (value instanceof OffsetDateTime offsetDateTime) {
      return offsetDateTime.toInstant();
    }
    throw new IllegalArgumentException("unsupported timestamp type: " + value.getClass().getName());
  }

  private static Double toDouble(Object value) {
    return value instanceof Number number ? number.doubleValue() : null;
  }

  private static Integer toInteger(Object value) {
    return value instanceof Number number ? number.intValue() : null;
  }
}
