package com.altivion.api.liveness;

import com.altivion.api.api.BadRequestException;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import org.springframework.stereotype.Component;

/**
 * In-memory record of the last heartbeat of each sensor node.
 *
 * <p>State is process-scoped and lost on restart. Entries are never evicted; stale nodes only
 * drop out of {@link #activeCount} through the time-window check. Node ids are not validated
 * against the configured fleet.
 */
@Component
public class LivenessTracker {
  private final Map<String, Instant> lastSeenByNode = new ConcurrentHashMap<>();
  private final Clock clock;

  public LivenessTracker(Clock clock) {
    this.clock = clock;
  }

  /**
   * Records a heartbeat at the current clock instant, replacing any previous one.
   *
   * @param nodeId caller-supplied node identifier
   * @return the recorded last-seen instant
   */
  public Instant heartbeat(String nodeId) {
    if (nodeId == null || nodeId.isBlank()) {
      throw new BadRequestException("Missing node_id");
    }
    Instant now = clock.instant();
    lastSeenByNode.put(nodeId, now);
    return now;
  }

  /**
   * Counts nodes whose last heartbeat is at or after {@code now - window}.
   *
   * @param window trailing liveness window
   * @param now reference instant
   * @return number of nodes considered online
   */
  public int activeCount(Duration window, Instant now) {
    Instant cutoff = now.minus(window);
    int active = 0;
    for (Instant lastSeen : lastSeenByNode.values()) {
      if (!lastSeen.isBefore(cutoff)) {
        active++;
      }
    }
    return active;
  }
}
