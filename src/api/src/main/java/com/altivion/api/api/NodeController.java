package com.altivion.api.api;

import com.altivion.api.config.AltivionProperties;
import com.altivion.api.liveness.LivenessTracker;
import com.altivion.api.model.DashboardStatsResponse;
import com.altivion.api.model.HeartbeatResponse;
import com.altivion.api.service.DashboardStatsService;
import com.altivion.api.service.QueryParser;
import java.time.Instant;
import java.util.Map;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

/**
 * Node heartbeat, dashboard KPI and health endpoints.
 */
@RestController
public class NodeController {
  private final LivenessTracker livenessTracker;
  private final DashboardStatsService dashboardStatsService;
  private final AltivionProperties properties;

  public NodeController(
      LivenessTracker livenessTracker,
      DashboardStatsService dashboardStatsService,
      AltivionProperties properties) {
    this.livenessTracker = livenessTracker;
    this.dashboardStatsService = dashboardStatsService;
    this.properties = properties;
  }

  @GetMapping("/health")
  public Map<String, String> health() {
    return Map.of("status", "ok");
  }

  /**
   * Records a heartbeat from a sensor node.
   *
   * @param nodeId caller-supplied node identifier
   * @return acknowledgement with the recorded time
   */
  @PostMapping("/node_heartbeat")
  public HeartbeatResponse heartbeat(@RequestParam(value = "node_id", required = false) String nodeId) {
    Instant lastSeen = livenessTracker.heartbeat(nodeId);
    return new HeartbeatResponse(true, nodeId, lastSeen);
  }

  /**
   * Returns KPIs for the dashboard cards.
   *
   * @param minutesOnlineWindow optional window for the online sensor count (default 2)
   * @return KPI payload
   */
  @GetMapping("/data")
  public DashboardStatsResponse data(
      @RequestParam(value = "minutes_online_window", required = false) String minutesOnlineWindow) {
    int minutes = QueryParser.parseMinutes(
        "minutes_online_window", minutesOnlineWindow, 2, properties.getApi().getMaxWindowMinutes());
    return dashboardStatsService.stats(minutes);
  }
}
