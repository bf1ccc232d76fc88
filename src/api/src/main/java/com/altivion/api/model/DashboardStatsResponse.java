package com.altivion.api.model;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * KPI payload for the dashboard cards ({@code GET /data}).
 *
 * @param uptimeSeconds seconds since the process started
 * @param todayUniqueUasids distinct UAS identifiers seen since midnight (store time zone)
 * @param onlineDrones distinct sensors reporting within the requested window
 * @param nodesActive nodes whose heartbeat falls within the liveness window
 * @param nodesTotal configured fleet size
 * @param asOf ISO-8601 computation time
 */
public record DashboardStatsResponse(
    @JsonProperty("uptime_seconds") long uptimeSeconds,
    @JsonProperty("today_unique_uasids") long todayUniqueUasids,
    @JsonProperty("online_drones") long onlineDrones,
    @JsonProperty("nodes_active") int nodesActive,
    @JsonProperty("nodes_total") int nodesTotal,
    @JsonProperty("as_of") String asOf) {}
