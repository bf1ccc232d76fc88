package com.altivion.api.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import java.time.Instant;

/** Acknowledgement of {@code POST /node_heartbeat}. */
public record HeartbeatResponse(
    @JsonProperty("ok") boolean ok,
    @JsonProperty("node_id") String nodeId,
    @JsonProperty("last_seen") Instant lastSeen) {}
