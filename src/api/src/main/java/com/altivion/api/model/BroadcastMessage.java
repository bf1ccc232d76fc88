package com.altivion.api.model;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Reduced projection of a {@link Signal} pushed to WebSocket viewers.
 *
 * <p>The same JSON shape is published on the PostgreSQL notification channel, so the listener
 * path relays it verbatim.
 */
public record BroadcastMessage(
    @JsonProperty("sn") String sn,
    @JsonProperty("ts") String ts,
    @JsonProperty("lat") Double lat,
    @JsonProperty("lon") Double lon,
    @JsonProperty("height_m") Double heightM,
    @JsonProperty("speed_h_mps") Double speedHMps,
    @JsonProperty("direction_deg") Integer directionDeg) {

  /**
   * Projects a stored signal to its wire form.
   *
   * @param signal signal with a resolved timestamp
   * @return broadcast payload
   */
  public static BroadcastMessage from(Signal signal) {
    return new BroadcastMessage(
        signal.sn(),
        signal.ts() == null ? null : signal.ts().toString(),
        signal.lat(),
        signal.lon(),
        signal.heightM(),
        signal.speedHMps(),
        signal.directionDeg());
  }
}
