package com.altivion.api.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import java.time.Instant;

/**
 * Most recent positioned report of one sensor, used by the map markers.
 *
 * @param sn sensor serial number
 * @param ts report time
 * @param lat latitude
 * @param lon longitude
 * @param heightM altitude when reported
 * @param speedHMps horizontal speed when reported
 * @param directionDeg heading when reported
 */
public record LatestPosition(
    @JsonProperty("sn") String sn,
    @JsonProperty("ts") Instant ts,
    @JsonProperty("lat") Double lat,
    @JsonProperty("lon") Double lon,
    @JsonProperty("height_m") Double heightM,
    @JsonProperty("speed_h_mps") Double speedHMps,
    @JsonProperty("direction_deg") Integer directionDeg) {}
