package com.altivion.api.model;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import java.time.Instant;

/**
 * One sensor report about a tracked drone, as posted to {@code /ingest}.
 *
 * <p>Inbound names follow the sensor alias schema ({@code SN}, {@code Latitude}, ...); the
 * snake_case storage names are accepted as well. Unknown fields are ignored.
 *
 * @param ts report time, ISO-8601 (UTC when no offset) or epoch; {@code null} until defaulted at ingestion
 * @param sn sensor serial number
 * @param uasid optional UAS identifier
 * @param droneType optional drone type label
 * @param directionDeg optional heading in degrees
 * @param speedHMps optional horizontal speed
 * @param speedVMps optional vertical speed, may be negative
 * @param lat optional latitude, absent when the sensor has no position fix
 * @param lon optional longitude, absent when the sensor has no position fix
 * @param heightM optional altitude
 * @param operatorLat optional operator latitude
 * @param operatorLon optional operator longitude
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record Signal(
    @JsonProperty("ts") @JsonDeserialize(using = LenientInstantDeserializer.class) Instant ts,
    @JsonProperty("SN") @JsonAlias("sn") String sn,
    @JsonProperty("UASID") @JsonAlias("uasid") String uasid,
    @JsonProperty("DroneType") @JsonAlias("drone_type") String droneType,
    @JsonProperty("Direction") @JsonAlias("direction_deg") Integer directionDeg,
    @JsonProperty("SpeedHorizontal") @JsonAlias("speed_h_mps") Double speedHMps,
    @JsonProperty("SpeedVertical") @JsonAlias("speed_v_mps") Double speedVMps,
    @JsonProperty("Latitude") @JsonAlias("lat") Double lat,
    @JsonProperty("Longitude") @JsonAlias("lon") Double lon,
    @JsonProperty("Height") @JsonAlias("height_m") Double heightM,
    @JsonProperty("OperatorLatitude") @JsonAlias("operator_lat") Double operatorLat,
    @JsonProperty("OperatorLongitude") @JsonAlias("operator_lon") Double operatorLon) {

  /**
   * Returns this signal with {@code ts} set to {@code now} when the producer omitted it.
   *
   * @param now ingestion wall-clock instant
   * @return this instance or a copy carrying the default timestamp
   */
  public Signal withDefaultTimestamp(Instant now) {
    if (ts != null) {
      return this;
    }
    return new Signal(
        now, sn, uasid, droneType, directionDeg, speedHMps, speedVMps,
        lat, lon, heightM, operatorLat, operatorLon);
  }
}
