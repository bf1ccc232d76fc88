package com.altivion.api.model;

/**
 * Immutable geographic bounding box used for map viewport queries.
 *
 * @param minLon minimum longitude
 * @param minLat minimum latitude
 * @param maxLon maximum longitude
 * @param maxLat maximum latitude
 */
public record Bbox(double minLon, double minLat, double maxLon, double maxLat) {
  /**
   * Builds a box from the viewport corners in whatever order the client sent them.
   *
   * @param swLat south-west latitude
   * @param swLng south-west longitude
   * @param neLat north-east latitude
   * @param neLng north-east longitude
   * @return normalized bbox with min &lt;= max on both axes
   */
  public static Bbox fromCorners(double swLat, double swLng, double neLat, double neLng) {
    return new Bbox(
        Math.min(swLng, neLng),
        Math.min(swLat, neLat),
        Math.max(swLng, neLng),
        Math.max(swLat, neLat));
  }
}
