package com.altivion.api.model;

import java.time.Instant;

/**
 * Track point representation used in track responses.
 *
 * @param ts point timestamp
 * @param lat latitude
 * @param lon longitude
 */
public record TrackPoint(Instant ts, Double lat, Double lon) {}
