package com.altivion.api.model;

import java.util.List;

/**
 * Positions of one sensor in ascending time order.
 *
 * @param sn sensor serial number
 * @param points ordered track points
 */
public record SensorTrack(String sn, List<TrackPoint> points) {}
