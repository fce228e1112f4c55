package com.anomaly.detection.engine.distance;

/**
 * A stored point's position in its detector's point list and its distance from a query.
 */
public record Neighbor(int index, double distance) {}
