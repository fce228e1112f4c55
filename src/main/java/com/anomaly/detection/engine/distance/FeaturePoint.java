package com.anomaly.detection.engine.distance;

/**
 * A stored point that neighbour searches can measure.
 */
public interface FeaturePoint {

    double[] getValues();
}
