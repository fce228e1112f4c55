package com.anomaly.detection.engine.lof;

import com.anomaly.detection.engine.distance.FeaturePoint;

/**
 * A stored LOF point. The score is meaningful only once {@code processed} is set by a build.
 */
public class LofPoint implements FeaturePoint {

    private final double[] values;
    private double lofScore;
    private boolean processed;

    public LofPoint(double[] values) {
        this.values = values;
    }

    @Override
    public double[] getValues() { return values; }

    public double getLofScore() { return lofScore; }
    public void setLofScore(double lofScore) { this.lofScore = lofScore; }

    public boolean isProcessed() { return processed; }
    public void setProcessed(boolean processed) { this.processed = processed; }
}
