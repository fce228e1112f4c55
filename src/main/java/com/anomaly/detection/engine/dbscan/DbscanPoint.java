package com.anomaly.detection.engine.dbscan;

import com.anomaly.detection.engine.distance.FeaturePoint;

/**
 * A point in DBSCAN's history with its cluster assignment.
 */
public class DbscanPoint implements FeaturePoint {

    public static final int UNCLASSIFIED = 0;
    public static final int NOISE = -1;

    private final double[] values;
    private int clusterId;
    private boolean visited; // only meaningful during a clustering pass

    public DbscanPoint(double[] values) {
        this(values, UNCLASSIFIED);
    }

    public DbscanPoint(double[] values, int clusterId) {
        this.values = values;
        this.clusterId = clusterId;
    }

    @Override
    public double[] getValues() { return values; }

    public int getClusterId() { return clusterId; }
    public void setClusterId(int clusterId) { this.clusterId = clusterId; }

    public boolean isVisited() { return visited; }
    public void setVisited(boolean visited) { this.visited = visited; }

    public boolean isNoise() {
        return clusterId == NOISE;
    }

    public boolean isClustered() {
        return clusterId > 0;
    }
}
