package com.anomaly.detection.engine.distance;

import com.anomaly.detection.engine.DimensionMismatchException;

public final class EuclideanDistance {

    private EuclideanDistance() {}

    /**
     * Euclidean norm of the element-wise difference.
     *
     * @throws DimensionMismatchException if the vectors differ in length
     */
    public static double distance(double[] a, double[] b) {
        if (a.length != b.length) {
            throw new DimensionMismatchException(a.length, b.length);
        }
        double sum = 0.0;
        for (int i = 0; i < a.length; i++) {
            double d = a[i] - b[i];
            sum += d * d;
        }
        return Math.sqrt(sum);
    }
}
