package com.anomaly.detection.engine.distance;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Brute-force neighbour search over a detector's stored points. O(n log n) per query.
 */
public final class NearestNeighbors {

    private static final Comparator<Neighbor> BY_DISTANCE =
            Comparator.comparingDouble(Neighbor::distance).thenComparingInt(Neighbor::index);

    private NearestNeighbors() {}

    /**
     * The up-to-{@code k} stored points closest to {@code query}, nearest first.
     *
     * If the query is itself stored, it shows up at distance exactly zero and is skipped once,
     * so a point is never its own neighbour. Further coincident points still count.
     * Ties are broken by insertion order.
     */
    public static List<Neighbor> findKNearest(List<? extends FeaturePoint> points, double[] query, int k) {
        List<Neighbor> all = new ArrayList<>(points.size());
        for (int i = 0; i < points.size(); i++) {
            all.add(new Neighbor(i, EuclideanDistance.distance(query, points.get(i).getValues())));
        }
        all.sort(BY_DISTANCE);

        List<Neighbor> result = new ArrayList<>(Math.min(k, all.size()));
        boolean selfSkipped = false;
        for (Neighbor candidate : all) {
            if (result.size() >= k) {
                break;
            }
            if (!selfSkipped && candidate.distance() == 0.0) {
                selfSkipped = true;
                continue;
            }
            result.add(candidate);
        }
        return result;
    }

    /**
     * Indices of the up-to-{@code k} nearest stored points, nearest first.
     */
    public static int[] findKNearestIndices(List<? extends FeaturePoint> points, double[] query, int k) {
        return findKNearest(points, query, k).stream().mapToInt(Neighbor::index).toArray();
    }

    /**
     * Indices of every stored point within {@code radius} of {@code query}, inclusive,
     * in insertion order. A stored query is its own neighbour here.
     */
    public static List<Integer> withinRadius(List<? extends FeaturePoint> points, double[] query, double radius) {
        List<Integer> result = new ArrayList<>();
        for (int i = 0; i < points.size(); i++) {
            if (EuclideanDistance.distance(query, points.get(i).getValues()) <= radius) {
                result.add(i);
            }
        }
        return result;
    }
}
