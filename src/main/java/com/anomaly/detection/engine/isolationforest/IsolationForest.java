package com.anomaly.detection.engine.isolationforest;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Random;

/**
 * Ensemble of isolation trees with score normalization. Not thread-safe on its own;
 * {@link IsolationForestDetector} guards it.
 */
public class IsolationForest {

    // Score reported when c(n) is zero (sub-sample of one point) and paths carry no information
    static final double UNINFORMATIVE_SCORE = 0.5;

    private final List<IsolationTree> trees;
    private final int sampleSize;
    private final double averagePathLength;

    private IsolationForest(List<IsolationTree> trees, int sampleSize) {
        this.trees = trees;
        this.sampleSize = sampleSize;
        this.averagePathLength = IsolationNode.averagePathLength(sampleSize);
    }

    /**
     * Train an isolation forest on the given data.
     *
     * @param data          training samples, each row is a feature vector
     * @param numTrees      number of trees in the forest (typically 100)
     * @param subSampleSize sub-sampling size per tree (typically 256)
     * @param maxDepth      depth at which a node becomes a leaf regardless of size
     * @param random        source of sampling and split randomness
     */
    public static IsolationForest train(double[][] data, int numTrees, int subSampleSize,
                                        int maxDepth, Random random) {
        if (data.length == 0) {
            throw new IllegalArgumentException("Training data cannot be empty");
        }
        int sampleSize = Math.min(subSampleSize, data.length);
        List<IsolationTree> trees = new ArrayList<>(numTrees);
        for (int i = 0; i < numTrees; i++) {
            double[][] sample = subsample(data, sampleSize, random);
            trees.add(IsolationTree.build(sample, maxDepth, random));
        }
        return new IsolationForest(Collections.unmodifiableList(trees), sampleSize);
    }

    public double meanPathLength(double[] point) {
        double total = 0.0;
        for (IsolationTree tree : trees) {
            total += tree.pathLength(point);
        }
        return total / trees.size();
    }

    /**
     * Compute the anomaly score of a single point: s(x, n) = 2^(-E(h(x)) / c(n)).
     *
     * @return score in (0, 1]; near 1 for isolated points, well below 0.5 for embedded ones
     */
    public double anomalyScore(double[] point) {
        if (averagePathLength <= 0) {
            return UNINFORMATIVE_SCORE;
        }
        return Math.pow(2.0, -meanPathLength(point) / averagePathLength);
    }

    /**
     * Compute feature contributions, i.e. which features pushed this point toward anomaly:
     * the score drop when a feature is replaced by its mean, floored at zero.
     */
    public double[] featureContributions(double[] point, double[] featureMeans) {
        double baseScore = anomalyScore(point);
        double[] contributions = new double[point.length];

        for (int i = 0; i < point.length; i++) {
            double[] modified = Arrays.copyOf(point, point.length);
            modified[i] = featureMeans[i];
            contributions[i] = Math.max(0, baseScore - anomalyScore(modified));
        }

        return contributions;
    }

    /**
     * First {@code size} entries of a uniformly random permutation, so sampling is
     * without replacement within one tree.
     */
    private static double[][] subsample(double[][] data, int size, Random random) {
        int[] indices = new int[data.length];
        for (int i = 0; i < data.length; i++) indices[i] = i;

        double[][] sample = new double[size][];
        for (int i = 0; i < size; i++) {
            int j = i + random.nextInt(data.length - i);
            int tmp = indices[i];
            indices[i] = indices[j];
            indices[j] = tmp;
            sample[i] = data[indices[i]];
        }
        return sample;
    }

    public List<IsolationTree> getTrees() { return trees; }
    public int getSampleSize() { return sampleSize; }
    public double getAveragePathLength() { return averagePathLength; }
}
