package com.anomaly.detection.engine.isolationforest;

import java.util.Random;

/**
 * One randomly partitioned tree, built once from a sub-sample and immutable afterwards.
 */
public class IsolationTree {

    private final IsolationNode root;

    public IsolationTree(IsolationNode root) {
        this.root = root;
    }

    public static IsolationTree build(double[][] data, int maxDepth, Random random) {
        if (data.length == 0) {
            throw new IllegalArgumentException("Training data cannot be empty");
        }
        return new IsolationTree(buildNode(data, 0, maxDepth, random));
    }

    private static IsolationNode buildNode(double[][] data, int depth, int maxDepth, Random random) {
        int n = data.length;

        if (n <= 1 || depth >= maxDepth) {
            return IsolationNode.externalNode(n);
        }

        int featureIdx = random.nextInt(data[0].length);

        double min = data[0][featureIdx];
        double max = min;
        for (double[] row : data) {
            if (row[featureIdx] < min) min = row[featureIdx];
            if (row[featureIdx] > max) max = row[featureIdx];
        }

        // A constant feature sends every row right; the depth limit ends the recursion.
        double splitValue = max > min ? min + random.nextDouble() * (max - min) : min;

        int leftCount = 0;
        for (double[] row : data) {
            if (row[featureIdx] < splitValue) leftCount++;
        }

        double[][] leftData = new double[leftCount][];
        double[][] rightData = new double[n - leftCount][];
        int li = 0, ri = 0;
        for (double[] row : data) {
            if (row[featureIdx] < splitValue) {
                leftData[li++] = row;
            } else {
                rightData[ri++] = row;
            }
        }

        IsolationNode left = leftCount > 0 ? buildNode(leftData, depth + 1, maxDepth, random) : null;
        IsolationNode right = rightData.length > 0 ? buildNode(rightData, depth + 1, maxDepth, random) : null;

        return IsolationNode.internalNode(featureIdx, splitValue, left, right, n);
    }

    /**
     * Edges walked from the root until a leaf or an absent child, plus c(leaf size)
     * for the part of the tree that the depth limit left unbuilt. Walking off an
     * absent child counts that edge and adds no correction.
     */
    public double pathLength(double[] point) {
        IsolationNode node = root;
        int edges = 0;
        while (node != null && !node.isLeaf()) {
            node = node.childFor(point);
            edges++;
        }
        if (node == null) {
            return edges;
        }
        return edges + IsolationNode.averagePathLength(node.getSize());
    }

    public IsolationNode getRoot() { return root; }
}
