package com.anomaly.detection.engine.isolationforest;

/**
 * Node of an isolation tree. A node with no children is a leaf; an internal node
 * has at least one child, the other may be absent when its partition was empty.
 * Children are owned exclusively by their parent.
 */
public class IsolationNode {

    private static final double EULER_MASCHERONI = 0.5772156649;

    private final int splitFeature;
    private final double splitValue;
    private final IsolationNode left;
    private final IsolationNode right;
    private final int size; // samples that reached this node

    private IsolationNode(int splitFeature, double splitValue,
                          IsolationNode left, IsolationNode right, int size) {
        this.splitFeature = splitFeature;
        this.splitValue = splitValue;
        this.left = left;
        this.right = right;
        this.size = size;
    }

    public static IsolationNode internalNode(int splitFeature, double splitValue,
                                             IsolationNode left, IsolationNode right, int size) {
        if (left == null && right == null) {
            throw new IllegalArgumentException("Internal node needs at least one child");
        }
        return new IsolationNode(splitFeature, splitValue, left, right, size);
    }

    public static IsolationNode externalNode(int size) {
        return new IsolationNode(-1, 0.0, null, null, size);
    }

    public boolean isLeaf() {
        return left == null && right == null;
    }

    /**
     * Child the point descends into: left when {@code point[splitFeature] < splitValue}.
     * May be null when that side's partition was empty at build time.
     */
    public IsolationNode childFor(double[] point) {
        return point[splitFeature] < splitValue ? left : right;
    }

    /**
     * Average path length of unsuccessful search in a BST of n nodes (Equation 1 of the IF paper):
     * c(n) = 2(ln(n-1) + gamma) - 2(n-1)/n for n > 2, 1 for n = 2, 0 otherwise.
     */
    public static double averagePathLength(int n) {
        if (n > 2) {
            double harmonicNumber = Math.log(n - 1.0) + EULER_MASCHERONI;
            return 2.0 * harmonicNumber - (2.0 * (n - 1.0) / n);
        }
        if (n == 2) return 1.0;
        return 0.0;
    }

    public int getSplitFeature() { return splitFeature; }
    public double getSplitValue() { return splitValue; }
    public IsolationNode getLeft() { return left; }
    public IsolationNode getRight() { return right; }
    public int getSize() { return size; }
}
