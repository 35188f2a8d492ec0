package com.csd.bizintel.ml;

import java.util.Arrays;
import java.util.Comparator;
import java.util.stream.IntStream;

/**
 * Least-squares regression tree of bounded depth, grown greedily on the split that yields the
 * largest reduction in squared error.
 */
public final class RegressionTree implements RegressionModel {

    private final Node root;

    private RegressionTree(Node root) {
        this.root = root;
    }

    public static RegressionTree fit(double[][] x, double[] y, int maxDepth, int minSamplesSplit) {
        int[] indices = IntStream.range(0, y.length).toArray();
        return new RegressionTree(grow(x, y, indices, 0, maxDepth, minSamplesSplit));
    }

    @Override
    public double predict(double[] features) {
        Node node = root;
        while (!node.isLeaf()) {
            node = features[node.feature] <= node.threshold ? node.left : node.right;
        }
        return node.value;
    }

    int depth() {
        return depth(root);
    }

    private static int depth(Node node) {
        if (node.isLeaf()) return 0;
        return 1 + Math.max(depth(node.left), depth(node.right));
    }

    private static Node grow(double[][] x, double[] y, int[] indices, int depth, int maxDepth, int minSamplesSplit) {
        double mean = mean(y, indices);
        if (depth >= maxDepth || indices.length < minSamplesSplit) {
            return Node.leaf(mean);
        }
        Split best = bestSplit(x, y, indices);
        if (best == null) {
            return Node.leaf(mean);
        }
        int[] left = Arrays.stream(indices).filter(i -> x[i][best.feature] <= best.threshold).toArray();
        int[] right = Arrays.stream(indices).filter(i -> x[i][best.feature] > best.threshold).toArray();
        return Node.split(best.feature, best.threshold,
                grow(x, y, left, depth + 1, maxDepth, minSamplesSplit),
                grow(x, y, right, depth + 1, maxDepth, minSamplesSplit));
    }

    private static Split bestSplit(double[][] x, double[] y, int[] indices) {
        int n = indices.length;
        double total = 0;
        for (int i : indices) total += y[i];

        Split best = null;
        double bestGain = 1e-12;
        int featureCount = x[indices[0]].length;
        for (int f = 0; f < featureCount; f++) {
            final int feature = f;
            Integer[] sorted = Arrays.stream(indices).boxed()
                    .sorted(Comparator.comparingDouble(i -> x[i][feature]))
                    .toArray(Integer[]::new);
            double leftSum = 0;
            for (int k = 0; k < n - 1; k++) {
                leftSum += y[sorted[k]];
                double current = x[sorted[k]][feature];
                double next = x[sorted[k + 1]][feature];
                if (current == next) continue;
                int leftCount = k + 1;
                int rightCount = n - leftCount;
                double rightSum = total - leftSum;
                // reduction in squared error, up to a constant shared by all candidate splits
                double gain = leftSum * leftSum / leftCount + rightSum * rightSum / rightCount - total * total / n;
                if (gain > bestGain) {
                    bestGain = gain;
                    best = new Split(feature, (current + next) / 2);
                }
            }
        }
        return best;
    }

    private static double mean(double[] y, int[] indices) {
        double sum = 0;
        for (int i : indices) sum += y[i];
        return indices.length == 0 ? 0 : sum / indices.length;
    }

    private static final class Split {
        final int feature;
        final double threshold;

        Split(int feature, double threshold) {
            this.feature = feature;
            this.threshold = threshold;
        }
    }

    private static final class Node {
        final int feature;
        final double threshold;
        final double value;
        final Node left;
        final Node right;

        private Node(int feature, double threshold, double value, Node left, Node right) {
            this.feature = feature;
            this.threshold = threshold;
            this.value = value;
            this.left = left;
            this.right = right;
        }

        static Node leaf(double value) {
            return new Node(-1, 0, value, null, null);
        }

        static Node split(int feature, double threshold, Node left, Node right) {
            return new Node(feature, threshold, 0, left, right);
        }

        boolean isLeaf() {
            return left == null;
        }
    }
}
