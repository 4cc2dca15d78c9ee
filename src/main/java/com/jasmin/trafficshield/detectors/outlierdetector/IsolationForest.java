package com.jasmin.trafficshield.detectors.outlierdetector;

import com.jasmin.trafficshield.exceptions.ModelException;

import java.util.ArrayList;
import java.util.List;
import java.util.Random;

/**
 * Ensemble of random isolation trees.
 * <p>
 * Each tree is grown on a sub-sample of at most {@code sampleSize} rows, splitting on a random
 * feature at a random value between that feature's min and max, until a row is isolated or the
 * height limit {@code ceil(log2(sampleSize))} is reached. Points that are isolated after few
 * splits are anomalous; {@link #score} returns {@code 2^(-E[h(x)] / c(psi))}, close to 1 for
 * outliers and around 0.5 or below for ordinary points.
 */
public class IsolationForest {

    private static final double EULER_GAMMA = 0.5772156649;

    private final List<Node> trees;
    private final int subSample;
    private final int features;

    private IsolationForest(List<Node> trees, int subSample, int features) {
        this.trees = trees;
        this.subSample = subSample;
        this.features = features;
    }

    /**
     * Grows {@code treeCount} trees over {@code data}.
     *
     * @throws ModelException when there are fewer than two rows, rows of different width or
     *                        non-finite values
     */
    public static IsolationForest fit(List<double[]> data, int treeCount, int sampleSize, long seed) {
        if (data == null || data.size() < 2) {
            throw new ModelException("Need at least 2 samples to fit, got " + (data == null ? 0 : data.size()));
        }
        int width = data.get(0).length;
        for (double[] row : data) {
            if (row.length != width) {
                throw new ModelException("Inconsistent feature width: " + row.length + " != " + width);
            }
            for (double v : row) {
                if (!Double.isFinite(v)) {
                    throw new ModelException("Non-finite feature value in training data");
                }
            }
        }

        Random rnd = new Random(seed);
        int psi = Math.min(sampleSize, data.size());
        int heightLimit = (int) Math.ceil(Math.log(psi) / Math.log(2));
        List<Node> trees = new ArrayList<>(treeCount);
        int[] idx = new int[data.size()];
        for (int t = 0; t < treeCount; t++) {
            for (int i = 0; i < idx.length; i++) {
                idx[i] = i;
            }
            // partial Fisher-Yates: the first psi slots become the sample
            for (int i = 0; i < psi; i++) {
                int j = i + rnd.nextInt(idx.length - i);
                int tmp = idx[i];
                idx[i] = idx[j];
                idx[j] = tmp;
            }
            List<double[]> sample = new ArrayList<>(psi);
            for (int i = 0; i < psi; i++) {
                sample.add(data.get(idx[i]));
            }
            trees.add(grow(sample, 0, heightLimit, width, rnd));
        }
        return new IsolationForest(trees, psi, width);
    }

    /**
     * Anomaly score in (0,1].
     *
     * @throws ModelException for a vector of the wrong width or with non-finite values
     */
    public double score(double[] x) {
        if (x.length != features) {
            throw new ModelException("Expected " + features + " features, got " + x.length);
        }
        for (double v : x) {
            if (!Double.isFinite(v)) {
                throw new ModelException("Non-finite feature value");
            }
        }
        double total = 0.0;
        for (Node tree : trees) {
            total += pathLength(x, tree, 0);
        }
        double mean = total / trees.size();
        double norm = averagePathLength(subSample);
        if (norm <= 0.0) {
            return 0.5;
        }
        return Math.pow(2.0, -mean / norm);
    }

    public int treeCount() {
        return trees.size();
    }

    public int subSample() {
        return subSample;
    }

    /** Average path length of an unsuccessful BST search over n points. */
    static double averagePathLength(int n) {
        if (n > 2) {
            double harmonic = Math.log(n - 1.0) + EULER_GAMMA;
            return 2.0 * harmonic - 2.0 * (n - 1.0) / n;
        }
        return n == 2 ? 1.0 : 0.0;
    }

    private static Node grow(List<double[]> rows, int depth, int heightLimit, int width, Random rnd) {
        if (depth >= heightLimit || rows.size() <= 1) {
            return new Leaf(rows.size());
        }

        // only features that still vary inside this node can split it
        double[] min = new double[width];
        double[] max = new double[width];
        for (int f = 0; f < width; f++) {
            min[f] = Double.POSITIVE_INFINITY;
            max[f] = Double.NEGATIVE_INFINITY;
        }
        for (double[] r : rows) {
            for (int f = 0; f < width; f++) {
                min[f] = Math.min(min[f], r[f]);
                max[f] = Math.max(max[f], r[f]);
            }
        }
        List<Integer> candidates = new ArrayList<>(width);
        for (int f = 0; f < width; f++) {
            if (max[f] > min[f]) {
                candidates.add(f);
            }
        }
        if (candidates.isEmpty()) {
            return new Leaf(rows.size());
        }

        int feature = candidates.get(rnd.nextInt(candidates.size()));
        double split = min[feature] + rnd.nextDouble() * (max[feature] - min[feature]);
        List<double[]> left = new ArrayList<>();
        List<double[]> right = new ArrayList<>();
        for (double[] r : rows) {
            if (r[feature] < split) {
                left.add(r);
            } else {
                right.add(r);
            }
        }
        return new Split(feature, split,
                grow(left, depth + 1, heightLimit, width, rnd),
                grow(right, depth + 1, heightLimit, width, rnd));
    }

    private static double pathLength(double[] x, Node node, int depth) {
        Node n = node;
        int d = depth;
        while (n instanceof Split) {
            Split s = (Split) n;
            n = x[s.feature] < s.value ? s.left : s.right;
            d++;
        }
        return d + averagePathLength(((Leaf) n).size);
    }

    private interface Node {
    }

    private static final class Leaf implements Node {
        private final int size;

        private Leaf(int size) {
            this.size = size;
        }
    }

    private static final class Split implements Node {
        private final int feature;
        private final double value;
        private final Node left;
        private final Node right;

        private Split(int feature, double value, Node left, Node right) {
            this.feature = feature;
            this.value = value;
            this.left = left;
            this.right = right;
        }
    }
}
