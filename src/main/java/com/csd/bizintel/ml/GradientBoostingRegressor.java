package com.csd.bizintel.ml;

import lombok.Builder;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * Gradient boosting with squared-error loss: starts from the target mean and adds shallow
 * regression trees fitted to the residuals, each shrunk by the learning rate.
 */
@Slf4j
@Builder
public class GradientBoostingRegressor {

    @Builder.Default
    private final int estimators = 100;
    @Builder.Default
    private final int maxDepth = 3;
    @Builder.Default
    private final double learningRate = 0.1;
    @Builder.Default
    private final int minSamplesSplit = 2;

    public RegressionModel fit(double[][] x, double[] y) {
        if (x.length == 0 || x.length != y.length) {
            throw new IllegalArgumentException("Training data must be non-empty and aligned: "
                    + x.length + " rows, " + y.length + " targets");
        }
        double initial = 0;
        for (double target : y) initial += target;
        initial /= y.length;

        double[] current = new double[y.length];
        Arrays.fill(current, initial);
        double[] residuals = new double[y.length];
        List<RegressionTree> trees = new ArrayList<>(estimators);

        for (int m = 0; m < estimators; m++) {
            for (int i = 0; i < y.length; i++) {
                residuals[i] = y[i] - current[i];
            }
            RegressionTree tree = RegressionTree.fit(x, residuals, maxDepth, minSamplesSplit);
            for (int i = 0; i < y.length; i++) {
                current[i] += learningRate * tree.predict(x[i]);
            }
            trees.add(tree);
        }
        log.debug("Fitted {} trees (depth {}, learning rate {}) on {} samples", trees.size(), maxDepth, learningRate, y.length);
        return new Ensemble(initial, learningRate, List.copyOf(trees));
    }

    private static final class Ensemble implements RegressionModel {
        private final double initial;
        private final double learningRate;
        private final List<RegressionTree> trees;

        Ensemble(double initial, double learningRate, List<RegressionTree> trees) {
            this.initial = initial;
            this.learningRate = learningRate;
            this.trees = trees;
        }

        @Override
        public double predict(double[] features) {
            double prediction = initial;
            for (RegressionTree tree : trees) {
                prediction += learningRate * tree.predict(features);
            }
            return prediction;
        }
    }
}
