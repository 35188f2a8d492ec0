package com.csd.bizintel.ml;

/**
 * A fitted regression estimator. Implementations are immutable after fitting and safe to
 * share between threads.
 */
public interface RegressionModel {
    double predict(double[] features);
}
