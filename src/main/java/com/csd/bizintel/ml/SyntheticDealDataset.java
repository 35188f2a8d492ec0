package com.csd.bizintel.ml;

import java.util.Random;

/**
 * Generated deal outcomes used to bootstrap the success model before any real outcomes exist.
 * Features are uniform in [0,1): value, description length, match score, urgency, duration.
 */
public final class SyntheticDealDataset {
    public static final long DEFAULT_SEED = 42L;
    public static final int DEFAULT_SAMPLES = 1000;
    public static final int FEATURES = 5;

    private static final double NOISE_STDDEV = 0.1;

    private final double[][] features;
    private final double[] targets;

    private SyntheticDealDataset(double[][] features, double[] targets) {
        this.features = features;
        this.targets = targets;
    }

    public static SyntheticDealDataset generate(long seed, int samples) {
        Random random = new Random(seed);
        double[][] x = new double[samples][FEATURES];
        double[] y = new double[samples];
        for (int i = 0; i < samples; i++) {
            for (int f = 0; f < FEATURES; f++) {
                x[i][f] = random.nextDouble();
            }
        }
        for (int i = 0; i < samples; i++) {
            double target = x[i][0] * 0.2
                    + x[i][2] * 0.4
                    + x[i][3] * 0.1
                    + (1 - x[i][4]) * 0.2
                    + random.nextGaussian() * NOISE_STDDEV;
            y[i] = Math.max(0, Math.min(1, target));
        }
        return new SyntheticDealDataset(x, y);
    }

    public double[][] features() {
        return features;
    }

    public double[] targets() {
        return targets;
    }

    public int size() {
        return targets.length;
    }
}
