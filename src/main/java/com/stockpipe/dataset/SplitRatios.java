package com.stockpipe.dataset;

import lombok.Value;

/**
 * Train and validation shares of the labeled dates; test takes the rest.
 */
@Value
public class SplitRatios {
    private static final double TOLERANCE = 1e-9;

    double train;
    double val;
    double test;

    public SplitRatios(double train, double val, double test) {
        if (!(train > 0.0) || !(val > 0.0) || !(test > 0.0)) {
            throw new IllegalArgumentException("split ratios must be positive: train=" + train + " val=" + val + " test=" + test);
        }
        if (Math.abs(train + val + test - 1.0) > TOLERANCE) {
            throw new IllegalArgumentException("split ratios must sum to 1: sum=" + (train + val + test));
        }
        this.train = train;
        this.val = val;
        this.test = test;
    }

    public static SplitRatios of(double train, double val) {
        return new SplitRatios(train, val, 1.0 - train - val);
    }

    public static SplitRatios defaults() {
        return of(0.70, 0.15);
    }
}
