package com.stockpipe.model;

import java.time.LocalDate;

/**
 * One normalized window of consecutive trading days ending at {@link #endDate}.
 */
public final class SequenceSample {
    public final String ticker;
    public final LocalDate startDate;
    public final LocalDate endDate;
    private final double[][] window;
    public final Integer label;

    public SequenceSample(String ticker, LocalDate startDate, LocalDate endDate, double[][] window, Integer label) {
        this.ticker = ticker;
        this.startDate = startDate;
        this.endDate = endDate;
        this.window = deepCopy(window);
        this.label = label;
    }

    public int length() {
        return window.length;
    }

    public int featureCount() {
        return window.length == 0 ? 0 : window[0].length;
    }

    public double at(int step, int feature) {
        return window[step][feature];
    }

    public double[][] window() {
        return deepCopy(window);
    }

    private static double[][] deepCopy(double[][] src) {
        if (src == null) {
            return new double[0][0];
        }
        double[][] out = new double[src.length][];
        for (int i = 0; i < src.length; i++) {
            out[i] = src[i].clone();
        }
        return out;
    }
}
