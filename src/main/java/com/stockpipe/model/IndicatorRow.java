package com.stockpipe.model;

import java.time.LocalDate;
import java.util.Arrays;
import java.util.List;

/**
 * Feature vector for one (ticker, date). Values follow {@link #FEATURE_NAMES} order and
 * depend only on bars dated on or before {@link #date}.
 */
public final class IndicatorRow {
    public static final List<String> FEATURE_NAMES = List.of(
            "open", "high", "low", "close", "volume",
            "rsi",
            "macd_line", "macd_signal", "macd_histogram",
            "bb_middle", "bb_upper", "bb_lower", "bb_width", "bb_position",
            "volume_ma", "volume_ratio"
    );

    public final String ticker;
    public final LocalDate date;
    private final double[] values;

    public IndicatorRow(String ticker, LocalDate date, double[] values) {
        if (values == null || values.length != FEATURE_NAMES.size()) {
            throw new IllegalArgumentException("indicator row expects " + FEATURE_NAMES.size() + " values");
        }
        this.ticker = ticker;
        this.date = date;
        this.values = values.clone();
    }

    public double value(String name) {
        int idx = FEATURE_NAMES.indexOf(name);
        if (idx < 0) {
            throw new IllegalArgumentException("unknown feature: " + name);
        }
        return values[idx];
    }

    public double valueAt(int index) {
        return values[index];
    }

    public double[] values() {
        return values.clone();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof IndicatorRow)) {
            return false;
        }
        IndicatorRow other = (IndicatorRow) o;
        return ticker.equals(other.ticker) && date.equals(other.date) && Arrays.equals(values, other.values);
    }

    @Override
    public int hashCode() {
        return 31 * (31 * ticker.hashCode() + date.hashCode()) + Arrays.hashCode(values);
    }
}
