package com.stockpipe.feature;

import com.stockpipe.model.IndicatorRow;
import com.stockpipe.model.Label;
import com.stockpipe.model.SequenceSample;
import com.stockpipe.time.TradingCalendar;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Sliding windows (stride 1) over runs of consecutive trading days. A missing session splits the
 * series and no window spans the gap. Each window is min-max scaled per column using its own rows.
 */
public final class SequenceGenerator {
    public static final int DEFAULT_WINDOW = 60;

    private final TradingCalendar calendar;
    private final int window;

    public SequenceGenerator(TradingCalendar calendar) {
        this(calendar, DEFAULT_WINDOW);
    }

    public SequenceGenerator(TradingCalendar calendar, int window) {
        if (window < 1) {
            throw new IllegalArgumentException("window must be >= 1: " + window);
        }
        this.calendar = calendar;
        this.window = window;
    }

    public List<SequenceSample> generate(String ticker, List<IndicatorRow> rows) {
        return generate(ticker, rows, window, null);
    }

    public List<SequenceSample> generate(String ticker, List<IndicatorRow> rows, int window) {
        if (window < 1) {
            throw new IllegalArgumentException("window must be >= 1: " + window);
        }
        return generate(ticker, rows, window, null);
    }

    /**
     * Only windows whose end date has a label are returned, with that label attached.
     */
    public List<SequenceSample> generate(String ticker, List<IndicatorRow> rows, Map<LocalDate, Label> labelsByDate) {
        return generate(ticker, rows, window, labelsByDate == null ? Map.of() : labelsByDate);
    }

    private List<SequenceSample> generate(String ticker, List<IndicatorRow> rows, int size, Map<LocalDate, Label> labels) {
        String symbol = ticker.toUpperCase(Locale.ROOT);
        List<SequenceSample> out = new ArrayList<>();
        for (List<IndicatorRow> run : consecutiveRuns(rows)) {
            for (int end = size - 1; end < run.size(); end++) {
                LocalDate endDate = run.get(end).date;
                Integer label = null;
                if (labels != null) {
                    Label l = labels.get(endDate);
                    if (l == null) {
                        continue;
                    }
                    label = l.labelBinary;
                }
                List<IndicatorRow> slice = run.subList(end - size + 1, end + 1);
                out.add(new SequenceSample(symbol, slice.get(0).date, endDate, normalize(slice), label));
            }
        }
        return out;
    }

    List<List<IndicatorRow>> consecutiveRuns(List<IndicatorRow> rows) {
        List<IndicatorRow> sorted = new ArrayList<>(rows == null ? List.of() : rows);
        sorted.sort(Comparator.comparing(r -> r.date));
        List<List<IndicatorRow>> runs = new ArrayList<>();
        List<IndicatorRow> current = new ArrayList<>();
        for (IndicatorRow row : sorted) {
            if (!current.isEmpty()) {
                LocalDate prev = current.get(current.size() - 1).date;
                if (row.date.equals(prev)) {
                    continue;
                }
                if (!row.date.equals(calendar.nextTradingDay(prev))) {
                    runs.add(current);
                    current = new ArrayList<>();
                }
            }
            current.add(row);
        }
        if (!current.isEmpty()) {
            runs.add(current);
        }
        return runs;
    }

    static double[][] normalize(List<IndicatorRow> slice) {
        int steps = slice.size();
        int features = IndicatorRow.FEATURE_NAMES.size();
        double[][] out = new double[steps][features];
        for (int f = 0; f < features; f++) {
            double min = Double.POSITIVE_INFINITY;
            double max = Double.NEGATIVE_INFINITY;
            for (IndicatorRow row : slice) {
                double v = row.valueAt(f);
                min = Math.min(min, v);
                max = Math.max(max, v);
            }
            double range = max - min;
            for (int s = 0; s < steps; s++) {
                out[s][f] = range == 0.0 ? 0.0 : (slice.get(s).valueAt(f) - min) / range;
            }
        }
        return out;
    }
}
