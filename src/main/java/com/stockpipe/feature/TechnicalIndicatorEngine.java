package com.stockpipe.feature;

import com.stockpipe.model.IndicatorRow;
import com.stockpipe.model.PriceBar;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;

/**
 * Causal technical indicators over a daily series. Every value for bar i is computed from bars
 * 0..i only, so appending newer bars never changes rows already emitted.
 */
public final class TechnicalIndicatorEngine {
    private final int rsiPeriod;
    private final int macdFast;
    private final int macdSlow;
    private final int macdSignal;
    private final int bollingerPeriod;
    private final double bollingerK;
    private final int volumePeriod;

    public TechnicalIndicatorEngine() {
        this(14, 12, 26, 9, 20, 2.0, 20);
    }

    public TechnicalIndicatorEngine(
            int rsiPeriod,
            int macdFast,
            int macdSlow,
            int macdSignal,
            int bollingerPeriod,
            double bollingerK,
            int volumePeriod
    ) {
        if (rsiPeriod < 1 || macdFast < 1 || macdSlow <= macdFast || macdSignal < 1
                || bollingerPeriod < 2 || volumePeriod < 1 || bollingerK <= 0.0) {
            throw new IllegalArgumentException("invalid indicator periods");
        }
        this.rsiPeriod = rsiPeriod;
        this.macdFast = macdFast;
        this.macdSlow = macdSlow;
        this.macdSignal = macdSignal;
        this.bollingerPeriod = bollingerPeriod;
        this.bollingerK = bollingerK;
        this.volumePeriod = volumePeriod;
    }

    /**
     * Index of the first bar for which every indicator is defined.
     */
    public int firstRowIndex() {
        int macd = (macdSlow - 1) + (macdSignal - 1);
        return Math.max(Math.max(rsiPeriod, macd), Math.max(bollingerPeriod - 1, volumePeriod - 1));
    }

    public List<IndicatorRow> compute(String ticker, List<PriceBar> series) {
        List<PriceBar> bars = usableBars(series);
        int n = bars.size();
        List<IndicatorRow> out = new ArrayList<>();
        int first = firstRowIndex();
        if (n <= first) {
            return out;
        }

        double[] open = new double[n];
        double[] high = new double[n];
        double[] low = new double[n];
        double[] close = new double[n];
        double[] volume = new double[n];
        for (int i = 0; i < n; i++) {
            PriceBar b = bars.get(i);
            open[i] = b.open;
            high[i] = b.high;
            low[i] = b.low;
            close[i] = b.close;
            volume[i] = b.volume;
        }

        double[] rsi = rsi(close, rsiPeriod);
        double[] emaFast = ema(close, 0, macdFast);
        double[] emaSlow = ema(close, 0, macdSlow);
        double[] macdLine = new double[n];
        for (int i = 0; i < n; i++) {
            macdLine[i] = i >= macdSlow - 1 ? emaFast[i] - emaSlow[i] : Double.NaN;
        }
        double[] signal = ema(macdLine, macdSlow - 1, macdSignal);
        double[] bbMiddle = sma(close, bollingerPeriod);
        double[] bbStd = populationStd(close, bbMiddle, bollingerPeriod);
        double[] volumeMa = sma(volume, volumePeriod);

        String symbol = ticker.toUpperCase(Locale.ROOT);
        for (int i = first; i < n; i++) {
            double middle = bbMiddle[i];
            double upper = middle + bollingerK * bbStd[i];
            double lower = middle - bollingerK * bbStd[i];
            double band = upper - lower;
            double width = middle == 0.0 ? 0.0 : band / middle;
            double position = band == 0.0 ? 0.5 : (close[i] - lower) / band;
            double volumeRatio = volumeMa[i] == 0.0 ? 0.0 : volume[i] / volumeMa[i];
            out.add(new IndicatorRow(symbol, bars.get(i).date, new double[]{
                    open[i], high[i], low[i], close[i], volume[i],
                    rsi[i],
                    macdLine[i], signal[i], macdLine[i] - signal[i],
                    middle, upper, lower, width, position,
                    volumeMa[i], volumeRatio
            }));
        }
        return out;
    }

    private static List<PriceBar> usableBars(List<PriceBar> series) {
        List<PriceBar> out = new ArrayList<>();
        if (series == null) {
            return out;
        }
        for (PriceBar bar : series) {
            if (bar != null && bar.date != null && bar.hasAllFields()) {
                out.add(bar);
            }
        }
        out.sort(Comparator.comparing(b -> b.date));
        List<PriceBar> distinct = new ArrayList<>();
        LocalDate prev = null;
        for (PriceBar bar : out) {
            if (!bar.date.equals(prev)) {
                distinct.add(bar);
            }
            prev = bar.date;
        }
        return distinct;
    }

    /**
     * Wilder RSI. The first value sits at index {@code period}, seeded by the plain average of the
     * first {@code period} changes.
     */
    static double[] rsi(double[] close, int period) {
        int n = close.length;
        double[] out = filledNaN(n);
        if (n <= period) {
            return out;
        }
        double gain = 0.0;
        double loss = 0.0;
        for (int i = 1; i <= period; i++) {
            double change = close[i] - close[i - 1];
            gain += Math.max(change, 0.0);
            loss += Math.max(-change, 0.0);
        }
        double avgGain = gain / period;
        double avgLoss = loss / period;
        out[period] = rsiValue(avgGain, avgLoss);
        for (int i = period + 1; i < n; i++) {
            double change = close[i] - close[i - 1];
            avgGain = (avgGain * (period - 1) + Math.max(change, 0.0)) / period;
            avgLoss = (avgLoss * (period - 1) + Math.max(-change, 0.0)) / period;
            out[i] = rsiValue(avgGain, avgLoss);
        }
        return out;
    }

    private static double rsiValue(double avgGain, double avgLoss) {
        if (avgLoss == 0.0) {
            return 100.0;
        }
        double rs = avgGain / avgLoss;
        return 100.0 - 100.0 / (1.0 + rs);
    }

    /**
     * EMA over {@code values} from {@code start}; the first value, at {@code start + period - 1},
     * is the simple average of the first {@code period} values.
     */
    static double[] ema(double[] values, int start, int period) {
        int n = values.length;
        double[] out = filledNaN(n);
        int seedAt = start + period - 1;
        if (seedAt >= n) {
            return out;
        }
        double sum = 0.0;
        for (int i = start; i <= seedAt; i++) {
            sum += values[i];
        }
        out[seedAt] = sum / period;
        double alpha = 2.0 / (period + 1.0);
        for (int i = seedAt + 1; i < n; i++) {
            out[i] = alpha * values[i] + (1.0 - alpha) * out[i - 1];
        }
        return out;
    }

    static double[] sma(double[] values, int period) {
        int n = values.length;
        double[] out = filledNaN(n);
        double sum = 0.0;
        for (int i = 0; i < n; i++) {
            sum += values[i];
            if (i >= period) {
                sum -= values[i - period];
            }
            if (i >= period - 1) {
                out[i] = sum / period;
            }
        }
        return out;
    }

    private static double[] populationStd(double[] values, double[] mean, int period) {
        int n = values.length;
        double[] out = filledNaN(n);
        for (int i = period - 1; i < n; i++) {
            double acc = 0.0;
            for (int j = i - period + 1; j <= i; j++) {
                double d = values[j] - mean[i];
                acc += d * d;
            }
            out[i] = Math.sqrt(acc / period);
        }
        return out;
    }

    private static double[] filledNaN(int n) {
        double[] out = new double[n];
        Arrays.fill(out, Double.NaN);
        return out;
    }
}
