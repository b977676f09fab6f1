package com.stockpipe.validate;

import com.stockpipe.db.PriceBarStore;
import com.stockpipe.model.PriceBar;
import com.stockpipe.time.TradingCalendar;
import lombok.Builder;
import lombok.Value;

import java.sql.SQLException;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Collection;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Read-only quality checks over stored bars. Large moves and zero-volume days are reported as
 * flags for review; they are not errors.
 */
public final class PriceDataValidator {
    private final PriceBarStore store;
    private final TradingCalendar calendar;
    private final double jumpThreshold;

    public PriceDataValidator(PriceBarStore store, TradingCalendar calendar, double jumpThreshold) {
        this.store = store;
        this.calendar = calendar;
        this.jumpThreshold = jumpThreshold <= 0 ? 0.20 : jumpThreshold;
    }

    public Report validate(Collection<String> tickers) throws SQLException {
        List<String> missingFields = new ArrayList<>();
        List<Anomaly> anomalies = new ArrayList<>();
        List<String> zeroVolume = new ArrayList<>();
        Map<String, Coverage> coverage = new LinkedHashMap<>();

        for (String raw : tickers) {
            String ticker = raw.trim().toUpperCase(Locale.ROOT);
            List<PriceBar> bars = store.loadSeries(ticker);
            Double prevClose = null;
            for (PriceBar bar : bars) {
                if (!bar.hasAllFields()) {
                    missingFields.add(ticker + "|" + bar.date + "|" + describeMissing(bar));
                }
                if (bar.volume != null && bar.volume == 0L) {
                    zeroVolume.add(ticker + "|" + bar.date);
                }
                if (bar.close != null && prevClose != null && prevClose > 0.0) {
                    double change = bar.close / prevClose - 1.0;
                    if (Math.abs(change) > jumpThreshold) {
                        anomalies.add(new Anomaly(ticker, bar.date, prevClose, bar.close, change));
                    }
                }
                if (bar.close != null) {
                    prevClose = bar.close;
                }
            }
            coverage.put(ticker, coverageOf(bars));
        }

        Report report = Report.builder()
                .missingFieldRows(missingFields)
                .priceAnomalies(anomalies)
                .zeroVolumeDays(zeroVolume)
                .coverage(coverage)
                .build();
        System.out.println("price validation tickers=" + coverage.size()
                + " missing_fields=" + missingFields.size()
                + " anomalies=" + anomalies.size()
                + " zero_volume=" + zeroVolume.size()
                + " gaps=" + report.totalGaps());
        return report;
    }

    private Coverage coverageOf(List<PriceBar> bars) {
        if (bars.isEmpty()) {
            return new Coverage(null, null, 0, List.of());
        }
        LocalDate first = bars.get(0).date;
        LocalDate last = bars.get(bars.size() - 1).date;
        Set<LocalDate> present = new HashSet<>();
        for (PriceBar bar : bars) {
            present.add(bar.date);
        }
        List<LocalDate> gaps = new ArrayList<>();
        for (LocalDate expected : calendar.tradingDaysBetween(first, last)) {
            if (!present.contains(expected)) {
                gaps.add(expected);
            }
        }
        return new Coverage(first, last, bars.size(), gaps);
    }

    private static String describeMissing(PriceBar bar) {
        List<String> fields = new ArrayList<>();
        if (bar.open == null) {
            fields.add("open");
        }
        if (bar.high == null) {
            fields.add("high");
        }
        if (bar.low == null) {
            fields.add("low");
        }
        if (bar.close == null) {
            fields.add("close");
        }
        if (bar.volume == null) {
            fields.add("volume");
        }
        return String.join(",", fields);
    }

    @Value
    public static class Anomaly {
        String ticker;
        LocalDate date;
        double previousClose;
        double close;
        double change;
    }

    @Value
    public static class Coverage {
        LocalDate first;
        LocalDate last;
        int tradingDays;
        List<LocalDate> missingDays;

        public int gapCount() {
            return missingDays.size();
        }
    }

    @Value
    @Builder
    public static class Report {
        List<String> missingFieldRows;
        List<Anomaly> priceAnomalies;
        List<String> zeroVolumeDays;
        Map<String, Coverage> coverage;

        public boolean passed() {
            return missingFieldRows.isEmpty();
        }

        public int totalGaps() {
            int total = 0;
            for (Coverage c : coverage.values()) {
                total += c.gapCount();
            }
            return total;
        }
    }
}
