package com.stockpipe.dataset;

import com.stockpipe.db.LabelStore;
import com.stockpipe.db.PriceBarStore;
import com.stockpipe.model.Label;
import com.stockpipe.model.PriceBar;
import lombok.Value;

import java.sql.SQLException;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Derives next-session direction labels from stored closes. A label for date t uses the close of
 * the next stored bar after t, so the last bar of each series stays unlabeled until a newer bar
 * arrives.
 */
public final class LabelGenerator {
    private final PriceBarStore prices;
    private final LabelStore labels;

    public LabelGenerator(PriceBarStore prices, LabelStore labels) {
        this.prices = prices;
        this.labels = labels;
    }

    public LabelSummary generate(Collection<String> tickers) throws SQLException {
        Map<String, Integer> written = new LinkedHashMap<>();
        Map<String, Integer> existing = new LinkedHashMap<>();
        for (String raw : tickers) {
            String ticker = raw.trim().toUpperCase(Locale.ROOT);
            List<Label> computed = computeLabels(ticker, prices.loadSeries(ticker));
            int added = computed.isEmpty() ? 0 : labels.insertIfAbsent(computed);
            written.put(ticker, added);
            existing.put(ticker, computed.size() - added);
        }
        LabelSummary out = new LabelSummary(written, existing);
        System.out.println("labels done tickers=" + out.getWritten().size()
                + " written=" + out.totalWritten()
                + " existing=" + out.totalExisting());
        return out;
    }

    public static List<Label> computeLabels(String ticker, List<PriceBar> bars) {
        List<PriceBar> usable = new ArrayList<>();
        if (bars != null) {
            for (PriceBar bar : bars) {
                if (bar != null && bar.date != null && bar.close != null && bar.close > 0.0) {
                    usable.add(bar);
                }
            }
        }
        usable.sort(Comparator.comparing(b -> b.date));
        List<Label> out = new ArrayList<>();
        for (int i = 0; i + 1 < usable.size(); i++) {
            PriceBar today = usable.get(i);
            PriceBar next = usable.get(i + 1);
            if (next.date.equals(today.date)) {
                continue;
            }
            double pct = (next.close - today.close) / today.close;
            out.add(new Label(
                    ticker.toUpperCase(Locale.ROOT),
                    today.date,
                    next.close > today.close ? 1 : 0,
                    pct,
                    today.close,
                    next.close
            ));
        }
        return out;
    }

    @Value
    public static class LabelSummary {
        Map<String, Integer> written;
        Map<String, Integer> existing;

        public int totalWritten() {
            return written.values().stream().mapToInt(Integer::intValue).sum();
        }

        public int totalExisting() {
            return existing.values().stream().mapToInt(Integer::intValue).sum();
        }
    }
}
