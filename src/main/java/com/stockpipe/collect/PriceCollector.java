package com.stockpipe.collect;

import com.stockpipe.core.TransientFetchException;
import com.stockpipe.data.PriceSource;
import com.stockpipe.db.PriceBarStore;
import com.stockpipe.db.RunLogStore;
import com.stockpipe.model.PriceBar;

import java.sql.SQLException;
import java.time.Clock;
import java.time.LocalDate;
import java.time.ZoneId;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Pulls daily bars per ticker and stores them insert-if-absent. Re-running over the same
 * window adds nothing and reports the overlap as duplicates.
 */
public final class PriceCollector extends AbstractCollector {
    public static final String RUN_TYPE = "price_collection";

    private final PriceSource source;
    private final PriceBarStore store;
    private final RetryPolicy retryPolicy;

    public PriceCollector(
            PriceSource source,
            PriceBarStore store,
            RunLogStore runLog,
            RetryPolicy retryPolicy,
            Clock clock,
            ZoneId marketZone
    ) {
        super(runLog, clock, marketZone);
        this.source = source;
        this.store = store;
        this.retryPolicy = retryPolicy;
    }

    @Override
    public String runType() {
        return RUN_TYPE;
    }

    @Override
    TickerOutcome collectTicker(String ticker, LocalDate from, LocalDate to) throws SQLException {
        List<PriceBar> fetched = retryPolicy.execute(source.name() + ":" + ticker, () -> {
            List<PriceBar> bars = source.fetchDaily(ticker, from, to);
            if (bars == null || bars.isEmpty()) {
                throw new TransientFetchException("no_data", "empty price response ticker=" + ticker);
            }
            return bars;
        });

        List<PriceBar> valid = new ArrayList<>(fetched.size());
        Set<LocalDate> seen = new HashSet<>();
        int rejected = 0;
        int duplicates = 0;
        for (PriceBar bar : fetched) {
            if (!isStorable(bar)) {
                rejected++;
                continue;
            }
            if (!seen.add(bar.date)) {
                duplicates++;
                continue;
            }
            valid.add(new PriceBar(ticker, bar.date, bar.open, bar.high, bar.low, bar.close, bar.volume, bar.adjustedClose));
        }
        int added = store.insertIfAbsent(valid);
        duplicates += valid.size() - added;
        return new TickerOutcome(added, duplicates, rejected);
    }

    static boolean isStorable(PriceBar bar) {
        return bar != null
                && bar.date != null
                && bar.close != null
                && Double.isFinite(bar.close)
                && bar.close > 0.0;
    }
}
