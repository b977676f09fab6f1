package com.stockpipe.collect;

import com.stockpipe.db.RunLogStore;
import com.stockpipe.model.RunRecord;

import java.sql.SQLException;
import java.time.Clock;
import java.time.LocalDate;
import java.time.OffsetDateTime;
import java.time.ZoneId;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Per-ticker loop shared by the collectors. A failing ticker is recorded and the batch continues;
 * the run record is appended once at the end.
 */
abstract class AbstractCollector implements Collector {
    private final RunLogStore runLog;
    private final Clock clock;
    private final ZoneId marketZone;

    AbstractCollector(RunLogStore runLog, Clock clock, ZoneId marketZone) {
        this.runLog = runLog;
        this.clock = clock == null ? Clock.systemUTC() : clock;
        this.marketZone = marketZone == null ? ZoneId.of("America/New_York") : marketZone;
    }

    /**
     * Fetch, validate and store one ticker's rows for [from, to].
     */
    abstract TickerOutcome collectTicker(String ticker, LocalDate from, LocalDate to) throws SQLException;

    @Override
    public final CollectionResult collect(Set<String> tickers, int days) {
        if (days <= 0) {
            throw new IllegalArgumentException("days must be positive, got " + days);
        }
        OffsetDateTime startedAt = OffsetDateTime.now(clock).atZoneSameInstant(marketZone).toOffsetDateTime();
        LocalDate to = startedAt.toLocalDate();
        LocalDate from = to.minusDays(days);

        Set<String> normalized = normalizeTickers(tickers);
        List<String> succeeded = new ArrayList<>();
        List<String> failed = new ArrayList<>();
        Map<String, String> errors = new LinkedHashMap<>();
        int added = 0;
        int duplicates = 0;
        int rejected = 0;

        for (String ticker : normalized) {
            try {
                TickerOutcome outcome = collectTicker(ticker, from, to);
                added += outcome.added;
                duplicates += outcome.duplicates;
                rejected += outcome.rejected;
                succeeded.add(ticker);
                System.out.println(runType() + " ticker=" + ticker
                        + " added=" + outcome.added
                        + " duplicates=" + outcome.duplicates
                        + " rejected=" + outcome.rejected);
            } catch (SQLException | RuntimeException e) {
                String message = e.getMessage() == null ? e.getClass().getSimpleName() : e.getMessage();
                failed.add(ticker);
                errors.put(ticker, message);
                System.err.println("WARN: " + runType() + " failed ticker=" + ticker + " cause=" + message);
            }
        }

        OffsetDateTime finishedAt = OffsetDateTime.now(clock).atZoneSameInstant(marketZone).toOffsetDateTime();
        RunRecord record = RunRecord.builder()
                .runType(runType())
                .status(RunRecord.statusOf(normalized.size(), failed.size()))
                .tickersAttempted(normalized)
                .tickersSucceeded(succeeded)
                .tickersFailed(failed)
                .rowsAdded(added)
                .duplicatesSkipped(duplicates)
                .rowsRejected(rejected)
                .startedAt(startedAt)
                .finishedAt(finishedAt)
                .errorMessages(errors)
                .build();

        boolean logged = true;
        try {
            runLog.append(record);
        } catch (SQLException | RuntimeException e) {
            logged = false;
            System.err.println("ERROR: run_log append failed run_type=" + runType() + " cause=" + e.getMessage());
        }
        System.out.println(runType() + " done status=" + record.getStatus()
                + " attempted=" + normalized.size()
                + " failed=" + failed.size()
                + " added=" + added
                + " duplicates=" + duplicates
                + " rejected=" + rejected
                + " duration_ms=" + record.durationMs());
        return new CollectionResult(record, logged);
    }

    static Set<String> normalizeTickers(Set<String> tickers) {
        Set<String> out = new LinkedHashSet<>();
        if (tickers == null) {
            return out;
        }
        for (String raw : tickers) {
            if (raw != null && !raw.isBlank()) {
                out.add(raw.trim().toUpperCase(Locale.ROOT));
            }
        }
        return out;
    }

    static final class TickerOutcome {
        final int added;
        final int duplicates;
        final int rejected;

        TickerOutcome(int added, int duplicates, int rejected) {
            this.added = added;
            this.duplicates = duplicates;
            this.rejected = rejected;
        }
    }
}
