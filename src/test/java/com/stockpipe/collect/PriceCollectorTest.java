package com.stockpipe.collect;

import com.stockpipe.core.PipelineException;
import com.stockpipe.core.TransientFetchException;
import com.stockpipe.data.PriceSource;
import com.stockpipe.db.InMemoryPriceBarStore;
import com.stockpipe.db.InMemoryRunLogStore;
import com.stockpipe.model.PriceBar;
import com.stockpipe.model.RunRecord;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class PriceCollectorTest {
    private static final Clock CLOCK = Clock.fixed(Instant.parse("2026-02-06T22:00:00Z"), ZoneOffset.UTC);
    private static final ZoneId NY = ZoneId.of("America/New_York");

    private final InMemoryPriceBarStore store = new InMemoryPriceBarStore();
    private final InMemoryRunLogStore runLog = new InMemoryRunLogStore();
    private final FakePriceSource source = new FakePriceSource();
    private final List<Long> sleeps = new ArrayList<>();

    private PriceCollector collector() {
        return new PriceCollector(source, store, runLog, new RetryPolicy(3, 2000L, sleeps::add), CLOCK, NY);
    }

    private static PriceBar bar(String ticker, String date, double close) {
        return new PriceBar(ticker, LocalDate.parse(date), close - 1, close + 1, close - 2, close, 1_000L);
    }

    @Test
    void collect_shouldBeIdempotentAcrossReruns() {
        source.bars.put("AAPL", List.of(bar("AAPL", "2026-02-04", 100), bar("AAPL", "2026-02-05", 101)));

        CollectionResult first = collector().collect(Set.of("AAPL"), 7);
        CollectionResult second = collector().collect(Set.of("AAPL"), 7);

        assertEquals(2, first.rowsAdded());
        assertEquals(0, first.duplicatesSkipped());
        assertEquals(0, second.rowsAdded());
        assertEquals(2, second.duplicatesSkipped());
        assertEquals(2, store.size());
        assertEquals(2, runLog.all().size());
    }

    @Test
    void collect_shouldRequestWindowEndingTodayInMarketZone() {
        source.bars.put("AAPL", List.of(bar("AAPL", "2026-02-05", 100)));

        collector().collect(Set.of("AAPL"), 21);

        assertEquals(LocalDate.of(2026, 2, 6), source.lastTo);
        assertEquals(LocalDate.of(2026, 1, 16), source.lastFrom);
    }

    @Test
    void collect_shouldRejectUnstorableBarsAndDedupeWithinBatch() {
        source.bars.put("AAPL", List.of(
                bar("AAPL", "2026-02-03", 100),
                bar("AAPL", "2026-02-03", 100),
                new PriceBar("AAPL", LocalDate.parse("2026-02-04"), 1.0, 1.0, 1.0, null, 10L),
                new PriceBar("AAPL", LocalDate.parse("2026-02-05"), 1.0, 1.0, 1.0, -3.0, 10L),
                new PriceBar("AAPL", null, 1.0, 1.0, 1.0, 5.0, 10L)
        ));

        CollectionResult result = collector().collect(Set.of("AAPL"), 7);

        assertEquals(1, result.rowsAdded());
        assertEquals(1, result.duplicatesSkipped());
        assertEquals(3, result.rowsRejected());
        assertEquals(RunRecord.STATUS_SUCCESS, result.status());
    }

    @Test
    void collect_shouldIsolateFailingTickerAndReportPartial() {
        source.bars.put("AAPL", List.of(bar("AAPL", "2026-02-05", 100)));
        source.permanentFailures.add("BAD");
        Set<String> tickers = new LinkedHashSet<>(List.of("AAPL", "BAD"));

        CollectionResult result = collector().collect(tickers, 7);

        assertEquals(List.of("AAPL"), result.succeeded());
        assertEquals(List.of("BAD"), result.failed());
        assertTrue(result.errors().get("BAD").contains("HTTP 404"));
        assertEquals(RunRecord.STATUS_PARTIAL, result.status());
        assertEquals(1, result.rowsAdded());
        assertEquals(1, source.calls.get("BAD"));
    }

    @Test
    void collect_shouldRetryEmptyResponseThenFailTicker() {
        CollectionResult result = collector().collect(Set.of("MSFT"), 7);

        assertEquals(3, source.calls.get("MSFT"));
        assertEquals(List.of(2000L, 4000L), sleeps);
        assertEquals(RunRecord.STATUS_FAILED, result.status());
        assertTrue(result.errors().get("MSFT").contains("retries_exhausted"));
    }

    @Test
    void collect_shouldRecoverWhenRetrySucceeds() {
        source.bars.put("AAPL", List.of(bar("AAPL", "2026-02-05", 100)));
        source.transientFailuresLeft.put("AAPL", 2);

        CollectionResult result = collector().collect(Set.of("AAPL"), 7);

        assertEquals(3, source.calls.get("AAPL"));
        assertEquals(1, result.rowsAdded());
        assertEquals(RunRecord.STATUS_SUCCESS, result.status());
    }

    @Test
    void collect_shouldKeepRowsWhenRunLogAppendFails() {
        source.bars.put("AAPL", List.of(bar("AAPL", "2026-02-05", 100)));
        runLog.failAppends = true;

        CollectionResult result = collector().collect(Set.of("AAPL"), 7);

        assertFalse(result.isRunLogged());
        assertEquals(1, store.size());
    }

    @Test
    void collect_shouldRejectNonPositiveDays() {
        assertThrows(IllegalArgumentException.class, () -> collector().collect(Set.of("AAPL"), 0));
    }

    @Test
    void collect_shouldNormalizeTickersAndRecordRun() {
        source.bars.put("AAPL", List.of(bar("AAPL", "2026-02-05", 100)));

        collector().collect(new LinkedHashSet<>(List.of(" aapl ", "AAPL")), 7);

        RunRecord record = runLog.all().get(0);
        assertEquals(PriceCollector.RUN_TYPE, record.getRunType());
        assertEquals(List.of("AAPL"), record.getTickersAttempted());
        assertEquals(1, source.calls.get("AAPL"));
    }

    private static final class FakePriceSource implements PriceSource {
        final Map<String, List<PriceBar>> bars = new HashMap<>();
        final Set<String> permanentFailures = new LinkedHashSet<>();
        final Map<String, Integer> transientFailuresLeft = new HashMap<>();
        final Map<String, Integer> calls = new HashMap<>();
        LocalDate lastFrom;
        LocalDate lastTo;

        @Override
        public List<PriceBar> fetchDaily(String ticker, LocalDate from, LocalDate to) {
            calls.merge(ticker, 1, Integer::sum);
            lastFrom = from;
            lastTo = to;
            if (permanentFailures.contains(ticker)) {
                throw new PipelineException("HTTP 404 for " + ticker);
            }
            int left = transientFailuresLeft.getOrDefault(ticker, 0);
            if (left > 0) {
                transientFailuresLeft.put(ticker, left - 1);
                throw new TransientFetchException("timeout", "slow " + ticker);
            }
            return bars.getOrDefault(ticker, List.of());
        }

        @Override
        public String name() {
            return "fake";
        }
    }
}
