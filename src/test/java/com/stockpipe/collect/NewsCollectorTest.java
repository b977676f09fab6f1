package com.stockpipe.collect;

import com.stockpipe.data.NewsSource;
import com.stockpipe.data.RawArticle;
import com.stockpipe.db.InMemoryNewsArticleStore;
import com.stockpipe.db.InMemoryRunLogStore;
import com.stockpipe.model.NewsArticle;
import com.stockpipe.model.RunRecord;
import com.stockpipe.time.Standardizer;
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
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertNull;

class NewsCollectorTest {
    private static final Clock CLOCK = Clock.fixed(Instant.parse("2026-02-06T22:00:00Z"), ZoneOffset.UTC);

    private final InMemoryNewsArticleStore store = new InMemoryNewsArticleStore();
    private final InMemoryRunLogStore runLog = new InMemoryRunLogStore();
    private final FakeNewsSource source = new FakeNewsSource();
    private final AtomicInteger permits = new AtomicInteger();

    private NewsCollector collector() {
        SlidingWindowRateLimiter limiter = new SlidingWindowRateLimiter(60, 60_000L, () -> permits.incrementAndGet() * 10L, ms -> { });
        return new NewsCollector(
                source,
                store,
                runLog,
                new RetryPolicy(3, 1L, ms -> { }),
                limiter,
                new RelevanceFilter(Map.of("AAPL", "Apple", "NVDA", "NVIDIA"), 0.10),
                new Standardizer(ZoneId.of("America/New_York")),
                CLOCK
        );
    }

    private static RawArticle item(String url, String headline, Object published) {
        return RawArticle.builder().url(url).headline(headline).source("Reuters").publishedRaw(published).build();
    }

    @Test
    void collect_shouldStoreEachUrlOnceAcrossTickers() {
        RawArticle shared = item("https://news.example.com/story-1", "Apple and NVIDIA sign chip deal", 1_770_000_000L);
        source.items.put("AAPL", List.of(shared));
        source.items.put("NVDA", List.of(shared));

        CollectionResult result = collector().collect(new LinkedHashSet<>(List.of("AAPL", "NVDA")), 7);

        assertEquals(1, store.size());
        assertEquals("AAPL", store.loadAll().get(0).tickerFetchedFor);
        assertEquals(1, result.rowsAdded());
        assertEquals(1, result.duplicatesSkipped());
        assertEquals(RunRecord.STATUS_SUCCESS, result.status());
    }

    @Test
    void collect_shouldBeIdempotentAcrossReruns() {
        source.items.put("AAPL", List.of(
                item("https://news.example.com/a", "Apple earnings", 1_770_000_000L),
                item("https://news.example.com/b", "AAPL options activity", "2026-02-05T14:00:00Z")
        ));

        collector().collect(Set.of("AAPL"), 7);
        CollectionResult second = collector().collect(Set.of("AAPL"), 7);

        assertEquals(2, store.size());
        assertEquals(0, second.rowsAdded());
        assertEquals(2, second.duplicatesSkipped());
    }

    @Test
    void collect_shouldTreatEmptyListAsSuccess() {
        source.items.put("AAPL", List.of());

        CollectionResult result = collector().collect(Set.of("AAPL"), 7);

        assertEquals(RunRecord.STATUS_SUCCESS, result.status());
        assertEquals(0, result.rowsAdded());
        assertEquals(1, source.calls.get());
    }

    @Test
    void collect_shouldCountRejectedItems() {
        source.items.put("AAPL", List.of(
                item("https://news.example.com/ok", "Apple ships", 1_770_000_000L),
                item("", "Apple without url", 1_770_000_000L),
                item("https://news.example.com/no-time", "Apple without time", null),
                item("https://news.example.com/bad-time", "Apple bad time", "sometime soon")
        ));

        CollectionResult result = collector().collect(Set.of("AAPL"), 7);

        assertEquals(1, result.rowsAdded());
        assertEquals(3, result.rowsRejected());
    }

    @Test
    void collect_shouldNormalizeTextUrlAndTimestamps() {
        source.items.put("AAPL", List.of(RawArticle.builder()
                .url("HTTPS://News.Example.com/a?id=7&utm_source=x#top")
                .headline("<b>Apple</b>&nbsp;rallies   again")
                .source("  ")
                .publishedRaw("2026-02-05T14:00:00Z")
                .build()));

        collector().collect(Set.of("AAPL"), 7);

        NewsArticle stored = store.loadAll().get(0);
        assertEquals("https://news.example.com/a?id=7", stored.url);
        assertEquals("Apple rallies again", stored.title);
        assertNull(stored.source);
        assertEquals(ZoneOffset.ofHours(-5), stored.publishedAt.getOffset());
        assertEquals(9, stored.publishedAt.getHour());
        assertNotNull(stored.collectedAt);
    }

    @Test
    void collect_shouldAcquireRatePermitPerCall() {
        source.items.put("AAPL", List.of(item("https://news.example.com/a", "Apple", 1_770_000_000L)));
        source.items.put("NVDA", List.of(item("https://news.example.com/b", "NVIDIA", 1_770_000_000L)));

        collector().collect(new LinkedHashSet<>(List.of("AAPL", "NVDA")), 7);

        assertEquals(2, source.calls.get());
        assertEquals(2, permits.get());
    }

    @Test
    void normalizeUrl_shouldDropTrackingParameters() {
        assertEquals("https://example.com/p?a=1",
                NewsCollector.normalizeUrl("https://Example.com/p?a=1&fbclid=zz&gclid=yy"));
        assertEquals("https://example.com/p", NewsCollector.normalizeUrl("https://example.com/p?utm_medium=mail"));
        assertEquals("", NewsCollector.normalizeUrl("   "));
    }

    private static final class FakeNewsSource implements NewsSource {
        final Map<String, List<RawArticle>> items = new HashMap<>();
        final AtomicInteger calls = new AtomicInteger();

        @Override
        public List<RawArticle> fetchCompanyNews(String ticker, LocalDate from, LocalDate to) {
            calls.incrementAndGet();
            return new ArrayList<>(items.getOrDefault(ticker, List.of()));
        }

        @Override
        public String name() {
            return "fake";
        }
    }
}
