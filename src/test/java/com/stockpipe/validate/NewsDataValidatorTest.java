package com.stockpipe.validate;

import com.stockpipe.db.InMemoryNewsArticleStore;
import com.stockpipe.model.NewsArticle;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class NewsDataValidatorTest {
    private static final Clock CLOCK = Clock.fixed(Instant.parse("2026-02-06T22:00:00Z"), ZoneOffset.UTC);
    private static final OffsetDateTime COLLECTED = OffsetDateTime.parse("2026-02-06T12:00:00-05:00");

    private final InMemoryNewsArticleStore store = new InMemoryNewsArticleStore();
    private final NewsDataValidator validator = new NewsDataValidator(store, 2, 10, CLOCK);

    private static NewsArticle article(String url, String ticker, String title, OffsetDateTime published) {
        return new NewsArticle(url, ticker, title, "Reuters", published, null, COLLECTED);
    }

    @Test
    void validate_shouldSummarizeCoveragePerTicker() throws Exception {
        store.insertIfAbsent(List.of(
                article("u1", "AAPL", "a", COLLECTED.minusHours(5)),
                article("u2", "AAPL", "b", COLLECTED.minusHours(1)),
                article("u3", "NVDA", "c", COLLECTED.minusHours(2))
        ));

        NewsDataValidator.Report report = validator.validate(List.of("AAPL", "NVDA"));

        assertTrue(report.passed());
        assertEquals(3, report.totalArticles());
        assertEquals(2, report.getPerTicker().get("AAPL").getCount());
        assertEquals(COLLECTED.minusHours(5), report.getPerTicker().get("AAPL").getEarliest());
        assertEquals(COLLECTED.minusHours(1), report.getPerTicker().get("AAPL").getLatest());
        assertEquals(List.of("NVDA"), report.getLowCoverageTickers());
    }

    @Test
    void validate_shouldFlagFutureTimestampsBeyondBuffer() throws Exception {
        store.insertIfAbsent(List.of(
                article("ok", "AAPL", "within buffer", COLLECTED.plusMinutes(9)),
                article("late", "AAPL", "from the future", COLLECTED.plusMinutes(11))
        ));

        NewsDataValidator.Report report = validator.validate(List.of("AAPL"));

        assertEquals(List.of("late"), report.getFutureTimestampUrls());
        assertFalse(report.passed());
    }

    @Test
    void validate_shouldFlagMissingFieldsAndDuplicateUrls() throws Exception {
        store.insertIfAbsent(List.of(article("no-title", "AAPL", " ", COLLECTED.minusHours(1))));
        store.addUnchecked(article("dup", "AAPL", "first", COLLECTED.minusHours(2)));
        store.addUnchecked(article("dup", "AAPL", "second", COLLECTED.minusHours(3)));

        NewsDataValidator.Report report = validator.validate(List.of("AAPL"));

        assertEquals(List.of("no-title"), report.getMissingFieldUrls());
        assertEquals(List.of("dup"), report.getDuplicateUrls());
    }
}
