package com.stockpipe.validate;

import com.stockpipe.db.NewsArticleStore;
import com.stockpipe.model.NewsArticle;
import lombok.Builder;
import lombok.Value;

import java.sql.SQLException;
import java.time.Clock;
import java.time.OffsetDateTime;
import java.util.ArrayList;
import java.util.Collection;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Read-only checks over stored articles: required fields, timestamps in the future relative to
 * collection time, duplicate urls and per-ticker coverage.
 */
public final class NewsDataValidator {
    private final NewsArticleStore store;
    private final int minArticles;
    private final int futureBufferMinutes;
    private final Clock clock;

    public NewsDataValidator(NewsArticleStore store, int minArticles, int futureBufferMinutes, Clock clock) {
        this.store = store;
        this.minArticles = Math.max(0, minArticles);
        this.futureBufferMinutes = Math.max(0, futureBufferMinutes);
        this.clock = clock == null ? Clock.systemUTC() : clock;
    }

    public Report validate(Collection<String> tickers) throws SQLException {
        OffsetDateTime now = OffsetDateTime.now(clock);
        List<String> missingFields = new ArrayList<>();
        List<String> futureTimestamps = new ArrayList<>();
        List<String> duplicateUrls = new ArrayList<>();
        Map<String, TickerStats> perTicker = new LinkedHashMap<>();
        List<String> lowCoverage = new ArrayList<>();
        Set<String> seenUrls = new HashSet<>();

        for (String raw : tickers) {
            String ticker = raw.trim().toUpperCase(Locale.ROOT);
            List<NewsArticle> articles = store.loadByTicker(ticker);
            OffsetDateTime earliest = null;
            OffsetDateTime latest = null;
            for (NewsArticle a : articles) {
                if (isBlank(a.title) || isBlank(a.source) || a.publishedAt == null) {
                    missingFields.add(a.url);
                }
                if (!seenUrls.add(a.url)) {
                    duplicateUrls.add(a.url);
                }
                if (a.publishedAt != null) {
                    OffsetDateTime reference = a.collectedAt == null ? now : a.collectedAt;
                    if (a.publishedAt.isAfter(reference.plusMinutes(futureBufferMinutes))) {
                        futureTimestamps.add(a.url);
                    }
                    if (earliest == null || a.publishedAt.isBefore(earliest)) {
                        earliest = a.publishedAt;
                    }
                    if (latest == null || a.publishedAt.isAfter(latest)) {
                        latest = a.publishedAt;
                    }
                }
            }
            perTicker.put(ticker, new TickerStats(articles.size(), earliest, latest));
            if (articles.size() < minArticles) {
                lowCoverage.add(ticker);
            }
        }

        Report report = Report.builder()
                .missingFieldUrls(missingFields)
                .futureTimestampUrls(futureTimestamps)
                .duplicateUrls(duplicateUrls)
                .perTicker(perTicker)
                .lowCoverageTickers(lowCoverage)
                .build();
        System.out.println("news validation tickers=" + perTicker.size()
                + " articles=" + report.totalArticles()
                + " missing_fields=" + missingFields.size()
                + " future_ts=" + futureTimestamps.size()
                + " duplicate_urls=" + duplicateUrls.size()
                + " low_coverage=" + lowCoverage);
        return report;
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }

    @Value
    public static class TickerStats {
        int count;
        OffsetDateTime earliest;
        OffsetDateTime latest;
    }

    @Value
    @Builder
    public static class Report {
        List<String> missingFieldUrls;
        List<String> futureTimestampUrls;
        List<String> duplicateUrls;
        Map<String, TickerStats> perTicker;
        List<String> lowCoverageTickers;

        public int totalArticles() {
            int total = 0;
            for (TickerStats s : perTicker.values()) {
                total += s.getCount();
            }
            return total;
        }

        public boolean passed() {
            return missingFieldUrls.isEmpty() && futureTimestampUrls.isEmpty() && duplicateUrls.isEmpty();
        }
    }
}
