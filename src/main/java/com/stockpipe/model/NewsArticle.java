package com.stockpipe.model;

import java.time.OffsetDateTime;
import java.util.Locale;

/**
 * A headline keyed by its url. {@code tickerFetchedFor} records which ticker's query first returned it.
 */
public final class NewsArticle {
    public final String url;
    public final String tickerFetchedFor;
    public final String title;
    public final String source;
    public final OffsetDateTime publishedAt;
    public final String summary;
    public final OffsetDateTime collectedAt;

    public NewsArticle(String url, String tickerFetchedFor, String title, String source, OffsetDateTime publishedAt) {
        this(url, tickerFetchedFor, title, source, publishedAt, null, null);
    }

    public NewsArticle(
            String url,
            String tickerFetchedFor,
            String title,
            String source,
            OffsetDateTime publishedAt,
            String summary,
            OffsetDateTime collectedAt
    ) {
        this.url = url;
        this.tickerFetchedFor = tickerFetchedFor == null ? null : tickerFetchedFor.trim().toUpperCase(Locale.ROOT);
        this.title = title;
        this.source = source;
        this.publishedAt = publishedAt;
        this.summary = summary;
        this.collectedAt = collectedAt;
    }

    public NewsArticle withCollectedAt(OffsetDateTime at) {
        return new NewsArticle(url, tickerFetchedFor, title, source, publishedAt, summary, at);
    }
}
