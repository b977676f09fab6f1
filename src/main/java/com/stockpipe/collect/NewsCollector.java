package com.stockpipe.collect;

import com.stockpipe.core.MalformedDateException;
import com.stockpipe.data.NewsSource;
import com.stockpipe.data.RawArticle;
import com.stockpipe.db.NewsArticleStore;
import com.stockpipe.db.RunLogStore;
import com.stockpipe.model.NewsArticle;
import com.stockpipe.time.Standardizer;
import org.jsoup.Jsoup;

import java.net.URI;
import java.sql.SQLException;
import java.time.Clock;
import java.time.LocalDate;
import java.time.OffsetDateTime;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Pulls company news per ticker under the shared rate limit, keeps relevant headlines and
 * stores them insert-if-absent on url. The first ticker to store a url owns it.
 */
public final class NewsCollector extends AbstractCollector {
    public static final String RUN_TYPE = "news_collection";

    private static final Set<String> TRACKING_PARAMS = Set.of("guccounter", "guce_referrer", "guce_referrer_sig", "fbclid", "gclid");

    private final NewsSource source;
    private final NewsArticleStore store;
    private final RetryPolicy retryPolicy;
    private final SlidingWindowRateLimiter rateLimiter;
    private final RelevanceFilter relevanceFilter;
    private final Standardizer standardizer;
    private final Clock clock;

    public NewsCollector(
            NewsSource source,
            NewsArticleStore store,
            RunLogStore runLog,
            RetryPolicy retryPolicy,
            SlidingWindowRateLimiter rateLimiter,
            RelevanceFilter relevanceFilter,
            Standardizer standardizer,
            Clock clock
    ) {
        super(runLog, clock, standardizer.marketZone());
        this.source = source;
        this.store = store;
        this.retryPolicy = retryPolicy;
        this.rateLimiter = rateLimiter;
        this.relevanceFilter = relevanceFilter;
        this.standardizer = standardizer;
        this.clock = clock == null ? Clock.systemUTC() : clock;
    }

    @Override
    public String runType() {
        return RUN_TYPE;
    }

    @Override
    TickerOutcome collectTicker(String ticker, LocalDate from, LocalDate to) throws SQLException {
        List<RawArticle> fetched = retryPolicy.execute(source.name() + ":" + ticker, () -> {
            rateLimiter.acquire();
            List<RawArticle> items = source.fetchCompanyNews(ticker, from, to);
            return items == null ? List.<RawArticle>of() : items;
        });
        if (fetched.isEmpty()) {
            return new TickerOutcome(0, 0, 0);
        }

        List<RawArticle> kept = relevanceFilter.apply(ticker, fetched);
        OffsetDateTime collectedAt = OffsetDateTime.now(clock).atZoneSameInstant(standardizer.marketZone()).toOffsetDateTime();
        Map<String, NewsArticle> byUrl = new LinkedHashMap<>();
        int rejected = 0;
        int duplicates = 0;
        for (RawArticle raw : kept) {
            String url = normalizeUrl(raw.getUrl());
            String title = cleanText(raw.getHeadline());
            if (url.isEmpty() || title.isEmpty() || raw.getPublishedRaw() == null) {
                rejected++;
                continue;
            }
            OffsetDateTime publishedAt;
            try {
                publishedAt = standardizer.standardizeTimestamp(raw.getPublishedRaw());
            } catch (MalformedDateException e) {
                rejected++;
                continue;
            }
            if (byUrl.containsKey(url)) {
                duplicates++;
                continue;
            }
            String source = cleanText(raw.getSource());
            String summary = cleanText(raw.getSummary());
            byUrl.put(url, new NewsArticle(
                    url,
                    ticker,
                    title,
                    source.isEmpty() ? null : source,
                    publishedAt,
                    summary.isEmpty() ? null : summary,
                    collectedAt
            ));
        }

        List<NewsArticle> batch = new ArrayList<>(byUrl.values());
        int added = store.insertIfAbsent(batch);
        duplicates += batch.size() - added;
        return new TickerOutcome(added, duplicates, rejected);
    }

    static String cleanText(String raw) {
        if (raw == null) {
            return "";
        }
        return Jsoup.parse(raw).text()
                .replace('\u00A0', ' ')
                .replaceAll("\\s+", " ")
                .trim();
    }

    /**
     * Drops fragments and tracking parameters so the same story shared with different
     * campaign tags maps to one url.
     */
    static String normalizeUrl(String raw) {
        if (raw == null || raw.trim().isEmpty()) {
            return "";
        }
        String text = raw.trim();
        URI uri;
        try {
            uri = URI.create(text);
        } catch (IllegalArgumentException e) {
            return text;
        }
        if (uri.getHost() == null || uri.getHost().isEmpty()) {
            return text;
        }
        StringBuilder out = new StringBuilder();
        out.append(uri.getScheme() == null ? "https" : uri.getScheme().toLowerCase(Locale.ROOT))
                .append("://")
                .append(uri.getHost().toLowerCase(Locale.ROOT));
        if (uri.getPort() > 0) {
            out.append(':').append(uri.getPort());
        }
        out.append(uri.getRawPath() == null ? "" : uri.getRawPath());
        String query = uri.getRawQuery();
        if (query != null && !query.isEmpty()) {
            List<String> kept = new ArrayList<>();
            for (String token : query.split("&")) {
                int eq = token.indexOf('=');
                String key = (eq > 0 ? token.substring(0, eq) : token).toLowerCase(Locale.ROOT);
                if (key.isEmpty() || key.startsWith("utm_") || TRACKING_PARAMS.contains(key)) {
                    continue;
                }
                kept.add(token);
            }
            if (!kept.isEmpty()) {
                out.append('?').append(String.join("&", kept));
            }
        }
        return out.toString();
    }
}
