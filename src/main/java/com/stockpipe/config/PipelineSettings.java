package com.stockpipe.config;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.nio.file.Path;
import java.time.LocalDate;
import java.time.LocalTime;
import java.time.ZoneId;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Typed view of the settings every pipeline component receives at construction.
 */
@Value
@Builder(toBuilder = true)
public class PipelineSettings {
    @Singular
    List<String> tickers;
    @Singular
    Map<String, String> companyNames;

    @Builder.Default
    ZoneId marketZone = ZoneId.of("America/New_York");
    @Builder.Default
    LocalTime cutoff = LocalTime.of(16, 0);
    @Singular
    Set<LocalDate> extraClosures;
    @Builder.Default
    int searchHorizonDays = 30;

    @Builder.Default
    int defaultDays = 21;
    @Builder.Default
    int retryMaxAttempts = 3;
    @Builder.Default
    long retryBaseDelayMs = 2000L;
    @Builder.Default
    int rateLimitMaxCalls = 60;
    @Builder.Default
    long rateLimitWindowMs = 60_000L;
    @Builder.Default
    double relevanceMinRetentionRatio = 0.10;

    @Builder.Default
    double trainRatio = 0.70;
    @Builder.Default
    double valRatio = 0.15;
    @Builder.Default
    int minSplitDates = 3;
    @Builder.Default
    int sequenceWindow = 60;

    @Builder.Default
    int newsMinArticles = 5;
    @Builder.Default
    double priceJumpThreshold = 0.20;
    @Builder.Default
    int newsFutureBufferMinutes = 10;

    @Builder.Default
    Path outputsDir = Path.of("outputs");

    public static PipelineSettings fromConfig(Config config) {
        List<String> tickers = new ArrayList<>();
        for (String raw : config.getList("tickers")) {
            tickers.add(raw.toUpperCase(Locale.ROOT));
        }
        Map<String, String> names = new LinkedHashMap<>();
        for (Map.Entry<String, String> e : config.getMap("tickers.company_names").entrySet()) {
            names.put(e.getKey().toUpperCase(Locale.ROOT), e.getValue());
        }
        Set<LocalDate> closures = new LinkedHashSet<>();
        for (String raw : config.getList("market.extra_closures")) {
            try {
                closures.add(LocalDate.parse(raw));
            } catch (DateTimeParseException e) {
                System.err.println("WARN: ignoring market.extra_closures entry=" + raw);
            }
        }

        return PipelineSettings.builder()
                .tickers(tickers)
                .companyNames(names)
                .marketZone(ZoneId.of(config.getString("market.zone", "America/New_York")))
                .cutoff(LocalTime.parse(config.getString("market.cutoff", "16:00")))
                .extraClosures(closures)
                .searchHorizonDays(Math.max(7, config.getInt("market.search_horizon_days", 30)))
                .defaultDays(Math.max(1, config.getInt("collect.default_days", 21)))
                .retryMaxAttempts(Math.max(1, config.getInt("collect.retry.max_attempts", 3)))
                .retryBaseDelayMs(Math.max(0L, config.getLong("collect.retry.base_delay_ms", 2000L)))
                .rateLimitMaxCalls(Math.max(1, config.getInt("news.rate_limit.max_calls", 60)))
                .rateLimitWindowMs(Math.max(1L, config.getLong("news.rate_limit.window_sec", 60L)) * 1000L)
                .relevanceMinRetentionRatio(config.getDouble("news.relevance.min_retention_ratio", 0.10))
                .trainRatio(config.getDouble("split.train_ratio", 0.70))
                .valRatio(config.getDouble("split.val_ratio", 0.15))
                .minSplitDates(Math.max(3, config.getInt("split.min_dates", 3)))
                .sequenceWindow(Math.max(1, config.getInt("sequence.window", 60)))
                .newsMinArticles(Math.max(0, config.getInt("validate.news.min_articles", 5)))
                .priceJumpThreshold(config.getDouble("validate.price.jump_threshold", 0.20))
                .newsFutureBufferMinutes(Math.max(0, config.getInt("validate.news.future_buffer_min", 10)))
                .outputsDir(config.getPath("outputs.dir"))
                .build();
    }

    public double testRatio() {
        return 1.0 - trainRatio - valRatio;
    }

    public String companyNameOf(String ticker) {
        if (ticker == null) {
            return "";
        }
        return companyNames.getOrDefault(ticker.toUpperCase(Locale.ROOT), "");
    }
}
