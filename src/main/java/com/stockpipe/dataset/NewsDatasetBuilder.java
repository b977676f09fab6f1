package com.stockpipe.dataset;

import com.stockpipe.core.PipelineException;
import com.stockpipe.model.Label;
import com.stockpipe.model.NewsArticle;
import com.stockpipe.time.CutoffRule;
import org.json.JSONArray;
import org.json.JSONObject;

import java.io.BufferedWriter;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;

/**
 * Groups stored headlines by the session they can inform. Label keys follow {@link Label#key()}.
 */
public final class NewsDatasetBuilder {
    private final CutoffRule cutoffRule;

    public NewsDatasetBuilder(CutoffRule cutoffRule) {
        this.cutoffRule = cutoffRule;
    }

    public List<NewsDatasetRow> build(List<NewsArticle> articles, Map<String, Label> labelsByKey, boolean requireLabels) {
        List<NewsArticle> ordered = new ArrayList<>();
        for (NewsArticle a : articles) {
            if (a != null && a.publishedAt != null && a.title != null && !a.title.isBlank()) {
                ordered.add(a);
            }
        }
        ordered.sort(Comparator.comparing((NewsArticle a) -> a.publishedAt.toInstant()).thenComparing(a -> a.url));

        // ticker|date in natural order gives output sorted by ticker then date
        TreeMap<String, Set<String>> grouped = new TreeMap<>();
        Map<String, LocalDate> dateOfKey = new TreeMap<>();
        Map<String, String> tickerOfKey = new TreeMap<>();
        int skipped = articles.size() - ordered.size();
        for (NewsArticle a : ordered) {
            LocalDate predictionDate;
            try {
                predictionDate = cutoffRule.predictionDate(a.publishedAt);
            } catch (PipelineException e) {
                skipped++;
                continue;
            }
            String key = a.tickerFetchedFor + "|" + predictionDate;
            grouped.computeIfAbsent(key, k -> new LinkedHashSet<>()).add(a.title.trim());
            dateOfKey.put(key, predictionDate);
            tickerOfKey.put(key, a.tickerFetchedFor);
        }

        List<NewsDatasetRow> rows = new ArrayList<>();
        int unlabeled = 0;
        for (Map.Entry<String, Set<String>> e : grouped.entrySet()) {
            Label label = labelsByKey == null ? null : labelsByKey.get(e.getKey());
            if (label == null) {
                unlabeled++;
                if (requireLabels) {
                    continue;
                }
            }
            rows.add(NewsDatasetRow.builder()
                    .ticker(tickerOfKey.get(e.getKey()))
                    .predictionDate(dateOfKey.get(e.getKey()))
                    .headlines(List.copyOf(e.getValue()))
                    .label(label == null ? null : label.labelBinary)
                    .pctReturn(label == null ? null : label.pctReturn)
                    .build());
        }
        System.out.println("news dataset rows=" + rows.size()
                + " groups=" + grouped.size()
                + " unlabeled=" + unlabeled
                + " skipped_articles=" + skipped);
        return rows;
    }

    public static Path writeJsonLines(Path target, List<NewsDatasetRow> rows) throws IOException {
        if (target.getParent() != null) {
            Files.createDirectories(target.getParent());
        }
        try (BufferedWriter writer = Files.newBufferedWriter(target, StandardCharsets.UTF_8)) {
            for (NewsDatasetRow row : rows) {
                JSONObject obj = new JSONObject();
                obj.put("ticker", row.getTicker());
                obj.put("date", row.getPredictionDate().toString());
                obj.put("headlines", new JSONArray(row.getHeadlines()));
                obj.put("label", row.getLabel() == null ? JSONObject.NULL : row.getLabel());
                obj.put("pct_return", row.getPctReturn() == null ? JSONObject.NULL : row.getPctReturn());
                writer.write(obj.toString());
                writer.newLine();
            }
        }
        return target;
    }
}
