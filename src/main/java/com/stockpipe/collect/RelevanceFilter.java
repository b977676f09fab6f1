package com.stockpipe.collect;

import com.stockpipe.data.RawArticle;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * Keeps headlines that name the ticker (as a word) or the company. When too few survive,
 * the provider's full answer is kept instead, since its own symbol filter already applied.
 */
public final class RelevanceFilter {
    private final Map<String, String> companyNames;
    private final double minRetentionRatio;

    public RelevanceFilter(Map<String, String> companyNames, double minRetentionRatio) {
        this.companyNames = companyNames == null ? Map.of() : Map.copyOf(companyNames);
        this.minRetentionRatio = Math.max(0.0, Math.min(1.0, minRetentionRatio));
    }

    public List<RawArticle> apply(String ticker, List<RawArticle> fetched) {
        if (fetched == null || fetched.isEmpty()) {
            return List.of();
        }
        String symbol = ticker.trim().toUpperCase(Locale.ROOT);
        Pattern symbolWord = Pattern.compile("\\b" + Pattern.quote(symbol) + "\\b", Pattern.CASE_INSENSITIVE);
        String company = companyNames.getOrDefault(symbol, "").toLowerCase(Locale.ROOT);

        List<RawArticle> relevant = new ArrayList<>();
        for (RawArticle article : fetched) {
            if (isRelevant(article.getHeadline(), symbolWord, company)) {
                relevant.add(article);
            }
        }
        double minKeep = minimumRetained(fetched.size());
        if (relevant.size() < minKeep) {
            System.out.println("relevance fallback ticker=" + symbol
                    + " relevant=" + relevant.size()
                    + " fetched=" + fetched.size()
                    + " min_keep=" + minKeep);
            return new ArrayList<>(fetched);
        }
        return relevant;
    }

    /**
     * Fewest relevant headlines that avoid the fallback. Not rounded: 1 of 15 at 10% falls back.
     */
    double minimumRetained(int fetchedCount) {
        return Math.max(1.0, fetchedCount * minRetentionRatio);
    }

    private boolean isRelevant(String headline, Pattern symbolWord, String company) {
        if (headline == null || headline.isBlank()) {
            return false;
        }
        if (symbolWord.matcher(headline).find()) {
            return true;
        }
        return !company.isEmpty() && headline.toLowerCase(Locale.ROOT).contains(company);
    }
}
