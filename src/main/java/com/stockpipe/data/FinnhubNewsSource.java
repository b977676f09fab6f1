package com.stockpipe.data;

import com.stockpipe.config.Config;
import com.stockpipe.core.TransientFetchException;
import com.stockpipe.data.http.HttpClientEx;
import org.json.JSONArray;
import org.json.JSONException;
import org.json.JSONObject;

import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Finnhub {@code /company-news}. The endpoint answers with a JSON array; an object body carries an error.
 */
public final class FinnhubNewsSource implements NewsSource {
    private final HttpClientEx http;
    private final String baseUrl;
    private final String apiKey;
    private final int timeoutSec;

    public FinnhubNewsSource(Config config, HttpClientEx http) {
        this.http = http;
        this.baseUrl = trimTrailingSlash(config.getString("news.finnhub.base_url", "https://finnhub.io/api/v1"));
        this.apiKey = config.requireString("news.finnhub.api_key");
        this.timeoutSec = Math.max(3, config.getInt("news.request_timeout_sec", 20));
    }

    @Override
    public String name() {
        return "finnhub";
    }

    @Override
    public List<RawArticle> fetchCompanyNews(String ticker, LocalDate from, LocalDate to) {
        String url = baseUrl + "/company-news"
                + "?symbol=" + URLEncoder.encode(ticker.trim().toUpperCase(Locale.ROOT), StandardCharsets.UTF_8)
                + "&from=" + from
                + "&to=" + to
                + "&token=" + URLEncoder.encode(apiKey, StandardCharsets.UTF_8);
        return parse(ticker, http.getText(url, timeoutSec));
    }

    static List<RawArticle> parse(String ticker, String body) {
        String text = body == null ? "" : body.trim();
        if (text.isEmpty()) {
            throw new TransientFetchException("no_data", "finnhub empty response ticker=" + ticker);
        }
        if (text.startsWith("{")) {
            String error = "";
            try {
                error = new JSONObject(text).optString("error", "");
            } catch (JSONException ignored) {
                // reported below as malformed
            }
            String category = error.toLowerCase(Locale.ROOT).contains("limit") ? "rate_limit" : "malformed_payload";
            throw new TransientFetchException(category, "finnhub error ticker=" + ticker + " error=" + error);
        }
        JSONArray array;
        try {
            array = new JSONArray(text);
        } catch (JSONException e) {
            throw new TransientFetchException("malformed_payload", "finnhub malformed payload ticker=" + ticker, e);
        }
        List<RawArticle> out = new ArrayList<>(array.length());
        for (int i = 0; i < array.length(); i++) {
            JSONObject item = array.optJSONObject(i);
            if (item == null) {
                continue;
            }
            out.add(RawArticle.builder()
                    .url(item.optString("url", null))
                    .headline(item.optString("headline", null))
                    .source(item.optString("source", null))
                    .summary(item.optString("summary", null))
                    .publishedRaw(item.has("datetime") && !item.isNull("datetime") ? item.get("datetime") : null)
                    .build());
        }
        return out;
    }

    private static String trimTrailingSlash(String url) {
        String out = url.trim();
        while (out.endsWith("/")) {
            out = out.substring(0, out.length() - 1);
        }
        return out;
    }
}
