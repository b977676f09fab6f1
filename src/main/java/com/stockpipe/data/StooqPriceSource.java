package com.stockpipe.data;

import com.stockpipe.config.Config;
import com.stockpipe.core.TransientFetchException;
import com.stockpipe.data.http.HttpClientEx;
import com.stockpipe.model.PriceBar;

import java.time.LocalDate;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;

/**
 * Daily bars from the Stooq CSV endpoint ({@code Date,Open,High,Low,Close,Volume}).
 * Stooq prices are already split-adjusted, so no separate adjusted close is reported.
 */
public final class StooqPriceSource implements PriceSource {
    private static final DateTimeFormatter RANGE_FMT = DateTimeFormatter.BASIC_ISO_DATE;

    private final HttpClientEx http;
    private final String baseUrl;
    private final int timeoutSec;

    public StooqPriceSource(Config config, HttpClientEx http) {
        this.http = http;
        this.baseUrl = config.getString("stooq.base_url", "https://stooq.com/q/d/l/?s=%s.us&i=d");
        this.timeoutSec = Math.max(3, config.getInt("stooq.request_timeout_sec", 20));
    }

    @Override
    public String name() {
        return "stooq";
    }

    @Override
    public List<PriceBar> fetchDaily(String ticker, LocalDate from, LocalDate to) {
        String symbol = ticker.trim().toLowerCase(Locale.ROOT);
        String url = String.format(baseUrl, symbol)
                + "&d1=" + RANGE_FMT.format(from)
                + "&d2=" + RANGE_FMT.format(to);
        String body = http.getText(url, timeoutSec);
        List<PriceBar> bars = parseCsv(ticker, body);
        List<PriceBar> inRange = new ArrayList<>(bars.size());
        for (PriceBar bar : bars) {
            if (bar.date == null || (!bar.date.isBefore(from) && !bar.date.isAfter(to))) {
                inRange.add(bar);
            }
        }
        return inRange;
    }

    static List<PriceBar> parseCsv(String ticker, String body) {
        String text = body == null ? "" : body.trim();
        if (text.isEmpty() || text.equalsIgnoreCase("No data")) {
            throw new TransientFetchException("no_data", "stooq empty response ticker=" + ticker);
        }
        if (text.toLowerCase(Locale.ROOT).contains("exceeded the daily hits limit")) {
            throw new TransientFetchException("rate_limit", "stooq_rate_limit ticker=" + ticker);
        }

        String[] lines = text.split("\\r?\\n");
        String header = lines[0].trim().toLowerCase(Locale.ROOT);
        if (!header.startsWith("date,open,high,low,close")) {
            String sample = text.length() > 120 ? text.substring(0, 120) : text;
            throw new TransientFetchException("malformed_payload", "unexpected_stooq_payload:" + sample);
        }

        List<PriceBar> out = new ArrayList<>(Math.max(16, lines.length));
        for (int i = 1; i < lines.length; i++) {
            String line = lines[i].trim();
            if (line.isEmpty()) {
                continue;
            }
            String[] cols = line.split(",", -1);
            out.add(new PriceBar(
                    ticker,
                    parseDate(col(cols, 0)),
                    parseDouble(col(cols, 1)),
                    parseDouble(col(cols, 2)),
                    parseDouble(col(cols, 3)),
                    parseDouble(col(cols, 4)),
                    parseLong(col(cols, 5))
            ));
        }
        out.sort(Comparator.comparing(b -> b.date, Comparator.nullsFirst(Comparator.naturalOrder())));
        return out;
    }

    private static String col(String[] cols, int idx) {
        return idx < cols.length ? cols[idx].trim() : "";
    }

    private static LocalDate parseDate(String raw) {
        try {
            return raw.isEmpty() ? null : LocalDate.parse(raw);
        } catch (DateTimeParseException e) {
            return null;
        }
    }

    private static Double parseDouble(String raw) {
        if (raw.isEmpty() || raw.equalsIgnoreCase("null")) {
            return null;
        }
        try {
            return Double.parseDouble(raw);
        } catch (NumberFormatException e) {
            return null;
        }
    }

    private static Long parseLong(String raw) {
        Double value = parseDouble(raw);
        return value == null ? null : Math.round(value);
    }
}
