package com.stockpipe.model;

import java.time.LocalDate;
import java.util.Locale;

/**
 * One daily OHLCV observation. Numeric fields are nullable so gaps in provider data survive
 * until validation; {@code adjustedClose} is optional.
 */
public final class PriceBar {
    public final String ticker;
    public final LocalDate date;
    public final Double open;
    public final Double high;
    public final Double low;
    public final Double close;
    public final Long volume;
    public final Double adjustedClose;

    public PriceBar(String ticker, LocalDate date, Double open, Double high, Double low, Double close, Long volume) {
        this(ticker, date, open, high, low, close, volume, null);
    }

    public PriceBar(
            String ticker,
            LocalDate date,
            Double open,
            Double high,
            Double low,
            Double close,
            Long volume,
            Double adjustedClose
    ) {
        this.ticker = ticker == null ? null : ticker.trim().toUpperCase(Locale.ROOT);
        this.date = date;
        this.open = open;
        this.high = high;
        this.low = low;
        this.close = close;
        this.volume = volume;
        this.adjustedClose = adjustedClose;
    }

    public boolean hasAllFields() {
        return date != null && open != null && high != null && low != null && close != null && volume != null;
    }

    public String key() {
        return ticker + "|" + date;
    }

    @Override
    public String toString() {
        return "PriceBar{" + ticker + " " + date + " close=" + close + " volume=" + volume + "}";
    }
}
