package com.stockpipe.model;

import java.time.LocalDate;

/**
 * Next-session direction for (ticker, date). {@code pctReturn} is a fraction: 0.05 means +5%.
 */
public final class Label {
    public final String ticker;
    public final LocalDate date;
    public final int labelBinary;
    public final double pctReturn;
    public final double closeT;
    public final double closeNext;

    public Label(String ticker, LocalDate date, int labelBinary, double pctReturn, double closeT, double closeNext) {
        this.ticker = ticker;
        this.date = date;
        this.labelBinary = labelBinary;
        this.pctReturn = pctReturn;
        this.closeT = closeT;
        this.closeNext = closeNext;
    }

    public String key() {
        return ticker + "|" + date;
    }

    @Override
    public String toString() {
        return "Label{" + ticker + " " + date + " y=" + labelBinary + " ret=" + pctReturn + "}";
    }
}
