package com.stockpipe.time;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;

/**
 * Sessions of the single exchange the pipeline tracks.
 */
public interface TradingCalendar {

    boolean isTradingDay(LocalDate date);

    /**
     * First trading day strictly after {@code date}.
     *
     * @throws com.stockpipe.core.NoTradingDayException when none exists within the search horizon
     */
    LocalDate nextTradingDay(LocalDate date);

    /**
     * Last trading day strictly before {@code date}.
     */
    LocalDate previousTradingDay(LocalDate date);

    default List<LocalDate> tradingDaysBetween(LocalDate startInclusive, LocalDate endInclusive) {
        List<LocalDate> out = new ArrayList<>();
        if (startInclusive == null || endInclusive == null || endInclusive.isBefore(startInclusive)) {
            return out;
        }
        for (LocalDate d = startInclusive; !d.isAfter(endInclusive); d = d.plusDays(1)) {
            if (isTradingDay(d)) {
                out.add(d);
            }
        }
        return out;
    }
}
