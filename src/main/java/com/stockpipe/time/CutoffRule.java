package com.stockpipe.time;

import java.time.LocalDate;
import java.time.LocalTime;
import java.time.OffsetDateTime;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.util.Objects;

/**
 * Maps a publication instant to the first trading session whose close-to-close move can
 * still react to it. The result is always a trading day strictly after the publication date.
 * <ul>
 *     <li>trading day, before the cutoff: the next trading day</li>
 *     <li>trading day, at or after the cutoff: the trading day after that</li>
 *     <li>weekend or holiday: the first trading day after that date</li>
 * </ul>
 */
public final class CutoffRule {
    private final TradingCalendar calendar;
    private final LocalTime cutoff;
    private final ZoneId marketZone;

    public CutoffRule(TradingCalendar calendar, LocalTime cutoff, ZoneId marketZone) {
        this.calendar = Objects.requireNonNull(calendar, "calendar");
        this.cutoff = cutoff == null ? LocalTime.of(16, 0) : cutoff;
        this.marketZone = marketZone == null ? ZoneId.of("America/New_York") : marketZone;
    }

    public LocalDate predictionDate(OffsetDateTime publishedAt) {
        Objects.requireNonNull(publishedAt, "publishedAt");
        ZonedDateTime local = publishedAt.atZoneSameInstant(marketZone);
        LocalDate day = local.toLocalDate();
        if (!calendar.isTradingDay(day)) {
            return calendar.nextTradingDay(day);
        }
        LocalDate next = calendar.nextTradingDay(day);
        if (local.toLocalTime().isBefore(cutoff)) {
            return next;
        }
        return calendar.nextTradingDay(next);
    }

    public LocalTime cutoff() {
        return cutoff;
    }

    public ZoneId marketZone() {
        return marketZone;
    }
}
