package com.stockpipe.time;

import com.stockpipe.core.NoTradingDayException;

import java.time.DayOfWeek;
import java.time.LocalDate;
import java.time.Month;
import java.time.temporal.TemporalAdjusters;
import java.util.Collection;
import java.util.HashSet;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * NYSE full-day closures computed by rule, plus configured one-off closures.
 * Early-close sessions count as ordinary trading days.
 */
public final class UsEquityCalendar implements TradingCalendar {
    private final Set<LocalDate> extraClosures;
    private final int searchHorizonDays;
    private final Map<Integer, Set<LocalDate>> holidaysByYear = new ConcurrentHashMap<>();

    public UsEquityCalendar() {
        this(Set.of(), 30);
    }

    public UsEquityCalendar(Collection<LocalDate> extraClosures, int searchHorizonDays) {
        this.extraClosures = extraClosures == null ? Set.of() : Set.copyOf(extraClosures);
        this.searchHorizonDays = Math.max(7, searchHorizonDays);
    }

    @Override
    public boolean isTradingDay(LocalDate date) {
        if (date == null) {
            return false;
        }
        DayOfWeek dow = date.getDayOfWeek();
        if (dow == DayOfWeek.SATURDAY || dow == DayOfWeek.SUNDAY) {
            return false;
        }
        if (extraClosures.contains(date)) {
            return false;
        }
        return !holidays(date.getYear()).contains(date);
    }

    @Override
    public LocalDate nextTradingDay(LocalDate date) {
        LocalDate cursor = date;
        for (int i = 0; i < searchHorizonDays; i++) {
            cursor = cursor.plusDays(1);
            if (isTradingDay(cursor)) {
                return cursor;
            }
        }
        throw new NoTradingDayException(date, searchHorizonDays);
    }

    @Override
    public LocalDate previousTradingDay(LocalDate date) {
        LocalDate cursor = date;
        for (int i = 0; i < searchHorizonDays; i++) {
            cursor = cursor.minusDays(1);
            if (isTradingDay(cursor)) {
                return cursor;
            }
        }
        throw new NoTradingDayException(date, searchHorizonDays);
    }

    public boolean isHoliday(LocalDate date) {
        return date != null && holidays(date.getYear()).contains(date);
    }

    private Set<LocalDate> holidays(int year) {
        return holidaysByYear.computeIfAbsent(year, UsEquityCalendar::computeHolidays);
    }

    static Set<LocalDate> computeHolidays(int year) {
        Set<LocalDate> out = new HashSet<>();

        // A Saturday New Year's Day is not made up on the preceding Friday.
        LocalDate newYear = LocalDate.of(year, Month.JANUARY, 1);
        if (newYear.getDayOfWeek() == DayOfWeek.SUNDAY) {
            out.add(newYear.plusDays(1));
        } else if (newYear.getDayOfWeek() != DayOfWeek.SATURDAY) {
            out.add(newYear);
        }

        out.add(nthWeekday(year, Month.JANUARY, DayOfWeek.MONDAY, 3));
        out.add(nthWeekday(year, Month.FEBRUARY, DayOfWeek.MONDAY, 3));
        out.add(easterSunday(year).minusDays(2));
        out.add(LocalDate.of(year, Month.MAY, 1).with(TemporalAdjusters.lastInMonth(DayOfWeek.MONDAY)));
        if (year >= 2022) {
            out.add(observed(LocalDate.of(year, Month.JUNE, 19)));
        }
        out.add(observed(LocalDate.of(year, Month.JULY, 4)));
        out.add(nthWeekday(year, Month.SEPTEMBER, DayOfWeek.MONDAY, 1));
        out.add(nthWeekday(year, Month.NOVEMBER, DayOfWeek.THURSDAY, 4));
        out.add(observed(LocalDate.of(year, Month.DECEMBER, 25)));
        return out;
    }

    private static LocalDate observed(LocalDate holiday) {
        DayOfWeek dow = holiday.getDayOfWeek();
        if (dow == DayOfWeek.SATURDAY) {
            return holiday.minusDays(1);
        }
        if (dow == DayOfWeek.SUNDAY) {
            return holiday.plusDays(1);
        }
        return holiday;
    }

    private static LocalDate nthWeekday(int year, Month month, DayOfWeek dow, int n) {
        return LocalDate.of(year, month, 1).with(TemporalAdjusters.dayOfWeekInMonth(n, dow));
    }

    // Anonymous Gregorian algorithm.
    static LocalDate easterSunday(int year) {
        int a = year % 19;
        int b = year / 100;
        int c = year % 100;
        int d = b / 4;
        int e = b % 4;
        int f = (b + 8) / 25;
        int g = (b - f + 1) / 3;
        int h = (19 * a + b - d - g + 15) % 30;
        int i = c / 4;
        int k = c % 4;
        int l = (32 + 2 * e + 2 * i - h - k) % 7;
        int m = (a + 11 * h + 22 * l) / 451;
        int month = (h + l - 7 * m + 114) / 31;
        int day = ((h + l - 7 * m + 114) % 31) + 1;
        return LocalDate.of(year, month, day);
    }
}
