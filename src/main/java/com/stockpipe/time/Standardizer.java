package com.stockpipe.time;

import com.stockpipe.core.MalformedDateException;

import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.time.format.ResolverStyle;
import java.util.Date;
import java.util.List;
import java.util.Locale;

/**
 * Converts provider date and timestamp values into the canonical forms stored by the pipeline:
 * {@code YYYY-MM-DD} dates and market-zone timestamps with an explicit offset.
 * <p>
 * Naive date-times (no offset, no zone) are read as UTC, which is how the news provider reports them.
 */
public final class Standardizer {
    private static final long EPOCH_MILLIS_THRESHOLD = 100_000_000_000L;

    private static final List<DateTimeFormatter> DATE_FORMATS = List.of(
            DateTimeFormatter.ISO_LOCAL_DATE,
            strict("uuuu/MM/dd"),
            strict("MM/dd/uuuu"),
            strict("uuuuMMdd"),
            strict("MMMM d, uuuu"),
            strict("MMM d, uuuu")
    );

    private final ZoneId marketZone;

    public Standardizer(ZoneId marketZone) {
        this.marketZone = marketZone == null ? ZoneId.of("America/New_York") : marketZone;
    }

    public ZoneId marketZone() {
        return marketZone;
    }

    public LocalDate standardizeDate(Object raw) {
        if (raw == null) {
            throw new MalformedDateException("null");
        }
        if (raw instanceof LocalDate) {
            return (LocalDate) raw;
        }
        if (raw instanceof LocalDateTime) {
            return ((LocalDateTime) raw).toLocalDate();
        }
        if (raw instanceof OffsetDateTime) {
            return ((OffsetDateTime) raw).atZoneSameInstant(marketZone).toLocalDate();
        }
        if (raw instanceof ZonedDateTime) {
            return ((ZonedDateTime) raw).withZoneSameInstant(marketZone).toLocalDate();
        }
        if (raw instanceof Instant) {
            return ((Instant) raw).atZone(marketZone).toLocalDate();
        }
        if (raw instanceof Date) {
            return ((Date) raw).toInstant().atZone(marketZone).toLocalDate();
        }

        String text = raw.toString().trim();
        if (text.isEmpty()) {
            throw new MalformedDateException(text);
        }
        for (DateTimeFormatter fmt : DATE_FORMATS) {
            try {
                return LocalDate.parse(text, fmt);
            } catch (DateTimeParseException ignored) {
                // try next format
            }
        }
        String isoText = text.replace(' ', 'T');
        try {
            return OffsetDateTime.parse(isoText).atZoneSameInstant(marketZone).toLocalDate();
        } catch (DateTimeParseException ignored) {
            // not offset
        }
        try {
            return LocalDateTime.parse(isoText).toLocalDate();
        } catch (DateTimeParseException e) {
            throw new MalformedDateException(text, e);
        }
    }

    public OffsetDateTime standardizeTimestamp(Object raw) {
        if (raw == null) {
            throw new MalformedDateException("null");
        }
        if (raw instanceof Number) {
            return fromEpoch(((Number) raw).longValue());
        }
        if (raw instanceof OffsetDateTime) {
            return toMarket(((OffsetDateTime) raw).toInstant());
        }
        if (raw instanceof ZonedDateTime) {
            return toMarket(((ZonedDateTime) raw).toInstant());
        }
        if (raw instanceof Instant) {
            return toMarket((Instant) raw);
        }
        if (raw instanceof Date) {
            return toMarket(((Date) raw).toInstant());
        }
        if (raw instanceof LocalDateTime) {
            return toMarket(((LocalDateTime) raw).toInstant(ZoneOffset.UTC));
        }
        if (raw instanceof LocalDate) {
            return ((LocalDate) raw).atStartOfDay(marketZone).toOffsetDateTime();
        }

        String text = raw.toString().trim();
        if (text.isEmpty()) {
            throw new MalformedDateException(text);
        }
        if (text.matches("\\d{8}")) {
            return standardizeDate(text).atStartOfDay(marketZone).toOffsetDateTime();
        }
        if (text.matches("-?\\d{1,15}")) {
            return fromEpoch(Long.parseLong(text));
        }
        String isoText = text.replace(' ', 'T');
        try {
            return toMarket(ZonedDateTime.parse(isoText, DateTimeFormatter.ISO_DATE_TIME).toInstant());
        } catch (DateTimeParseException ignored) {
            // no offset or zone
        }
        try {
            return toMarket(LocalDateTime.parse(isoText).toInstant(ZoneOffset.UTC));
        } catch (DateTimeParseException ignored) {
            // not a date-time
        }
        LocalDate dateOnly = standardizeDate(text);
        return dateOnly.atStartOfDay(marketZone).toOffsetDateTime();
    }

    public String formatDate(LocalDate date) {
        return date == null ? null : DateTimeFormatter.ISO_LOCAL_DATE.format(date);
    }

    public String formatTimestamp(OffsetDateTime ts) {
        return ts == null ? null : DateTimeFormatter.ISO_OFFSET_DATE_TIME.format(toMarket(ts.toInstant()));
    }

    private OffsetDateTime fromEpoch(long value) {
        Instant instant = Math.abs(value) >= EPOCH_MILLIS_THRESHOLD
                ? Instant.ofEpochMilli(value)
                : Instant.ofEpochSecond(value);
        return toMarket(instant);
    }

    private OffsetDateTime toMarket(Instant instant) {
        return instant.atZone(marketZone).toOffsetDateTime();
    }

    private static DateTimeFormatter strict(String pattern) {
        return DateTimeFormatter.ofPattern(pattern, Locale.US).withResolverStyle(ResolverStyle.STRICT);
    }
}
