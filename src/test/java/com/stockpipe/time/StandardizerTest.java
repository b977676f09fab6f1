package com.stockpipe.time;

import com.stockpipe.core.MalformedDateException;
import org.junit.jupiter.api.Test;

import java.time.LocalDate;
import java.time.OffsetDateTime;
import java.time.ZoneId;
import java.time.ZoneOffset;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

class StandardizerTest {
    private final Standardizer standardizer = new Standardizer(ZoneId.of("America/New_York"));

    @Test
    void standardizeDate_shouldAcceptCommonProviderFormats() {
        LocalDate expected = LocalDate.of(2025, 3, 7);

        assertEquals(expected, standardizer.standardizeDate("2025-03-07"));
        assertEquals(expected, standardizer.standardizeDate("2025/03/07"));
        assertEquals(expected, standardizer.standardizeDate("03/07/2025"));
        assertEquals(expected, standardizer.standardizeDate("20250307"));
        assertEquals(expected, standardizer.standardizeDate("March 7, 2025"));
        assertEquals(expected, standardizer.standardizeDate("Mar 7, 2025"));
        assertEquals(expected, standardizer.standardizeDate(" 2025-03-07 "));
    }

    @Test
    void standardizeDate_shouldConvertZonedValuesToMarketDate() {
        // 02:00 UTC on the 8th is still the 7th in New York.
        assertEquals(LocalDate.of(2025, 3, 7), standardizer.standardizeDate("2025-03-08T02:00:00Z"));
    }

    @Test
    void standardizeDate_shouldRejectGarbage() {
        MalformedDateException e = assertThrows(MalformedDateException.class, () -> standardizer.standardizeDate("yesterday-ish"));
        assertEquals("yesterday-ish", e.rawValue());
        assertThrows(MalformedDateException.class, () -> standardizer.standardizeDate("2025-02-30"));
        assertThrows(MalformedDateException.class, () -> standardizer.standardizeDate(""));
        assertThrows(MalformedDateException.class, () -> standardizer.standardizeDate(null));
    }

    @Test
    void standardizeTimestamp_shouldReadEpochSecondsAndMillis() {
        OffsetDateTime fromSeconds = standardizer.standardizeTimestamp(1_700_000_000L);
        OffsetDateTime fromMillis = standardizer.standardizeTimestamp(1_700_000_000_000L);

        assertEquals(fromSeconds.toInstant(), fromMillis.toInstant());
        assertEquals(ZoneOffset.ofHours(-5), fromSeconds.getOffset());
        assertEquals(fromSeconds.toInstant(), standardizer.standardizeTimestamp("1700000000").toInstant());
    }

    @Test
    void standardizeTimestamp_shouldTreatNaiveValuesAsUtc() {
        OffsetDateTime ts = standardizer.standardizeTimestamp("2025-03-07 20:30:00");

        assertEquals(OffsetDateTime.of(2025, 3, 7, 15, 30, 0, 0, ZoneOffset.ofHours(-5)), ts);
    }

    @Test
    void standardizeTimestamp_shouldKeepExplicitOffsetInstant() {
        OffsetDateTime ts = standardizer.standardizeTimestamp("2025-07-01T12:00:00+02:00");

        assertEquals(OffsetDateTime.of(2025, 7, 1, 6, 0, 0, 0, ZoneOffset.ofHours(-4)), ts);
        assertEquals("2025-07-01T06:00:00-04:00", standardizer.formatTimestamp(ts));
    }

    @Test
    void standardizeTimestamp_shouldReadCompactDateAsStartOfDay() {
        OffsetDateTime ts = standardizer.standardizeTimestamp("20250307");

        assertEquals(LocalDate.of(2025, 3, 7), ts.toLocalDate());
        assertEquals(0, ts.getHour());
    }

    @Test
    void standardizeTimestamp_shouldRejectUnparseableText() {
        assertThrows(MalformedDateException.class, () -> standardizer.standardizeTimestamp("not a time"));
    }
}
