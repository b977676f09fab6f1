package com.stockpipe.data;

import com.stockpipe.core.TransientFetchException;
import com.stockpipe.model.PriceBar;
import org.junit.jupiter.api.Test;

import java.time.LocalDate;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class StooqPriceSourceTest {

    @Test
    void parseCsv_shouldReadRowsSortedByDate() {
        String body = "Date,Open,High,Low,Close,Volume\n"
                + "2025-03-07,101.0,103.5,100.2,102.8,1200000\n"
                + "2025-03-06,99.0,101.0,98.5,100.5,1500000\n";

        List<PriceBar> bars = StooqPriceSource.parseCsv("aapl", body);

        assertEquals(2, bars.size());
        assertEquals(LocalDate.of(2025, 3, 6), bars.get(0).date);
        assertEquals("AAPL", bars.get(0).ticker);
        assertEquals(102.8, bars.get(1).close, 1e-12);
        assertEquals(1_200_000L, bars.get(1).volume);
    }

    @Test
    void parseCsv_shouldKeepUnparseableFieldsAsNull() {
        String body = "Date,Open,High,Low,Close,Volume\r\n2025-03-07,abc,103.5,100.2,102.8,\r\n";

        PriceBar bar = StooqPriceSource.parseCsv("AAPL", body).get(0);

        assertNull(bar.open);
        assertNull(bar.volume);
        assertEquals(102.8, bar.close, 1e-12);
    }

    @Test
    void parseCsv_shouldClassifyEmptyAndLimitBodiesAsTransient() {
        assertEquals("no_data", assertThrows(TransientFetchException.class,
                () -> StooqPriceSource.parseCsv("AAPL", "No data")).category());
        assertEquals("no_data", assertThrows(TransientFetchException.class,
                () -> StooqPriceSource.parseCsv("AAPL", "  ")).category());
        assertEquals("rate_limit", assertThrows(TransientFetchException.class,
                () -> StooqPriceSource.parseCsv("AAPL", "Exceeded the daily hits limit")).category());
    }

    @Test
    void parseCsv_shouldRejectUnexpectedHeader() {
        TransientFetchException e = assertThrows(TransientFetchException.class,
                () -> StooqPriceSource.parseCsv("AAPL", "<html>maintenance</html>"));

        assertEquals("malformed_payload", e.category());
        assertTrue(e.getMessage().contains("unexpected_stooq_payload"));
    }
}
