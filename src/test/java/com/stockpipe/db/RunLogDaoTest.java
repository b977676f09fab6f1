package com.stockpipe.db;

import com.stockpipe.db.mybatis.RunLogRow;
import com.stockpipe.model.RunRecord;
import org.junit.jupiter.api.Test;

import java.time.OffsetDateTime;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

class RunLogDaoTest {

    private static RunRecord sample() {
        OffsetDateTime start = OffsetDateTime.parse("2026-02-06T17:00:00-05:00");
        return RunRecord.builder()
                .runType("price_collection")
                .status(RunRecord.STATUS_PARTIAL)
                .attempted("AAPL")
                .attempted("BAD")
                .succeeded("AAPL")
                .failed("BAD")
                .rowsAdded(5)
                .duplicatesSkipped(2)
                .rowsRejected(1)
                .startedAt(start)
                .finishedAt(start.plusSeconds(3))
                .errorMessage("BAD", "HTTP 404 \"not found\"")
                .build();
    }

    @Test
    void toRow_shouldSerializeListsAndErrorsAsJson() {
        RunLogRow row = RunLogDao.toRow(sample());

        assertEquals("[\"AAPL\",\"BAD\"]", row.getTickersAttempted());
        assertEquals("[\"BAD\"]", row.getTickersFailed());
        assertEquals(Long.valueOf(3000L), row.getDurationMs());
        assertTrue(row.getErrorMessages().contains("\"BAD\""));
    }

    @Test
    void fromRow_shouldRestoreTheRecord() {
        RunRecord restored = RunLogDao.fromRow(RunLogDao.toRow(sample()));

        assertEquals(List.of("AAPL", "BAD"), restored.getTickersAttempted());
        assertEquals(List.of("AAPL"), restored.getTickersSucceeded());
        assertEquals(Map.of("BAD", "HTTP 404 \"not found\""), restored.getErrorMessages());
        assertEquals(5, restored.getRowsAdded());
        assertEquals(RunRecord.STATUS_PARTIAL, restored.getStatus());
    }

    @Test
    void toRow_shouldStoreNullWhenNoErrors() {
        RunRecord clean = sample().toBuilder().clearErrorMessages().status(RunRecord.STATUS_SUCCESS).build();

        assertNull(RunLogDao.toRow(clean).getErrorMessages());
    }

    @Test
    void fromRow_shouldTolerateUnreadableJson() {
        RunLogRow row = RunLogDao.toRow(sample());
        row.setTickersFailed("not json");
        row.setErrorMessages("{broken");

        RunRecord restored = RunLogDao.fromRow(row);

        assertTrue(restored.getTickersFailed().isEmpty());
        assertTrue(restored.getErrorMessages().isEmpty());
    }

    @Test
    void summarize_shouldDescribeRunsOrReportNone() {
        assertEquals("No runs in DB.", RunLogDao.summarize(List.of()));

        String text = RunLogDao.summarize(List.of(sample()));

        assertTrue(text.startsWith("Recent runs:"));
        assertTrue(text.contains("type=price_collection status=partial attempted=2 failed=1 added=5"));
    }

    @Test
    void statusOf_shouldDistinguishSuccessPartialAndFailed() {
        assertEquals(RunRecord.STATUS_SUCCESS, RunRecord.statusOf(3, 0));
        assertEquals(RunRecord.STATUS_PARTIAL, RunRecord.statusOf(3, 1));
        assertEquals(RunRecord.STATUS_FAILED, RunRecord.statusOf(3, 3));
    }
}
