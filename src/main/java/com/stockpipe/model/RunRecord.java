package com.stockpipe.model;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.time.Duration;
import java.time.OffsetDateTime;
import java.util.List;
import java.util.Map;

/**
 * Append-only audit entry describing one collection invocation.
 */
@Value
@Builder(toBuilder = true)
public class RunRecord {
    public static final String STATUS_SUCCESS = "success";
    public static final String STATUS_PARTIAL = "partial";
    public static final String STATUS_FAILED = "failed";

    String runType;
    String status;
    @Singular("attempted")
    List<String> tickersAttempted;
    @Singular("succeeded")
    List<String> tickersSucceeded;
    @Singular("failed")
    List<String> tickersFailed;
    int rowsAdded;
    int duplicatesSkipped;
    int rowsRejected;
    OffsetDateTime startedAt;
    OffsetDateTime finishedAt;
    @Singular
    Map<String, String> errorMessages;

    public static String statusOf(int attempted, int failed) {
        if (failed <= 0) {
            return STATUS_SUCCESS;
        }
        if (failed >= attempted) {
            return STATUS_FAILED;
        }
        return STATUS_PARTIAL;
    }

    public long durationMs() {
        if (startedAt == null || finishedAt == null) {
            return 0L;
        }
        return Math.max(0L, Duration.between(startedAt, finishedAt).toMillis());
    }
}
