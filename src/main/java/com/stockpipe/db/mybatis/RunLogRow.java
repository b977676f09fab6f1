package com.stockpipe.db.mybatis;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.OffsetDateTime;

/**
 * run_log row; ticker lists and the error map are JSON text.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class RunLogRow {
    private Long id;
    private String runType;
    private String status;
    private String tickersAttempted;
    private String tickersSucceeded;
    private String tickersFailed;
    private Integer rowsAdded;
    private Integer duplicatesSkipped;
    private Integer rowsRejected;
    private OffsetDateTime startedAt;
    private OffsetDateTime finishedAt;
    private Long durationMs;
    private String errorMessages;
}
