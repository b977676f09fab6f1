package com.stockpipe.db.mybatis;

import org.apache.ibatis.annotations.Insert;
import org.apache.ibatis.annotations.Options;
import org.apache.ibatis.annotations.Param;
import org.apache.ibatis.annotations.Select;

import java.util.List;

public interface RunLogMapper {
    @Insert("INSERT INTO run_log(run_type, status, tickers_attempted, tickers_succeeded, tickers_failed, " +
            "rows_added, duplicates_skipped, rows_rejected, started_at, finished_at, duration_ms, error_messages) " +
            "VALUES(#{runType}, #{status}, #{tickersAttempted}, #{tickersSucceeded}, #{tickersFailed}, " +
            "#{rowsAdded}, #{duplicatesSkipped}, #{rowsRejected}, #{startedAt}, #{finishedAt}, #{durationMs}, " +
            "#{errorMessages,jdbcType=VARCHAR})")
    @Options(useGeneratedKeys = true, keyProperty = "id", keyColumn = "id")
    int insertRunLog(RunLogRow row);

    @Select("SELECT id, run_type, status, tickers_attempted, tickers_succeeded, tickers_failed, rows_added, " +
            "duplicates_skipped, rows_rejected, started_at, finished_at, duration_ms, error_messages " +
            "FROM run_log ORDER BY id DESC LIMIT #{limit}")
    List<RunLogRow> listRecent(@Param("limit") int limit);
}
