package com.stockpipe.db;

import com.stockpipe.db.mybatis.MyBatisSupport;
import com.stockpipe.db.mybatis.RunLogMapper;
import com.stockpipe.db.mybatis.RunLogRow;
import com.stockpipe.model.RunRecord;
import org.apache.ibatis.session.SqlSession;
import org.json.JSONArray;
import org.json.JSONException;
import org.json.JSONObject;

import java.sql.Connection;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.TreeMap;

/**
 * DAO for the append-only run_log table. Ticker lists are JSON arrays, errors a JSON object keyed by ticker.
 */
public final class RunLogDao implements RunLogStore {
    private final Database database;

    public RunLogDao(Database database) {
        this.database = database;
    }

    @Override
    public void append(RunRecord record) throws SQLException {
        try (Connection conn = database.connect();
             SqlSession session = MyBatisSupport.openSession(conn)) {
            conn.setAutoCommit(false);
            session.getMapper(RunLogMapper.class).insertRunLog(toRow(record));
            conn.commit();
        }
    }

    @Override
    public List<RunRecord> listRecent(int limit) throws SQLException {
        List<RunRecord> out = new ArrayList<>();
        try (Connection conn = database.connect();
             SqlSession session = MyBatisSupport.openSession(conn)) {
            for (RunLogRow row : session.getMapper(RunLogMapper.class).listRecent(Math.max(1, limit))) {
                out.add(fromRow(row));
            }
        }
        return out;
    }

    public String summarizeRecentRuns(int limit) throws SQLException {
        return summarize(listRecent(limit));
    }

    static String summarize(List<RunRecord> runs) {
        if (runs.isEmpty()) {
            return "No runs in DB.";
        }
        StringBuilder sb = new StringBuilder();
        sb.append("Recent runs:\n");
        for (RunRecord run : runs) {
            sb.append(String.format(
                    Locale.US,
                    "type=%s status=%s attempted=%d failed=%d added=%d duplicates=%d rejected=%d started=%s duration_ms=%d\n",
                    run.getRunType(),
                    run.getStatus(),
                    run.getTickersAttempted().size(),
                    run.getTickersFailed().size(),
                    run.getRowsAdded(),
                    run.getDuplicatesSkipped(),
                    run.getRowsRejected(),
                    run.getStartedAt(),
                    run.durationMs()
            ));
        }
        return sb.toString().trim();
    }

    static RunLogRow toRow(RunRecord record) {
        JSONObject errors = new JSONObject();
        for (Map.Entry<String, String> e : new TreeMap<>(record.getErrorMessages()).entrySet()) {
            errors.put(e.getKey(), e.getValue());
        }
        return RunLogRow.builder()
                .runType(record.getRunType())
                .status(record.getStatus())
                .tickersAttempted(toJsonArray(record.getTickersAttempted()))
                .tickersSucceeded(toJsonArray(record.getTickersSucceeded()))
                .tickersFailed(toJsonArray(record.getTickersFailed()))
                .rowsAdded(record.getRowsAdded())
                .duplicatesSkipped(record.getDuplicatesSkipped())
                .rowsRejected(record.getRowsRejected())
                .startedAt(record.getStartedAt())
                .finishedAt(record.getFinishedAt())
                .durationMs(record.durationMs())
                .errorMessages(errors.isEmpty() ? null : errors.toString())
                .build();
    }

    static RunRecord fromRow(RunLogRow row) {
        return RunRecord.builder()
                .runType(row.getRunType())
                .status(row.getStatus())
                .tickersAttempted(fromJsonArray(row.getTickersAttempted()))
                .tickersSucceeded(fromJsonArray(row.getTickersSucceeded()))
                .tickersFailed(fromJsonArray(row.getTickersFailed()))
                .rowsAdded(row.getRowsAdded() == null ? 0 : row.getRowsAdded())
                .duplicatesSkipped(row.getDuplicatesSkipped() == null ? 0 : row.getDuplicatesSkipped())
                .rowsRejected(row.getRowsRejected() == null ? 0 : row.getRowsRejected())
                .startedAt(row.getStartedAt())
                .finishedAt(row.getFinishedAt())
                .errorMessages(fromJsonObject(row.getErrorMessages()))
                .build();
    }

    private static String toJsonArray(Collection<String> values) {
        return new JSONArray(values).toString();
    }

    private static List<String> fromJsonArray(String text) {
        List<String> out = new ArrayList<>();
        if (text == null || text.isBlank()) {
            return out;
        }
        try {
            JSONArray array = new JSONArray(text);
            for (int i = 0; i < array.length(); i++) {
                out.add(array.optString(i, ""));
            }
        } catch (JSONException e) {
            System.err.println("WARN: run_log list unreadable value=" + text);
        }
        return out;
    }

    private static Map<String, String> fromJsonObject(String text) {
        Map<String, String> out = new LinkedHashMap<>();
        if (text == null || text.isBlank()) {
            return out;
        }
        try {
            JSONObject obj = new JSONObject(text);
            for (String key : new TreeMap<>(obj.toMap()).keySet()) {
                out.put(key, obj.optString(key, ""));
            }
        } catch (JSONException e) {
            System.err.println("WARN: run_log errors unreadable value=" + text);
        }
        return out;
    }
}
