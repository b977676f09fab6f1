package com.stockpipe.db;

import com.stockpipe.model.RunRecord;

import java.sql.SQLException;
import java.util.List;

/**
 * Append-only run audit log.
 */
public interface RunLogStore {

    void append(RunRecord record) throws SQLException;

    /**
     * Most recent records first.
     */
    List<RunRecord> listRecent(int limit) throws SQLException;
}
