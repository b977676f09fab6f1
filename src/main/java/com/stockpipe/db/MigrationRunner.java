package com.stockpipe.db;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.ArrayList;
import java.util.List;

/**
 * Idempotent PostgreSQL schema migration runner.
 */
public final class MigrationRunner {
    static final int TARGET_VERSION = 1;

    public void run(Database database) throws SQLException {
        String schema = database.schema();
        try (Connection conn = database.connect(); Statement st = conn.createStatement()) {
            st.execute("CREATE SCHEMA IF NOT EXISTS " + schema);
            st.execute("SET search_path TO " + schema + ", public");
            st.execute("CREATE TABLE IF NOT EXISTS metadata (" +
                    "meta_key TEXT PRIMARY KEY," +
                    "meta_value TEXT NOT NULL," +
                    "updated_at TIMESTAMPTZ NOT NULL DEFAULT now()" +
                    ")");

            int currentVersion = readSchemaVersion(conn);
            String lastSql = "";
            try {
                for (String sql : buildStatements()) {
                    lastSql = sql;
                    st.execute(sql);
                }
                writeSchemaVersion(conn, TARGET_VERSION);
            } catch (SQLException e) {
                String detail = "migration_failed: schema_version=" + currentVersion
                        + ", target_version=" + TARGET_VERSION
                        + ", failed_sql=" + summarizeSql(lastSql)
                        + ", cause=" + (e.getMessage() == null ? "" : e.getMessage());
                System.err.println("ERROR: " + detail);
                throw new SQLException(detail, e.getSQLState(), e.getErrorCode(), e);
            }
            System.out.println("migration done schema=" + schema
                    + " from_version=" + currentVersion
                    + " to_version=" + TARGET_VERSION);
        }
    }

    static List<String> buildStatements() {
        List<String> sqls = new ArrayList<>();

        sqls.add("CREATE TABLE IF NOT EXISTS prices (" +
                "id BIGSERIAL PRIMARY KEY," +
                "ticker TEXT NOT NULL," +
                "date DATE NOT NULL," +
                "open DOUBLE PRECISION NULL," +
                "high DOUBLE PRECISION NULL," +
                "low DOUBLE PRECISION NULL," +
                "close DOUBLE PRECISION NULL," +
                "volume BIGINT NULL," +
                "adjusted_close DOUBLE PRECISION NULL," +
                "created_at TIMESTAMPTZ NOT NULL DEFAULT now()," +
                "UNIQUE (ticker, date)" +
                ")");

        sqls.add("CREATE TABLE IF NOT EXISTS news (" +
                "id BIGSERIAL PRIMARY KEY," +
                "url TEXT NOT NULL UNIQUE," +
                "ticker_fetched_for TEXT NOT NULL," +
                "title TEXT NULL," +
                "source TEXT NULL," +
                "published_at TIMESTAMPTZ NULL," +
                "summary TEXT NULL," +
                "collected_at TIMESTAMPTZ NOT NULL DEFAULT now()" +
                ")");

        sqls.add("CREATE TABLE IF NOT EXISTS labels (" +
                "id BIGSERIAL PRIMARY KEY," +
                "ticker TEXT NOT NULL," +
                "date DATE NOT NULL," +
                "label_binary SMALLINT NOT NULL CHECK (label_binary IN (0, 1))," +
                "pct_return DOUBLE PRECISION NOT NULL," +
                "close_t DOUBLE PRECISION NOT NULL," +
                "close_next DOUBLE PRECISION NOT NULL," +
                "created_at TIMESTAMPTZ NOT NULL DEFAULT now()," +
                "UNIQUE (ticker, date)" +
                ")");

        sqls.add("CREATE TABLE IF NOT EXISTS predictions (" +
                "id BIGSERIAL PRIMARY KEY," +
                "ticker TEXT NOT NULL," +
                "date DATE NOT NULL," +
                "model_name TEXT NOT NULL," +
                "probability DOUBLE PRECISION NULL," +
                "actual_outcome SMALLINT NULL," +
                "created_at TIMESTAMPTZ NOT NULL DEFAULT now()," +
                "UNIQUE (ticker, date, model_name)" +
                ")");

        sqls.add("CREATE TABLE IF NOT EXISTS run_log (" +
                "id BIGSERIAL PRIMARY KEY," +
                "run_type TEXT NOT NULL," +
                "status TEXT NOT NULL," +
                "tickers_attempted TEXT NOT NULL," +
                "tickers_succeeded TEXT NOT NULL," +
                "tickers_failed TEXT NOT NULL," +
                "rows_added INTEGER NOT NULL DEFAULT 0," +
                "duplicates_skipped INTEGER NOT NULL DEFAULT 0," +
                "rows_rejected INTEGER NOT NULL DEFAULT 0," +
                "started_at TIMESTAMPTZ NOT NULL," +
                "finished_at TIMESTAMPTZ NOT NULL," +
                "duration_ms BIGINT NOT NULL DEFAULT 0," +
                "error_messages TEXT NULL" +
                ")");

        sqls.add("CREATE INDEX IF NOT EXISTS idx_prices_ticker_date ON prices(ticker, date)");
        sqls.add("CREATE INDEX IF NOT EXISTS idx_news_ticker_published ON news(ticker_fetched_for, published_at)");
        sqls.add("CREATE INDEX IF NOT EXISTS idx_labels_date ON labels(date)");
        sqls.add("CREATE INDEX IF NOT EXISTS idx_run_log_started ON run_log(started_at DESC)");
        return sqls;
    }

    private int readSchemaVersion(Connection conn) throws SQLException {
        try (PreparedStatement ps = conn.prepareStatement("SELECT meta_value FROM metadata WHERE meta_key='schema_version'");
             ResultSet rs = ps.executeQuery()) {
            if (rs.next()) {
                String value = rs.getString(1);
                if (value != null && value.trim().matches("\\d+")) {
                    return Integer.parseInt(value.trim());
                }
            }
        }
        return 0;
    }

    private void writeSchemaVersion(Connection conn, int version) throws SQLException {
        try (PreparedStatement ps = conn.prepareStatement(
                "INSERT INTO metadata(meta_key, meta_value, updated_at) VALUES('schema_version', ?, now()) " +
                        "ON CONFLICT(meta_key) DO UPDATE SET meta_value=excluded.meta_value, updated_at=excluded.updated_at"
        )) {
            ps.setString(1, Integer.toString(version));
            ps.executeUpdate();
        }
    }

    static String summarizeSql(String sql) {
        if (sql == null || sql.trim().isEmpty()) {
            return "-";
        }
        String oneLine = sql.replaceAll("\\s+", " ").trim();
        if (oneLine.length() <= 180) {
            return oneLine;
        }
        return oneLine.substring(0, 177) + "...";
    }
}
