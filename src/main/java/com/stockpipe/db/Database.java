package com.stockpipe.db;

import com.stockpipe.config.Config;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.postgresql.ds.PGSimpleDataSource;

import java.sql.Connection;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.Locale;
import java.util.Map;

/**
 * PostgreSQL access for the pipeline stores. Connections are opened per call with the
 * pipeline schema first on the search path, and optionally wrapped by {@link SqlLogProxy}.
 */
public final class Database {
    public static final String ENV_URL = "STOCKPIPE_DB_URL";
    public static final String ENV_USER = "STOCKPIPE_DB_USER";
    public static final String ENV_PASS = "STOCKPIPE_DB_PASS";

    private static final Logger SQL_LOG = LogManager.getLogger("SQL");
    private static final String DEFAULT_SCHEMA = "stockpipe";

    private final PGSimpleDataSource dataSource;
    private final String jdbcUrl;
    private final String schema;
    private final boolean sqlLogEnabled;

    public Database(String jdbcUrl, String user, String pass, String schema, boolean sqlLogEnabled) {
        this.jdbcUrl = requirePostgresUrl(jdbcUrl);
        this.schema = normalizeSchema(schema);
        this.sqlLogEnabled = sqlLogEnabled;
        this.dataSource = new PGSimpleDataSource();
        dataSource.setUrl(this.jdbcUrl);
        if (user != null && !user.isBlank()) {
            dataSource.setUser(user.trim());
        }
        if (pass != null) {
            dataSource.setPassword(pass);
        }
        dataSource.setCurrentSchema(this.schema);
        dataSource.setApplicationName("stockpipe");
    }

    /**
     * Connection settings from {@code db.*} keys; non-blank {@code STOCKPIPE_DB_*} variables win.
     */
    public static Database fromConfig(Config config, Map<String, String> env) {
        return new Database(
                firstNonBlank(env.get(ENV_URL), config.getString("db.url")),
                firstNonBlank(env.get(ENV_USER), config.getString("db.user")),
                firstNonBlank(env.get(ENV_PASS), config.getString("db.pass")),
                config.getString("db.schema", DEFAULT_SCHEMA),
                config.getBoolean("db.sql_log.enabled", false)
        );
    }

    public Connection connect() throws SQLException {
        Connection raw;
        try {
            raw = dataSource.getConnection();
        } catch (SQLException e) {
            String details = connectFailureDetails(e);
            System.err.println("ERROR: " + details);
            throw new SQLException(details, e.getSQLState(), e.getErrorCode(), e);
        }
        try (Statement st = raw.createStatement()) {
            st.execute("SET search_path TO " + schema + ", public");
        } catch (SQLException e) {
            raw.close();
            throw e;
        }
        return sqlLogEnabled ? SqlLogProxy.wrap(raw, SQL_LOG) : raw;
    }

    public String schema() {
        return schema;
    }

    public String describe() {
        return "url=" + maskedJdbcUrl() + " schema=" + schema + " sql_log=" + sqlLogEnabled;
    }

    public String maskedJdbcUrl() {
        return jdbcUrl
                .replaceAll("(?i)(password=)[^&]+", "$1***")
                .replaceAll("(://[^:/@]+:)[^@]+(@)", "$1***$2");
    }

    String connectFailureDetails(SQLException e) {
        return "db connect failed " + describe()
                + " hint=" + classifyConnectFailure(e)
                + " cause=" + (e.getMessage() == null ? "" : e.getMessage());
    }

    static String requirePostgresUrl(String raw) {
        if (raw == null || raw.isBlank()) {
            throw new IllegalArgumentException("db.url must not be empty");
        }
        String url = raw.trim();
        if (!url.toLowerCase(Locale.ROOT).startsWith("jdbc:postgresql:")) {
            throw new IllegalArgumentException("db.url must be a PostgreSQL JDBC URL (jdbc:postgresql://...)");
        }
        return url;
    }

    static String normalizeSchema(String raw) {
        String value = raw == null || raw.isBlank() ? DEFAULT_SCHEMA : raw.trim();
        if (!value.matches("[A-Za-z_][A-Za-z0-9_]*")) {
            throw new IllegalArgumentException("invalid db.schema, allowed pattern: [A-Za-z_][A-Za-z0-9_]*");
        }
        return value;
    }

    static String classifyConnectFailure(SQLException e) {
        String msg = e == null || e.getMessage() == null ? "" : e.getMessage().toLowerCase(Locale.ROOT);
        if (msg.contains("password authentication failed") || msg.contains("permission denied")) {
            return "auth";
        }
        if (msg.contains("connection refused") || msg.contains("connect timed out")) {
            return "unreachable";
        }
        if (msg.contains("does not exist")) {
            return "missing_database";
        }
        return "connection_error";
    }

    private static String firstNonBlank(String first, String second) {
        if (first != null && !first.isBlank()) {
            return first.trim();
        }
        return second == null ? "" : second.trim();
    }
}
