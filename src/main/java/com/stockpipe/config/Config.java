package com.stockpipe.config;

import java.io.IOException;
import java.io.InputStream;
import java.lang.reflect.Array;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Properties;

/**
 * Layered key/value configuration: built-in defaults, then classpath {@code config.properties},
 * then a {@code config.properties} in the working directory.
 */
public final class Config {

    private static final Map<String, String> DEFAULTS = buildDefaults();

    private final Properties props = new Properties();
    private final Properties resourceProps = new Properties();
    private final Properties overrideProps = new Properties();
    private final Path workingDir;

    private Config(Path workingDir) {
        this.workingDir = workingDir;
    }

    public static Config load(Path workingDir) {
        Config config = new Config(workingDir);
        try (InputStream in = Config.class.getClassLoader().getResourceAsStream("config.properties")) {
            config.readLayer(config.resourceProps, in, "classpath config.properties");
        } catch (IOException e) {
            System.err.println("WARN: failed to read classpath config.properties: " + e.getMessage());
        }
        Path local = workingDir.resolve("config.properties");
        if (Files.exists(local)) {
            try (InputStream in = Files.newInputStream(local)) {
                config.readLayer(config.overrideProps, in, local.toString());
            } catch (IOException e) {
                System.err.println("WARN: failed to read " + local + ": " + e.getMessage());
            }
        }
        return config;
    }

    private void readLayer(Properties layer, InputStream in, String origin) throws IOException {
        if (in == null) {
            return;
        }
        layer.load(in);
        props.putAll(layer);
        System.out.println("config layer loaded origin=" + origin + " keys=" + layer.size());
    }

    /**
     * Build a Config from an in-memory (possibly nested) map. Nested maps become dotted keys,
     * lists and arrays become comma separated values.
     */
    public static Config fromMap(Path workingDir, Map<String, ?> rawProperties) {
        Config config = new Config(workingDir);
        flattenInto(config, "", rawProperties);
        return config;
    }

    public Path workingDir() {
        return workingDir;
    }

    public String getString(String key) {
        String raw = props.getProperty(key);
        if (raw != null) {
            String trimmed = raw.trim();
            if (!trimmed.isEmpty()) {
                return trimmed;
            }
        }
        return DEFAULTS.getOrDefault(key, "");
    }

    public String getString(String key, String fallback) {
        String value = getString(key);
        if (value.isEmpty()) {
            return fallback;
        }
        return value;
    }

    public boolean getBoolean(String key) {
        String value = getString(key);
        if (value.isEmpty()) {
            return false;
        }
        return "true".equalsIgnoreCase(value)
                || "1".equals(value)
                || "yes".equalsIgnoreCase(value)
                || "y".equalsIgnoreCase(value);
    }

    public boolean getBoolean(String key, boolean fallback) {
        String value = getString(key);
        if (value.isEmpty()) {
            return fallback;
        }
        return getBoolean(key);
    }

    public int getInt(String key) {
        return getInt(key, parseInt(DEFAULTS.get(key), 0));
    }

    public int getInt(String key, int fallback) {
        return parseInt(getString(key), fallback);
    }

    public long getLong(String key, long fallback) {
        String value = getString(key);
        try {
            return Long.parseLong(value.trim());
        } catch (NumberFormatException e) {
            return fallback;
        }
    }

    public double getDouble(String key) {
        return getDouble(key, parseDouble(DEFAULTS.get(key), 0.0));
    }

    public double getDouble(String key, double fallback) {
        return parseDouble(getString(key), fallback);
    }

    public Path getPath(String key) {
        String value = getString(key);
        if (value.isEmpty()) {
            return workingDir;
        }
        return workingDir.resolve(value).normalize();
    }

    public List<String> getList(String key) {
        String value = getString(key);
        if (value.isEmpty()) {
            return List.of();
        }
        List<String> out = new ArrayList<>();
        for (String token : value.split("[,;]")) {
            String trimmed = token.trim();
            if (!trimmed.isEmpty()) {
                out.add(trimmed);
            }
        }
        return out;
    }

    /**
     * Reads {@code KEY=value;KEY2=value2} pairs. Entries without '=' are ignored.
     */
    public Map<String, String> getMap(String key) {
        String value = getString(key);
        Map<String, String> out = new LinkedHashMap<>();
        if (value.isEmpty()) {
            return out;
        }
        for (String token : value.split(";")) {
            int eq = token.indexOf('=');
            if (eq <= 0) {
                continue;
            }
            String k = token.substring(0, eq).trim();
            String v = token.substring(eq + 1).trim();
            if (!k.isEmpty() && !v.isEmpty()) {
                out.put(k, v);
            }
        }
        return out;
    }

    public String requireString(String key) {
        String value = getString(key);
        if (value.isEmpty()) {
            throw new IllegalArgumentException("missing required config: " + key);
        }
        return value;
    }

    /**
     * Which layer supplied {@code key}: {@code override}, {@code resource} or {@code default}.
     */
    public String sourceOf(String key) {
        if (key == null || key.trim().isEmpty()) {
            return "default";
        }
        if (!nonBlank(overrideProps.getProperty(key)).isEmpty()) {
            return "override";
        }
        if (!nonBlank(resourceProps.getProperty(key)).isEmpty()) {
            return "resource";
        }
        return "default";
    }

    private String nonBlank(String raw) {
        if (raw == null) {
            return "";
        }
        return raw.trim();
    }

    private static void flattenInto(Config config, String prefix, Object value) {
        if (config == null || value == null) {
            return;
        }
        if (value instanceof Map<?, ?> map) {
            for (Map.Entry<?, ?> entry : map.entrySet()) {
                String key = entry.getKey() == null ? "" : entry.getKey().toString().trim();
                if (key.isEmpty()) {
                    continue;
                }
                String fullKey = prefix.isEmpty() ? key : prefix + "." + key;
                flattenInto(config, fullKey, entry.getValue());
            }
            return;
        }
        if (value instanceof List<?> list) {
            List<String> parts = new ArrayList<>();
            for (Object item : list) {
                parts.add(stringify(item));
            }
            putBoundValue(config, prefix, String.join(",", parts));
            return;
        }
        if (value.getClass().isArray()) {
            int len = Array.getLength(value);
            List<String> parts = new ArrayList<>(len);
            for (int i = 0; i < len; i++) {
                parts.add(stringify(Array.get(value, i)));
            }
            putBoundValue(config, prefix, String.join(",", parts));
            return;
        }
        putBoundValue(config, prefix, stringify(value));
    }

    private static void putBoundValue(Config config, String key, String value) {
        if (key == null || key.trim().isEmpty()) {
            return;
        }
        String normalizedKey = key.trim();
        String normalizedValue = value == null ? "" : value;
        config.overrideProps.setProperty(normalizedKey, normalizedValue);
        config.props.setProperty(normalizedKey, normalizedValue);
    }

    private static String stringify(Object value) {
        return value == null ? "" : String.valueOf(value);
    }

    private static int parseInt(String value, int fallback) {
        if (value == null) {
            return fallback;
        }
        try {
            return Integer.parseInt(value.trim());
        } catch (NumberFormatException e) {
            return fallback;
        }
    }

    private static double parseDouble(String value, double fallback) {
        if (value == null) {
            return fallback;
        }
        try {
            return Double.parseDouble(value.trim());
        } catch (NumberFormatException e) {
            return fallback;
        }
    }

    private static Map<String, String> buildDefaults() {
        Map<String, String> defaults = new HashMap<>();

        defaults.put("outputs.dir", "outputs");
        defaults.put("db.url", "jdbc:postgresql://localhost:5432/stockpipe");
        defaults.put("db.user", "stockpipe");
        defaults.put("db.pass", "stockpipe");
        defaults.put("db.schema", "stockpipe");
        defaults.put("db.sql_log.enabled", "false");

        defaults.put("tickers", "AAPL,NVDA,WMT,LLY,JPM,XOM,MCD,TSLA,DAL,MAR,GS,NFLX,META,ORCL,PLTR");
        defaults.put("tickers.company_names", "");

        defaults.put("market.zone", "America/New_York");
        defaults.put("market.cutoff", "16:00");
        defaults.put("market.extra_closures", "");
        defaults.put("market.search_horizon_days", "30");

        defaults.put("collect.default_days", "21");
        defaults.put("collect.retry.max_attempts", "3");
        defaults.put("collect.retry.base_delay_ms", "2000");
        defaults.put("stooq.base_url", "https://stooq.com/q/d/l/?s=%s.us&i=d");
        defaults.put("stooq.request_timeout_sec", "20");
        defaults.put("news.finnhub.base_url", "https://finnhub.io/api/v1");
        defaults.put("news.finnhub.api_key", "");
        defaults.put("news.request_timeout_sec", "20");
        defaults.put("news.rate_limit.max_calls", "60");
        defaults.put("news.rate_limit.window_sec", "60");
        defaults.put("news.relevance.min_retention_ratio", "0.10");

        defaults.put("split.train_ratio", "0.70");
        defaults.put("split.val_ratio", "0.15");
        defaults.put("split.min_dates", "3");
        defaults.put("sequence.window", "60");
        defaults.put("validate.news.min_articles", "5");
        defaults.put("validate.price.jump_threshold", "0.20");
        defaults.put("validate.news.future_buffer_min", "10");

        return Collections.unmodifiableMap(defaults);
    }
}
