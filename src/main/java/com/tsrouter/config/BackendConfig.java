package com.tsrouter.config;

import com.tsrouter.exception.ConfigException;

import java.net.URI;
import java.net.URISyntaxException;
import java.util.Objects;

/**
 * Immutable definition of one backend: where it lives and how writes,
 * queries and health checks against it are tuned. All durations are in milliseconds.
 */
public final class BackendConfig {

    public static final int DEFAULT_INTERVAL_MS = 1000;
    public static final int DEFAULT_TIMEOUT_MS = 10000;
    public static final int DEFAULT_QUERY_TIMEOUT_MS = 600000;
    public static final int DEFAULT_MAX_ROW_LIMIT = 10000;
    public static final int DEFAULT_CHECK_INTERVAL_MS = 1000;
    public static final int DEFAULT_REWRITE_INTERVAL_MS = 10000;

    private final String name;
    private final String url;
    private final String db;
    private final String zone;
    private final int interval;
    private final int timeout;
    private final int timeoutQuery;
    private final int maxRowLimit;
    private final int checkInterval;
    private final int rewriteInterval;
    private final boolean writeOnly;

    public BackendConfig(String name, String url, String db, String zone,
                         int interval, int timeout, int timeoutQuery, int maxRowLimit,
                         int checkInterval, int rewriteInterval, boolean writeOnly) {
        String key = "b:" + name;
        if (name == null || name.isBlank()) {
            throw new ConfigException(key, "backend name is empty");
        }
        if (db == null || db.isBlank()) {
            throw new ConfigException(key, "db is required");
        }
        this.name = name;
        this.url = validateUrl(key, url);
        this.db = db;
        this.zone = zone != null ? zone : "";
        this.interval = positive(key, "interval", interval);
        this.timeout = positive(key, "timeout", timeout);
        this.timeoutQuery = positive(key, "timeoutquery", timeoutQuery);
        this.maxRowLimit = positive(key, "maxrowlimit", maxRowLimit);
        this.checkInterval = positive(key, "checkinterval", checkInterval);
        this.rewriteInterval = positive(key, "rewriteinterval", rewriteInterval);
        this.writeOnly = writeOnly;
    }

    /**
     * Backend with default tuning.
     */
    public BackendConfig(String name, String url, String db, String zone) {
        this(name, url, db, zone, DEFAULT_INTERVAL_MS, DEFAULT_TIMEOUT_MS, DEFAULT_QUERY_TIMEOUT_MS,
             DEFAULT_MAX_ROW_LIMIT, DEFAULT_CHECK_INTERVAL_MS, DEFAULT_REWRITE_INTERVAL_MS, false);
    }

    /**
     * Builds a backend from its store record. Absent or zero numbers take their defaults.
     */
    public static BackendConfig fromBlock(String name, ConfigValue.Block block) {
        String key = "b:" + name;
        return new BackendConfig(
            name,
            block.getString("url", null),
            block.getString("db", null),
            block.getString("zone", ""),
            block.getInt(key, "interval", DEFAULT_INTERVAL_MS),
            block.getInt(key, "timeout", DEFAULT_TIMEOUT_MS),
            block.getInt(key, "timeoutquery", DEFAULT_QUERY_TIMEOUT_MS),
            block.getInt(key, "maxrowlimit", DEFAULT_MAX_ROW_LIMIT),
            block.getInt(key, "checkinterval", DEFAULT_CHECK_INTERVAL_MS),
            block.getInt(key, "rewriteinterval", DEFAULT_REWRITE_INTERVAL_MS),
            block.getFlag(key, "writeonly", false)
        );
    }

    private static String validateUrl(String key, String url) {
        if (url == null || url.isBlank()) {
            throw new ConfigException(key, "url is required");
        }
        try {
            URI uri = new URI(url);
            String scheme = uri.getScheme();
            if (uri.getHost() == null || scheme == null ||
                !(scheme.equalsIgnoreCase("http") || scheme.equalsIgnoreCase("https"))) {
                throw new ConfigException(key, "url must be an absolute http(s) url: " + url);
            }
        } catch (URISyntaxException e) {
            throw new ConfigException(key, "invalid url: " + url, e);
        }
        return url.endsWith("/") ? url.substring(0, url.length() - 1) : url;
    }

    private static int positive(String key, String field, int value) {
        if (value <= 0) {
            throw new ConfigException(key, field + " must be positive: " + value);
        }
        return value;
    }

    public String getName() {
        return name;
    }

    public String getUrl() {
        return url;
    }

    public String getDb() {
        return db;
    }

    /**
     * Zone label; empty for a global backend.
     */
    public String getZone() {
        return zone;
    }

    /**
     * Maximum age of the oldest buffered point before a flush.
     */
    public int getInterval() {
        return interval;
    }

    public int getTimeout() {
        return timeout;
    }

    public int getTimeoutQuery() {
        return timeoutQuery;
    }

    public int getMaxRowLimit() {
        return maxRowLimit;
    }

    public int getCheckInterval() {
        return checkInterval;
    }

    public int getRewriteInterval() {
        return rewriteInterval;
    }

    public boolean isWriteOnly() {
        return writeOnly;
    }

    /**
     * Probe timeout, kept below the check interval so probes never overlap.
     */
    public int getProbeTimeout() {
        return Math.max(1, checkInterval * 4 / 5);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;

        BackendConfig that = (BackendConfig) o;
        return interval == that.interval &&
               timeout == that.timeout &&
               timeoutQuery == that.timeoutQuery &&
               maxRowLimit == that.maxRowLimit &&
               checkInterval == that.checkInterval &&
               rewriteInterval == that.rewriteInterval &&
               writeOnly == that.writeOnly &&
               name.equals(that.name) &&
               url.equals(that.url) &&
               db.equals(that.db) &&
               zone.equals(that.zone);
    }

    @Override
    public int hashCode() {
        return Objects.hash(name, url, db, zone, interval, timeout, timeoutQuery,
                            maxRowLimit, checkInterval, rewriteInterval, writeOnly);
    }

    @Override
    public String toString() {
        return String.format("BackendConfig{name='%s', url='%s', db='%s', zone='%s', interval=%d, timeout=%d, " +
                           "timeoutQuery=%d, maxRowLimit=%d, checkInterval=%d, rewriteInterval=%d, writeOnly=%s}",
                name, url, db, zone, interval, timeout, timeoutQuery, maxRowLimit,
                checkInterval, rewriteInterval, writeOnly);
    }
}
