package com.tsrouter.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Process-level configuration for the router. Backend, node and routing
 * definitions live in the configuration store document, not here.
 */
@Component
@ConfigurationProperties(prefix = "router")
public class RouterProperties {

    /**
     * Path of the configuration store document (backends, nodes, measurements).
     */
    private String configFile = "./router.json";

    /**
     * Name of the node record used for requests that arrive on no node-specific port.
     * Empty means the default node record.
     */
    private String node = "";

    /**
     * Interval for re-reading the configuration store in milliseconds. 0 disables periodic reload.
     */
    private long reloadIntervalMs = 0;

    /**
     * How long a reload waits for in-flight requests on the previous snapshot before retiring it.
     */
    private long retireTimeoutMs = 30000;

    /**
     * Threads shared by all health probes.
     */
    private int healthCheckThreads = 2;

    private Write write = new Write();

    private Query query = new Query();

    /**
     * What a batcher does with a batch its backend refused.
     */
    public enum FailurePolicy {
        /**
         * Count the batch as dropped and discard it.
         */
        DROP,

        /**
         * Keep retryable batches in a bounded buffer and resend them every rewrite interval.
         */
        REWRITE
    }

    public static class Write {

        private FailurePolicy failurePolicy = FailurePolicy.DROP;

        /**
         * Hard memory ceiling of each backend's rewrite buffer.
         */
        private long rewriteBufferMaxBytes = 64L * 1024 * 1024;

        /**
         * Gzip batch bodies sent to backends.
         */
        private boolean gzip = true;

        /**
         * Stamp lines without a timestamp with the receive time instead of rejecting them.
         */
        private boolean defaultTimestamp = false;

        /**
         * Batches a backend may have cut but not yet sent; further points are refused.
         */
        private int maxPendingBatches = 16;

        public FailurePolicy getFailurePolicy() {
            return failurePolicy;
        }

        public void setFailurePolicy(FailurePolicy failurePolicy) {
            this.failurePolicy = failurePolicy;
        }

        public long getRewriteBufferMaxBytes() {
            return rewriteBufferMaxBytes;
        }

        public void setRewriteBufferMaxBytes(long rewriteBufferMaxBytes) {
            this.rewriteBufferMaxBytes = rewriteBufferMaxBytes;
        }

        public boolean isGzip() {
            return gzip;
        }

        public void setGzip(boolean gzip) {
            this.gzip = gzip;
        }

        public boolean isDefaultTimestamp() {
            return defaultTimestamp;
        }

        public void setDefaultTimestamp(boolean defaultTimestamp) {
            this.defaultTimestamp = defaultTimestamp;
        }

        public int getMaxPendingBatches() {
            return maxPendingBatches;
        }

        public void setMaxPendingBatches(int maxPendingBatches) {
            this.maxPendingBatches = maxPendingBatches;
        }
    }

    public static class Query {

        /**
         * Queries matching any of these patterns are rejected.
         */
        private List<String> forbiddenPatterns = new ArrayList<>(List.of("(?i:^\\s*grant|^\\s*revoke|\\(\\)\\$)"));

        /**
         * Queries must match at least one of these patterns; empty disables the check.
         */
        private List<String> obligatedPatterns = new ArrayList<>(List.of("(?i:from|drop\\s*measurement)"));

        /**
         * Reject SELECT queries without a time condition in their WHERE clause.
         */
        private boolean requireTimeBound = false;

        public List<String> getForbiddenPatterns() {
            return forbiddenPatterns;
        }

        public void setForbiddenPatterns(List<String> forbiddenPatterns) {
            this.forbiddenPatterns = forbiddenPatterns;
        }

        public List<String> getObligatedPatterns() {
            return obligatedPatterns;
        }

        public void setObligatedPatterns(List<String> obligatedPatterns) {
            this.obligatedPatterns = obligatedPatterns;
        }

        public boolean isRequireTimeBound() {
            return requireTimeBound;
        }

        public void setRequireTimeBound(boolean requireTimeBound) {
            this.requireTimeBound = requireTimeBound;
        }
    }

    public String getConfigFile() {
        return configFile;
    }

    public void setConfigFile(String configFile) {
        this.configFile = configFile;
    }

    public String getNode() {
        return node;
    }

    public void setNode(String node) {
        this.node = node;
    }

    public long getReloadIntervalMs() {
        return reloadIntervalMs;
    }

    public void setReloadIntervalMs(long reloadIntervalMs) {
        this.reloadIntervalMs = reloadIntervalMs;
    }

    public long getRetireTimeoutMs() {
        return retireTimeoutMs;
    }

    public void setRetireTimeoutMs(long retireTimeoutMs) {
        this.retireTimeoutMs = retireTimeoutMs;
    }

    public int getHealthCheckThreads() {
        return healthCheckThreads;
    }

    public void setHealthCheckThreads(int healthCheckThreads) {
        this.healthCheckThreads = healthCheckThreads;
    }

    public Write getWrite() {
        return write;
    }

    public void setWrite(Write write) {
        this.write = write;
    }

    public Query getQuery() {
        return query;
    }

    public void setQuery(Query query) {
        this.query = query;
    }

    @Override
    public String toString() {
        return String.format("RouterProperties{configFile='%s', node='%s', reloadIntervalMs=%d, " +
                           "failurePolicy=%s, gzip=%s, requireTimeBound=%s}",
                configFile, node, reloadIntervalMs, write.failurePolicy, write.gzip, query.requireTimeBound);
    }
}
