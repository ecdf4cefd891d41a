package com.delta.searchsync.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;

@ConfigurationProperties(prefix = "search-sync")
public class SearchSyncProperties {
    private static final String DEFAULT_REFRESH_INTERVAL = "1s";

    private int batchSize = 1000;
    private int concurrency = 4;
    private int queueCapacity = 8;
    private Backoff backoff = new Backoff();
    private Index index = new Index();
    private Map<String, IndexDefinition> indices = new LinkedHashMap<>();
    private Cli cli = new Cli();

    public int getBatchSize() {
        return Math.max(1, batchSize);
    }

    public void setBatchSize(int batchSize) {
        this.batchSize = Math.max(1, batchSize);
    }

    public int getConcurrency() {
        return Math.max(1, concurrency);
    }

    public void setConcurrency(int concurrency) {
        this.concurrency = Math.max(1, concurrency);
    }

    public int getQueueCapacity() {
        return Math.max(1, queueCapacity);
    }

    public void setQueueCapacity(int queueCapacity) {
        this.queueCapacity = Math.max(1, queueCapacity);
    }

    public Backoff getBackoff() {
        return backoff;
    }

    public void setBackoff(Backoff backoff) {
        this.backoff = backoff;
    }

    public Index getIndex() {
        return index;
    }

    public void setIndex(Index index) {
        this.index = index;
    }

    public Map<String, IndexDefinition> getIndices() {
        return indices;
    }

    public void setIndices(Map<String, IndexDefinition> indices) {
        this.indices = indices == null ? new LinkedHashMap<>() : indices;
    }

    public Cli getCli() {
        return cli;
    }

    public void setCli(Cli cli) {
        this.cli = cli;
    }

    public IndexDefinition definitionFor(String indexName) {
        IndexDefinition configured = indices.get(indexName);
        IndexDefinition definition = new IndexDefinition();
        definition.setTable(configured == null || configured.table == null ? indexName : configured.table);
        definition.setRefreshInterval(configured == null ? DEFAULT_REFRESH_INTERVAL : configured.getRefreshInterval());
        return definition;
    }

    public static class Backoff {
        private long intervalMs = 100;
        private int maxAttempts = 0;

        public long getIntervalMs() {
            return Math.max(1, intervalMs);
        }

        public void setIntervalMs(long intervalMs) {
            this.intervalMs = Math.max(1, intervalMs);
        }

        public Duration getInterval() {
            return Duration.ofMillis(getIntervalMs());
        }

        public int getMaxAttempts() {
            return Math.max(0, maxAttempts);
        }

        public void setMaxAttempts(int maxAttempts) {
            this.maxAttempts = Math.max(0, maxAttempts);
        }
    }

    public static class Index {
        private String baseUrl = "http://localhost:9200";
        private int requestTimeoutSeconds = 30;
        private String scrollKeepAlive = "1m";

        public String getBaseUrl() {
            return baseUrl;
        }

        public void setBaseUrl(String baseUrl) {
            this.baseUrl = baseUrl;
        }

        public int getRequestTimeoutSeconds() {
            return Math.max(1, requestTimeoutSeconds);
        }

        public void setRequestTimeoutSeconds(int requestTimeoutSeconds) {
            this.requestTimeoutSeconds = requestTimeoutSeconds;
        }

        public String getScrollKeepAlive() {
            return scrollKeepAlive == null || scrollKeepAlive.isBlank() ? "1m" : scrollKeepAlive;
        }

        public void setScrollKeepAlive(String scrollKeepAlive) {
            this.scrollKeepAlive = scrollKeepAlive;
        }
    }

    public static class IndexDefinition {
        private String table;
        private String refreshInterval = DEFAULT_REFRESH_INTERVAL;

        public String getTable() {
            return table;
        }

        public void setTable(String table) {
            this.table = table;
        }

        public String getRefreshInterval() {
            return refreshInterval == null || refreshInterval.isBlank() ? DEFAULT_REFRESH_INTERVAL : refreshInterval;
        }

        public void setRefreshInterval(String refreshInterval) {
            this.refreshInterval = refreshInterval;
        }
    }

    public static class Cli {
        private boolean run = false;
        private String indices = "";
        private boolean onlyImport = false;
        private boolean exitAfterRun = true;

        public boolean isRun() {
            return run;
        }

        public void setRun(boolean run) {
            this.run = run;
        }

        public String getIndices() {
            return indices == null ? "" : indices;
        }

        public void setIndices(String indices) {
            this.indices = indices;
        }

        public boolean isOnlyImport() {
            return onlyImport;
        }

        public void setOnlyImport(boolean onlyImport) {
            this.onlyImport = onlyImport;
        }

        public boolean isExitAfterRun() {
            return exitAfterRun;
        }

        public void setExitAfterRun(boolean exitAfterRun) {
            this.exitAfterRun = exitAfterRun;
        }
    }
}
