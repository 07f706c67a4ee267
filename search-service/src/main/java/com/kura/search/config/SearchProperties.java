package com.kura.search.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "search")
public class SearchProperties {
    public static final int MIN_LIMIT = 1;
    public static final int MAX_LIMIT = 50;

    private SearchMode mode = SearchMode.COMBINED;
    private LimitPolicy limitPolicy = LimitPolicy.REJECT;
    private int defaultLimit = 10;
    private int maxQueryLength = 1000;
    private int candidateMultiplier = 3;
    private int maxCandidatePool = 150;
    private int maxWideningRounds = 3;
    private int maxWidenedPool = 1000;
    private Timeouts timeouts = new Timeouts();
    private QueryLog queryLog = new QueryLog();

    public SearchMode getMode() {
        return mode;
    }

    public void setMode(SearchMode mode) {
        this.mode = mode;
    }

    public LimitPolicy getLimitPolicy() {
        return limitPolicy;
    }

    public void setLimitPolicy(LimitPolicy limitPolicy) {
        this.limitPolicy = limitPolicy;
    }

    public int getDefaultLimit() {
        return defaultLimit;
    }

    public void setDefaultLimit(int defaultLimit) {
        this.defaultLimit = defaultLimit;
    }

    public int getMaxQueryLength() {
        return maxQueryLength;
    }

    public void setMaxQueryLength(int maxQueryLength) {
        this.maxQueryLength = maxQueryLength;
    }

    public int getCandidateMultiplier() {
        return candidateMultiplier;
    }

    public void setCandidateMultiplier(int candidateMultiplier) {
        this.candidateMultiplier = candidateMultiplier;
    }

    public int getMaxCandidatePool() {
        return maxCandidatePool;
    }

    public void setMaxCandidatePool(int maxCandidatePool) {
        this.maxCandidatePool = maxCandidatePool;
    }

    public int getMaxWideningRounds() {
        return maxWideningRounds;
    }

    public void setMaxWideningRounds(int maxWideningRounds) {
        this.maxWideningRounds = maxWideningRounds;
    }

    public int getMaxWidenedPool() {
        return maxWidenedPool;
    }

    public void setMaxWidenedPool(int maxWidenedPool) {
        this.maxWidenedPool = maxWidenedPool;
    }

    public Timeouts getTimeouts() {
        return timeouts;
    }

    public void setTimeouts(Timeouts timeouts) {
        this.timeouts = timeouts;
    }

    public QueryLog getQueryLog() {
        return queryLog;
    }

    public void setQueryLog(QueryLog queryLog) {
        this.queryLog = queryLog;
    }

    public static class Timeouts {
        private long embeddingMs = 2000;
        private long vectorMs = 800;
        private long lexicalMs = 800;

        public long getEmbeddingMs() {
            return embeddingMs;
        }

        public void setEmbeddingMs(long embeddingMs) {
            this.embeddingMs = embeddingMs;
        }

        public long getVectorMs() {
            return vectorMs;
        }

        public void setVectorMs(long vectorMs) {
            this.vectorMs = vectorMs;
        }

        public long getLexicalMs() {
            return lexicalMs;
        }

        public void setLexicalMs(long lexicalMs) {
            this.lexicalMs = lexicalMs;
        }
    }

    public static class QueryLog {
        private boolean enabled = true;
        private int capacity = 1000;

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        public int getCapacity() {
            return capacity;
        }

        public void setCapacity(int capacity) {
            this.capacity = capacity;
        }
    }
}
