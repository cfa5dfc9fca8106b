package com.herzen.mastery.config;

import jakarta.validation.Valid;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Min;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

@ConfigurationProperties(prefix = "reasoning")
@Validated
public class ReasoningProperties {

    @DecimalMin("0.0")
    @DecimalMax("1.0")
    private double knownThreshold = 0.7;

    @Valid
    private Clustering clustering = new Clustering();

    @Valid
    private Gaps gaps = new Gaps();

    @Valid
    private Refresh refresh = new Refresh();

    public double getKnownThreshold() {
        return knownThreshold;
    }

    public void setKnownThreshold(double knownThreshold) {
        this.knownThreshold = knownThreshold;
    }

    public Clustering getClustering() {
        return clustering;
    }

    public void setClustering(Clustering clustering) {
        this.clustering = clustering;
    }

    public Gaps getGaps() {
        return gaps;
    }

    public void setGaps(Gaps gaps) {
        this.gaps = gaps;
    }

    public Refresh getRefresh() {
        return refresh;
    }

    public void setRefresh(Refresh refresh) {
        this.refresh = refresh;
    }

    public static class Clustering {
        @DecimalMin("0.0")
        @DecimalMax("1.0")
        private double minSimilarity = 0.6;

        @Min(2)
        private int maxClusterSize = 20;

        @Min(2)
        private int minClusterSize = 3;

        public double getMinSimilarity() {
            return minSimilarity;
        }

        public void setMinSimilarity(double minSimilarity) {
            this.minSimilarity = minSimilarity;
        }

        public int getMaxClusterSize() {
            return maxClusterSize;
        }

        public void setMaxClusterSize(int maxClusterSize) {
            this.maxClusterSize = maxClusterSize;
        }

        public int getMinClusterSize() {
            return minClusterSize;
        }

        public void setMinClusterSize(int minClusterSize) {
            this.minClusterSize = minClusterSize;
        }
    }

    public static class Gaps {
        private boolean includeMinor = false;

        @Min(0)
        private int maxConnectorSuggestions = 5;

        public boolean isIncludeMinor() {
            return includeMinor;
        }

        public void setIncludeMinor(boolean includeMinor) {
            this.includeMinor = includeMinor;
        }

        public int getMaxConnectorSuggestions() {
            return maxConnectorSuggestions;
        }

        public void setMaxConnectorSuggestions(int maxConnectorSuggestions) {
            this.maxConnectorSuggestions = maxConnectorSuggestions;
        }
    }

    public static class Refresh {
        private boolean enabled = true;

        @Min(1000)
        private long fixedDelayMs = 600_000;

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        public long getFixedDelayMs() {
            return fixedDelayMs;
        }

        public void setFixedDelayMs(long fixedDelayMs) {
            this.fixedDelayMs = fixedDelayMs;
        }
    }
}
