package com.talentpilot.tracker.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

/**
 * Tunables under the {@code tracker.*} prefix. Setters clamp to sane minimums.
 */
@ConfigurationProperties(prefix = "tracker")
public class TrackerProperties {

    private Bulk bulk = new Bulk();
    private Outreach outreach = new Outreach();
    private Dispatch dispatch = new Dispatch();

    public Bulk getBulk() { return bulk; }
    public void setBulk(Bulk bulk) { this.bulk = bulk; }

    public Outreach getOutreach() { return outreach; }
    public void setOutreach(Outreach outreach) { this.outreach = outreach; }

    public Dispatch getDispatch() { return dispatch; }
    public void setDispatch(Dispatch dispatch) { this.dispatch = dispatch; }

    public static class Bulk {
        // Upper bound on concurrent sends; keeps us under the provider's rate limit.
        private int maxConcurrency = 4;
        // Zero means wait for every item.
        private Duration batchTimeout = Duration.ofMinutes(2);
        private int maxBatchSize = 500;

        public int getMaxConcurrency() { return maxConcurrency; }
        public void setMaxConcurrency(int maxConcurrency) { this.maxConcurrency = Math.max(1, maxConcurrency); }

        public Duration getBatchTimeout() { return batchTimeout; }
        public void setBatchTimeout(Duration batchTimeout) {
            this.batchTimeout = (batchTimeout == null || batchTimeout.isNegative()) ? Duration.ZERO : batchTimeout;
        }

        public int getMaxBatchSize() { return maxBatchSize; }
        public void setMaxBatchSize(int maxBatchSize) { this.maxBatchSize = Math.max(1, maxBatchSize); }
    }

    public static class Outreach {
        private int resendAfterDays = 2;
        private int noResponseAfterHours = 48;
        private boolean sweepEnabled = false;

        public int getResendAfterDays() { return resendAfterDays; }
        public void setResendAfterDays(int resendAfterDays) { this.resendAfterDays = Math.max(0, resendAfterDays); }

        public int getNoResponseAfterHours() { return noResponseAfterHours; }
        public void setNoResponseAfterHours(int hours) { this.noResponseAfterHours = Math.max(1, hours); }

        public boolean isSweepEnabled() { return sweepEnabled; }
        public void setSweepEnabled(boolean sweepEnabled) { this.sweepEnabled = sweepEnabled; }
    }

    public static class Dispatch {
        private String baseUrl = "http://localhost:8090";
        private Duration connectTimeout = Duration.ofSeconds(10);
        private Duration requestTimeout = Duration.ofSeconds(30);

        public String getBaseUrl() { return baseUrl; }
        public void setBaseUrl(String baseUrl) {
            this.baseUrl = baseUrl == null ? null : baseUrl.replaceAll("/+$", "");
        }

        public Duration getConnectTimeout() { return connectTimeout; }
        public void setConnectTimeout(Duration connectTimeout) { this.connectTimeout = connectTimeout; }

        public Duration getRequestTimeout() { return requestTimeout; }
        public void setRequestTimeout(Duration requestTimeout) { this.requestTimeout = requestTimeout; }
    }
}
