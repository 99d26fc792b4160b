package com.ownding.telemetry.config;

import com.ownding.telemetry.retention.EnforcementMode;
import jakarta.validation.Valid;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;

@Validated
@ConfigurationProperties(prefix = "app")
public class AppProperties {

    @Valid
    private final Retention retention = new Retention();

    public Retention getRetention() {
        return retention;
    }

    public static class Retention {
        @NotNull
        private EnforcementMode mode = EnforcementMode.SYNC;
        @Min(1)
        private int defaultCap = 30;
        @Min(1)
        private int maxAttempts = 3;
        @NotNull
        private Duration retryBackoff = Duration.ofMillis(20);
        @NotNull
        private Duration policyCacheTtl = Duration.ofSeconds(60);
        @NotBlank
        private String expiredSubscriptionTier = "free";
        @NotNull
        private UnknownTierPolicy unknownTierPolicy = UnknownTierPolicy.UNBOUNDED;
        @Min(1000)
        private long sweepIntervalMs = 60_000;
        @Min(1)
        private int sweepMaxRounds = 10;
        @Min(1000)
        private long walCheckpointIntervalMs = 600_000;
        @Min(1)
        private int workerThreads = 4;
        @NotNull
        private Duration transactionTimeout = Duration.ofSeconds(10);
        @Valid
        private Map<String, TierRule> tiers = new LinkedHashMap<>();

        public EnforcementMode getMode() {
            return mode;
        }

        public void setMode(EnforcementMode mode) {
            this.mode = mode;
        }

        public int getDefaultCap() {
            return defaultCap;
        }

        public void setDefaultCap(int defaultCap) {
            this.defaultCap = defaultCap;
        }

        public int getMaxAttempts() {
            return maxAttempts;
        }

        public void setMaxAttempts(int maxAttempts) {
            this.maxAttempts = maxAttempts;
        }

        public Duration getRetryBackoff() {
            return retryBackoff;
        }

        public void setRetryBackoff(Duration retryBackoff) {
            this.retryBackoff = retryBackoff;
        }

        public Duration getPolicyCacheTtl() {
            return policyCacheTtl;
        }

        public void setPolicyCacheTtl(Duration policyCacheTtl) {
            this.policyCacheTtl = policyCacheTtl;
        }

        public String getExpiredSubscriptionTier() {
            return expiredSubscriptionTier;
        }

        public void setExpiredSubscriptionTier(String expiredSubscriptionTier) {
            this.expiredSubscriptionTier = expiredSubscriptionTier;
        }

        public UnknownTierPolicy getUnknownTierPolicy() {
            return unknownTierPolicy;
        }

        public void setUnknownTierPolicy(UnknownTierPolicy unknownTierPolicy) {
            this.unknownTierPolicy = unknownTierPolicy;
        }

        public long getSweepIntervalMs() {
            return sweepIntervalMs;
        }

        public void setSweepIntervalMs(long sweepIntervalMs) {
            this.sweepIntervalMs = sweepIntervalMs;
        }

        public int getSweepMaxRounds() {
            return sweepMaxRounds;
        }

        public void setSweepMaxRounds(int sweepMaxRounds) {
            this.sweepMaxRounds = sweepMaxRounds;
        }

        public int getWorkerThreads() {
            return workerThreads;
        }

        public void setWorkerThreads(int workerThreads) {
            this.workerThreads = workerThreads;
        }

        public Duration getTransactionTimeout() {
            return transactionTimeout;
        }

        public void setTransactionTimeout(Duration transactionTimeout) {
            this.transactionTimeout = transactionTimeout;
        }

        public long getWalCheckpointIntervalMs() {
            return walCheckpointIntervalMs;
        }

        public void setWalCheckpointIntervalMs(long walCheckpointIntervalMs) {
            this.walCheckpointIntervalMs = walCheckpointIntervalMs;
        }

        public Map<String, TierRule> getTiers() {
            return tiers;
        }

        public void setTiers(Map<String, TierRule> tiers) {
            this.tiers = tiers;
        }
    }

    public static class TierRule {
        private boolean unbounded = false;
        @Min(1)
        private Integer cap;

        public boolean isUnbounded() {
            return unbounded;
        }

        public void setUnbounded(boolean unbounded) {
            this.unbounded = unbounded;
        }

        public Integer getCap() {
            return cap;
        }

        public void setCap(Integer cap) {
            this.cap = cap;
        }
    }

    public enum UnknownTierPolicy {
        UNBOUNDED,
        DEFAULT_CAP
    }
}
