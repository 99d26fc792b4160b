package com.ownding.telemetry.retention;

import com.ownding.telemetry.config.AppProperties;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;

import static org.junit.jupiter.api.Assertions.assertEquals;

class ConfiguredTierPolicyProviderTest {

    private static final Instant NOW = Instant.parse("2026-05-01T12:00:00Z");

    private AppProperties appProperties;
    private ConfiguredTierPolicyProvider provider;

    @BeforeEach
    void setUp() {
        appProperties = new AppProperties();
        AppProperties.Retention retention = appProperties.getRetention();
        retention.setDefaultCap(30);

        AppProperties.TierRule free = new AppProperties.TierRule();
        free.setCap(30);
        AppProperties.TierRule premium = new AppProperties.TierRule();
        premium.setUnbounded(true);
        AppProperties.TierRule trial = new AppProperties.TierRule();
        retention.getTiers().put("free", free);
        retention.getTiers().put("premium", premium);
        retention.getTiers().put("trial", trial);

        provider = new ConfiguredTierPolicyProvider(appProperties);
    }

    @Test
    void mapsConfiguredTiers() {
        assertEquals(RetentionPolicy.cappedAt(30), provider.policyFor(new UserTier("free", null, null), NOW));
        assertEquals(RetentionPolicy.unbounded(), provider.policyFor(new UserTier("premium", null, null), NOW));
        assertEquals(RetentionPolicy.unbounded(), provider.policyFor(new UserTier(" Premium ", null, null), NOW));
    }

    @Test
    void capturesDefaultCapForTierWithoutExplicitCap() {
        assertEquals(RetentionPolicy.cappedAt(30), provider.policyFor(new UserTier("trial", null, null), NOW));
    }

    @Test
    void capOverrideWinsOverTier() {
        assertEquals(RetentionPolicy.cappedAt(5), provider.policyFor(new UserTier("premium", null, 5), NOW));
    }

    @Test
    void lapsedSubscriptionFallsBackToExpiredTier() {
        UserTier lapsed = new UserTier("premium", NOW.minus(Duration.ofDays(1)), null);
        UserTier active = new UserTier("premium", NOW.plus(Duration.ofDays(1)), null);

        assertEquals(RetentionPolicy.cappedAt(30), provider.policyFor(lapsed, NOW));
        assertEquals(RetentionPolicy.unbounded(), provider.policyFor(active, NOW));
    }

    @Test
    void unknownTierFollowsConfiguredFallback() {
        UserTier legacy = new UserTier("legacy-gold", null, null);
        assertEquals(RetentionPolicy.unbounded(), provider.policyFor(legacy, NOW));

        appProperties.getRetention().setUnknownTierPolicy(AppProperties.UnknownTierPolicy.DEFAULT_CAP);
        assertEquals(RetentionPolicy.cappedAt(30), provider.policyFor(legacy, NOW));
    }
}
