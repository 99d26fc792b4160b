package com.ownding.telemetry.retention;

import com.ownding.telemetry.config.AppProperties;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.Locale;

/**
 * Policy mapping driven by {@code app.retention.tiers}. Resolution order: per-account cap override,
 * then the tier rule, where a lapsed subscription falls back to {@code expired-subscription-tier}.
 */
@Component
public class ConfiguredTierPolicyProvider implements TierPolicyProvider {

    private final AppProperties.Retention retention;

    public ConfiguredTierPolicyProvider(AppProperties appProperties) {
        this.retention = appProperties.getRetention();
    }

    @Override
    public RetentionPolicy policyFor(UserTier userTier, Instant now) {
        if (userTier.capOverride() != null) {
            return RetentionPolicy.cappedAt(userTier.capOverride());
        }
        String tier = effectiveTier(userTier, now);
        AppProperties.TierRule rule = retention.getTiers().get(tier);
        if (rule == null) {
            return retention.getUnknownTierPolicy() == AppProperties.UnknownTierPolicy.DEFAULT_CAP
                    ? RetentionPolicy.cappedAt(retention.getDefaultCap())
                    : RetentionPolicy.unbounded();
        }
        if (rule.isUnbounded()) {
            return RetentionPolicy.unbounded();
        }
        return RetentionPolicy.cappedAt(rule.getCap() == null ? retention.getDefaultCap() : rule.getCap());
    }

    private String effectiveTier(UserTier userTier, Instant now) {
        Instant subscriptionEnd = userTier.subscriptionEnd();
        if (subscriptionEnd != null && !subscriptionEnd.isAfter(now)) {
            return normalize(retention.getExpiredSubscriptionTier());
        }
        return normalize(userTier.tier());
    }

    private static String normalize(String tier) {
        return tier == null ? "" : tier.trim().toLowerCase(Locale.ROOT);
    }
}
