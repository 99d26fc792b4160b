package com.ownding.telemetry.retention;

import com.ownding.telemetry.config.AppProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Resolves policies from the user registry and keeps them for {@code app.retention.policy-cache-ttl}.
 * A tier change made outside {@link #invalidate(long)} reaches enforcement within that window;
 * a cached entry never outlives the subscription it was computed from.
 */
@Component
public class CachingTierResolver implements TierResolver {

    private static final Logger log = LoggerFactory.getLogger(CachingTierResolver.class);

    private final Map<Long, CachedPolicy> policyByUser = new ConcurrentHashMap<>();
    // bumped under the entry's lock on every eviction; a lookup that started before one is not cached
    private final AtomicLong invalidations = new AtomicLong();

    private final UserTierLookup userTierLookup;
    private final TierPolicyProvider tierPolicyProvider;
    private final Clock clock;
    private final Duration cacheTtl;

    public CachingTierResolver(UserTierLookup userTierLookup, TierPolicyProvider tierPolicyProvider, Clock clock,
            AppProperties appProperties) {
        this.userTierLookup = userTierLookup;
        this.tierPolicyProvider = tierPolicyProvider;
        this.clock = clock;
        this.cacheTtl = appProperties.getRetention().getPolicyCacheTtl();
    }

    @Override
    public RetentionPolicy resolvePolicy(long userId) {
        Instant now = clock.instant();
        CachedPolicy cached = policyByUser.get(userId);
        if (cached != null && now.isBefore(cached.expiresAt())) {
            return cached.policy();
        }

        long stamp = invalidations.get();
        UserTier userTier;
        try {
            userTier = userTierLookup.findUserTier(userId)
                    .orElseThrow(() -> new EnforcementException(EnforcementFailure.POLICY_RESOLUTION,
                            "unknown user " + userId));
        } catch (DataAccessException ex) {
            throw new EnforcementException(EnforcementFailure.POLICY_RESOLUTION,
                    "tier lookup failed for user " + userId + ": " + ex.getMessage(), ex);
        }

        RetentionPolicy policy = tierPolicyProvider.policyFor(userTier, now);
        Instant expiresAt = now.plus(cacheTtl);
        Instant subscriptionEnd = userTier.subscriptionEnd();
        if (subscriptionEnd != null && subscriptionEnd.isAfter(now) && subscriptionEnd.isBefore(expiresAt)) {
            expiresAt = subscriptionEnd;
        }
        CachedPolicy fresh = new CachedPolicy(policy, expiresAt);
        policyByUser.compute(userId, (id, current) -> invalidations.get() == stamp ? fresh : current);
        log.debug("policy resolved. userId={}, tier={}, policy={}, cachedUntil={}",
                userId, userTier.tier(), policy, expiresAt);
        return policy;
    }

    @Override
    public void invalidate(long userId) {
        policyByUser.compute(userId, (id, current) -> {
            invalidations.incrementAndGet();
            return null;
        });
    }

    private record CachedPolicy(RetentionPolicy policy, Instant expiresAt) {
    }
}
