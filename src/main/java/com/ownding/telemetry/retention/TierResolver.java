package com.ownding.telemetry.retention;

public interface TierResolver {

    /**
     * Resolves the policy currently in force for the user.
     *
     * @throws EnforcementException with {@link EnforcementFailure#POLICY_RESOLUTION} when the user's tier
     *                              cannot be determined within bounded time
     */
    RetentionPolicy resolvePolicy(long userId);

    default void invalidate(long userId) {
    }
}
