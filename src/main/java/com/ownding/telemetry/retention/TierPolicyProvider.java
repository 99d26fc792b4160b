package com.ownding.telemetry.retention;

import java.time.Instant;

public interface TierPolicyProvider {

    RetentionPolicy policyFor(UserTier userTier, Instant now);
}
