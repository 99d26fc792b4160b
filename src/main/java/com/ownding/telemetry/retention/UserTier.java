package com.ownding.telemetry.retention;

import java.time.Instant;

public record UserTier(String tier, Instant subscriptionEnd, Integer capOverride) {
}
