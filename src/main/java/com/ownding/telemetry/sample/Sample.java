package com.ownding.telemetry.sample;

import java.time.Instant;

public record Sample(
        long id,
        long userId,
        long deviceId,
        Instant timestamp,
        String payload,
        String createdAt
) {
}
