package com.ownding.telemetry.device;

public record Device(
        long id,
        long userId,
        String deviceCode,
        String name,
        String createdAt
) {
}
