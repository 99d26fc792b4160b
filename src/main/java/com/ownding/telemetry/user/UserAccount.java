package com.ownding.telemetry.user;

public record UserAccount(
        long id,
        String username,
        String email,
        String tier,
        String subscriptionEnd,
        Integer capOverride,
        String createdAt,
        String updatedAt
) {
}
