package com.ownding.telemetry.retention;

import java.util.Optional;

@FunctionalInterface
public interface UserTierLookup {

    Optional<UserTier> findUserTier(long userId);
}
