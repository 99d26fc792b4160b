package com.ownding.telemetry.retention;

public enum EnforcementFailure {
    POLICY_RESOLUTION(true),
    RANKING_READ(true),
    DELETE_CONFLICT(true),
    STORAGE_UNAVAILABLE(false);

    private final boolean transientFailure;

    EnforcementFailure(boolean transientFailure) {
        this.transientFailure = transientFailure;
    }

    public boolean isTransient() {
        return transientFailure;
    }
}
