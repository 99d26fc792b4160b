package com.ownding.telemetry.retention;

public enum EnforcementMode {
    SYNC,
    ASYNC
}
