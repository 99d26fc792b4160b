package com.ownding.telemetry.retention;

public class EnforcementException extends RuntimeException {

    private final EnforcementFailure failure;

    public EnforcementException(EnforcementFailure failure, String message) {
        super(message);
        this.failure = failure;
    }

    public EnforcementException(EnforcementFailure failure, String message, Throwable cause) {
        super(message, cause);
        this.failure = failure;
    }

    public EnforcementFailure getFailure() {
        return failure;
    }

    public boolean isTransient() {
        return failure.isTransient();
    }
}
