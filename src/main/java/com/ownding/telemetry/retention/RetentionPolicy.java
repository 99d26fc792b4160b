package com.ownding.telemetry.retention;

public record RetentionPolicy(boolean capped, int cap) {

    private static final RetentionPolicy UNBOUNDED = new RetentionPolicy(false, 0);

    public RetentionPolicy {
        if (capped && cap < 1) {
            throw new IllegalArgumentException("cap must be positive: " + cap);
        }
        if (!capped && cap != 0) {
            throw new IllegalArgumentException("unbounded policy cannot carry a cap");
        }
    }

    public static RetentionPolicy unbounded() {
        return UNBOUNDED;
    }

    public static RetentionPolicy cappedAt(int cap) {
        return new RetentionPolicy(true, cap);
    }

    @Override
    public String toString() {
        return capped ? "cappedAt(" + cap + ")" : "unbounded";
    }
}
