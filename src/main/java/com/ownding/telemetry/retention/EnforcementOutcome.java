package com.ownding.telemetry.retention;

public record EnforcementOutcome(SeriesKey key, Status status, int deleted, int attempts) {

    public enum Status {
        UNBOUNDED(true),
        WITHIN_CAP(true),
        PRUNED(true),
        COALESCED(false),
        SKIPPED_POLICY_UNAVAILABLE(false),
        ABORTED_READ_FAILURE(false),
        DEFERRED_CONFLICT(false);

        private final boolean settled;

        Status(boolean settled) {
            this.settled = settled;
        }

        public boolean isSettled() {
            return settled;
        }
    }

    public static EnforcementOutcome of(SeriesKey key, Status status, int attempts) {
        return new EnforcementOutcome(key, status, 0, attempts);
    }

    public static EnforcementOutcome pruned(SeriesKey key, int deleted, int attempts) {
        return new EnforcementOutcome(key, deleted == 0 ? Status.WITHIN_CAP : Status.PRUNED, deleted, attempts);
    }

    public static EnforcementOutcome coalesced(SeriesKey key) {
        return new EnforcementOutcome(key, Status.COALESCED, 0, 0);
    }
}
