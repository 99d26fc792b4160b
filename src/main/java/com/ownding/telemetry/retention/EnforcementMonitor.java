package com.ownding.telemetry.retention;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.LongAdder;

@Component
public class EnforcementMonitor {

    private static final Logger log = LoggerFactory.getLogger(EnforcementMonitor.class);

    private final Map<EnforcementOutcome.Status, LongAdder> cyclesByStatus = new ConcurrentHashMap<>();
    private final Map<EnforcementFailure, LongAdder> failuresByKind = new ConcurrentHashMap<>();
    private final LongAdder deletedSamples = new LongAdder();
    private final Map<SeriesKey, DeferredKey> deferredKeys = new ConcurrentHashMap<>();
    private final Clock clock;
    private volatile String lastFailure;

    public EnforcementMonitor(Clock clock) {
        this.clock = clock;
    }

    public void record(EnforcementOutcome outcome) {
        cyclesByStatus.computeIfAbsent(outcome.status(), status -> new LongAdder()).increment();
        deletedSamples.add(outcome.deleted());
        if (outcome.status().isSettled()) {
            deferredKeys.remove(outcome.key());
        } else if (outcome.status() != EnforcementOutcome.Status.COALESCED) {
            markDeferred(outcome.key(), outcome.status().name());
        }
    }

    public void recordFailure(SeriesKey key, EnforcementException ex) {
        failuresByKind.computeIfAbsent(ex.getFailure(), kind -> new LongAdder()).increment();
        lastFailure = clock.instant() + " " + key + " " + ex.getFailure() + ": " + ex.getMessage();
        markDeferred(key, ex.getFailure().name());
        if (!ex.isTransient()) {
            log.error("retention storage unavailable. key={}, err={}", key, ex.getMessage());
        }
    }

    public void forget(SeriesKey key) {
        deferredKeys.remove(key);
    }

    public List<DeferredKey> deferredKeys() {
        List<DeferredKey> keys = new ArrayList<>(deferredKeys.values());
        keys.sort(Comparator.comparing(DeferredKey::since));
        return keys;
    }

    public RetentionStats snapshot(int activeKeys) {
        Map<EnforcementOutcome.Status, Long> cycles = new EnumMap<>(EnforcementOutcome.Status.class);
        cyclesByStatus.forEach((status, count) -> cycles.put(status, count.sum()));
        Map<EnforcementFailure, Long> failures = new EnumMap<>(EnforcementFailure.class);
        failuresByKind.forEach((kind, count) -> failures.put(kind, count.sum()));
        return new RetentionStats(cycles, failures, deletedSamples.sum(), activeKeys, deferredKeys(), lastFailure);
    }

    private void markDeferred(SeriesKey key, String reason) {
        String now = clock.instant().toString();
        deferredKeys.merge(key, new DeferredKey(key, reason, now, now, 1),
                (existing, fresh) -> new DeferredKey(key, reason, existing.since(), now, existing.rounds() + 1));
    }

    public record DeferredKey(SeriesKey key, String reason, String since, String lastSeen, int rounds) {
    }

    public record RetentionStats(
            Map<EnforcementOutcome.Status, Long> cycles,
            Map<EnforcementFailure, Long> failures,
            long deletedSamples,
            int activeKeys,
            List<DeferredKey> deferredKeys,
            String lastFailure
    ) {
    }
}
