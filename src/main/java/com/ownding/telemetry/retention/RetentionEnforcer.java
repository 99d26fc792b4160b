package com.ownding.telemetry.retention;

import com.ownding.telemetry.config.AppProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.support.TransactionOperations;

import java.time.Duration;
import java.util.List;

/**
 * Keeps each capped series at its K newest samples, ranked by timestamp and then id, newest first.
 * <p>
 * One call is one enforcement cycle for a (user, device) key: resolve the policy, then rank and
 * delete the overflow in a single serializable transaction. Cycles for the same key are serialized by
 * {@link KeyedEnforcementGate}. A conflicting delete is retried with a fresh ranking up to
 * {@code app.retention.max-attempts} times; transient failures end the cycle and leave the key for the
 * next trigger. Only {@link EnforcementFailure#STORAGE_UNAVAILABLE} is thrown to the caller.
 */
@Service
public class RetentionEnforcer {

    private static final Logger log = LoggerFactory.getLogger(RetentionEnforcer.class);

    private final TierResolver tierResolver;
    private final SeriesStore seriesStore;
    private final TransactionOperations transactionOperations;
    private final KeyedEnforcementGate gate;
    private final EnforcementMonitor monitor;
    private final int maxAttempts;
    private final Duration retryBackoff;

    public RetentionEnforcer(TierResolver tierResolver, SeriesStore seriesStore,
            TransactionOperations transactionOperations, KeyedEnforcementGate gate, EnforcementMonitor monitor,
            AppProperties appProperties) {
        this.tierResolver = tierResolver;
        this.seriesStore = seriesStore;
        this.transactionOperations = transactionOperations;
        this.gate = gate;
        this.monitor = monitor;
        this.maxAttempts = appProperties.getRetention().getMaxAttempts();
        this.retryBackoff = appProperties.getRetention().getRetryBackoff();
    }

    public EnforcementOutcome enforce(long userId, long deviceId) {
        SeriesKey key = new SeriesKey(userId, deviceId);
        EnforcementOutcome outcome = gate.runCoalesced(key, () -> recordedCycle(key));
        if (outcome.status() == EnforcementOutcome.Status.COALESCED) {
            monitor.record(outcome);
        }
        return outcome;
    }

    private EnforcementOutcome recordedCycle(SeriesKey key) {
        try {
            EnforcementOutcome outcome = runCycle(key);
            monitor.record(outcome);
            return outcome;
        } catch (EnforcementException ex) {
            monitor.recordFailure(key, ex);
            throw ex;
        }
    }

    private EnforcementOutcome runCycle(SeriesKey key) {
        RetentionPolicy policy;
        try {
            policy = tierResolver.resolvePolicy(key.userId());
        } catch (EnforcementException ex) {
            log.warn("retention skipped, policy unavailable. key={}, err={}", key, ex.getMessage());
            return EnforcementOutcome.of(key, EnforcementOutcome.Status.SKIPPED_POLICY_UNAVAILABLE, 0);
        }
        if (!policy.capped()) {
            return EnforcementOutcome.of(key, EnforcementOutcome.Status.UNBOUNDED, 0);
        }

        for (int attempt = 1; ; attempt++) {
            try {
                int deleted = pruneBeyondCap(key, policy.cap());
                if (deleted > 0) {
                    log.info("retention pruned. key={}, cap={}, deleted={}, attempt={}",
                            key, policy.cap(), deleted, attempt);
                }
                return EnforcementOutcome.pruned(key, deleted, attempt);
            } catch (EnforcementException ex) {
                switch (ex.getFailure()) {
                    case DELETE_CONFLICT -> {
                        if (attempt >= maxAttempts || !backoff(attempt)) {
                            log.warn("retention deferred after conflicts. key={}, attempts={}, err={}",
                                    key, attempt, ex.getMessage());
                            return EnforcementOutcome.of(key, EnforcementOutcome.Status.DEFERRED_CONFLICT, attempt);
                        }
                        log.debug("retention conflict, retrying with fresh ranking. key={}, attempt={}, err={}",
                                key, attempt, ex.getMessage());
                    }
                    case RANKING_READ -> {
                        log.warn("retention aborted, ranking read failed. key={}, err={}", key, ex.getMessage());
                        return EnforcementOutcome.of(key, EnforcementOutcome.Status.ABORTED_READ_FAILURE, attempt);
                    }
                    default -> throw ex;
                }
            }
        }
    }

    /**
     * One attempt: ranks the series and deletes everything past {@code cap} inside one transaction.
     * A delete that removes fewer rows than ranked means another writer got there first; the
     * attempt is rolled back and reported as a conflict.
     */
    private int pruneBeyondCap(SeriesKey key, int cap) {
        try {
            Integer deleted = transactionOperations.execute(status -> {
                List<Long> ranked;
                try {
                    ranked = seriesStore.rankedIds(key);
                } catch (RuntimeException ex) {
                    throw StorageFailures.translate(key, StorageFailures.Phase.RANKING_READ, ex);
                }
                if (ranked.size() <= cap) {
                    return 0;
                }
                List<Long> overflow = ranked.subList(cap, ranked.size());
                int removed;
                try {
                    removed = seriesStore.deleteByIds(key, overflow);
                } catch (RuntimeException ex) {
                    throw StorageFailures.translate(key, StorageFailures.Phase.DELETE, ex);
                }
                if (removed != overflow.size()) {
                    throw new EnforcementException(EnforcementFailure.DELETE_CONFLICT,
                            "series " + key + " changed during prune, expected " + overflow.size()
                                    + " deletions but removed " + removed);
                }
                return removed;
            });
            return deleted == null ? 0 : deleted;
        } catch (RuntimeException ex) {
            throw StorageFailures.translate(key, StorageFailures.Phase.TRANSACTION, ex);
        }
    }

    private boolean backoff(int attempt) {
        if (retryBackoff.isZero() || retryBackoff.isNegative()) {
            return true;
        }
        try {
            Thread.sleep(retryBackoff.multipliedBy(attempt).toMillis());
            return true;
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
            return false;
        }
    }
}
