package com.ownding.telemetry.retention;

import com.ownding.telemetry.config.AppProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import org.springframework.transaction.support.TransactionSynchronization;
import org.springframework.transaction.support.TransactionSynchronizationManager;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Scheduler;

import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Entry point for the ingestion path: called once per committed sample insert.
 * <p>
 * Whatever happens during enforcement, the caller only gets a {@link DispatchResult}; the insert's own
 * result is never changed. When called inside an open transaction the cycle is postponed until after
 * commit, so enforcement always ranks committed state.
 */
@Component
public class EnforcementDispatcher {

    private static final Logger log = LoggerFactory.getLogger(EnforcementDispatcher.class);

    private final RetentionEnforcer retentionEnforcer;
    private final Scheduler retentionScheduler;
    private final EnforcementMode mode;
    private final Set<SeriesKey> queuedKeys = ConcurrentHashMap.newKeySet();

    public EnforcementDispatcher(RetentionEnforcer retentionEnforcer, Scheduler retentionScheduler,
            AppProperties appProperties) {
        this.retentionEnforcer = retentionEnforcer;
        this.retentionScheduler = retentionScheduler;
        this.mode = appProperties.getRetention().getMode();
    }

    public DispatchResult onSampleInserted(long userId, long deviceId) {
        SeriesKey key = new SeriesKey(userId, deviceId);
        if (TransactionSynchronizationManager.isSynchronizationActive()) {
            TransactionSynchronizationManager.registerSynchronization(new TransactionSynchronization() {
                @Override
                public void afterCommit() {
                    dispatch(key);
                }
            });
            return DispatchResult.scheduled();
        }
        return dispatch(key);
    }

    public EnforcementMode mode() {
        return mode;
    }

    private DispatchResult dispatch(SeriesKey key) {
        if (mode == EnforcementMode.ASYNC) {
            submit(key);
            return DispatchResult.scheduled();
        }
        try {
            return DispatchResult.completed(retentionEnforcer.enforce(key.userId(), key.deviceId()));
        } catch (EnforcementException ex) {
            log.error("retention enforcement failed, sample kept. key={}, failure={}, err={}",
                    key, ex.getFailure(), ex.getMessage());
            return DispatchResult.failed(ex.getFailure());
        } catch (RuntimeException ex) {
            log.error("retention enforcement failed unexpectedly, sample kept. key={}", key, ex);
            return DispatchResult.failed(EnforcementFailure.STORAGE_UNAVAILABLE);
        }
    }

    /**
     * Queues at most one job per key. A trigger for a key whose job is already queued adds nothing;
     * a trigger for a key whose job is running queues one follow-up, which the gate folds into the
     * running cycle.
     */
    private void submit(SeriesKey key) {
        if (!queuedKeys.add(key)) {
            return;
        }
        Mono.fromCallable(() -> {
                    queuedKeys.remove(key);
                    return retentionEnforcer.enforce(key.userId(), key.deviceId());
                })
                .subscribeOn(retentionScheduler)
                .subscribe(
                        outcome -> log.debug("async retention cycle done. key={}, status={}, deleted={}",
                                key, outcome.status(), outcome.deleted()),
                        error -> {
                            queuedKeys.remove(key);
                            log.error("async retention cycle failed. key={}, err={}", key, error.getMessage());
                        });
    }

    public record DispatchResult(State state, EnforcementOutcome outcome, EnforcementFailure failure) {

        public enum State {
            COMPLETED,
            SCHEDULED,
            FAILED
        }

        static DispatchResult completed(EnforcementOutcome outcome) {
            return new DispatchResult(State.COMPLETED, outcome, null);
        }

        static DispatchResult scheduled() {
            return new DispatchResult(State.SCHEDULED, null, null);
        }

        static DispatchResult failed(EnforcementFailure failure) {
            return new DispatchResult(State.FAILED, null, failure);
        }
    }
}
