package com.ownding.telemetry.retention;

import com.ownding.telemetry.config.AppProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * Re-runs enforcement for series whose last cycle was skipped, aborted, deferred or failed, so a
 * device that stops sending still converges to its cap.
 */
@Component
public class RetentionSweepScheduler {

    private static final Logger log = LoggerFactory.getLogger(RetentionSweepScheduler.class);

    private final RetentionEnforcer retentionEnforcer;
    private final EnforcementMonitor monitor;
    private final int maxRounds;

    public RetentionSweepScheduler(RetentionEnforcer retentionEnforcer, EnforcementMonitor monitor,
            AppProperties appProperties) {
        this.retentionEnforcer = retentionEnforcer;
        this.monitor = monitor;
        this.maxRounds = appProperties.getRetention().getSweepMaxRounds();
    }

    @Scheduled(fixedDelayString = "${app.retention.sweep-interval-ms:60000}")
    public void sweepDeferredKeys() {
        int settled = 0;
        int pending = 0;
        for (EnforcementMonitor.DeferredKey deferred : monitor.deferredKeys()) {
            SeriesKey key = deferred.key();
            if (deferred.rounds() > maxRounds) {
                monitor.forget(key);
                log.warn("retention sweep gave up on key. key={}, rounds={}, reason={}",
                        key, deferred.rounds(), deferred.reason());
                continue;
            }
            try {
                EnforcementOutcome outcome = retentionEnforcer.enforce(key.userId(), key.deviceId());
                if (outcome.status().isSettled()) {
                    settled++;
                } else {
                    pending++;
                }
            } catch (EnforcementException ex) {
                pending++;
                log.warn("retention sweep cycle failed. key={}, failure={}, err={}",
                        key, ex.getFailure(), ex.getMessage());
            }
        }
        if (settled + pending > 0) {
            log.info("retention sweep done, settled={}, pending={}", settled, pending);
        }
    }
}
