package com.ownding.telemetry.retention;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Supplier;

/**
 * Lets at most one enforcement cycle per series key run at a time.
 * <p>
 * The first caller for an idle key becomes its runner. Callers that arrive while the key is running
 * do not queue up; they flag the key and return {@link EnforcementOutcome.Status#COALESCED} at once.
 * The runner checks the flag after each cycle and runs exactly one more cycle if it was set, so any
 * number of overlapping triggers collapse into a single follow-up run against fresh state.
 * Distinct keys never contend.
 */
@Component
public class KeyedEnforcementGate {

    private static final Logger log = LoggerFactory.getLogger(KeyedEnforcementGate.class);

    private final Map<SeriesKey, KeyState> stateByKey = new ConcurrentHashMap<>();

    public EnforcementOutcome runCoalesced(SeriesKey key, Supplier<EnforcementOutcome> cycle) {
        AtomicBoolean runner = new AtomicBoolean(false);
        stateByKey.compute(key, (k, state) -> {
            if (state == null) {
                runner.set(true);
                return new KeyState();
            }
            state.rerunRequested = true;
            return state;
        });
        if (!runner.get()) {
            return EnforcementOutcome.coalesced(key);
        }

        boolean released = false;
        try {
            EnforcementOutcome outcome;
            do {
                outcome = cycle.get();
            } while (claimRerun(key));
            released = true;
            return outcome;
        } finally {
            if (!released) {
                KeyState dropped = stateByKey.remove(key);
                if (dropped != null && dropped.rerunRequested) {
                    log.debug("pending rerun dropped after failed cycle. key={}", key);
                }
            }
        }
    }

    public int activeKeys() {
        return stateByKey.size();
    }

    private boolean claimRerun(SeriesKey key) {
        AtomicBoolean rerun = new AtomicBoolean(false);
        stateByKey.computeIfPresent(key, (k, state) -> {
            if (state.rerunRequested) {
                state.rerunRequested = false;
                rerun.set(true);
                return state;
            }
            return null;
        });
        return rerun.get();
    }

    private static final class KeyState {
        // only read and written inside ConcurrentHashMap.compute for the key
        private boolean rerunRequested;
    }
}
