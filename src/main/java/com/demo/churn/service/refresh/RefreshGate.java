package com.demo.churn.service.refresh;

import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Optional;

/**
 * Decides whether the upstream refresh runs before scoring: at most once per TTL
 * for a target, or always when forced. Only a successful run is recorded.
 *
 * <p>The gate holds no state of its own. Callers pass in the loaded snapshot and
 * persist the snapshot handed back in {@link Decision#state()}.
 */
@Slf4j
public class RefreshGate {

    private final RefreshExecutor executor;
    private final Clock clock;

    public RefreshGate(RefreshExecutor executor, Clock clock) {
        this.executor = executor;
        this.clock = clock;
    }

    public Decision maybeRun(RefreshGateState state, RefreshTarget target, boolean force, Duration ttl) {
        String key = target.key();
        if (force) {
            return execute(state, target, "forced");
        }
        Optional<Instant> last = state.lastRun(key);
        if (last.isPresent() && clock.instant().isBefore(last.get().plus(ttl))) {
            return new Decision(state, RefreshOutcome.skipped("recent (last run " + last.get() + ")"));
        }
        return execute(state, target, "ttl_expired");
    }

    private Decision execute(RefreshGateState state, RefreshTarget target, String reason) {
        RefreshResult result;
        try {
            result = executor.execute(target);
        } catch (RuntimeException e) {
            log.error("Refresh {} threw: {}", target.qualifiedName(), e.toString());
            result = RefreshResult.failure(e.getMessage() == null ? e.getClass().getSimpleName() : e.getMessage());
        }
        if (result == null || !result.success()) {
            String msg = result == null ? "no result" : result.message();
            return new Decision(state, RefreshOutcome.failed(msg));
        }
        return new Decision(state.record(target.key(), clock.instant()), RefreshOutcome.ran(reason));
    }

    /**
     * @param state snapshot after the decision; the same instance when nothing changed
     */
    public record Decision(RefreshGateState state, RefreshOutcome outcome) {
    }
}
