package com.example.cruisesync.infrastructure.ftp;

import com.example.cruisesync.domain.enumtype.CircuitState;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.Deque;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Per-host breaker. Opens when {@code failureThreshold} failures land inside the sliding
 * window, rejects calls for the cool-down, then lets exactly one trial call through.
 * The trial's outcome closes or re-opens the breaker.
 *
 * <p>Every granted {@link Permit} must be followed by exactly one of
 * {@link #recordSuccess(Permit)}, {@link #recordFailure(Permit)} or {@link #release(Permit)}.
 * A permit remembers the state generation it was granted in; verdicts from a permit granted
 * before the last state change are ignored, so a slow call started while CLOSED cannot decide
 * the trial of a later HALF_OPEN phase.
 */
public class CircuitBreaker {

    private static final Logger log = LoggerFactory.getLogger(CircuitBreaker.class);

    private final String name;
    private final int failureThreshold;
    private final Duration window;
    private final Duration coolDown;
    private final Clock clock;

    private final Deque<Instant> failures = new ArrayDeque<>();
    private CircuitState state = CircuitState.CLOSED;
    private long generation;
    private Instant openedAt;
    private boolean trialInFlight;
    private long totalOpenings;

    public CircuitBreaker(String name, int failureThreshold, Duration window, Duration coolDown, Clock clock) {
        this.name = name;
        this.failureThreshold = Math.max(1, failureThreshold);
        this.window = window;
        this.coolDown = coolDown;
        this.clock = clock;
    }

    /**
     * @return a permit, or {@code null} while the breaker is open or a trial is in flight
     */
    public synchronized Permit tryAcquire() {
        if (state == CircuitState.OPEN) {
            if (clock.instant().isBefore(openedAt.plus(coolDown))) {
                return null;
            }
            transition(CircuitState.HALF_OPEN);
        }
        if (state == CircuitState.HALF_OPEN) {
            if (trialInFlight) {
                return null;
            }
            trialInFlight = true;
        }
        return new Permit(generation);
    }

    public synchronized void recordSuccess(Permit permit) {
        if (isStale(permit)) {
            return;
        }
        if (state == CircuitState.HALF_OPEN) {
            trialInFlight = false;
            failures.clear();
            transition(CircuitState.CLOSED);
        }
    }

    public synchronized void recordFailure(Permit permit) {
        if (isStale(permit)) {
            return;
        }
        Instant now = clock.instant();
        if (state == CircuitState.HALF_OPEN) {
            trialInFlight = false;
            open(now);
            return;
        }
        failures.addLast(now);
        evictOutsideWindow(now);
        if (failures.size() >= failureThreshold) {
            open(now);
        }
    }

    /**
     * Give back a permit without a verdict, e.g. when the call never reached the host.
     */
    public synchronized void release(Permit permit) {
        if (!isStale(permit) && state == CircuitState.HALF_OPEN) {
            trialInFlight = false;
        }
    }

    /** Operator override: force the breaker closed and forget recent failures. */
    public synchronized void reset() {
        failures.clear();
        trialInFlight = false;
        openedAt = null;
        if (state != CircuitState.CLOSED) {
            transition(CircuitState.CLOSED);
        }
        log.info("CIRCUIT_BREAKER_RESET name={}", name);
    }

    public synchronized CircuitState state() {
        if (state == CircuitState.OPEN && !clock.instant().isBefore(openedAt.plus(coolDown))) {
            return CircuitState.HALF_OPEN;
        }
        return state;
    }

    public synchronized Duration remainingCoolDown() {
        if (state != CircuitState.OPEN) {
            return Duration.ZERO;
        }
        Duration remaining = Duration.between(clock.instant(), openedAt.plus(coolDown));
        return remaining.isNegative() ? Duration.ZERO : remaining;
    }

    public synchronized int recentFailureCount() {
        evictOutsideWindow(clock.instant());
        return failures.size();
    }

    public synchronized long totalOpenings() {
        return totalOpenings;
    }

    public String name() {
        return name;
    }

    private void open(Instant now) {
        openedAt = now;
        failures.clear();
        totalOpenings++;
        transition(CircuitState.OPEN);
    }

    private void evictOutsideWindow(Instant now) {
        Instant cutoff = now.minus(window);
        while (!failures.isEmpty() && !failures.peekFirst().isAfter(cutoff)) {
            failures.pollFirst();
        }
    }

    private boolean isStale(Permit permit) {
        return permit == null || permit.generation != generation;
    }

    private void transition(CircuitState next) {
        CircuitState previous = state;
        state = next;
        generation++;
        if (next == CircuitState.OPEN) {
            log.warn("CIRCUIT_BREAKER_OPENED name={} from={} coolDownMs={}", name, previous, coolDown.toMillis());
        } else {
            log.info("CIRCUIT_BREAKER_STATE name={} from={} to={}", name, previous, next);
        }
    }

    public static final class Permit {

        private final long generation;

        private Permit(long generation) {
            this.generation = generation;
        }
    }
}
