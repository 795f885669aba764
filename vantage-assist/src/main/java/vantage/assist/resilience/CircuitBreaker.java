package vantage.assist.resilience;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;

public class CircuitBreaker {
    private static final Logger log = LoggerFactory.getLogger(CircuitBreaker.class);

    private final String name;
    private final int failureThreshold;
    private final Duration cooldown;
    private final Clock clock;

    private int consecutiveFailures;
    private Instant openUntil;
    private boolean trialInFlight;

    public CircuitBreaker(String name, int failureThreshold, Duration cooldown, Clock clock) {
        if (failureThreshold < 1) {
            throw new IllegalArgumentException("failureThreshold must be >= 1");
        }
        if (cooldown == null || cooldown.isNegative()) {
            throw new IllegalArgumentException("cooldown must be >= 0");
        }
        this.name = name;
        this.failureThreshold = failureThreshold;
        this.cooldown = cooldown;
        this.clock = clock;
    }

    /**
     * Returns whether a call may go out now. When the cooldown has elapsed the
     * first caller makes the trial call and later callers are rejected until it
     * reports back.
     */
    public synchronized boolean tryAcquire() {
        if (openUntil == null) {
            return true;
        }
        if (clock.instant().isBefore(openUntil)) {
            return false;
        }
        if (trialInFlight) {
            return false;
        }
        trialInFlight = true;
        log.info("Circuit {} cooldown elapsed, allowing trial call", name);
        return true;
    }

    public synchronized boolean isOpen() {
        return state() == CircuitState.OPEN;
    }

    public synchronized void recordSuccess() {
        if (openUntil != null || consecutiveFailures > 0) {
            log.info("Circuit {} closed after success (previous failures={})", name, consecutiveFailures);
        }
        consecutiveFailures = 0;
        openUntil = null;
        trialInFlight = false;
    }

    /**
     * Counts a provider-health failure.
     *
     * @return true when this failure left the circuit open
     */
    public synchronized boolean recordFailure() {
        consecutiveFailures++;
        trialInFlight = false;
        if (consecutiveFailures >= failureThreshold) {
            openUntil = clock.instant().plus(cooldown);
            log.warn("Circuit {} open until {} after {} consecutive failures",
                    name, openUntil, consecutiveFailures);
            return true;
        }
        return false;
    }

    /** Releases a trial slot after an outcome that says nothing about provider health. */
    public synchronized void recordIgnored() {
        trialInFlight = false;
    }

    public synchronized CircuitState state() {
        if (openUntil == null) {
            return CircuitState.CLOSED;
        }
        if (clock.instant().isBefore(openUntil)) {
            return CircuitState.OPEN;
        }
        return CircuitState.HALF_OPEN;
    }

    public synchronized int consecutiveFailures() {
        return consecutiveFailures;
    }

    public synchronized Instant openUntil() {
        return openUntil;
    }

    public String name() {
        return name;
    }

    public int failureThreshold() {
        return failureThreshold;
    }
}
