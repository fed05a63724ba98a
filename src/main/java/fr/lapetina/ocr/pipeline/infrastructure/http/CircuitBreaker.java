package fr.lapetina.ocr.pipeline.infrastructure.http;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Circuit breaker guarding the inference backend against a crashed or restarting server.
 *
 * States:
 * - CLOSED: Normal operation, requests pass through
 * - OPEN: Transport failures exceeded threshold, callers must probe readiness first
 * - HALF_OPEN: Recovery timeout elapsed or a probe succeeded, traffic resumes on trial
 *
 * Thread-safe via atomic operations.
 */
public final class CircuitBreaker {

    private static final Logger log = LoggerFactory.getLogger(CircuitBreaker.class);

    public enum State {
        CLOSED,
        OPEN,
        HALF_OPEN
    }

    private final String backendId;
    private final int failureThreshold;
    private final Duration recoveryTimeout;
    private final int successThresholdInHalfOpen;
    private final Clock clock;

    private final AtomicReference<State> state = new AtomicReference<>(State.CLOSED);
    private final AtomicInteger failureCount = new AtomicInteger(0);
    private final AtomicInteger successCountInHalfOpen = new AtomicInteger(0);
    private volatile Instant openedAt;

    public CircuitBreaker(
            String backendId,
            int failureThreshold,
            Duration recoveryTimeout,
            int successThresholdInHalfOpen,
            Clock clock
    ) {
        this.backendId = backendId;
        this.failureThreshold = failureThreshold;
        this.recoveryTimeout = recoveryTimeout;
        this.successThresholdInHalfOpen = successThresholdInHalfOpen;
        this.clock = clock;
    }

    public CircuitBreaker(String backendId, int failureThreshold, Duration recoveryTimeout, int successThresholdInHalfOpen) {
        this(backendId, failureThreshold, recoveryTimeout, successThresholdInHalfOpen, Clock.systemUTC());
    }

    public CircuitBreaker(String backendId) {
        this(backendId, 5, Duration.ofSeconds(30), 3);
    }

    /**
     * Checks if a request is allowed through the circuit breaker.
     *
     * @return true if request should proceed, false if the backend must be probed first
     */
    public boolean allowRequest() {
        State currentState = state.get();

        switch (currentState) {
            case OPEN:
                if (clock.instant().isAfter(openedAt.plus(recoveryTimeout))) {
                    if (state.compareAndSet(State.OPEN, State.HALF_OPEN)) {
                        successCountInHalfOpen.set(0);
                        log.info("Circuit breaker transitioning to HALF_OPEN: backendId={}", backendId);
                    }
                    return true;
                }
                return false;

            case CLOSED:
            case HALF_OPEN:
            default:
                return true;
        }
    }

    /**
     * Records a request that reached the backend.
     */
    public void recordSuccess() {
        State currentState = state.get();

        if (currentState == State.CLOSED) {
            // Reset failure count on success
            failureCount.set(0);
            return;
        }

        if (currentState == State.HALF_OPEN) {
            int successes = successCountInHalfOpen.incrementAndGet();
            if (successes >= successThresholdInHalfOpen
                    && state.compareAndSet(State.HALF_OPEN, State.CLOSED)) {
                failureCount.set(0);
                log.info("Circuit breaker CLOSED after recovery: backendId={}", backendId);
            }
        }
    }

    /**
     * Records a transport failure.
     */
    public void recordFailure() {
        Instant now = clock.instant();
        State currentState = state.get();

        if (currentState == State.HALF_OPEN) {
            // Any failure in half-open immediately opens the circuit
            if (state.compareAndSet(State.HALF_OPEN, State.OPEN)) {
                openedAt = now;
                log.warn("Circuit breaker OPENED (half-open failure): backendId={}", backendId);
            }
            return;
        }

        if (currentState == State.CLOSED) {
            int failures = failureCount.incrementAndGet();
            if (failures >= failureThreshold && state.compareAndSet(State.CLOSED, State.OPEN)) {
                openedAt = now;
                log.warn("Circuit breaker OPENED: backendId={}, failures={}", backendId, failures);
            }
        }
    }

    /**
     * Records a successful readiness probe: an open circuit lets trial traffic through again.
     */
    public void recordProbeSuccess() {
        if (state.compareAndSet(State.OPEN, State.HALF_OPEN)) {
            successCountInHalfOpen.set(0);
            log.info("Circuit breaker HALF_OPEN after successful probe: backendId={}", backendId);
        }
    }

    /**
     * Forces the circuit to a specific state. For testing/admin use.
     */
    public void forceState(State newState) {
        State old = state.getAndSet(newState);
        if (newState == State.CLOSED) {
            failureCount.set(0);
        }
        if (newState == State.OPEN) {
            openedAt = clock.instant();
        }
        log.info("Circuit breaker forced from {} to {}: backendId={}", old, newState, backendId);
    }

    public State getState() {
        // Check for automatic transition from OPEN to HALF_OPEN
        if (state.get() == State.OPEN && openedAt != null
                && clock.instant().isAfter(openedAt.plus(recoveryTimeout))
                && state.compareAndSet(State.OPEN, State.HALF_OPEN)) {
            successCountInHalfOpen.set(0);
        }
        return state.get();
    }

    public int getFailureCount() {
        return failureCount.get();
    }

    @Override
    public String toString() {
        return "CircuitBreaker{" +
                "backendId='" + backendId + '\'' +
                ", state=" + state.get() +
                ", failures=" + failureCount.get() +
                '}';
    }
}
