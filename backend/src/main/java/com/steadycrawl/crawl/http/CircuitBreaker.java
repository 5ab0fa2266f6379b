package com.steadycrawl.crawl.http;

import com.steadycrawl.config.CircuitBreakerConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;

/**
 * Failure state machine for one target.
 *
 * <pre>
 * CLOSED    --failureThreshold consecutive failures--> OPEN
 * OPEN      --recoveryTimeout elapsed-----------------> HALF_OPEN
 * HALF_OPEN --successThreshold consecutive successes--> CLOSED
 * HALF_OPEN --any failure-----------------------------> OPEN
 * </pre>
 *
 * Every call must pair a successful {@link #tryAcquire()} with exactly one of {@link #recordSuccess()},
 * {@link #recordFailure()} or {@link #release()}.
 */
public class CircuitBreaker {
    private static final Logger log = LoggerFactory.getLogger(CircuitBreaker.class);

    private final String name;
    private final CircuitBreakerConfig config;
    private final Clock clock;

    private CircuitState state = CircuitState.CLOSED;
    private int consecutiveFailures;
    private int consecutiveSuccesses;
    private int trialsAdmitted;
    private Instant openedAt;

    public CircuitBreaker(String name, CircuitBreakerConfig config, Clock clock) {
        this.name = name;
        this.config = config;
        this.clock = clock;
    }

    public synchronized boolean tryAcquire() {
        evaluateRecovery();
        switch (state) {
            case CLOSED:
                return true;
            case HALF_OPEN:
                if (trialsAdmitted < config.halfOpenMaxCalls()) {
                    trialsAdmitted++;
                    return true;
                }
                return false;
            case OPEN:
            default:
                return false;
        }
    }

    public synchronized void recordSuccess() {
        switch (state) {
            case CLOSED:
                consecutiveFailures = 0;
                break;
            case HALF_OPEN:
                consecutiveSuccesses++;
                if (consecutiveSuccesses >= config.successThreshold()) {
                    transitionTo(CircuitState.CLOSED);
                }
                break;
            case OPEN:
            default:
                // late result of a call admitted before the breaker opened
                break;
        }
    }

    public synchronized void recordFailure() {
        switch (state) {
            case CLOSED:
                consecutiveFailures++;
                if (consecutiveFailures >= config.failureThreshold()) {
                    transitionTo(CircuitState.OPEN);
                }
                break;
            case HALF_OPEN:
                consecutiveFailures++;
                transitionTo(CircuitState.OPEN);
                break;
            case OPEN:
            default:
                break;
        }
    }

    /**
     * Gives back a permission whose call never completed, leaving the counters untouched.
     */
    public synchronized void release() {
        if (state == CircuitState.HALF_OPEN && trialsAdmitted > 0) {
            trialsAdmitted--;
        }
    }

    public synchronized CircuitState state() {
        evaluateRecovery();
        return state;
    }

    public synchronized int consecutiveFailures() {
        return consecutiveFailures;
    }

    /**
     * @return when an OPEN breaker starts admitting trial calls, or now when it already does
     */
    public synchronized Instant retryAfter() {
        if (state == CircuitState.OPEN && openedAt != null) {
            return openedAt.plus(config.recoveryTimeout());
        }
        return clock.instant();
    }

    public synchronized void reset() {
        transitionTo(CircuitState.CLOSED);
    }

    public String name() {
        return name;
    }

    private void evaluateRecovery() {
        if (state == CircuitState.OPEN && openedAt != null
            && !clock.instant().isBefore(openedAt.plus(config.recoveryTimeout()))) {
            transitionTo(CircuitState.HALF_OPEN);
        }
    }

    private void transitionTo(CircuitState next) {
        CircuitState previous = state;
        state = next;
        switch (next) {
            case OPEN:
                openedAt = clock.instant();
                consecutiveSuccesses = 0;
                trialsAdmitted = 0;
                log.warn("Circuit {} {} -> OPEN after {} consecutive failures, retry after {}",
                    name, previous, consecutiveFailures, openedAt.plus(config.recoveryTimeout()));
                break;
            case HALF_OPEN:
                consecutiveSuccesses = 0;
                trialsAdmitted = 0;
                log.info("Circuit {} OPEN -> HALF_OPEN, admitting {} trial calls", name, config.halfOpenMaxCalls());
                break;
            case CLOSED:
            default:
                consecutiveFailures = 0;
                consecutiveSuccesses = 0;
                trialsAdmitted = 0;
                openedAt = null;
                if (previous != CircuitState.CLOSED) {
                    log.info("Circuit {} {} -> CLOSED", name, previous);
                }
                break;
        }
    }
}
