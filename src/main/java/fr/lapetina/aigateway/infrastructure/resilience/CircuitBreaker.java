package fr.lapetina.aigateway.infrastructure.resilience;

import fr.lapetina.aigateway.domain.model.CircuitSnapshot;
import fr.lapetina.aigateway.domain.model.CircuitState;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Optional;

/**
 * Circuit breaker for one provider.
 *
 * States:
 * - CLOSED: Normal operation, requests pass through
 * - OPEN: {@code failureThreshold} consecutive failures, requests rejected until {@code openTimeout} elapses
 * - HALF_OPEN: At most {@code halfOpenRequests} concurrent trial calls; {@code successThreshold}
 *   consecutive successes close the circuit, any failure reopens it
 *
 * All state lives behind this instance's monitor, so each provider's state has a single writer.
 * Every transition starts a new epoch; outcomes reported with a permit from an earlier epoch are
 * ignored, so a slow call admitted while CLOSED cannot free a HALF_OPEN trial slot.
 * Time comes from the injected {@link Clock}.
 */
public final class CircuitBreaker {

    private static final Logger log = LoggerFactory.getLogger(CircuitBreaker.class);

    private final String providerId;
    private final int failureThreshold;
    private final int successThreshold;
    private final Duration openTimeout;
    private final int halfOpenRequests;
    private final Clock clock;

    private volatile CircuitTransitionListener transitionListener = (id, from, to) -> { };

    private CircuitState state = CircuitState.CLOSED;
    private int consecutiveFailures;
    private int consecutiveSuccesses;
    private int halfOpenTrialsInFlight;
    private long epoch;
    private Instant lastTransitionAt;

    public CircuitBreaker(
            String providerId,
            int failureThreshold,
            int successThreshold,
            Duration openTimeout,
            int halfOpenRequests,
            Clock clock
    ) {
        if (failureThreshold <= 0 || successThreshold <= 0 || halfOpenRequests <= 0) {
            throw new IllegalArgumentException("Circuit breaker thresholds must be positive");
        }
        this.providerId = providerId;
        this.failureThreshold = failureThreshold;
        this.successThreshold = successThreshold;
        this.openTimeout = openTimeout;
        this.halfOpenRequests = halfOpenRequests;
        this.clock = clock;
        this.lastTransitionAt = clock.instant();
    }

    public CircuitBreaker(String providerId, Clock clock) {
        this(providerId, 5, 2, Duration.ofSeconds(60), 3, clock);
    }

    public void setTransitionListener(CircuitTransitionListener listener) {
        this.transitionListener = listener != null ? listener : (id, from, to) -> { };
    }

    /**
     * Asks to send one request through the breaker.
     *
     * This is the only call that moves OPEN to HALF_OPEN. A granted HALF_OPEN permit reserves a
     * trial slot until it is settled by {@link #recordSuccess(Permit)}, {@link #recordFailure(Permit)}
     * or {@link #releasePermission(Permit)}.
     *
     * @return a permit if the request may proceed, empty otherwise
     */
    public Optional<Permit> tryAcquirePermission() {
        CircuitState from;
        CircuitState to;
        Permit permit;
        synchronized (this) {
            from = state;
            if (state == CircuitState.OPEN && openTimeoutElapsed()) {
                transitionTo(CircuitState.HALF_OPEN);
                log.info("Circuit breaker transitioning to HALF_OPEN: providerId={}", providerId);
            }
            to = state;
            switch (state) {
                case CLOSED:
                    permit = new Permit(this, epoch, false);
                    break;
                case HALF_OPEN:
                    if (halfOpenTrialsInFlight < halfOpenRequests) {
                        halfOpenTrialsInFlight++;
                        permit = new Permit(this, epoch, true);
                    } else {
                        permit = null;
                    }
                    break;
                default:
                    permit = null;
            }
        }
        fireIfChanged(from, to);
        return Optional.ofNullable(permit);
    }

    /**
     * Gives back a permit that was granted but never used for a dispatch.
     */
    public synchronized void releasePermission(Permit permit) {
        if (settle(permit) && permit.trial) {
            halfOpenTrialsInFlight--;
        }
    }

    /**
     * Records a successful request. Ignored when the permit predates the current state.
     */
    public void recordSuccess(Permit permit) {
        CircuitState from;
        CircuitState to;
        synchronized (this) {
            from = state;
            if (settle(permit)) {
                consecutiveFailures = 0;
                if (state == CircuitState.HALF_OPEN) {
                    halfOpenTrialsInFlight--;
                    consecutiveSuccesses++;
                    if (consecutiveSuccesses >= successThreshold) {
                        transitionTo(CircuitState.CLOSED);
                        log.info("Circuit breaker CLOSED after recovery: providerId={}", providerId);
                    }
                }
            }
            to = state;
        }
        fireIfChanged(from, to);
    }

    /**
     * Records a failed request. Ignored when the permit predates the current state.
     */
    public void recordFailure(Permit permit) {
        CircuitState from;
        CircuitState to;
        synchronized (this) {
            from = state;
            if (settle(permit)) {
                consecutiveSuccesses = 0;
                consecutiveFailures++;
                if (state == CircuitState.HALF_OPEN) {
                    // Any failure in half-open immediately opens the circuit
                    transitionTo(CircuitState.OPEN);
                    log.warn("Circuit breaker OPENED (half-open failure): providerId={}", providerId);
                } else if (consecutiveFailures >= failureThreshold) {
                    transitionTo(CircuitState.OPEN);
                    log.warn("Circuit breaker OPENED: providerId={}, failures={}", providerId, consecutiveFailures);
                }
            }
            to = state;
        }
        fireIfChanged(from, to);
    }

    /**
     * Marks the permit as used. A permit from another breaker, from an earlier state, or already
     * settled has no effect.
     */
    private boolean settle(Permit permit) {
        if (permit == null || permit.owner != this || permit.settled) {
            return false;
        }
        permit.settled = true;
        if (permit.epoch != epoch) {
            log.debug("Ignoring outcome of a stale permit: providerId={}, permitEpoch={}, epoch={}",
                    providerId, permit.epoch, epoch);
            return false;
        }
        return true;
    }

    /**
     * Forces the circuit to a specific state. For testing/admin use.
     */
    public void forceState(CircuitState newState) {
        CircuitState old;
        synchronized (this) {
            old = state;
            transitionTo(newState);
            if (newState == CircuitState.CLOSED) {
                consecutiveFailures = 0;
            }
        }
        log.info("Circuit breaker forced from {} to {}: providerId={}", old, newState, providerId);
        fireIfChanged(old, newState);
    }

    /**
     * Returns the breaker to a fresh CLOSED state.
     */
    public void reset() {
        forceState(CircuitState.CLOSED);
    }

    /**
     * Current state, without side effects. An OPEN breaker whose timeout elapsed is still
     * reported OPEN until a permission request moves it.
     */
    public synchronized CircuitState getState() {
        return state;
    }

    /**
     * Whether a permission request would currently be granted.
     */
    public synchronized boolean isCallPermitted() {
        switch (state) {
            case CLOSED:
                return true;
            case HALF_OPEN:
                return halfOpenTrialsInFlight < halfOpenRequests;
            default:
                return openTimeoutElapsed();
        }
    }

    public synchronized CircuitSnapshot snapshot() {
        return new CircuitSnapshot(providerId, state, consecutiveFailures, consecutiveSuccesses,
                lastTransitionAt, halfOpenTrialsInFlight);
    }

    public synchronized int getFailureCount() {
        return consecutiveFailures;
    }

    public String getProviderId() {
        return providerId;
    }

    private boolean openTimeoutElapsed() {
        return !clock.instant().isBefore(lastTransitionAt.plus(openTimeout));
    }

    private void transitionTo(CircuitState newState) {
        state = newState;
        epoch++;
        lastTransitionAt = clock.instant();
        consecutiveSuccesses = 0;
        halfOpenTrialsInFlight = 0;
        if (newState == CircuitState.CLOSED) {
            consecutiveFailures = 0;
        }
    }

    private void fireIfChanged(CircuitState from, CircuitState to) {
        if (from == to) {
            return;
        }
        try {
            transitionListener.onTransition(providerId, from, to);
        } catch (Exception e) {
            log.error("Error notifying circuit transition listener: providerId={}", providerId, e);
        }
    }

    /**
     * One granted permission. Settled exactly once, under the breaker's monitor.
     */
    public static final class Permit {
        private final CircuitBreaker owner;
        private final long epoch;
        private final boolean trial;
        private boolean settled;

        private Permit(CircuitBreaker owner, long epoch, boolean trial) {
            this.owner = owner;
            this.epoch = epoch;
            this.trial = trial;
        }

        public boolean isTrial() {
            return trial;
        }
    }

    @Override
    public synchronized String toString() {
        return "CircuitBreaker{" +
                "providerId='" + providerId + '\'' +
                ", state=" + state +
                ", failures=" + consecutiveFailures +
                '}';
    }
}
