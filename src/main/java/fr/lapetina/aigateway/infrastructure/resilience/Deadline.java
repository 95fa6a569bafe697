package fr.lapetina.aigateway.infrastructure.resilience;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;

/**
 * Absolute point in time bounding all work done for one request.
 */
public final class Deadline {

    private final Instant expiresAt;
    private final Clock clock;

    private Deadline(Instant expiresAt, Clock clock) {
        this.expiresAt = expiresAt;
        this.clock = clock;
    }

    public static Deadline after(Duration budget, Clock clock) {
        return new Deadline(clock.instant().plus(budget), clock);
    }

    /**
     * Time left, never negative.
     */
    public Duration remaining() {
        Duration remaining = Duration.between(clock.instant(), expiresAt);
        return remaining.isNegative() ? Duration.ZERO : remaining;
    }

    public boolean isExpired() {
        return !clock.instant().isBefore(expiresAt);
    }

    public Instant getExpiresAt() {
        return expiresAt;
    }

    /**
     * The shorter of the remaining time and the given bound.
     */
    public Duration cap(Duration bound) {
        Duration remaining = remaining();
        return bound.compareTo(remaining) < 0 ? bound : remaining;
    }

    @Override
    public String toString() {
        return "Deadline{expiresAt=" + expiresAt + ", remaining=" + remaining() + '}';
    }
}
