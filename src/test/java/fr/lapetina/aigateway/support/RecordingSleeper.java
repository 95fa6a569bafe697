package fr.lapetina.aigateway.support;

import fr.lapetina.aigateway.infrastructure.resilience.Sleeper;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Sleeper that records requested pauses and advances a {@link MutableClock} instead of blocking.
 */
public final class RecordingSleeper implements Sleeper {

    private final List<Duration> sleeps = new CopyOnWriteArrayList<>();
    private final MutableClock clock;

    public RecordingSleeper(MutableClock clock) {
        this.clock = clock;
    }

    public RecordingSleeper() {
        this(null);
    }

    @Override
    public void sleep(Duration duration) {
        sleeps.add(duration);
        if (clock != null) {
            clock.advance(duration);
        }
    }

    public List<Duration> getSleeps() {
        return sleeps;
    }

    public Duration total() {
        return sleeps.stream().reduce(Duration.ZERO, Duration::plus);
    }
}
