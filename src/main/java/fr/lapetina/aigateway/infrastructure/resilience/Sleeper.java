package fr.lapetina.aigateway.infrastructure.resilience;

import java.time.Duration;

/**
 * Blocking pause used between retry attempts. Replaceable in tests.
 */
@FunctionalInterface
public interface Sleeper {

    Sleeper SYSTEM = duration -> Thread.sleep(duration.toMillis());

    void sleep(Duration duration) throws InterruptedException;
}
