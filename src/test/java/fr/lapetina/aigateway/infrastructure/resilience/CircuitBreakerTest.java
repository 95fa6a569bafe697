package fr.lapetina.aigateway.infrastructure.resilience;

import fr.lapetina.aigateway.domain.model.CircuitState;
import fr.lapetina.aigateway.support.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class CircuitBreakerTest {

    private MutableClock clock;
    private CircuitBreaker circuitBreaker;
    private List<String> transitions;

    @BeforeEach
    void setUp() {
        clock = MutableClock.at("2025-01-01T00:00:00Z");
        // 3 failures to open, 2 successes to close, 100ms recovery, 1 trial call
        circuitBreaker = new CircuitBreaker("test-provider", 3, 2, Duration.ofMillis(100), 1, clock);
        transitions = new ArrayList<>();
        circuitBreaker.setTransitionListener((id, from, to) -> transitions.add(id + ":" + from + "->" + to));
    }

    private CircuitBreaker.Permit acquire() {
        return circuitBreaker.tryAcquirePermission().orElseThrow();
    }

    private void fail() {
        circuitBreaker.recordFailure(acquire());
    }

    private void succeed() {
        circuitBreaker.recordSuccess(acquire());
    }

    private void open() {
        fail();
        fail();
        fail();
    }

    @Test
    @DisplayName("should start in CLOSED state")
    void shouldStartClosed() {
        assertThat(circuitBreaker.getState()).isEqualTo(CircuitState.CLOSED);
        assertThat(circuitBreaker.tryAcquirePermission()).isPresent();
    }

    @Test
    @DisplayName("should open after exactly the failure threshold")
    void shouldOpenAfterThresholdFailures() {
        fail();
        fail();
        assertThat(circuitBreaker.getState()).isEqualTo(CircuitState.CLOSED);

        fail(); // Third failure hits threshold

        assertThat(circuitBreaker.getState()).isEqualTo(CircuitState.OPEN);
        assertThat(circuitBreaker.tryAcquirePermission()).isEmpty();
        assertThat(transitions).containsExactly("test-provider:CLOSED->OPEN");
    }

    @Test
    @DisplayName("should reset failure count on success")
    void shouldResetFailureCountOnSuccess() {
        fail();
        fail();
        assertThat(circuitBreaker.getFailureCount()).isEqualTo(2);

        succeed();

        assertThat(circuitBreaker.getFailureCount()).isZero();
    }

    @Test
    @DisplayName("should count each permit outcome only once")
    void shouldSettlePermitOnce() {
        CircuitBreaker.Permit permit = acquire();

        circuitBreaker.recordFailure(permit);
        circuitBreaker.recordFailure(permit);
        circuitBreaker.recordFailure(permit);

        assertThat(circuitBreaker.getFailureCount()).isEqualTo(1);
        assertThat(circuitBreaker.getState()).isEqualTo(CircuitState.CLOSED);
    }

    @Test
    @DisplayName("should ignore permits issued by another breaker")
    void shouldIgnoreForeignPermit() {
        CircuitBreaker other = new CircuitBreaker("other-provider", clock);
        CircuitBreaker.Permit foreign = other.tryAcquirePermission().orElseThrow();

        circuitBreaker.recordFailure(foreign);

        assertThat(circuitBreaker.getFailureCount()).isZero();
    }

    @Nested
    @DisplayName("recovery")
    class Recovery {

        @Test
        @DisplayName("should stay OPEN before the timeout elapses")
        void shouldStayOpenBeforeTimeout() {
            open();
            clock.advance(Duration.ofMillis(99));

            assertThat(circuitBreaker.isCallPermitted()).isFalse();
            assertThat(circuitBreaker.tryAcquirePermission()).isEmpty();
            assertThat(circuitBreaker.getState()).isEqualTo(CircuitState.OPEN);
        }

        @Test
        @DisplayName("should move to HALF_OPEN on the first permission request after the timeout")
        void shouldTransitionToHalfOpenAfterTimeout() {
            open();
            clock.advance(Duration.ofMillis(100));

            assertThat(circuitBreaker.isCallPermitted()).isTrue();
            // Reading the state has no side effect
            assertThat(circuitBreaker.getState()).isEqualTo(CircuitState.OPEN);

            assertThat(circuitBreaker.tryAcquirePermission())
                    .hasValueSatisfying(permit -> assertThat(permit.isTrial()).isTrue());
            assertThat(circuitBreaker.getState()).isEqualTo(CircuitState.HALF_OPEN);
        }

        @Test
        @DisplayName("should limit concurrent trial calls in HALF_OPEN")
        void shouldLimitHalfOpenTrials() {
            open();
            clock.advance(Duration.ofMillis(100));

            CircuitBreaker.Permit trial = acquire();
            assertThat(circuitBreaker.tryAcquirePermission()).isEmpty();

            circuitBreaker.releasePermission(trial);
            assertThat(circuitBreaker.tryAcquirePermission()).isPresent();
        }

        @Test
        @DisplayName("should close after the success threshold in HALF_OPEN")
        void shouldCloseAfterSuccessesInHalfOpen() {
            open();
            clock.advance(Duration.ofMillis(100));

            succeed();
            assertThat(circuitBreaker.getState()).isEqualTo(CircuitState.HALF_OPEN);

            succeed();

            assertThat(circuitBreaker.getState()).isEqualTo(CircuitState.CLOSED);
            assertThat(transitions).containsExactly(
                    "test-provider:CLOSED->OPEN",
                    "test-provider:OPEN->HALF_OPEN",
                    "test-provider:HALF_OPEN->CLOSED");
        }

        @Test
        @DisplayName("should reopen on failure in HALF_OPEN")
        void shouldReopenOnFailureInHalfOpen() {
            open();
            clock.advance(Duration.ofMillis(100));

            fail();

            assertThat(circuitBreaker.getState()).isEqualTo(CircuitState.OPEN);
            assertThat(circuitBreaker.isCallPermitted()).isFalse();
        }
    }

    @Nested
    @DisplayName("late outcomes")
    class LateOutcomes {

        private CircuitBreaker breaker;

        @BeforeEach
        void setUp() {
            // Opens on the first failure, one trial call, closes after one success
            breaker = new CircuitBreaker("slow-provider", 1, 1, Duration.ofSeconds(1), 1, clock);
        }

        @Test
        @DisplayName("should not free the HALF_OPEN slot when a call admitted while CLOSED succeeds late")
        void shouldIgnoreLateSuccessFromClosedState() {
            CircuitBreaker.Permit slow = breaker.tryAcquirePermission().orElseThrow();
            breaker.recordFailure(breaker.tryAcquirePermission().orElseThrow());
            assertThat(breaker.getState()).isEqualTo(CircuitState.OPEN);

            clock.advance(Duration.ofSeconds(1));
            CircuitBreaker.Permit trial = breaker.tryAcquirePermission().orElseThrow();
            assertThat(trial.isTrial()).isTrue();

            breaker.recordSuccess(slow);

            assertThat(breaker.tryAcquirePermission()).isEmpty();
            assertThat(breaker.getState()).isEqualTo(CircuitState.HALF_OPEN);
            assertThat(breaker.snapshot().halfOpenTrialsInFlight()).isEqualTo(1);
        }

        @Test
        @DisplayName("should not reopen a HALF_OPEN circuit when a call admitted while CLOSED fails late")
        void shouldIgnoreLateFailureFromClosedState() {
            CircuitBreaker.Permit slow = breaker.tryAcquirePermission().orElseThrow();
            breaker.recordFailure(breaker.tryAcquirePermission().orElseThrow());
            clock.advance(Duration.ofSeconds(1));
            CircuitBreaker.Permit trial = breaker.tryAcquirePermission().orElseThrow();

            breaker.recordFailure(slow);
            assertThat(breaker.getState()).isEqualTo(CircuitState.HALF_OPEN);

            breaker.recordSuccess(trial);
            assertThat(breaker.getState()).isEqualTo(CircuitState.CLOSED);
        }

        @Test
        @DisplayName("should ignore outcomes of permits granted before a reset")
        void shouldIgnoreOutcomesAcrossReset() {
            CircuitBreaker.Permit before = breaker.tryAcquirePermission().orElseThrow();
            breaker.reset();

            breaker.recordFailure(before);

            assertThat(breaker.getState()).isEqualTo(CircuitState.CLOSED);
            assertThat(breaker.getFailureCount()).isZero();
        }
    }

    @Test
    @DisplayName("should allow forcing state and resetting")
    void shouldAllowForcingState() {
        circuitBreaker.forceState(CircuitState.OPEN);
        assertThat(circuitBreaker.getState()).isEqualTo(CircuitState.OPEN);

        circuitBreaker.reset();
        assertThat(circuitBreaker.getState()).isEqualTo(CircuitState.CLOSED);
        assertThat(circuitBreaker.getFailureCount()).isZero();
        assertThat(transitions).containsExactly(
                "test-provider:CLOSED->OPEN",
                "test-provider:OPEN->CLOSED");
    }

    @Test
    @DisplayName("should keep working when the transition listener throws")
    void shouldSurviveListenerFailure() {
        circuitBreaker.setTransitionListener((id, from, to) -> {
            throw new IllegalStateException("boom");
        });

        open();

        assertThat(circuitBreaker.getState()).isEqualTo(CircuitState.OPEN);
    }
}
