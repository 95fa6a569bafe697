package fr.lapetina.aigateway.disruptor;

import fr.lapetina.aigateway.domain.event.RouterEvent;
import fr.lapetina.aigateway.domain.event.RouterEventType;
import fr.lapetina.aigateway.infrastructure.metrics.MetricsRegistry;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;

class RouterEventBusTest {

    private static final Instant AT = Instant.parse("2025-03-10T12:00:00Z");

    private MetricsRegistry metrics;
    private RouterEventBus bus;

    @BeforeEach
    void setUp() {
        metrics = new MetricsRegistry("test");
        bus = RouterEventBus.builder()
                .ringBufferSize(64)
                .waitStrategy("blocking")
                .metricsRegistry(metrics)
                .build();
    }

    @AfterEach
    void tearDown() {
        bus.close();
        metrics.close();
    }

    private static RouterEvent completed(String requestId) {
        return RouterEvent.of(RouterEventType.REQUEST_COMPLETE, AT, requestId, "openai", Map.of(
                RouterEvent.MODEL, "gpt-4o",
                RouterEvent.LATENCY_MS, 120L,
                RouterEvent.CACHED, false,
                RouterEvent.INPUT_TOKENS, 100,
                RouterEvent.OUTPUT_TOKENS, 50,
                RouterEvent.COST, new BigDecimal("0.00075")));
    }

    @Test
    @DisplayName("should deliver published events to listeners in order")
    void shouldDeliverToListeners() throws Exception {
        List<String> received = new CopyOnWriteArrayList<>();
        CountDownLatch latch = new CountDownLatch(3);
        bus.addListener(event -> {
            received.add(event.requestId());
            latch.countDown();
        });
        bus.start();

        bus.publish(completed("req-1"));
        bus.publish(completed("req-2"));
        bus.publish(completed("req-3"));

        assertThat(latch.await(5, TimeUnit.SECONDS)).isTrue();
        assertThat(received).containsExactly("req-1", "req-2", "req-3");
        assertThat(bus.getPublishedEvents()).isEqualTo(3);
    }

    @Test
    @DisplayName("should keep delivering when a listener throws")
    void shouldIsolateListenerFailures() throws Exception {
        CountDownLatch latch = new CountDownLatch(2);
        bus.addListener(event -> {
            throw new IllegalStateException("listener down");
        });
        bus.addListener(event -> latch.countDown());
        bus.start();

        bus.publish(completed("req-1"));
        bus.publish(completed("req-2"));

        assertThat(latch.await(5, TimeUnit.SECONDS)).isTrue();
    }

    @Test
    @DisplayName("should record request, token and failover metrics")
    void shouldRecordMetrics() {
        bus.start();

        bus.publish(completed("req-1"));
        bus.publish(RouterEvent.of(RouterEventType.REQUEST_FAILED, AT, "req-2", "anthropic", Map.of(
                RouterEvent.ERROR_TYPE, "RATE_LIMIT",
                RouterEvent.ERROR, "throttled")));
        bus.publish(RouterEvent.of(RouterEventType.FAILOVER, AT, "req-2", "anthropic", Map.of(
                RouterEvent.TO, "openai")));
        bus.close();

        assertThat(metrics.getRegistry().get("test_requests_total")
                .tags("provider", "openai", "outcome", "success").counter().count()).isEqualTo(1.0);
        assertThat(metrics.getRegistry().get("test_tokens_total")
                .tags("provider", "openai", "direction", "output").counter().count()).isEqualTo(50.0);
        assertThat(metrics.getRegistry().get("test_errors_total")
                .tags("provider", "anthropic", "type", "RATE_LIMIT").counter().count()).isEqualTo(1.0);
        assertThat(metrics.getRegistry().get("test_failovers_total")
                .tags("provider", "anthropic").counter().count()).isEqualTo(1.0);
    }

    @Test
    @DisplayName("should drop events instead of blocking when the ring buffer is full")
    void shouldDropWhenFull() throws Exception {
        RouterEventBus small = RouterEventBus.builder()
                .ringBufferSize(4)
                .metricsRegistry(metrics)
                .build();
        CountDownLatch release = new CountDownLatch(1);
        small.addListener(event -> {
            try {
                release.await(5, TimeUnit.SECONDS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        });
        small.start();

        int accepted = 0;
        for (int i = 0; i < 20; i++) {
            if (small.publish(completed("req-" + i))) {
                accepted++;
            }
        }
        release.countDown();
        small.close();

        assertThat(accepted).isLessThanOrEqualTo(4);
        assertThat(small.getDroppedEvents()).isEqualTo(20 - accepted);
    }

    @Test
    @DisplayName("should drop events published before start")
    void shouldDropBeforeStart() {
        assertThat(bus.publish(completed("req-1"))).isFalse();
        assertThat(bus.getDroppedEvents()).isEqualTo(1);
    }
}
