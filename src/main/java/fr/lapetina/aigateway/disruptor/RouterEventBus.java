package fr.lapetina.aigateway.disruptor;

import com.lmax.disruptor.BlockingWaitStrategy;
import com.lmax.disruptor.BusySpinWaitStrategy;
import com.lmax.disruptor.ExceptionHandler;
import com.lmax.disruptor.InsufficientCapacityException;
import com.lmax.disruptor.RingBuffer;
import com.lmax.disruptor.SleepingWaitStrategy;
import com.lmax.disruptor.TimeoutException;
import com.lmax.disruptor.WaitStrategy;
import com.lmax.disruptor.YieldingWaitStrategy;
import com.lmax.disruptor.dsl.Disruptor;
import com.lmax.disruptor.dsl.ProducerType;
import fr.lapetina.aigateway.disruptor.handlers.ListenerDispatchHandler;
import fr.lapetina.aigateway.disruptor.handlers.MetricsHandler;
import fr.lapetina.aigateway.domain.event.RouterEvent;
import fr.lapetina.aigateway.domain.event.RouterEventListener;
import fr.lapetina.aigateway.domain.event.RouterEventSlot;
import fr.lapetina.aigateway.domain.event.RouterEventSlotFactory;
import fr.lapetina.aigateway.infrastructure.config.GatewayConfig;
import fr.lapetina.aigateway.infrastructure.metrics.MetricsRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Locale;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Delivers router events to metrics and listeners off the request path.
 *
 * Publishing never blocks: when the ring buffer is full the event is dropped and counted.
 * Events flow through two stages:
 * <pre>
 * Metrics -> Listener dispatch
 * </pre>
 * Multiple request threads publish concurrently, hence {@link ProducerType#MULTI}.
 */
public final class RouterEventBus implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(RouterEventBus.class);

    private final Disruptor<RouterEventSlot> disruptor;
    private final RingBuffer<RouterEventSlot> ringBuffer;
    private final List<RouterEventListener> listeners = new CopyOnWriteArrayList<>();
    private final AtomicBoolean running = new AtomicBoolean(false);
    private final AtomicLong published = new AtomicLong();
    private final AtomicLong dropped = new AtomicLong();

    private RouterEventBus(Builder builder) {
        this.disruptor = new Disruptor<>(
                new RouterEventSlotFactory(),
                builder.ringBufferSize,
                new EventBusThreadFactory("router-events"),
                ProducerType.MULTI,
                createWaitStrategy(builder.waitStrategy)
        );

        disruptor
                .handleEventsWith(new MetricsHandler(builder.metricsRegistry))
                .then(new ListenerDispatchHandler(listeners));
        disruptor.setDefaultExceptionHandler(new EventBusExceptionHandler());

        this.ringBuffer = disruptor.getRingBuffer();

        log.info("RouterEventBus created: ringBufferSize={}, waitStrategy={}",
                builder.ringBufferSize, builder.waitStrategy);
    }

    public void start() {
        if (running.compareAndSet(false, true)) {
            disruptor.start();
            log.info("RouterEventBus started");
        }
    }

    /**
     * Publishes an event without blocking.
     *
     * @return false if the event was dropped
     */
    public boolean publish(RouterEvent event) {
        if (!running.get()) {
            dropped.incrementAndGet();
            log.debug("Event dropped, bus not running: type={}", event.type().getEventName());
            return false;
        }

        long sequence;
        try {
            sequence = ringBuffer.tryNext();
        } catch (InsufficientCapacityException e) {
            long total = dropped.incrementAndGet();
            log.warn("Event dropped, ring buffer full: type={}, requestId={}, droppedTotal={}",
                    event.type().getEventName(), event.requestId(), total);
            return false;
        }

        try {
            ringBuffer.get(sequence).set(event, sequence);
        } finally {
            ringBuffer.publish(sequence);
        }
        published.incrementAndGet();
        return true;
    }

    public void addListener(RouterEventListener listener) {
        listeners.add(listener);
    }

    public void removeListener(RouterEventListener listener) {
        listeners.remove(listener);
    }

    public long getDroppedEvents() {
        return dropped.get();
    }

    public long getPublishedEvents() {
        return published.get();
    }

    public long getRemainingCapacity() {
        return ringBuffer.remainingCapacity();
    }

    /**
     * Drains pending events, then stops the handler threads.
     */
    @Override
    public void close() {
        if (running.compareAndSet(true, false)) {
            log.info("Shutting down RouterEventBus...");
            try {
                disruptor.shutdown(30, TimeUnit.SECONDS);
                log.info("RouterEventBus shut down gracefully");
            } catch (TimeoutException e) {
                log.warn("RouterEventBus shutdown timed out, halting...");
                disruptor.halt();
            }
        }
    }

    private static WaitStrategy createWaitStrategy(String name) {
        switch (name.toLowerCase(Locale.ROOT)) {
            case "blocking":
                return new BlockingWaitStrategy();
            case "yielding":
                return new YieldingWaitStrategy();
            case "busy-spin":
                return new BusySpinWaitStrategy();
            case "sleeping":
                return new SleepingWaitStrategy();
            default:
                log.warn("Unknown wait strategy '{}', using BlockingWaitStrategy", name);
                return new BlockingWaitStrategy();
        }
    }

    public static Builder builder() {
        return new Builder();
    }

    private static class EventBusThreadFactory implements ThreadFactory {
        private final String namePrefix;
        private final AtomicInteger counter = new AtomicInteger(0);

        EventBusThreadFactory(String namePrefix) {
            this.namePrefix = namePrefix;
        }

        @Override
        public Thread newThread(Runnable r) {
            Thread t = new Thread(r, namePrefix + "-" + counter.getAndIncrement());
            t.setDaemon(true);
            return t;
        }
    }

    private static class EventBusExceptionHandler implements ExceptionHandler<RouterEventSlot> {

        private static final Logger log = LoggerFactory.getLogger(EventBusExceptionHandler.class);

        @Override
        public void handleEventException(Throwable ex, long sequence, RouterEventSlot slot) {
            log.error("Exception in event handler: sequence={}, event={}", sequence, slot, ex);
        }

        @Override
        public void handleOnStartException(Throwable ex) {
            log.error("Exception during event bus start", ex);
        }

        @Override
        public void handleOnShutdownException(Throwable ex) {
            log.error("Exception during event bus shutdown", ex);
        }
    }

    public static final class Builder {
        private int ringBufferSize = 1024;
        private String waitStrategy = "blocking";
        private MetricsRegistry metricsRegistry;

        private Builder() {
        }

        public Builder ringBufferSize(int size) {
            if (Integer.bitCount(size) != 1) {
                throw new IllegalArgumentException("Ring buffer size must be power of 2");
            }
            this.ringBufferSize = size;
            return this;
        }

        public Builder waitStrategy(String strategy) {
            this.waitStrategy = strategy;
            return this;
        }

        public Builder metricsRegistry(MetricsRegistry registry) {
            this.metricsRegistry = registry;
            return this;
        }

        public Builder fromConfig(GatewayConfig.EventsConfig config) {
            ringBufferSize(config.getRingBufferSize());
            this.waitStrategy = config.getWaitStrategy();
            return this;
        }

        public RouterEventBus build() {
            if (metricsRegistry == null) {
                throw new IllegalStateException("MetricsRegistry is required");
            }
            return new RouterEventBus(this);
        }
    }
}
