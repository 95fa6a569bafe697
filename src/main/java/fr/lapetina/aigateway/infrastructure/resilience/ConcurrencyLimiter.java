package fr.lapetina.aigateway.infrastructure.resilience;

import fr.lapetina.aigateway.domain.error.QueueFullException;
import fr.lapetina.aigateway.domain.error.QueueFullException.QueueFullReason;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Semaphore;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Per-provider concurrency slots with a bounded global wait queue.
 *
 * A request that finds its provider saturated waits for a slot and counts toward the queue;
 * once {@code queueSize} requests are waiting, further requests are rejected immediately.
 */
public final class ConcurrencyLimiter {

    private static final Logger log = LoggerFactory.getLogger(ConcurrencyLimiter.class);

    private final Map<String, ResizableSemaphore> slots = new ConcurrentHashMap<>();
    private final Map<String, Integer> limits = new ConcurrentHashMap<>();
    private final AtomicInteger waiting = new AtomicInteger(0);
    private final int queueSize;

    public ConcurrencyLimiter(int queueSize) {
        this.queueSize = queueSize;
    }

    /**
     * Registers a provider with its slot count. Re-registering keeps in-flight permits valid.
     */
    public void register(String providerId, int maxConcurrent) {
        Integer previous = limits.put(providerId, maxConcurrent);
        if (previous == null) {
            slots.put(providerId, new ResizableSemaphore(maxConcurrent));
            return;
        }
        ResizableSemaphore semaphore = slots.get(providerId);
        if (maxConcurrent > previous) {
            semaphore.release(maxConcurrent - previous);
        } else if (maxConcurrent < previous) {
            // May go negative until in-flight requests complete
            semaphore.shrink(previous - maxConcurrent);
        }
        log.info("Concurrency limit updated: providerId={}, {} -> {}", providerId, previous, maxConcurrent);
    }

    /**
     * Acquires a slot for the provider, waiting at most {@code maxWait}.
     *
     * @return true if a slot was acquired, false if the wait timed out
     * @throws QueueFullException if too many requests are already waiting
     */
    public boolean acquire(String providerId, Duration maxWait) throws InterruptedException {
        Semaphore semaphore = slots.get(providerId);
        if (semaphore == null) {
            throw new IllegalArgumentException("Unknown provider: " + providerId);
        }
        if (semaphore.tryAcquire()) {
            return true;
        }

        int queued = waiting.incrementAndGet();
        try {
            if (queued > queueSize) {
                throw new QueueFullException(QueueFullReason.WAIT_QUEUE_FULL,
                        "waiting=" + (queued - 1) + ", queueSize=" + queueSize);
            }
            log.debug("Waiting for slot: providerId={}, waiting={}", providerId, queued);
            return semaphore.tryAcquire(maxWait.toMillis(), TimeUnit.MILLISECONDS);
        } finally {
            waiting.decrementAndGet();
        }
    }

    /**
     * Takes a slot only if one is free right now. Never joins the wait queue.
     */
    public boolean tryAcquire(String providerId) {
        Semaphore semaphore = slots.get(providerId);
        return semaphore != null && semaphore.tryAcquire();
    }

    public void release(String providerId) {
        Semaphore semaphore = slots.get(providerId);
        if (semaphore != null) {
            semaphore.release();
        }
    }

    public int availableSlots(String providerId) {
        Semaphore semaphore = slots.get(providerId);
        return semaphore != null ? semaphore.availablePermits() : 0;
    }

    public int inFlight(String providerId) {
        Integer limit = limits.get(providerId);
        return limit != null ? limit - availableSlots(providerId) : 0;
    }

    public int getWaiting() {
        return waiting.get();
    }

    public int getQueueSize() {
        return queueSize;
    }

    private static final class ResizableSemaphore extends Semaphore {

        ResizableSemaphore(int permits) {
            super(permits, true);
        }

        void shrink(int reduction) {
            reducePermits(reduction);
        }
    }
}
