package fr.lapetina.aigateway.infrastructure.provider;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Consumer;

/**
 * Forwards streamed text deltas to the caller and remembers whether any reached it.
 *
 * Once a chunk was delivered the request can no longer be retried or failed over without the
 * caller seeing duplicated output. A throwing consumer is logged and does not abort the stream.
 */
public final class StreamSink implements Consumer<String> {

    private static final Logger log = LoggerFactory.getLogger(StreamSink.class);

    private final Consumer<String> downstream;
    private final AtomicBoolean emitted = new AtomicBoolean(false);

    public StreamSink(Consumer<String> downstream) {
        if (downstream == null) {
            throw new IllegalArgumentException("Chunk consumer is required");
        }
        this.downstream = downstream;
    }

    @Override
    public void accept(String chunk) {
        if (chunk == null || chunk.isEmpty()) {
            return;
        }
        emitted.set(true);
        try {
            downstream.accept(chunk);
        } catch (Exception e) {
            log.error("Error notifying chunk consumer", e);
        }
    }

    public boolean hasEmitted() {
        return emitted.get();
    }
}
