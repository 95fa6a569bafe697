package fr.lapetina.aigateway.domain.event;

/**
 * Mutable holder pre-allocated in the Disruptor ring buffer.
 *
 * Slots are reused: publishers overwrite the event and the last handler clears it.
 * It should never be accessed outside the event bus.
 */
public final class RouterEventSlot {

    private RouterEvent event;
    private long sequence = -1;

    public void set(RouterEvent event, long sequence) {
        this.event = event;
        this.sequence = sequence;
    }

    public void clear() {
        this.event = null;
        this.sequence = -1;
    }

    public RouterEvent getEvent() {
        return event;
    }

    public long getSequence() {
        return sequence;
    }

    @Override
    public String toString() {
        return "RouterEventSlot{sequence=" + sequence + ", event=" + event + '}';
    }
}
