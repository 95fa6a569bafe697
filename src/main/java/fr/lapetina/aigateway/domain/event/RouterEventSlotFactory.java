package fr.lapetina.aigateway.domain.event;

import com.lmax.disruptor.EventFactory;

/**
 * Factory for pre-allocating {@link RouterEventSlot}s in the Disruptor ring buffer.
 */
public final class RouterEventSlotFactory implements EventFactory<RouterEventSlot> {

    @Override
    public RouterEventSlot newInstance() {
        return new RouterEventSlot();
    }
}
