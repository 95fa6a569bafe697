package fr.lapetina.aigateway.disruptor.handlers;

import com.lmax.disruptor.EventHandler;
import fr.lapetina.aigateway.domain.event.RouterEvent;
import fr.lapetina.aigateway.domain.event.RouterEventListener;
import fr.lapetina.aigateway.domain.event.RouterEventSlot;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

/**
 * Last stage: hands each event to the subscribed listeners, then releases the slot.
 *
 * A failing listener is logged and does not prevent delivery to the others.
 */
public final class ListenerDispatchHandler implements EventHandler<RouterEventSlot> {

    private static final Logger log = LoggerFactory.getLogger(ListenerDispatchHandler.class);

    private final List<RouterEventListener> listeners;

    public ListenerDispatchHandler(List<RouterEventListener> listeners) {
        this.listeners = listeners;
    }

    @Override
    public void onEvent(RouterEventSlot slot, long sequence, boolean endOfBatch) {
        RouterEvent event = slot.getEvent();
        try {
            if (event == null) {
                return;
            }
            for (RouterEventListener listener : listeners) {
                try {
                    listener.onEvent(event);
                } catch (Exception e) {
                    log.error("Error notifying listener: type={}, requestId={}",
                            event.type().getEventName(), event.requestId(), e);
                }
            }
        } finally {
            slot.clear();
        }
    }
}
