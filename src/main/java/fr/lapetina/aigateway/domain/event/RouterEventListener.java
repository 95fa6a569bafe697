package fr.lapetina.aigateway.domain.event;

/**
 * Observer of router events. Called from the event bus thread, never from the request path.
 */
@FunctionalInterface
public interface RouterEventListener {

    void onEvent(RouterEvent event);
}
