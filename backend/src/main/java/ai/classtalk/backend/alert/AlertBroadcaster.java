package ai.classtalk.backend.alert;

import ai.classtalk.backend.model.dto.AlertEvent;

/**
 * Best-effort fan-out of alert events to connected observers.
 */
public interface AlertBroadcaster {

    /**
     * Publishes an event to every open observer. Must not block the caller
     * on slow observers and must not throw on delivery failures.
     */
    void publish(AlertEvent event);

    int connectedObserverCount();
}
