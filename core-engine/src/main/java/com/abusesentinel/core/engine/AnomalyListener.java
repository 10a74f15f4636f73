package com.abusesentinel.core.engine;

import com.abusesentinel.core.model.AnomalyEvent;

/**
 * Receives anomaly events as they are raised.
 * <p>
 * Called synchronously on the engine's thread. An exception thrown here is
 * logged and counted by the engine and never reaches the caller that
 * triggered the event.
 * </p>
 */
@FunctionalInterface
public interface AnomalyListener {

    void onAnomaly(AnomalyEvent event);

    /**
     * @return a listener that ignores every event
     */
    static AnomalyListener noop() {
        return event -> {
        };
    }
}
