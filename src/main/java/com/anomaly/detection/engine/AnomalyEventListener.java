package com.anomaly.detection.engine;

/**
 * Receives anomaly-state transitions. Invoked synchronously on the detecting
 * thread while the detector's lock is held.
 */
@FunctionalInterface
public interface AnomalyEventListener {

    void onAnomalyEvent(AnomalyEvent event);
}
