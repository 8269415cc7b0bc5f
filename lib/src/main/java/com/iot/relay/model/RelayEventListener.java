package com.iot.relay.model;

/**
 * Callback interface for relay node state changes.
 */
@FunctionalInterface
public interface RelayEventListener {
    /**
     * Called after the state change described by the event has been applied.
     * 
     * @param event the event
     */
    void onEvent(RelayEvent event);
}
