package com.iot.relay.model;

/**
 * State of the downstream admission gate.
 * There is no half-open state: once the reset timeout has elapsed the gate closes for every caller.
 */
public enum CircuitState {
    
    /**
     * Deliveries are attempted.
     */
    CLOSED,
    
    /**
     * Deliveries are refused until the reset timeout elapses.
     */
    OPEN
}
