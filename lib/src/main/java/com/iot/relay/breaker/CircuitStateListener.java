package com.iot.relay.breaker;

import com.iot.relay.model.CircuitState;

/**
 * Callback for admission gate transitions.
 */
@FunctionalInterface
public interface CircuitStateListener {
    
    void onStateChange(CircuitState from, CircuitState to);
    
    static CircuitStateListener noop() {
        return (from, to) -> { };
    }
}
