package com.iot.relay.transport;

/**
 * Connection-state callbacks. Transports may invoke these on their own threads.
 */
public interface ConnectionListener {
    
    void onConnected(boolean reconnect);
    
    void onConnectionLost(Throwable cause);
    
    static ConnectionListener noop() {
        return new ConnectionListener() {
            @Override
            public void onConnected(boolean reconnect) {
            }
            
            @Override
            public void onConnectionLost(Throwable cause) {
            }
        };
    }
}
