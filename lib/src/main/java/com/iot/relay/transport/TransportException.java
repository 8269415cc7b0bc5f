package com.iot.relay.transport;

import com.iot.relay.RelayException;

/**
 * Thrown when the messaging transport cannot connect, subscribe or publish.
 */
public class TransportException extends RelayException {
    
    public TransportException(String message) {
        super(message);
    }
    
    public TransportException(String message, Throwable cause) {
        super(message, cause);
    }
}
