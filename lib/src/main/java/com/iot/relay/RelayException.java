package com.iot.relay;

/**
 * Base class of all relay failures. Every per-message failure is caught at the
 * relay loop boundary, so subclasses are unchecked.
 */
public class RelayException extends RuntimeException {
    
    public RelayException(String message) {
        super(message);
    }
    
    public RelayException(String message, Throwable cause) {
        super(message, cause);
    }
}
