package com.iot.relay.pipeline;

/**
 * Thrown when a payload is malformed or lacks a required field.
 */
public class ValidationException extends ProcessingException {
    
    public ValidationException(String stageName, String message) {
        super(stageName, message);
    }
    
    public ValidationException(String stageName, String message, Throwable cause) {
        super(stageName, message, cause);
    }
}
