package com.iot.relay.pipeline;

import com.iot.relay.RelayException;

/**
 * Thrown when a pipeline stage cannot process a message. The message is dropped.
 */
public class ProcessingException extends RelayException {
    
    private final String stageName;
    
    public ProcessingException(String stageName, String message) {
        super(String.format("[%s] %s", stageName, message));
        this.stageName = stageName;
    }
    
    public ProcessingException(String stageName, String message, Throwable cause) {
        super(String.format("[%s] %s", stageName, message), cause);
        this.stageName = stageName;
    }
    
    public String getStageName() {
        return stageName;
    }
}
