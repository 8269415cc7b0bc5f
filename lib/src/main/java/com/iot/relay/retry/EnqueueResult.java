package com.iot.relay.retry;

/**
 * Outcome of adding a payload to the retry buffer.
 */
public enum EnqueueResult {
    ACCEPTED,
    ACCEPTED_OLDEST_DROPPED,
    REJECTED;
    
    public boolean isAccepted() {
        return this != REJECTED;
    }
    
    public boolean droppedPayload() {
        return this != ACCEPTED;
    }
}
