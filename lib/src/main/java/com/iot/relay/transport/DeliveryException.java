package com.iot.relay.transport;

import com.iot.relay.RelayException;

/**
 * Thrown when a payload could not be published to the downstream topic.
 */
public class DeliveryException extends RelayException {
    
    private final String topic;
    
    public DeliveryException(String topic, String message, Throwable cause) {
        super(String.format("Delivery to '%s' failed: %s", topic, message), cause);
        this.topic = topic;
    }
    
    public String getTopic() {
        return topic;
    }
}
