package com.iot.relay.transport;

/**
 * A message taken from a subscribed topic.
 */
public class InboundMessage {
    
    private final String topic;
    private final String payload;
    
    public InboundMessage(String topic, String payload) {
        this.topic = topic;
        this.payload = payload;
    }
    
    public String getTopic() {
        return topic;
    }
    
    public String getPayload() {
        return payload;
    }
    
    @Override
    public String toString() {
        return String.format("InboundMessage{topic='%s', payload='%s'}", topic, payload);
    }
}
