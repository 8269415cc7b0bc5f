package com.iot.relay.model;

import java.time.Instant;

/**
 * Notification of a state change on a relay node.
 */
public class RelayEvent {
    
    private final RelayEventType type;
    private final String nodeId;
    private final String detail;
    private final Instant timestamp;
    
    public RelayEvent(RelayEventType type, String nodeId, String detail, Instant timestamp) {
        this.type = type;
        this.nodeId = nodeId;
        this.detail = detail;
        this.timestamp = timestamp;
    }
    
    public RelayEventType getType() {
        return type;
    }
    
    public String getNodeId() {
        return nodeId;
    }
    
    public String getDetail() {
        return detail;
    }
    
    public Instant getTimestamp() {
        return timestamp;
    }
    
    @Override
    public String toString() {
        return String.format("RelayEvent{type=%s, node='%s', detail='%s', at=%s}", type, nodeId, detail, timestamp);
    }
}
