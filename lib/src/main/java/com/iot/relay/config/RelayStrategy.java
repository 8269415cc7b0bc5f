package com.iot.relay.config;

/**
 * Fault-tolerance strategy wrapped around the relay of each ingress message.
 * The strategies are alternatives, a node runs exactly one of them.
 */
public enum RelayStrategy {
    
    /**
     * Gate deliveries with the admission controller and buffer failed ones for ordered retry.
     */
    BREAKER,
    
    /**
     * Run every message through the supervised processing pipeline, dropping failures.
     */
    PIPELINE,
    
    /**
     * Relay only from the leader node and replicate to peers; followers defer to the leader.
     */
    CLUSTER;
    
    public static RelayStrategy fromString(String raw) {
        if (raw == null || raw.isBlank()) {
            return BREAKER;
        }
        for (RelayStrategy value : values()) {
            if (value.name().equalsIgnoreCase(raw.trim())) {
                return value;
            }
        }
        throw new IllegalArgumentException("Unknown relay strategy: " + raw);
    }
}
