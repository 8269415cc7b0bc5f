package com.iot.relay.model;

/**
 * Role of a relay node inside its cluster.
 */
public enum NodeRole {
    
    /**
     * Performs authoritative processing, replicates to peers and publishes downstream.
     */
    LEADER,
    
    /**
     * Defers messages to the current leader and watches for leader failure.
     */
    FOLLOWER
}
