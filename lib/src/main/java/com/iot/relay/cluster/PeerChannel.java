package com.iot.relay.cluster;

/**
 * Node-to-node messaging used by the cluster coordinator.
 */
public interface PeerChannel {
    
    /**
     * Announces a relayed payload to a peer. No acknowledgement is expected.
     * 
     * @throws CoordinationException if the peer cannot be reached
     */
    void replicate(String peerId, String payload);
    
    /**
     * Hands a payload received by a follower to the leader.
     * 
     * @throws CoordinationException if the leader cannot be reached
     */
    void forwardToLeader(String leaderId, String payload);
}
