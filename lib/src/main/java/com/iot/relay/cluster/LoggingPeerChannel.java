package com.iot.relay.cluster;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Peer channel that records the intent to replicate or forward without sending anything.
 * Followers therefore do not relay the messages they receive.
 */
public class LoggingPeerChannel implements PeerChannel {
    
    private static final Logger logger = LoggerFactory.getLogger(LoggingPeerChannel.class);
    
    private final String nodeId;
    
    public LoggingPeerChannel(String nodeId) {
        this.nodeId = nodeId;
    }
    
    @Override
    public void replicate(String peerId, String payload) {
        requirePeer(peerId);
        logger.info("[{}] Replicating to {}", nodeId, peerId);
    }
    
    @Override
    public void forwardToLeader(String leaderId, String payload) {
        requirePeer(leaderId);
        logger.info("[{}] Forwarding to leader {}: {}", nodeId, leaderId, payload);
    }
    
    private static void requirePeer(String peerId) {
        if (peerId == null || peerId.trim().isEmpty()) {
            throw new CoordinationException(peerId, "No peer address to reach");
        }
    }
}
