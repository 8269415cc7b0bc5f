package com.iot.relay.cluster;

import com.iot.relay.RelayException;

/**
 * Thrown by a {@link PeerChannel} that cannot reach a peer or the leader.
 * There is no recovery path beyond the relay loop logging the failure.
 */
public class CoordinationException extends RelayException {
    
    private final String peerId;
    
    public CoordinationException(String peerId, String message) {
        super(String.format("Peer '%s': %s", peerId, message));
        this.peerId = peerId;
    }
    
    public CoordinationException(String peerId, String message, Throwable cause) {
        super(String.format("Peer '%s': %s", peerId, message), cause);
        this.peerId = peerId;
    }
    
    public String getPeerId() {
        return peerId;
    }
}
