package com.iot.relay.model;

import java.util.List;

/**
 * Point-in-time view of a node's cluster membership and role.
 */
public class ClusterNode {
    
    private final String id;
    private final NodeRole role;
    private final String leaderId;
    private final List<String> peers;
    
    public ClusterNode(String id, NodeRole role, String leaderId, List<String> peers) {
        this.id = id;
        this.role = role;
        this.leaderId = leaderId;
        this.peers = List.copyOf(peers);
    }
    
    public String getId() {
        return id;
    }
    
    public NodeRole getRole() {
        return role;
    }
    
    /**
     * @return the node this node currently believes to be leader, may be null if unknown
     */
    public String getLeaderId() {
        return leaderId;
    }
    
    public List<String> getPeers() {
        return peers;
    }
    
    public boolean isLeader() {
        return role == NodeRole.LEADER;
    }
    
    @Override
    public String toString() {
        return String.format("ClusterNode{id='%s', role=%s, leader='%s', peers=%s}", id, role, leaderId, peers);
    }
}
