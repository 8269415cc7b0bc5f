package com.iot.relay.config;

import java.util.List;

/**
 * Static cluster membership and leader-failure heuristic settings.
 * Membership is fixed for the lifetime of the process.
 */
public class ClusterConfig {
    
    private final String nodeId;
    private final String seedNodeId;
    private final List<String> peers;
    private final int failureDetectionCycles;
    private final boolean processOnLeader;
    
    private ClusterConfig(Builder builder) {
        this.nodeId = builder.nodeId;
        this.seedNodeId = builder.seedNodeId;
        this.peers = List.copyOf(builder.peers);
        this.failureDetectionCycles = builder.failureDetectionCycles;
        this.processOnLeader = builder.processOnLeader;
    }
    
    public String getNodeId() {
        return nodeId;
    }
    
    public String getSeedNodeId() {
        return seedNodeId;
    }
    
    public List<String> getPeers() {
        return peers;
    }
    
    public int getFailureDetectionCycles() {
        return failureDetectionCycles;
    }
    
    /**
     * @return true if the leader runs the processing pipeline before replicating, false for direct relay
     */
    public boolean isProcessOnLeader() {
        return processOnLeader;
    }
    
    public static ClusterConfig defaultConfig() {
        return builder().build();
    }
    
    public static Builder builder() {
        return new Builder();
    }
    
    @Override
    public String toString() {
        return String.format("ClusterConfig{nodeId='%s', seedNodeId='%s', peers=%s, failureDetectionCycles=%d, processOnLeader=%s}",
            nodeId, seedNodeId, peers, failureDetectionCycles, processOnLeader);
    }
    
    public static class Builder {
        private String nodeId = "node1";
        private String seedNodeId = "node1";
        private List<String> peers = List.of("node1", "node2", "node3");
        private int failureDetectionCycles = 10;
        private boolean processOnLeader = false;
        
        public Builder nodeId(String nodeId) {
            this.nodeId = nodeId;
            return this;
        }
        
        public Builder seedNodeId(String seedNodeId) {
            this.seedNodeId = seedNodeId;
            return this;
        }
        
        public Builder peers(List<String> peers) {
            this.peers = peers;
            return this;
        }
        
        public Builder failureDetectionCycles(int cycles) {
            this.failureDetectionCycles = cycles;
            return this;
        }
        
        public Builder processOnLeader(boolean processOnLeader) {
            this.processOnLeader = processOnLeader;
            return this;
        }
        
        public ClusterConfig build() {
            if (nodeId == null || nodeId.trim().isEmpty()) {
                throw new IllegalArgumentException("Node ID must be specified");
            }
            if (seedNodeId == null || seedNodeId.trim().isEmpty()) {
                throw new IllegalArgumentException("Seed node ID must be specified");
            }
            if (peers == null || peers.isEmpty()) {
                throw new IllegalArgumentException("At least one peer must be configured");
            }
            if (peers.stream().distinct().count() != peers.size()) {
                throw new IllegalArgumentException("Peer IDs must be unique within the cluster");
            }
            if (failureDetectionCycles < 1) {
                throw new IllegalArgumentException("Failure detection cycles must be at least 1");
            }
            return new ClusterConfig(this);
        }
    }
}
