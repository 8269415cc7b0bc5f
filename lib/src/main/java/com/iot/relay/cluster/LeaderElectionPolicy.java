package com.iot.relay.cluster;

import java.util.List;
import java.util.Optional;

/**
 * Local, message-free leader selection. Implementations decide from static membership only,
 * so two nodes evaluating concurrently may both elect themselves.
 */
@FunctionalInterface
public interface LeaderElectionPolicy {
    
    /**
     * @param localNodeId the node running the election
     * @param seedNodeId the statically configured initial leader, presumed failed
     * @param peers cluster membership in configured order
     * @return the id of the node this node now considers leader, empty if none qualifies
     */
    Optional<String> elect(String localNodeId, String seedNodeId, List<String> peers);
}
