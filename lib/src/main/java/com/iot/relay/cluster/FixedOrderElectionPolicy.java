package com.iot.relay.cluster;

import java.util.List;
import java.util.Optional;

/**
 * Walks the peer list in configured order, skipping the seed, and elects the first
 * peer that matches the local node. Any non-seed member running this election
 * therefore elects itself.
 */
public class FixedOrderElectionPolicy implements LeaderElectionPolicy {
    
    @Override
    public Optional<String> elect(String localNodeId, String seedNodeId, List<String> peers) {
        for (String peer : peers) {
            if (peer.equals(seedNodeId)) {
                continue;
            }
            if (peer.equals(localNodeId)) {
                return Optional.of(peer);
            }
        }
        return Optional.empty();
    }
}
