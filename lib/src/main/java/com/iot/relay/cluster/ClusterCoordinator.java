package com.iot.relay.cluster;

import com.iot.relay.config.ClusterConfig;
import com.iot.relay.model.ClusterNode;
import com.iot.relay.model.NodeRole;
import com.iot.relay.model.RelayEvent;
import com.iot.relay.model.RelayEventListener;
import com.iot.relay.model.RelayEventType;
import com.iot.relay.observability.RelayMetrics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.List;
import java.util.Optional;

/**
 * Leader/follower role state machine for one relay node.
 *
 * <p>This is a best-effort liveness hint, not consensus. Roles are computed locally from
 * static membership with no message exchange, no terms and no quorum. Concurrent
 * elections on different nodes can leave more than one node believing it is leader.
 *
 * <p>Not thread-safe. The owning relay node serialises access under its lock.
 */
public class ClusterCoordinator {
    
    private static final Logger logger = LoggerFactory.getLogger(ClusterCoordinator.class);
    
    private final ClusterConfig config;
    private final LeaderElectionPolicy electionPolicy;
    private final FailureDetector failureDetector;
    private final PeerChannel peerChannel;
    private final RelayMetrics metrics;
    private final RelayEventListener eventListener;
    private final Clock clock;
    
    private NodeRole role;
    private String leaderId;
    
    public ClusterCoordinator(ClusterConfig config, LeaderElectionPolicy electionPolicy,
                              FailureDetector failureDetector, PeerChannel peerChannel,
                              RelayMetrics metrics, RelayEventListener eventListener, Clock clock) {
        this.config = config;
        this.electionPolicy = electionPolicy;
        this.failureDetector = failureDetector;
        this.peerChannel = peerChannel;
        this.metrics = metrics;
        this.eventListener = eventListener;
        this.clock = clock;
        this.role = config.getNodeId().equals(config.getSeedNodeId()) ? NodeRole.LEADER : NodeRole.FOLLOWER;
        this.leaderId = config.getSeedNodeId();
        metrics.updateLeader(role == NodeRole.LEADER);
        
        logger.info("Node {} starting as {}", config.getNodeId(), role);
    }
    
    /**
     * Creates a coordinator with the fixed-order election, cycle-count detector and logging channel.
     */
    public static ClusterCoordinator withDefaults(ClusterConfig config, RelayMetrics metrics,
                                                  RelayEventListener eventListener, Clock clock) {
        return new ClusterCoordinator(config,
            new FixedOrderElectionPolicy(),
            new CycleCountFailureDetector(config.getFailureDetectionCycles()),
            new LoggingPeerChannel(config.getNodeId()),
            metrics, eventListener, clock);
    }
    
    public boolean isLeader() {
        return role == NodeRole.LEADER;
    }
    
    /**
     * Announces a relayed payload to every peer other than this node.
     * Only meaningful on the leader.
     */
    public void replicate(String payload) {
        for (String peer : config.getPeers()) {
            if (!peer.equals(config.getNodeId())) {
                peerChannel.replicate(peer, payload);
            }
        }
    }
    
    /**
     * Hands a payload to the node this follower believes is leader.
     */
    public void forwardToLeader(String payload) {
        peerChannel.forwardToLeader(leaderId, payload);
    }
    
    /**
     * Runs the leader-failure heuristic for one polling cycle. Leaders skip it.
     * 
     * @return true if an election was started
     */
    public boolean onTick() {
        if (role == NodeRole.LEADER) {
            return false;
        }
        if (!failureDetector.leaderSuspected()) {
            return false;
        }
        logger.warn("Node {} suspects leader {} failed, starting election", config.getNodeId(), leaderId);
        eventListener.onEvent(new RelayEvent(RelayEventType.LEADER_FAILURE_SUSPECTED,
            config.getNodeId(), leaderId, clock.instant()));
        startElection();
        return true;
    }
    
    /**
     * Re-evaluates this node's role with the election policy.
     * 
     * @return the role after the election
     */
    public NodeRole startElection() {
        Optional<String> elected = electionPolicy.elect(config.getNodeId(), config.getSeedNodeId(), config.getPeers());
        NodeRole previous = role;
        
        if (elected.isPresent()) {
            leaderId = elected.get();
            role = leaderId.equals(config.getNodeId()) ? NodeRole.LEADER : NodeRole.FOLLOWER;
        } else {
            role = NodeRole.FOLLOWER;
            logger.warn("Election on node {} found no eligible leader, keeping {}", config.getNodeId(), leaderId);
        }
        
        metrics.recordElection(role == NodeRole.LEADER);
        if (role == NodeRole.LEADER) {
            logger.info("Node {} elected as new LEADER", config.getNodeId());
        }
        if (previous != role) {
            eventListener.onEvent(new RelayEvent(RelayEventType.ROLE_CHANGED,
                config.getNodeId(), previous + "->" + role, clock.instant()));
        }
        return role;
    }
    
    public NodeRole getRole() {
        return role;
    }
    
    public String getLeaderId() {
        return leaderId;
    }
    
    public ClusterNode snapshot() {
        return new ClusterNode(config.getNodeId(), role, leaderId, config.getPeers());
    }
    
    public List<String> getPeers() {
        return config.getPeers();
    }
    
    public ClusterConfig getConfig() {
        return config;
    }
}
