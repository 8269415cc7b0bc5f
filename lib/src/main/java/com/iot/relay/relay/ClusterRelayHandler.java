package com.iot.relay.relay;

import com.iot.relay.cluster.ClusterCoordinator;
import com.iot.relay.config.RelayStrategy;
import com.iot.relay.observability.RelayMetrics;
import com.iot.relay.pipeline.ProcessingPipeline;
import com.iot.relay.pipeline.Supervisor;
import com.iot.relay.transport.EgressPublisher;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;

/**
 * Leader/follower strategy. The leader replicates and publishes every payload it
 * receives; followers hand theirs to the leader they know of and watch for its failure.
 *
 * <p>When a pipeline is supplied the leader runs payloads through it before replicating.
 */
public class ClusterRelayHandler implements RelayHandler {
    
    private static final Logger logger = LoggerFactory.getLogger(ClusterRelayHandler.class);
    
    private final ClusterCoordinator coordinator;
    private final EgressPublisher egressPublisher;
    private final RelayMetrics metrics;
    private final ProcessingPipeline pipeline;
    private final Supervisor supervisor;
    
    public ClusterRelayHandler(ClusterCoordinator coordinator, EgressPublisher egressPublisher, RelayMetrics metrics) {
        this(coordinator, egressPublisher, metrics, null, null);
    }
    
    public ClusterRelayHandler(ClusterCoordinator coordinator, EgressPublisher egressPublisher, RelayMetrics metrics,
                               ProcessingPipeline pipeline, Supervisor supervisor) {
        if ((pipeline == null) != (supervisor == null)) {
            throw new IllegalArgumentException("Pipeline and supervisor must be supplied together");
        }
        this.coordinator = coordinator;
        this.egressPublisher = egressPublisher;
        this.metrics = metrics;
        this.pipeline = pipeline;
        this.supervisor = supervisor;
        metrics.updateLeader(coordinator.isLeader());
    }
    
    @Override
    public RelayStrategy strategy() {
        return RelayStrategy.CLUSTER;
    }
    
    /**
     * @throws com.iot.relay.pipeline.ProcessingException if the leader's pipeline rejects the payload
     * @throws com.iot.relay.transport.DeliveryException if the leader cannot publish
     */
    @Override
    public void handle(String payload) {
        if (!coordinator.isLeader()) {
            coordinator.forwardToLeader(payload);
            return;
        }
        
        logger.info("Leader {} processing message", coordinator.getConfig().getNodeId());
        String output = pipeline != null ? pipeline.runPipeline(payload) : payload;
        coordinator.replicate(output);
        if (!egressPublisher.deliver(output)) {
            logger.warn("Downstream refused payload on leader {}", coordinator.getConfig().getNodeId());
        }
    }
    
    @Override
    public void onTick(Instant now) {
        if (coordinator.onTick()) {
            metrics.updateLeader(coordinator.isLeader());
        }
        if (pipeline != null && coordinator.isLeader()) {
            pipeline.healthSweep(supervisor);
        }
    }
    
    public ClusterCoordinator getCoordinator() {
        return coordinator;
    }
}
