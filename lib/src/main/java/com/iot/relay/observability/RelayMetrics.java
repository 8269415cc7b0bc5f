package com.iot.relay.observability;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Collects delivery, buffering, supervision and coordination metrics of a relay node.
 */
public class RelayMetrics {
    
    private static final Logger logger = LoggerFactory.getLogger(RelayMetrics.class);
    
    private final String nodeId;
    private final MeterRegistry meterRegistry;
    
    private final Counter received;
    private final Counter delivered;
    private final Counter deliveryFailures;
    private final Counter rejectedByBreaker;
    private final Counter enqueued;
    private final Counter overflowDropped;
    private final Counter pipelineDropped;
    private final Counter stageRestarts;
    private final Counter elections;
    private final Counter loopErrors;
    private final Timer deliveryLatency;
    private final AtomicLong retryDepth;
    private final AtomicLong circuitOpen;
    private final AtomicLong leader;
    
    public RelayMetrics(String nodeId) {
        this(nodeId, new SimpleMeterRegistry());
    }
    
    public RelayMetrics(String nodeId, MeterRegistry meterRegistry) {
        this.nodeId = nodeId;
        this.meterRegistry = meterRegistry;
        this.retryDepth = new AtomicLong();
        this.circuitOpen = new AtomicLong();
        this.leader = new AtomicLong();
        
        this.received = counter("relay.messages.received", "Messages taken from the ingress topic");
        this.delivered = counter("relay.messages.delivered", "Messages published to the egress topic");
        this.deliveryFailures = counter("relay.delivery.failures", "Failed downstream delivery attempts");
        this.rejectedByBreaker = counter("relay.breaker.rejected", "Deliveries refused by the open admission gate");
        this.enqueued = counter("relay.retry.enqueued", "Payloads added to the retry buffer");
        this.overflowDropped = counter("relay.retry.dropped", "Payloads discarded by the retry buffer overflow policy");
        this.pipelineDropped = counter("relay.pipeline.dropped", "Messages dropped by the pipeline strategy");
        this.stageRestarts = counter("relay.pipeline.stage.restarts", "Pipeline stages replaced by the supervisor");
        this.elections = counter("relay.cluster.elections", "Leader elections started on this node");
        this.loopErrors = counter("relay.loop.errors", "Unexpected errors caught at the relay loop boundary");
        
        this.deliveryLatency = Timer.builder("relay.delivery.latency")
            .tag("node", nodeId)
            .description("Downstream publish latency")
            .register(meterRegistry);
        
        Gauge.builder("relay.retry.depth", retryDepth, AtomicLong::doubleValue)
            .tag("node", nodeId)
            .description("Payloads waiting in the retry buffer")
            .register(meterRegistry);
        Gauge.builder("relay.breaker.open", circuitOpen, AtomicLong::doubleValue)
            .tag("node", nodeId)
            .description("1 while the admission gate is open, 0 otherwise")
            .register(meterRegistry);
        Gauge.builder("relay.cluster.leader", leader, AtomicLong::doubleValue)
            .tag("node", nodeId)
            .description("1 while this node holds the leader role, 0 otherwise")
            .register(meterRegistry);
        
        logger.debug("Relay metrics initialized for node {}", nodeId);
    }
    
    private Counter counter(String name, String description) {
        return Counter.builder(name)
            .tag("node", nodeId)
            .description(description)
            .register(meterRegistry);
    }
    
    public void recordReceived() {
        received.increment();
    }
    
    public void recordDelivery(Duration latency, boolean success) {
        deliveryLatency.record(latency);
        if (success) {
            delivered.increment();
        } else {
            deliveryFailures.increment();
        }
    }
    
    public void recordRejected() {
        rejectedByBreaker.increment();
    }
    
    public void recordEnqueued(int depth) {
        enqueued.increment();
        retryDepth.set(depth);
    }
    
    public void recordOverflowDrop() {
        overflowDropped.increment();
    }
    
    public void updateRetryDepth(int depth) {
        retryDepth.set(depth);
    }
    
    public void recordCircuitState(boolean open) {
        circuitOpen.set(open ? 1 : 0);
        Counter.builder("relay.breaker.transitions")
            .tag("node", nodeId)
            .tag("to", open ? "open" : "closed")
            .description("Admission gate state transitions")
            .register(meterRegistry)
            .increment();
    }
    
    public void recordPipelineDrop(String reason) {
        pipelineDropped.increment();
        Counter.builder("relay.pipeline.errors")
            .tag("node", nodeId)
            .tag("reason", reason)
            .description("Pipeline failures by kind")
            .register(meterRegistry)
            .increment();
    }
    
    public void recordStageRestart(String stageName) {
        stageRestarts.increment();
        logger.debug("Stage restart recorded for {}", stageName);
    }
    
    public void recordElection(boolean electedSelf) {
        elections.increment();
        leader.set(electedSelf ? 1 : 0);
    }
    
    public void updateLeader(boolean isLeader) {
        leader.set(isLeader ? 1 : 0);
    }
    
    public void recordLoopError() {
        loopErrors.increment();
    }
    
    public String getNodeId() {
        return nodeId;
    }
    
    public MeterRegistry getMeterRegistry() {
        return meterRegistry;
    }
}
