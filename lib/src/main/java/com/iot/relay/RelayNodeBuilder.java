package com.iot.relay;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.iot.relay.breaker.AdmissionController;
import com.iot.relay.cluster.ClusterCoordinator;
import com.iot.relay.cluster.CycleCountFailureDetector;
import com.iot.relay.cluster.FixedOrderElectionPolicy;
import com.iot.relay.cluster.PeerChannel;
import com.iot.relay.config.ClusterConfig;
import com.iot.relay.config.RelayConfiguration;
import com.iot.relay.model.CircuitState;
import com.iot.relay.model.RelayEvent;
import com.iot.relay.model.RelayEventType;
import com.iot.relay.observability.RelayEventPublisher;
import com.iot.relay.observability.RelayMetrics;
import com.iot.relay.pipeline.FaultInjector;
import com.iot.relay.pipeline.ProcessingPipeline;
import com.iot.relay.pipeline.Supervisor;
import com.iot.relay.relay.BreakerRelayHandler;
import com.iot.relay.relay.ClusterRelayHandler;
import com.iot.relay.relay.PipelineRelayHandler;
import com.iot.relay.relay.RelayHandler;
import com.iot.relay.relay.RelayNode;
import com.iot.relay.resilience.ResilienceManager;
import com.iot.relay.retry.RetryBuffer;
import com.iot.relay.transport.EgressPublisher;
import com.iot.relay.transport.MessageTransport;
import com.iot.relay.transport.MqttMessageTransport;
import com.iot.relay.util.Jsons;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;

import java.time.Clock;
import java.util.Random;

/**
 * Builder for creating RelayNode instances.
 * Wires the strategy selected in the configuration to a transport, metrics and events.
 */
public class RelayNodeBuilder {
    
    private final RelayConfiguration configuration;
    private MessageTransport transport;
    private Clock clock = Clock.systemUTC();
    private MeterRegistry meterRegistry;
    private FaultInjector downstreamFault;
    private FaultInjector transformationFault = FaultInjector.never();
    private PeerChannel peerChannel;
    
    private RelayNodeBuilder(RelayConfiguration configuration) {
        this.configuration = configuration;
    }
    
    /**
     * Create a relay node connected to the configured MQTT broker.
     * 
     * @param configuration The relay configuration
     * @return A new, not yet started RelayNode
     */
    public static RelayNode create(RelayConfiguration configuration) {
        return forConfiguration(configuration).build();
    }
    
    /**
     * Create a relay node over the given transport.
     */
    public static RelayNode create(RelayConfiguration configuration, MessageTransport transport) {
        return forConfiguration(configuration).transport(transport).build();
    }
    
    /**
     * Start building a new relay configuration.
     * 
     * @return A new configuration builder
     */
    public static RelayConfiguration.Builder builder() {
        return RelayConfiguration.builder();
    }
    
    public static RelayNodeBuilder forConfiguration(RelayConfiguration configuration) {
        if (configuration == null) {
            throw new IllegalArgumentException("Configuration must be specified");
        }
        return new RelayNodeBuilder(configuration);
    }
    
    public RelayNodeBuilder transport(MessageTransport transport) {
        this.transport = transport;
        return this;
    }
    
    public RelayNodeBuilder clock(Clock clock) {
        this.clock = clock;
        return this;
    }
    
    public RelayNodeBuilder meterRegistry(MeterRegistry meterRegistry) {
        this.meterRegistry = meterRegistry;
        return this;
    }
    
    /**
     * Overrides the refusal simulation derived from {@code downstreamFailureRate}.
     */
    public RelayNodeBuilder downstreamFault(FaultInjector fault) {
        this.downstreamFault = fault;
        return this;
    }
    
    public RelayNodeBuilder transformationFault(FaultInjector fault) {
        this.transformationFault = fault;
        return this;
    }
    
    public RelayNodeBuilder peerChannel(PeerChannel peerChannel) {
        this.peerChannel = peerChannel;
        return this;
    }
    
    public RelayNode build() {
        String nodeId = configuration.getClusterConfig().getNodeId();
        MessageTransport nodeTransport = transport != null ? transport
            : new MqttMessageTransport(configuration.getBrokerUri(), configuration.getClientId(),
                configuration.getConnectionTimeout());
        RelayMetrics metrics = new RelayMetrics(nodeId, meterRegistry != null ? meterRegistry : new SimpleMeterRegistry());
        RelayEventPublisher eventPublisher = new RelayEventPublisher();
        EgressPublisher egress = new EgressPublisher(nodeTransport, configuration.getEgressTopic(),
            configuration.getQos(), metrics, resolveDownstreamFault());
        
        RelayHandler handler;
        switch (configuration.getStrategy()) {
            case PIPELINE:
                handler = new PipelineRelayHandler(pipeline(), new Supervisor(nodeId, metrics, eventPublisher, clock),
                    egress, metrics);
                break;
            case CLUSTER:
                handler = clusterHandler(metrics, eventPublisher, egress);
                break;
            case BREAKER:
            default:
                handler = breakerHandler(nodeId, metrics, eventPublisher, egress);
                break;
        }
        
        return new RelayNode(configuration, nodeTransport, handler, metrics, eventPublisher,
            new ResilienceManager(configuration.getResilienceConfig()), clock);
    }
    
    private RelayHandler breakerHandler(String nodeId, RelayMetrics metrics, RelayEventPublisher eventPublisher,
                                        EgressPublisher egress) {
        AdmissionController admission = new AdmissionController(configuration.getCircuitBreakerConfig(), clock,
            (from, to) -> {
                boolean open = to == CircuitState.OPEN;
                metrics.recordCircuitState(open);
                eventPublisher.publish(new RelayEvent(
                    open ? RelayEventType.CIRCUIT_OPENED : RelayEventType.CIRCUIT_CLOSED,
                    nodeId, from + "->" + to, clock.instant()));
            });
        RetryBuffer buffer = new RetryBuffer(configuration.getRetryBufferConfig(), clock.instant());
        return new BreakerRelayHandler(nodeId, admission, buffer, egress, metrics, eventPublisher, clock);
    }
    
    private RelayHandler clusterHandler(RelayMetrics metrics, RelayEventPublisher eventPublisher,
                                        EgressPublisher egress) {
        ClusterConfig cluster = configuration.getClusterConfig();
        ClusterCoordinator coordinator = peerChannel == null
            ? ClusterCoordinator.withDefaults(cluster, metrics, eventPublisher, clock)
            : new ClusterCoordinator(cluster,
                new FixedOrderElectionPolicy(),
                new CycleCountFailureDetector(cluster.getFailureDetectionCycles()),
                peerChannel, metrics, eventPublisher, clock);
        if (cluster.isProcessOnLeader()) {
            return new ClusterRelayHandler(coordinator, egress, metrics, pipeline(),
                new Supervisor(cluster.getNodeId(), metrics, eventPublisher, clock));
        }
        return new ClusterRelayHandler(coordinator, egress, metrics);
    }
    
    private ProcessingPipeline pipeline() {
        ObjectMapper mapper = Jsons.mapper();
        return ProcessingPipeline.standard(configuration.getPipelineConfig(), mapper, clock, transformationFault);
    }
    
    private FaultInjector resolveDownstreamFault() {
        if (downstreamFault != null) {
            return downstreamFault;
        }
        double rate = configuration.getDownstreamFailureRate();
        return rate > 0.0 ? FaultInjector.probability(rate, new Random()) : FaultInjector.never();
    }
}
