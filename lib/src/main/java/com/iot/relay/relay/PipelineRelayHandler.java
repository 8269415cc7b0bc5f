package com.iot.relay.relay;

import com.iot.relay.config.RelayStrategy;
import com.iot.relay.observability.RelayMetrics;
import com.iot.relay.pipeline.ProcessingException;
import com.iot.relay.pipeline.ProcessingPipeline;
import com.iot.relay.pipeline.Supervisor;
import com.iot.relay.pipeline.ValidationException;
import com.iot.relay.transport.DeliveryException;
import com.iot.relay.transport.EgressPublisher;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;

/**
 * Supervised-pipeline strategy. Each payload runs through the pipeline and the result is
 * published; a payload any stage rejects is dropped. Unhealthy stages are swapped for
 * fresh instances on every tick.
 */
public class PipelineRelayHandler implements RelayHandler {
    
    private static final Logger logger = LoggerFactory.getLogger(PipelineRelayHandler.class);
    
    private final ProcessingPipeline pipeline;
    private final Supervisor supervisor;
    private final EgressPublisher egressPublisher;
    private final RelayMetrics metrics;
    
    public PipelineRelayHandler(ProcessingPipeline pipeline, Supervisor supervisor,
                                EgressPublisher egressPublisher, RelayMetrics metrics) {
        this.pipeline = pipeline;
        this.supervisor = supervisor;
        this.egressPublisher = egressPublisher;
        this.metrics = metrics;
    }
    
    @Override
    public RelayStrategy strategy() {
        return RelayStrategy.PIPELINE;
    }
    
    @Override
    public void handle(String payload) {
        String output;
        try {
            output = pipeline.runPipeline(payload);
        } catch (ValidationException e) {
            logger.error("Pipeline error in {}: {}", e.getStageName(), e.getMessage());
            metrics.recordPipelineDrop("validation");
            return;
        } catch (ProcessingException e) {
            logger.error("Pipeline error in {}: {}", e.getStageName(), e.getMessage());
            metrics.recordPipelineDrop("processing");
            return;
        }
        
        try {
            if (!egressPublisher.deliver(output)) {
                logger.warn("Downstream refused processed payload, dropping it");
                metrics.recordPipelineDrop("delivery");
            }
        } catch (DeliveryException e) {
            logger.error("Failed to publish processed payload to {}: {}", e.getTopic(), e.getMessage());
            metrics.recordPipelineDrop("delivery");
        }
    }
    
    @Override
    public void onTick(Instant now) {
        pipeline.healthSweep(supervisor);
    }
    
    public ProcessingPipeline getPipeline() {
        return pipeline;
    }
}
