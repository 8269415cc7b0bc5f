package com.iot.relay.pipeline;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.iot.relay.config.PipelineConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;

/**
 * Ordered sequence of stages owned by a single relay node.
 *
 * <p>Traversal is fail-fast: the first stage failure aborts the message and the
 * exception reaches the caller. Stage order never changes; a restarted stage takes the
 * position of the one it replaces.
 *
 * <p>Not thread-safe. The owning relay node serialises access under its lock.
 */
public class ProcessingPipeline {
    
    private static final Logger logger = LoggerFactory.getLogger(ProcessingPipeline.class);
    
    private final List<PipelineStage> stages;
    
    public ProcessingPipeline(List<PipelineStage> stages) {
        if (stages == null || stages.isEmpty()) {
            throw new IllegalArgumentException("Pipeline needs at least one stage");
        }
        this.stages = new ArrayList<>(stages);
    }
    
    /**
     * Builds the standard validation then transformation pipeline.
     */
    public static ProcessingPipeline standard(PipelineConfig config, ObjectMapper mapper, Clock clock) {
        return standard(config, mapper, clock, FaultInjector.never());
    }
    
    public static ProcessingPipeline standard(PipelineConfig config, ObjectMapper mapper, Clock clock,
                                              FaultInjector transformationFault) {
        FaultInjector healthFault = config.getHealthFaultCadence() > 0
            ? FaultInjector.everyNth(config.getHealthFaultCadence())
            : FaultInjector.never();
        return new ProcessingPipeline(List.of(
            new ValidationStage(mapper, config.getRequiredFields()),
            new TransformationStage(mapper, clock, transformationFault, healthFault,
                config.getMaxConsecutiveFailures())));
    }
    
    /**
     * Feeds the input through every stage in order.
     * 
     * @throws ValidationException if the payload is rejected by validation
     * @throws ProcessingException if any other stage fails
     */
    public String runPipeline(String input) {
        String current = input;
        for (PipelineStage stage : stages) {
            current = stage.process(current);
        }
        return current;
    }
    
    /**
     * Queries every stage and swaps unhealthy ones for the supervisor's replacement.
     * 
     * @return number of stages replaced
     */
    public int healthSweep(Supervisor supervisor) {
        int replaced = 0;
        for (int i = 0; i < stages.size(); i++) {
            PipelineStage stage = stages.get(i);
            if (!stage.isHealthy()) {
                stages.set(i, supervisor.restartStage(stage));
                replaced++;
            }
        }
        if (replaced > 0) {
            logger.info("Health sweep replaced {} of {} stages", replaced, stages.size());
        }
        return replaced;
    }
    
    public List<PipelineStage> getStages() {
        return List.copyOf(stages);
    }
}
