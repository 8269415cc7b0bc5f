package com.iot.relay.pipeline;

/**
 * One step of the processing pipeline.
 */
public interface PipelineStage {
    
    /**
     * @return short name used in logs and metrics
     */
    String name();
    
    /**
     * Processes the output of the previous stage.
     * 
     * @param input payload produced by the previous stage, or the raw ingress payload
     * @return payload handed to the next stage
     * @throws ProcessingException if the payload cannot be processed
     */
    String process(String input);
    
    /**
     * Liveness probe queried once per health sweep. May advance internal probe state.
     */
    boolean isHealthy();
    
    /**
     * Reset contract used by the supervisor: returns a stage of the same kind and
     * configuration with all runtime state cleared. The returned stage reports healthy
     * unless an injected fault says otherwise. Implementations must not return {@code this}.
     */
    PipelineStage restart();
}
