package com.iot.relay.pipeline;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.time.Clock;

/**
 * Enriches a payload with {@code processed: true} and a {@code server_timestamp}
 * in epoch seconds.
 *
 * <p>Reports unhealthy when {@code maxConsecutiveFailures} processing attempts in a
 * row have failed, or when its health fault injector fires.
 */
public class TransformationStage implements PipelineStage {
    
    public static final String NAME = "transformation";
    public static final String PROCESSED_FIELD = "processed";
    public static final String SERVER_TIMESTAMP_FIELD = "server_timestamp";
    
    private final ObjectMapper mapper;
    private final Clock clock;
    private final FaultInjector processingFault;
    private final FaultInjector healthFault;
    private final int maxConsecutiveFailures;
    private int consecutiveFailures;
    
    public TransformationStage(ObjectMapper mapper, Clock clock, FaultInjector processingFault,
                               FaultInjector healthFault, int maxConsecutiveFailures) {
        this.mapper = mapper;
        this.clock = clock;
        this.processingFault = processingFault;
        this.healthFault = healthFault;
        this.maxConsecutiveFailures = maxConsecutiveFailures;
    }
    
    @Override
    public String name() {
        return NAME;
    }
    
    @Override
    public String process(String input) {
        if (processingFault.shouldFail()) {
            consecutiveFailures++;
            throw new ProcessingException(NAME, "Simulated transformation failure");
        }
        try {
            JsonNode root = mapper.readTree(input);
            if (root == null || !root.isObject()) {
                consecutiveFailures++;
                throw new ProcessingException(NAME, "Payload is not a JSON object");
            }
            ObjectNode enriched = (ObjectNode) root;
            enriched.put(PROCESSED_FIELD, true);
            enriched.put(SERVER_TIMESTAMP_FIELD, clock.instant().getEpochSecond());
            String output = mapper.writeValueAsString(enriched);
            consecutiveFailures = 0;
            return output;
        } catch (JsonProcessingException e) {
            consecutiveFailures++;
            throw new ProcessingException(NAME, "Failed to transform payload", e);
        }
    }
    
    @Override
    public boolean isHealthy() {
        if (healthFault.shouldFail()) {
            return false;
        }
        return consecutiveFailures < maxConsecutiveFailures;
    }
    
    @Override
    public PipelineStage restart() {
        return new TransformationStage(mapper, clock, processingFault, healthFault, maxConsecutiveFailures);
    }
    
    public int getConsecutiveFailures() {
        return consecutiveFailures;
    }
}
