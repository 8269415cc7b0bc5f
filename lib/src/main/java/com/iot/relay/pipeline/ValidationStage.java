package com.iot.relay.pipeline;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.util.List;

/**
 * Rejects payloads that are not JSON objects or that lack any required field.
 * Passes accepted payloads through unchanged. Always healthy.
 */
public class ValidationStage implements PipelineStage {
    
    public static final String NAME = "validation";
    
    private final ObjectMapper mapper;
    private final List<String> requiredFields;
    
    public ValidationStage(ObjectMapper mapper, List<String> requiredFields) {
        this.mapper = mapper;
        this.requiredFields = List.copyOf(requiredFields);
    }
    
    @Override
    public String name() {
        return NAME;
    }
    
    @Override
    public String process(String input) {
        JsonNode root;
        try {
            root = mapper.readTree(input);
        } catch (JsonProcessingException e) {
            throw new ValidationException(NAME, "Payload is not valid JSON", e);
        }
        if (root == null || !root.isObject()) {
            throw new ValidationException(NAME, "Payload is not a JSON object");
        }
        for (String field : requiredFields) {
            if (!root.has(field)) {
                throw new ValidationException(NAME, "Invalid message format, missing field '" + field + "'");
            }
        }
        return input;
    }
    
    @Override
    public boolean isHealthy() {
        return true;
    }
    
    @Override
    public PipelineStage restart() {
        return new ValidationStage(mapper, requiredFields);
    }
    
    public List<String> getRequiredFields() {
        return requiredFields;
    }
}
