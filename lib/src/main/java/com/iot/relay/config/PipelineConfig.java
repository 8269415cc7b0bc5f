package com.iot.relay.config;

import java.util.List;

/**
 * Configuration of the processing pipeline stages.
 */
public class PipelineConfig {
    
    private final List<String> requiredFields;
    private final int maxConsecutiveFailures;
    private final int healthFaultCadence;
    
    private PipelineConfig(Builder builder) {
        this.requiredFields = List.copyOf(builder.requiredFields);
        this.maxConsecutiveFailures = builder.maxConsecutiveFailures;
        this.healthFaultCadence = builder.healthFaultCadence;
    }
    
    public List<String> getRequiredFields() {
        return requiredFields;
    }
    
    /**
     * @return consecutive processing failures after which a transformation stage reports itself unhealthy
     */
    public int getMaxConsecutiveFailures() {
        return maxConsecutiveFailures;
    }
    
    /**
     * @return every how many health probes a synthetic health fault is injected, 0 disables injection
     */
    public int getHealthFaultCadence() {
        return healthFaultCadence;
    }
    
    public static PipelineConfig defaultConfig() {
        return builder().build();
    }
    
    public static Builder builder() {
        return new Builder();
    }
    
    @Override
    public String toString() {
        return String.format("PipelineConfig{requiredFields=%s, maxConsecutiveFailures=%d, healthFaultCadence=%d}",
            requiredFields, maxConsecutiveFailures, healthFaultCadence);
    }
    
    public static class Builder {
        private List<String> requiredFields = List.of("device_id", "temperature");
        private int maxConsecutiveFailures = 3;
        private int healthFaultCadence = 0;
        
        public Builder requiredFields(List<String> fields) {
            this.requiredFields = fields;
            return this;
        }
        
        public Builder maxConsecutiveFailures(int failures) {
            this.maxConsecutiveFailures = failures;
            return this;
        }
        
        public Builder healthFaultCadence(int cadence) {
            this.healthFaultCadence = cadence;
            return this;
        }
        
        public PipelineConfig build() {
            if (requiredFields == null || requiredFields.isEmpty()) {
                throw new IllegalArgumentException("At least one required field must be configured");
            }
            if (maxConsecutiveFailures < 1) {
                throw new IllegalArgumentException("Max consecutive failures must be at least 1");
            }
            if (healthFaultCadence < 0) {
                throw new IllegalArgumentException("Health fault cadence cannot be negative");
            }
            return new PipelineConfig(this);
        }
    }
}
