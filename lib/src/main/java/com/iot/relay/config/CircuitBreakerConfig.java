package com.iot.relay.config;

import java.time.Duration;

/**
 * Admission control configuration for the downstream delivery gate.
 */
public class CircuitBreakerConfig {
    
    private final int failureThreshold;
    private final int successThreshold;
    private final Duration resetTimeout;
    
    private CircuitBreakerConfig(Builder builder) {
        this.failureThreshold = builder.failureThreshold;
        this.successThreshold = builder.successThreshold;
        this.resetTimeout = builder.resetTimeout;
    }
    
    public int getFailureThreshold() {
        return failureThreshold;
    }
    
    public int getSuccessThreshold() {
        return successThreshold;
    }
    
    public Duration getResetTimeout() {
        return resetTimeout;
    }
    
    public static CircuitBreakerConfig defaultConfig() {
        return builder().build();
    }
    
    public static Builder builder() {
        return new Builder();
    }
    
    @Override
    public String toString() {
        return String.format("CircuitBreakerConfig{failureThreshold=%d, successThreshold=%d, resetTimeout=%s}",
            failureThreshold, successThreshold, resetTimeout);
    }
    
    public static class Builder {
        private int failureThreshold = 3;
        private int successThreshold = 2;
        private Duration resetTimeout = Duration.ofSeconds(10);
        
        public Builder failureThreshold(int threshold) {
            this.failureThreshold = threshold;
            return this;
        }
        
        public Builder successThreshold(int threshold) {
            this.successThreshold = threshold;
            return this;
        }
        
        public Builder resetTimeout(Duration timeout) {
            this.resetTimeout = timeout;
            return this;
        }
        
        public CircuitBreakerConfig build() {
            if (failureThreshold < 1) {
                throw new IllegalArgumentException("Failure threshold must be at least 1");
            }
            if (successThreshold < 1) {
                throw new IllegalArgumentException("Success threshold must be at least 1");
            }
            if (resetTimeout == null || resetTimeout.isNegative()) {
                throw new IllegalArgumentException("Reset timeout must be a non-negative duration");
            }
            return new CircuitBreakerConfig(this);
        }
    }
}
