package com.iot.relay.config;

import io.github.resilience4j.retry.RetryConfig;

import java.time.Duration;

/**
 * Resilience4j configuration for broker connection establishment.
 * Message-level fault tolerance is handled by the relay strategies, not here.
 */
public class ResilienceConfig {
    
    private final RetryConfig connectRetryConfig;
    private final boolean enableConnectRetry;
    
    private ResilienceConfig(Builder builder) {
        this.connectRetryConfig = builder.connectRetryConfig;
        this.enableConnectRetry = builder.enableConnectRetry;
    }
    
    public RetryConfig getConnectRetryConfig() {
        return connectRetryConfig;
    }
    
    public boolean isConnectRetryEnabled() {
        return enableConnectRetry;
    }
    
    /**
     * Creates the default configuration: five connection attempts, five seconds apart.
     */
    public static ResilienceConfig defaultConfig() {
        return builder().build();
    }
    
    /**
     * Creates a configuration that fails on the first unsuccessful connection attempt.
     */
    public static ResilienceConfig failFastConfig() {
        return builder()
                .enableConnectRetry(false)
                .build();
    }
    
    public static Builder builder() {
        return new Builder();
    }
    
    public static class Builder {
        private RetryConfig connectRetryConfig;
        private boolean enableConnectRetry = true;
        
        public Builder() {
            this.connectRetryConfig = RetryConfig.custom()
                    .maxAttempts(5)
                    .waitDuration(Duration.ofSeconds(5))
                    .retryOnException(throwable -> true)
                    .build();
        }
        
        public Builder connectRetry(RetryConfig config) {
            this.connectRetryConfig = config;
            return this;
        }
        
        public Builder enableConnectRetry(boolean enable) {
            this.enableConnectRetry = enable;
            return this;
        }
        
        /**
         * Convenience method to configure connection retry with common parameters.
         */
        public Builder connectRetryConfig(int maxAttempts, Duration waitDuration) {
            this.connectRetryConfig = RetryConfig.custom()
                    .maxAttempts(maxAttempts)
                    .waitDuration(waitDuration)
                    .retryOnException(throwable -> true)
                    .build();
            return this;
        }
        
        public ResilienceConfig build() {
            return new ResilienceConfig(this);
        }
    }
}
