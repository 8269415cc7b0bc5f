package com.iot.relay.config;

import java.time.Duration;

/**
 * Configuration for the in-memory retry buffer.
 */
public class RetryBufferConfig {
    
    private final Duration retryInterval;
    private final int maxDepth;
    private final OverflowPolicy overflowPolicy;
    
    private RetryBufferConfig(Builder builder) {
        this.retryInterval = builder.retryInterval;
        this.maxDepth = builder.maxDepth;
        this.overflowPolicy = builder.overflowPolicy;
    }
    
    public Duration getRetryInterval() {
        return retryInterval;
    }
    
    /**
     * @return maximum number of buffered payloads, ignored when the policy is {@link OverflowPolicy#UNBOUNDED}
     */
    public int getMaxDepth() {
        return maxDepth;
    }
    
    public OverflowPolicy getOverflowPolicy() {
        return overflowPolicy;
    }
    
    public boolean isBounded() {
        return overflowPolicy != OverflowPolicy.UNBOUNDED;
    }
    
    public static RetryBufferConfig defaultConfig() {
        return builder().build();
    }
    
    public static Builder builder() {
        return new Builder();
    }
    
    @Override
    public String toString() {
        return String.format("RetryBufferConfig{retryInterval=%s, maxDepth=%d, overflowPolicy=%s}",
            retryInterval, maxDepth, overflowPolicy);
    }
    
    public static class Builder {
        private Duration retryInterval = Duration.ofSeconds(5);
        private int maxDepth = 10_000;
        private OverflowPolicy overflowPolicy = OverflowPolicy.UNBOUNDED;
        
        public Builder retryInterval(Duration interval) {
            this.retryInterval = interval;
            return this;
        }
        
        public Builder maxDepth(int depth) {
            this.maxDepth = depth;
            return this;
        }
        
        public Builder overflowPolicy(OverflowPolicy policy) {
            this.overflowPolicy = policy;
            return this;
        }
        
        public RetryBufferConfig build() {
            if (retryInterval == null || retryInterval.isNegative()) {
                throw new IllegalArgumentException("Retry interval must be a non-negative duration");
            }
            if (overflowPolicy == null) {
                throw new IllegalArgumentException("Overflow policy must be specified");
            }
            if (overflowPolicy != OverflowPolicy.UNBOUNDED && maxDepth < 1) {
                throw new IllegalArgumentException("Bounded retry buffer needs a max depth of at least 1");
            }
            return new RetryBufferConfig(this);
        }
    }
}
