package com.iot.relay.config;

import java.time.Duration;

/**
 * Configuration for a relay node.
 * Defines the broker endpoint, topics, polling cadence and the settings of every
 * fault-tolerance component.
 */
public class RelayConfiguration {
    
    public static final String DEFAULT_BROKER_URI = "tcp://localhost:1883";
    public static final String DEFAULT_INGRESS_TOPIC = "iot/input";
    public static final String DEFAULT_EGRESS_TOPIC = "iot/data";
    
    private final String brokerUri;
    private final String clientId;
    private final String ingressTopic;
    private final String egressTopic;
    private final int qos;
    private final RelayStrategy strategy;
    private final Duration pollInterval;
    private final Duration receiveTimeout;
    private final Duration connectionTimeout;
    private final double downstreamFailureRate;
    private final CircuitBreakerConfig circuitBreakerConfig;
    private final RetryBufferConfig retryBufferConfig;
    private final PipelineConfig pipelineConfig;
    private final ClusterConfig clusterConfig;
    private final ResilienceConfig resilienceConfig;
    
    private RelayConfiguration(Builder builder) {
        this.brokerUri = builder.brokerUri;
        this.clientId = builder.clientId;
        this.ingressTopic = builder.ingressTopic;
        this.egressTopic = builder.egressTopic;
        this.qos = builder.qos;
        this.strategy = builder.strategy;
        this.pollInterval = builder.pollInterval;
        this.receiveTimeout = builder.receiveTimeout;
        this.connectionTimeout = builder.connectionTimeout;
        this.downstreamFailureRate = builder.downstreamFailureRate;
        this.circuitBreakerConfig = builder.circuitBreakerConfig;
        this.retryBufferConfig = builder.retryBufferConfig;
        this.pipelineConfig = builder.pipelineConfig;
        this.clusterConfig = builder.clusterConfig;
        this.resilienceConfig = builder.resilienceConfig;
    }
    
    public String getBrokerUri() {
        return brokerUri;
    }
    
    public String getClientId() {
        return clientId;
    }
    
    public String getIngressTopic() {
        return ingressTopic;
    }
    
    public String getEgressTopic() {
        return egressTopic;
    }
    
    public int getQos() {
        return qos;
    }
    
    public RelayStrategy getStrategy() {
        return strategy;
    }
    
    public Duration getPollInterval() {
        return pollInterval;
    }
    
    public Duration getReceiveTimeout() {
        return receiveTimeout;
    }
    
    public Duration getConnectionTimeout() {
        return connectionTimeout;
    }
    
    /**
     * Probability that a delivery is refused as if the downstream receiver had failed.
     * Zero outside of fault drills.
     */
    public double getDownstreamFailureRate() {
        return downstreamFailureRate;
    }
    
    public CircuitBreakerConfig getCircuitBreakerConfig() {
        return circuitBreakerConfig;
    }
    
    public RetryBufferConfig getRetryBufferConfig() {
        return retryBufferConfig;
    }
    
    public PipelineConfig getPipelineConfig() {
        return pipelineConfig;
    }
    
    public ClusterConfig getClusterConfig() {
        return clusterConfig;
    }
    
    public ResilienceConfig getResilienceConfig() {
        return resilienceConfig;
    }
    
    public static RelayConfiguration defaultConfig() {
        return builder().build();
    }
    
    public static Builder builder() {
        return new Builder();
    }
    
    @Override
    public String toString() {
        return String.format("RelayConfiguration{broker='%s', clientId='%s', ingress='%s', egress='%s', qos=%d, strategy=%s, pollInterval=%s}",
            brokerUri, clientId, ingressTopic, egressTopic, qos, strategy, pollInterval);
    }
    
    public static class Builder {
        private String brokerUri = DEFAULT_BROKER_URI;
        private String clientId;
        private String ingressTopic = DEFAULT_INGRESS_TOPIC;
        private String egressTopic = DEFAULT_EGRESS_TOPIC;
        private int qos = 1;
        private RelayStrategy strategy = RelayStrategy.BREAKER;
        private Duration pollInterval = Duration.ofMillis(100);
        private Duration receiveTimeout = Duration.ofMillis(50);
        private Duration connectionTimeout = Duration.ofSeconds(10);
        private double downstreamFailureRate = 0.0;
        private CircuitBreakerConfig circuitBreakerConfig = CircuitBreakerConfig.defaultConfig();
        private RetryBufferConfig retryBufferConfig = RetryBufferConfig.defaultConfig();
        private PipelineConfig pipelineConfig = PipelineConfig.defaultConfig();
        private ClusterConfig clusterConfig = ClusterConfig.defaultConfig();
        private ResilienceConfig resilienceConfig = ResilienceConfig.defaultConfig();
        
        public Builder brokerUri(String brokerUri) {
            this.brokerUri = brokerUri;
            return this;
        }
        
        public Builder clientId(String clientId) {
            this.clientId = clientId;
            return this;
        }
        
        public Builder ingressTopic(String topic) {
            this.ingressTopic = topic;
            return this;
        }
        
        public Builder egressTopic(String topic) {
            this.egressTopic = topic;
            return this;
        }
        
        public Builder qos(int qos) {
            this.qos = qos;
            return this;
        }
        
        public Builder strategy(RelayStrategy strategy) {
            this.strategy = strategy;
            return this;
        }
        
        public Builder pollInterval(Duration interval) {
            this.pollInterval = interval;
            return this;
        }
        
        public Builder receiveTimeout(Duration timeout) {
            this.receiveTimeout = timeout;
            return this;
        }
        
        public Builder connectionTimeout(Duration timeout) {
            this.connectionTimeout = timeout;
            return this;
        }
        
        public Builder downstreamFailureRate(double rate) {
            this.downstreamFailureRate = rate;
            return this;
        }
        
        public Builder circuitBreakerConfig(CircuitBreakerConfig config) {
            this.circuitBreakerConfig = config;
            return this;
        }
        
        public Builder retryBufferConfig(RetryBufferConfig config) {
            this.retryBufferConfig = config;
            return this;
        }
        
        public Builder pipelineConfig(PipelineConfig config) {
            this.pipelineConfig = config;
            return this;
        }
        
        public Builder clusterConfig(ClusterConfig config) {
            this.clusterConfig = config;
            return this;
        }
        
        public Builder resilienceConfig(ResilienceConfig config) {
            this.resilienceConfig = config;
            return this;
        }
        
        public RelayConfiguration build() {
            if (brokerUri == null || brokerUri.trim().isEmpty()) {
                throw new IllegalArgumentException("Broker URI must be specified");
            }
            if (ingressTopic == null || ingressTopic.trim().isEmpty()) {
                throw new IllegalArgumentException("Ingress topic must be specified");
            }
            if (egressTopic == null || egressTopic.trim().isEmpty()) {
                throw new IllegalArgumentException("Egress topic must be specified");
            }
            if (ingressTopic.equals(egressTopic)) {
                throw new IllegalArgumentException("Ingress and egress topics must differ");
            }
            if (qos < 0 || qos > 2) {
                throw new IllegalArgumentException("QoS must be 0, 1 or 2");
            }
            if (strategy == null) {
                throw new IllegalArgumentException("Relay strategy must be specified");
            }
            if (pollInterval == null || pollInterval.isNegative() || pollInterval.isZero()) {
                throw new IllegalArgumentException("Poll interval must be positive");
            }
            if (downstreamFailureRate < 0.0 || downstreamFailureRate > 1.0) {
                throw new IllegalArgumentException("Downstream failure rate must be between 0 and 1");
            }
            if (clientId == null || clientId.trim().isEmpty()) {
                clientId = "relay-" + strategy.name().toLowerCase() + "-" + clusterConfig.getNodeId();
            }
            return new RelayConfiguration(this);
        }
    }
}
