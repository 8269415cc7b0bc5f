package com.iot.relay.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.time.Duration;
import java.util.Arrays;
import java.util.List;
import java.util.Properties;
import java.util.function.Consumer;
import java.util.stream.Collectors;

/**
 * Builds a {@link RelayConfiguration} from {@code relay.properties} on the classpath,
 * overlaid with JVM system properties of the same name.
 * Keys that are absent keep the builder defaults.
 */
public final class RelayConfigurationLoader {
    
    private static final Logger logger = LoggerFactory.getLogger(RelayConfigurationLoader.class);
    
    public static final String DEFAULT_RESOURCE = "relay.properties";
    
    private RelayConfigurationLoader() {
    }
    
    public static RelayConfiguration load() {
        return load(DEFAULT_RESOURCE, System.getProperties());
    }
    
    public static RelayConfiguration load(String resource, Properties overrides) {
        Properties properties = new Properties();
        try (InputStream in = RelayConfigurationLoader.class.getClassLoader().getResourceAsStream(resource)) {
            if (in != null) {
                properties.load(in);
                logger.info("Loaded relay configuration from classpath resource {}", resource);
            } else {
                logger.info("No {} on classpath, using defaults", resource);
            }
        } catch (IOException e) {
            throw new IllegalStateException("Failed to read configuration resource " + resource, e);
        }
        for (String name : overrides.stringPropertyNames()) {
            if (name.startsWith("relay.")) {
                properties.setProperty(name, overrides.getProperty(name));
            }
        }
        return fromProperties(properties);
    }
    
    public static RelayConfiguration fromProperties(Properties properties) {
        ClusterConfig.Builder cluster = ClusterConfig.builder();
        ifPresent(properties, "relay.cluster.node-id", cluster::nodeId);
        ifPresent(properties, "relay.cluster.seed-node-id", cluster::seedNodeId);
        ifPresent(properties, "relay.cluster.peers", raw -> cluster.peers(splitList(raw)));
        ifPresent(properties, "relay.cluster.failure-detection-cycles",
            raw -> cluster.failureDetectionCycles(Integer.parseInt(raw.trim())));
        ifPresent(properties, "relay.cluster.process-on-leader",
            raw -> cluster.processOnLeader(Boolean.parseBoolean(raw.trim())));
        
        CircuitBreakerConfig.Builder breaker = CircuitBreakerConfig.builder();
        ifPresent(properties, "relay.breaker.failure-threshold",
            raw -> breaker.failureThreshold(Integer.parseInt(raw.trim())));
        ifPresent(properties, "relay.breaker.success-threshold",
            raw -> breaker.successThreshold(Integer.parseInt(raw.trim())));
        ifPresent(properties, "relay.breaker.reset-timeout", raw -> breaker.resetTimeout(parseDuration(raw)));
        
        RetryBufferConfig.Builder retry = RetryBufferConfig.builder();
        ifPresent(properties, "relay.retry.interval", raw -> retry.retryInterval(parseDuration(raw)));
        ifPresent(properties, "relay.retry.max-depth", raw -> retry.maxDepth(Integer.parseInt(raw.trim())));
        ifPresent(properties, "relay.retry.overflow-policy",
            raw -> retry.overflowPolicy(OverflowPolicy.valueOf(raw.trim().toUpperCase())));
        
        PipelineConfig.Builder pipeline = PipelineConfig.builder();
        ifPresent(properties, "relay.pipeline.required-fields", raw -> pipeline.requiredFields(splitList(raw)));
        ifPresent(properties, "relay.pipeline.max-consecutive-failures",
            raw -> pipeline.maxConsecutiveFailures(Integer.parseInt(raw.trim())));
        ifPresent(properties, "relay.pipeline.health-fault-cadence",
            raw -> pipeline.healthFaultCadence(Integer.parseInt(raw.trim())));
        
        ResilienceConfig.Builder resilience = ResilienceConfig.builder();
        String attempts = properties.getProperty("relay.connect.max-attempts");
        String wait = properties.getProperty("relay.connect.wait");
        if (attempts != null || wait != null) {
            resilience.connectRetryConfig(
                attempts != null ? Integer.parseInt(attempts.trim()) : 5,
                wait != null ? parseDuration(wait) : Duration.ofSeconds(5));
        }
        ifPresent(properties, "relay.connect.retry-enabled",
            raw -> resilience.enableConnectRetry(Boolean.parseBoolean(raw.trim())));
        
        RelayConfiguration.Builder builder = RelayConfiguration.builder();
        ifPresent(properties, "relay.broker.uri", builder::brokerUri);
        ifPresent(properties, "relay.client-id", builder::clientId);
        ifPresent(properties, "relay.ingress.topic", builder::ingressTopic);
        ifPresent(properties, "relay.egress.topic", builder::egressTopic);
        ifPresent(properties, "relay.qos", raw -> builder.qos(Integer.parseInt(raw.trim())));
        ifPresent(properties, "relay.strategy", raw -> builder.strategy(RelayStrategy.fromString(raw)));
        ifPresent(properties, "relay.poll-interval", raw -> builder.pollInterval(parseDuration(raw)));
        ifPresent(properties, "relay.receive-timeout", raw -> builder.receiveTimeout(parseDuration(raw)));
        ifPresent(properties, "relay.connection-timeout", raw -> builder.connectionTimeout(parseDuration(raw)));
        ifPresent(properties, "relay.downstream.failure-rate",
            raw -> builder.downstreamFailureRate(Double.parseDouble(raw.trim())));
        
        return builder
            .clusterConfig(cluster.build())
            .circuitBreakerConfig(breaker.build())
            .retryBufferConfig(retry.build())
            .pipelineConfig(pipeline.build())
            .resilienceConfig(resilience.build())
            .build();
    }
    
    /**
     * Parses either an ISO-8601 duration ({@code PT5S}) or a number with a
     * {@code ms}, {@code s} or {@code m} suffix. A bare number is taken as milliseconds.
     */
    static Duration parseDuration(String raw) {
        String value = raw.trim().toLowerCase();
        if (value.startsWith("pt") || value.startsWith("p")) {
            return Duration.parse(value.toUpperCase());
        }
        if (value.endsWith("ms")) {
            return Duration.ofMillis(Long.parseLong(value.substring(0, value.length() - 2).trim()));
        }
        if (value.endsWith("s")) {
            return Duration.ofSeconds(Long.parseLong(value.substring(0, value.length() - 1).trim()));
        }
        if (value.endsWith("m")) {
            return Duration.ofMinutes(Long.parseLong(value.substring(0, value.length() - 1).trim()));
        }
        return Duration.ofMillis(Long.parseLong(value));
    }
    
    private static List<String> splitList(String raw) {
        return Arrays.stream(raw.split(","))
            .map(String::trim)
            .filter(s -> !s.isEmpty())
            .collect(Collectors.toList());
    }
    
    private static void ifPresent(Properties properties, String key, Consumer<String> setter) {
        String value = properties.getProperty(key);
        if (value != null && !value.isBlank()) {
            setter.accept(value);
        }
    }
}
