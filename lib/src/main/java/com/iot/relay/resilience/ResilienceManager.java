package com.iot.relay.resilience;

import com.iot.relay.config.ResilienceConfig;
import com.iot.relay.transport.MessageTransport;
import io.github.resilience4j.retry.Retry;
import io.github.resilience4j.retry.RetryRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.function.Supplier;

/**
 * Resilience4j retry around broker connection establishment.
 * A relay node cannot start relaying until its transport is connected and subscribed,
 * so those steps are retried before the polling loop starts.
 */
public class ResilienceManager {
    
    private static final Logger logger = LoggerFactory.getLogger(ResilienceManager.class);
    
    private final ResilienceConfig config;
    private final RetryRegistry retryRegistry;
    
    public ResilienceManager(ResilienceConfig config) {
        this.config = config;
        this.retryRegistry = RetryRegistry.of(config.getConnectRetryConfig());
        
        setupEventHandlers();
    }
    
    /**
     * Get or create the retry instance for a named connection.
     */
    public Retry getRetry(String name) {
        return retryRegistry.retry(name);
    }
    
    /**
     * Decorate a supplier with connection retry, if enabled.
     */
    public <T> Supplier<T> decorateSupplier(String name, Supplier<T> supplier) {
        if (!config.isConnectRetryEnabled()) {
            return supplier;
        }
        return Retry.decorateSupplier(getRetry(name), supplier);
    }
    
    /**
     * Runs the setup action, retrying on failure per the connect retry configuration.
     * 
     * @param name retry instance name, usually the client id
     * @param transport transport to connect
     * @param setup actions to run once connected, such as subscribing
     */
    public void connect(String name, MessageTransport transport, Runnable setup) {
        decorateSupplier(name, () -> {
            transport.connect();
            setup.run();
            return Boolean.TRUE;
        }).get();
    }
    
    public ResilienceConfig getConfig() {
        return config;
    }
    
    private void setupEventHandlers() {
        retryRegistry.getEventPublisher().onEntryAdded(event -> {
            Retry retry = event.getAddedEntry();
            String name = retry.getName();
            
            retry.getEventPublisher()
                    .onRetry(e -> logger.warn("Connection {} attempt {} failed: {}, retrying",
                            name, e.getNumberOfRetryAttempts(), e.getLastThrowable().getMessage()))
                    .onSuccess(e -> logger.info("Connection {} established after {} retries",
                            name, e.getNumberOfRetryAttempts()))
                    .onError(e -> logger.error("Connection {} failed after {} attempts: {}",
                            name, e.getNumberOfRetryAttempts(), e.getLastThrowable().getMessage()));
        });
    }
}
