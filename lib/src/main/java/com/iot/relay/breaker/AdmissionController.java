package com.iot.relay.breaker;

import com.iot.relay.config.CircuitBreakerConfig;
import com.iot.relay.model.CircuitState;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;

/**
 * Two-state circuit breaker that protects a fragile downstream.
 *
 * <p>The gate opens once {@code failureThreshold} failures have been recorded without
 * an intervening run of {@code successThreshold} successes. It closes again only from
 * {@link #allowRequest()}, the first time it is queried after more than
 * {@code resetTimeout} has passed since the last failure. There is no half-open trial
 * phase: after that query every caller is admitted again.
 *
 * <p>Not thread-safe. The owning relay node serialises access under its lock.
 */
public class AdmissionController {
    
    private static final Logger logger = LoggerFactory.getLogger(AdmissionController.class);
    
    private final CircuitBreakerConfig config;
    private final Clock clock;
    private final CircuitStateListener listener;
    
    private int failureCount;
    private int successCount;
    private CircuitState state = CircuitState.CLOSED;
    private Instant lastFailureTimestamp;
    
    public AdmissionController(CircuitBreakerConfig config) {
        this(config, Clock.systemUTC(), CircuitStateListener.noop());
    }
    
    public AdmissionController(CircuitBreakerConfig config, Clock clock, CircuitStateListener listener) {
        this.config = config;
        this.clock = clock;
        this.listener = listener;
    }
    
    /**
     * Decides whether a delivery attempt may proceed.
     * 
     * @return true when closed, or when open and the reset timeout has strictly elapsed
     *         (which also closes the gate); false otherwise
     */
    public boolean allowRequest() {
        if (state == CircuitState.CLOSED) {
            return true;
        }
        Duration sinceFailure = Duration.between(lastFailureTimestamp, clock.instant());
        if (sinceFailure.compareTo(config.getResetTimeout()) > 0) {
            transitionTo(CircuitState.CLOSED);
            return true;
        }
        return false;
    }
    
    public void recordFailure() {
        failureCount++;
        successCount = 0;
        lastFailureTimestamp = clock.instant();
        
        if (failureCount >= config.getFailureThreshold() && state != CircuitState.OPEN) {
            transitionTo(CircuitState.OPEN);
        }
    }
    
    public void recordSuccess() {
        successCount++;
        if (successCount >= config.getSuccessThreshold() && failureCount > 0) {
            failureCount = 0;
            logger.info("Admission gate failure count reset after {} consecutive successes", successCount);
        }
    }
    
    private void transitionTo(CircuitState next) {
        CircuitState previous = state;
        state = next;
        if (next == CircuitState.OPEN) {
            logger.warn("Admission gate OPENED after {} failures, refusing deliveries for {}",
                failureCount, config.getResetTimeout());
        } else {
            logger.info("Admission gate CLOSED, reset timeout of {} elapsed", config.getResetTimeout());
        }
        listener.onStateChange(previous, next);
    }
    
    public CircuitState getState() {
        return state;
    }
    
    public int getFailureCount() {
        return failureCount;
    }
    
    public int getSuccessCount() {
        return successCount;
    }
    
    public Instant getLastFailureTimestamp() {
        return lastFailureTimestamp;
    }
    
    public CircuitBreakerConfig getConfig() {
        return config;
    }
}
