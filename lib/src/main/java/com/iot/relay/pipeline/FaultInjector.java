package com.iot.relay.pipeline;

import java.util.Random;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Injectable source of synthetic failures. Each instance keeps its own state, so
 * components never share hidden counters and tests can trigger faults deterministically.
 */
@FunctionalInterface
public interface FaultInjector {
    
    /**
     * @return true if the guarded operation should fail this time
     */
    boolean shouldFail();
    
    static FaultInjector never() {
        return () -> false;
    }
    
    static FaultInjector always() {
        return () -> true;
    }
    
    /**
     * Fails on every {@code n}-th invocation (the n-th, 2n-th, ...).
     */
    static FaultInjector everyNth(int n) {
        if (n < 1) {
            throw new IllegalArgumentException("Cadence must be at least 1");
        }
        AtomicLong invocations = new AtomicLong();
        return () -> invocations.incrementAndGet() % n == 0;
    }
    
    /**
     * Fails with the given probability on each invocation.
     */
    static FaultInjector probability(double rate, Random random) {
        if (rate < 0.0 || rate > 1.0) {
            throw new IllegalArgumentException("Failure rate must be between 0 and 1");
        }
        return () -> random.nextDouble() < rate;
    }
    
    /**
     * Manually operated fault flag.
     */
    static Toggle toggle() {
        return new Toggle();
    }
    
    /**
     * A fault flag that stays set until cleared.
     */
    final class Toggle implements FaultInjector {
        private final AtomicBoolean engaged = new AtomicBoolean();
        
        private Toggle() {
        }
        
        public void engage() {
            engaged.set(true);
        }
        
        public void clear() {
            engaged.set(false);
        }
        
        @Override
        public boolean shouldFail() {
            return engaged.get();
        }
    }
}
