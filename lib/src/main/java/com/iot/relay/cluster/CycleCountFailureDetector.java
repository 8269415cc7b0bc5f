package com.iot.relay.cluster;

/**
 * Synthetic detector that suspects the leader on every {@code n}-th polling cycle.
 * It observes nothing about the leader; it stands in for a heartbeat timeout.
 */
public class CycleCountFailureDetector implements FailureDetector {
    
    private final int cycles;
    private long counter;
    
    public CycleCountFailureDetector(int cycles) {
        if (cycles < 1) {
            throw new IllegalArgumentException("Detection cycles must be at least 1");
        }
        this.cycles = cycles;
    }
    
    @Override
    public boolean leaderSuspected() {
        return ++counter % cycles == 0;
    }
    
    public long getCounter() {
        return counter;
    }
}
