package com.iot.relay.cluster;

/**
 * Decides, once per polling cycle on a follower, whether the leader should be presumed failed.
 */
@FunctionalInterface
public interface FailureDetector {
    
    boolean leaderSuspected();
}
