package com.iot.relay.config;

/**
 * Behaviour of the retry buffer once its configured depth is reached.
 */
public enum OverflowPolicy {
    
    /**
     * No depth limit. Every failed delivery is kept until it is forwarded.
     */
    UNBOUNDED,
    
    /**
     * Evict the payload at the head to make room for the new one.
     * Favours fresh readings over stale ones.
     */
    DROP_OLDEST,
    
    /**
     * Reject the incoming payload and keep the buffered ones untouched.
     */
    DROP_NEWEST
}
