package com.iot.relay.retry;

import com.iot.relay.config.OverflowPolicy;
import com.iot.relay.config.RetryBufferConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;
import java.util.function.Predicate;

/**
 * Order-preserving holding area for payloads whose delivery failed.
 *
 * <p>Payloads leave strictly from the head. A drain stops at the first payload that still
 * cannot be forwarded and leaves it, and everything behind it, in place until the next
 * drain. Nothing is ever reordered or skipped.
 *
 * <p>Not thread-safe. The owning relay node serialises access under its lock.
 */
public class RetryBuffer {
    
    private static final Logger logger = LoggerFactory.getLogger(RetryBuffer.class);
    
    private final RetryBufferConfig config;
    private final Deque<String> pending;
    private Instant lastDrainTime;
    
    public RetryBuffer(RetryBufferConfig config, Instant createdAt) {
        this.config = config;
        this.pending = new ArrayDeque<>();
        this.lastDrainTime = createdAt;
    }
    
    /**
     * Appends a payload to the tail, applying the overflow policy if the buffer is bounded and full.
     */
    public EnqueueResult enqueue(String payload) {
        if (config.isBounded() && pending.size() >= config.getMaxDepth()) {
            if (config.getOverflowPolicy() == OverflowPolicy.DROP_NEWEST) {
                logger.warn("Retry buffer full ({} payloads), dropping incoming payload", pending.size());
                return EnqueueResult.REJECTED;
            }
            pending.pollFirst();
            pending.addLast(payload);
            logger.warn("Retry buffer full ({} payloads), dropped oldest payload", pending.size());
            return EnqueueResult.ACCEPTED_OLDEST_DROPPED;
        }
        pending.addLast(payload);
        return EnqueueResult.ACCEPTED;
    }
    
    /**
     * Forwards buffered payloads head first if the retry interval has passed since the last drain.
     * 
     * @param now current time
     * @param forward delivery attempt, returning true on success; an exception counts as failure
     * @return number of payloads forwarded and removed, 0 when the drain was not yet due
     */
    public int drainTick(Instant now, Predicate<String> forward) {
        if (Duration.between(lastDrainTime, now).compareTo(config.getRetryInterval()) < 0) {
            return 0;
        }
        lastDrainTime = now;
        
        if (pending.isEmpty()) {
            return 0;
        }
        
        logger.info("Retrying {} buffered payloads", pending.size());
        int forwarded = 0;
        while (!pending.isEmpty()) {
            String head = pending.peekFirst();
            boolean delivered;
            try {
                delivered = forward.test(head);
            } catch (RuntimeException e) {
                logger.warn("Retry of buffered payload failed: {}", e.getMessage());
                delivered = false;
            }
            if (!delivered) {
                break;
            }
            pending.pollFirst();
            forwarded++;
        }
        
        if (!pending.isEmpty()) {
            logger.info("Retry halted after {} payloads, {} still buffered", forwarded, pending.size());
        }
        return forwarded;
    }
    
    public int size() {
        return pending.size();
    }
    
    public boolean isEmpty() {
        return pending.isEmpty();
    }
    
    /**
     * @return a copy of the buffered payloads in delivery order
     */
    public List<String> snapshot() {
        return List.copyOf(pending);
    }
    
    public Instant getLastDrainTime() {
        return lastDrainTime;
    }
    
    public RetryBufferConfig getConfig() {
        return config;
    }
}
