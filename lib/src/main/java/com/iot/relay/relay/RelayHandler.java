package com.iot.relay.relay;

import com.iot.relay.config.RelayStrategy;

import java.time.Instant;

/**
 * Fault-tolerance strategy wrapped around the relay of a single message.
 * Implementations are driven by {@link RelayNode} under the node lock and are not thread-safe.
 */
public interface RelayHandler {
    
    RelayStrategy strategy();
    
    /**
     * Relays one ingress payload.
     * 
     * @throws com.iot.relay.RelayException for failures the strategy does not absorb;
     *         the relay loop logs them and moves on
     */
    void handle(String payload);
    
    /**
     * Periodic maintenance, called once per polling cycle whether or not a message arrived.
     */
    void onTick(Instant now);
}
