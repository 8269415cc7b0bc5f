package com.iot.relay.transport;

import java.time.Duration;
import java.util.Optional;

/**
 * Publish/subscribe transport primitives used by a relay node.
 * Delivery within a topic is assumed to be ordered.
 */
public interface MessageTransport extends AutoCloseable {
    
    /**
     * @throws TransportException if the broker cannot be reached
     */
    void connect();
    
    /**
     * @throws TransportException if the subscription is refused
     */
    void subscribe(String topic, int qos);
    
    /**
     * Waits up to {@code timeout} for the next message from any subscribed topic.
     * 
     * @return the next message in arrival order, empty if none arrived in time
     */
    Optional<InboundMessage> receive(Duration timeout);
    
    /**
     * Publishes a payload and waits for the broker to accept it at the given QoS.
     * 
     * @throws TransportException if the publish fails
     */
    void publish(String topic, String payload, int qos);
    
    boolean isConnected();
    
    void setConnectionListener(ConnectionListener listener);
    
    @Override
    void close();
}
