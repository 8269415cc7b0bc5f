package com.iot.relay.transport;

import com.iot.relay.pipeline.FaultInjector;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;

/**
 * Broker-less transport for local runs and tests. Publishing to a topic this transport
 * is subscribed to makes the message available to {@link #receive(Duration)}; every
 * publish is also recorded per topic for inspection.
 */
public class InMemoryMessageTransport implements MessageTransport {
    
    private static final Logger logger = LoggerFactory.getLogger(InMemoryMessageTransport.class);
    
    private final BlockingQueue<InboundMessage> inbound;
    private final Set<String> subscriptions;
    private final Map<String, List<String>> published;
    private final FaultInjector publishFault;
    private volatile ConnectionListener connectionListener = ConnectionListener.noop();
    private volatile boolean connected;
    
    public InMemoryMessageTransport() {
        this(FaultInjector.never());
    }
    
    /**
     * @param publishFault makes {@link #publish} throw {@link TransportException} when it fires
     */
    public InMemoryMessageTransport(FaultInjector publishFault) {
        this.inbound = new LinkedBlockingQueue<>();
        this.subscriptions = ConcurrentHashMap.newKeySet();
        this.published = new ConcurrentHashMap<>();
        this.publishFault = publishFault;
    }
    
    @Override
    public void connect() {
        connected = true;
        connectionListener.onConnected(false);
    }
    
    @Override
    public void subscribe(String topic, int qos) {
        requireConnected();
        subscriptions.add(topic);
        logger.debug("Subscribed to {} at QoS {}", topic, qos);
    }
    
    @Override
    public Optional<InboundMessage> receive(Duration timeout) {
        try {
            return Optional.ofNullable(inbound.poll(timeout.toMillis(), TimeUnit.MILLISECONDS));
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return Optional.empty();
        }
    }
    
    @Override
    public void publish(String topic, String payload, int qos) {
        requireConnected();
        if (publishFault.shouldFail()) {
            throw new TransportException("Simulated publish failure on " + topic);
        }
        published.computeIfAbsent(topic, t -> new CopyOnWriteArrayList<>()).add(payload);
        if (subscriptions.contains(topic)) {
            inbound.add(new InboundMessage(topic, payload));
        }
    }
    
    /**
     * Simulates a broker disconnect, notifying the connection listener.
     */
    public void dropConnection(Throwable cause) {
        connected = false;
        connectionListener.onConnectionLost(cause);
    }
    
    /**
     * @return payloads published to the topic, in publish order
     */
    public List<String> publishedTo(String topic) {
        return List.copyOf(published.getOrDefault(topic, List.of()));
    }
    
    public int pendingInbound() {
        return inbound.size();
    }
    
    @Override
    public boolean isConnected() {
        return connected;
    }
    
    @Override
    public void setConnectionListener(ConnectionListener listener) {
        this.connectionListener = listener;
    }
    
    @Override
    public void close() {
        connected = false;
        subscriptions.clear();
    }
    
    private void requireConnected() {
        if (!connected) {
            throw new TransportException("Transport is not connected");
        }
    }
}
