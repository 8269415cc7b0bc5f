package com.iot.relay.relay;

import com.iot.relay.RelayException;
import com.iot.relay.config.RelayConfiguration;
import com.iot.relay.model.RelayEvent;
import com.iot.relay.model.RelayEventType;
import com.iot.relay.observability.RelayEventPublisher;
import com.iot.relay.observability.RelayMetrics;
import com.iot.relay.resilience.ResilienceManager;
import com.iot.relay.transport.ConnectionListener;
import com.iot.relay.transport.InboundMessage;
import com.iot.relay.transport.MessageTransport;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.Optional;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.ReentrantLock;

/**
 * A running relay: one transport, one strategy handler and a single polling loop.
 *
 * <p>Each cycle waits briefly for an ingress message, hands it to the handler, then lets
 * the handler run its periodic maintenance. Handler calls happen under a per-node lock, so
 * breaker, buffer, pipeline and coordinator state is only ever touched by one thread.
 * Errors raised while handling a message are logged and never stop the loop.
 */
public class RelayNode implements AutoCloseable {
    
    private static final Logger logger = LoggerFactory.getLogger(RelayNode.class);
    
    private final RelayConfiguration configuration;
    private final MessageTransport transport;
    private final RelayHandler handler;
    private final RelayMetrics metrics;
    private final RelayEventPublisher eventPublisher;
    private final ResilienceManager resilienceManager;
    private final Clock clock;
    private final String nodeId;
    private final ReentrantLock lock = new ReentrantLock();
    private final ScheduledExecutorService scheduler;
    private volatile boolean running = false;
    private ScheduledFuture<?> pollTask;
    
    public RelayNode(RelayConfiguration configuration, MessageTransport transport, RelayHandler handler,
                     RelayMetrics metrics, RelayEventPublisher eventPublisher,
                     ResilienceManager resilienceManager, Clock clock) {
        this.configuration = configuration;
        this.transport = transport;
        this.handler = handler;
        this.metrics = metrics;
        this.eventPublisher = eventPublisher;
        this.resilienceManager = resilienceManager;
        this.clock = clock;
        this.nodeId = configuration.getClusterConfig().getNodeId();
        this.scheduler = Executors.newSingleThreadScheduledExecutor(
            r -> new Thread(r, "relay-loop-" + nodeId));
        
        transport.setConnectionListener(new NodeConnectionListener());
    }
    
    /**
     * Connects to the broker, subscribes to the ingress topic and starts polling.
     * 
     * @throws com.iot.relay.transport.TransportException if the broker stays unreachable
     *         after the configured connection retries
     */
    public void start() {
        if (running) {
            return;
        }
        
        resilienceManager.connect(configuration.getClientId(), transport,
            () -> transport.subscribe(configuration.getIngressTopic(), configuration.getQos()));
        
        running = true;
        pollTask = scheduler.scheduleWithFixedDelay(
            this::runCycle,
            0,
            configuration.getPollInterval().toMillis(),
            TimeUnit.MILLISECONDS
        );
        
        logger.info("Relay node {} started with {} strategy: {} -> {}", nodeId, handler.strategy(),
            configuration.getIngressTopic(), configuration.getEgressTopic());
    }
    
    /**
     * Runs one polling cycle: receive with timeout, handle, tick.
     * 
     * @return true if a message was received this cycle
     */
    public boolean runCycle() {
        Optional<InboundMessage> message;
        try {
            message = transport.receive(configuration.getReceiveTimeout());
        } catch (RuntimeException e) {
            logger.error("Failed to receive from {}", configuration.getIngressTopic(), e);
            metrics.recordLoopError();
            message = Optional.empty();
        }
        
        message.ifPresent(this::handleMessage);
        tick();
        return message.isPresent();
    }
    
    private void handleMessage(InboundMessage message) {
        metrics.recordReceived();
        logger.debug("Received message on {}: {}", message.getTopic(), message.getPayload());
        
        lock.lock();
        try {
            handler.handle(message.getPayload());
        } catch (RelayException e) {
            logger.error("Error relaying message: {}", e.getMessage());
            metrics.recordLoopError();
        } catch (RuntimeException e) {
            logger.error("Unexpected error relaying message", e);
            metrics.recordLoopError();
        } finally {
            lock.unlock();
        }
    }
    
    private void tick() {
        lock.lock();
        try {
            handler.onTick(clock.instant());
        } catch (RuntimeException e) {
            logger.error("Error during {} maintenance", handler.strategy(), e);
            metrics.recordLoopError();
        } finally {
            lock.unlock();
        }
    }
    
    public void stop() {
        if (!running) {
            return;
        }
        
        running = false;
        
        if (pollTask != null) {
            pollTask.cancel(false);
        }
        
        scheduler.shutdown();
        try {
            if (!scheduler.awaitTermination(5, TimeUnit.SECONDS)) {
                scheduler.shutdownNow();
            }
        } catch (InterruptedException e) {
            scheduler.shutdownNow();
            Thread.currentThread().interrupt();
        }
        
        logger.info("Relay node {} stopped", nodeId);
    }
    
    @Override
    public void close() {
        stop();
        scheduler.shutdownNow();
        try {
            transport.close();
        } catch (Exception e) {
            logger.warn("Error closing transport for node {}", nodeId, e);
        }
        eventPublisher.close();
    }
    
    public boolean isRunning() {
        return running;
    }
    
    public RelayHandler getHandler() {
        return handler;
    }
    
    public RelayMetrics getMetrics() {
        return metrics;
    }
    
    public RelayEventPublisher getEventPublisher() {
        return eventPublisher;
    }
    
    public RelayConfiguration getConfiguration() {
        return configuration;
    }
    
    private class NodeConnectionListener implements ConnectionListener {
        
        @Override
        public void onConnected(boolean reconnect) {
            if (reconnect) {
                logger.info("Node {} reconnected to broker", nodeId);
                eventPublisher.publish(new RelayEvent(RelayEventType.CONNECTION_RESTORED, nodeId,
                    configuration.getBrokerUri(), clock.instant()));
            }
        }
        
        @Override
        public void onConnectionLost(Throwable cause) {
            String reason = cause != null ? cause.getMessage() : "unknown";
            logger.warn("Node {} lost broker connection: {}", nodeId, reason);
            eventPublisher.publish(new RelayEvent(RelayEventType.CONNECTION_LOST, nodeId, reason, clock.instant()));
        }
    }
}
