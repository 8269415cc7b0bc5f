package com.iot.relay.transport;

import com.iot.relay.observability.RelayMetrics;
import com.iot.relay.pipeline.FaultInjector;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;

/**
 * Delivers final payloads to the downstream topic.
 */
public class EgressPublisher {
    
    private static final Logger logger = LoggerFactory.getLogger(EgressPublisher.class);
    
    private final MessageTransport transport;
    private final String topic;
    private final int qos;
    private final RelayMetrics metrics;
    private final FaultInjector downstreamFault;
    
    public EgressPublisher(MessageTransport transport, String topic, int qos, RelayMetrics metrics) {
        this(transport, topic, qos, metrics, FaultInjector.never());
    }
    
    /**
     * @param downstreamFault simulates the receiver refusing a delivery when it fires
     */
    public EgressPublisher(MessageTransport transport, String topic, int qos, RelayMetrics metrics,
                           FaultInjector downstreamFault) {
        this.transport = transport;
        this.topic = topic;
        this.qos = qos;
        this.metrics = metrics;
        this.downstreamFault = downstreamFault;
    }
    
    /**
     * Attempts one delivery.
     * 
     * @return true if the payload was published, false if the downstream refused it
     * @throws DeliveryException if the transport failed to publish
     */
    public boolean deliver(String payload) {
        long start = System.nanoTime();
        if (downstreamFault.shouldFail()) {
            logger.warn("Simulated receiver failure for payload: {}", payload);
            metrics.recordDelivery(Duration.ofNanos(System.nanoTime() - start), false);
            return false;
        }
        try {
            transport.publish(topic, payload, qos);
        } catch (TransportException e) {
            metrics.recordDelivery(Duration.ofNanos(System.nanoTime() - start), false);
            throw new DeliveryException(topic, e.getMessage(), e);
        }
        metrics.recordDelivery(Duration.ofNanos(System.nanoTime() - start), true);
        logger.debug("Forwarded message to {}: {}", topic, payload);
        return true;
    }
    
    public String getTopic() {
        return topic;
    }
}
