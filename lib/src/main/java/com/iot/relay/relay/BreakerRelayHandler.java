package com.iot.relay.relay;

import com.iot.relay.breaker.AdmissionController;
import com.iot.relay.config.RelayStrategy;
import com.iot.relay.model.RelayEvent;
import com.iot.relay.model.RelayEventListener;
import com.iot.relay.model.RelayEventType;
import com.iot.relay.observability.RelayMetrics;
import com.iot.relay.retry.EnqueueResult;
import com.iot.relay.retry.RetryBuffer;
import com.iot.relay.transport.DeliveryException;
import com.iot.relay.transport.EgressPublisher;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;

/**
 * Fail-and-buffer strategy: deliveries pass through the admission controller and
 * every payload that is refused or fails goes to the retry buffer.
 *
 * <p>Retries consult the same admission gate as fresh deliveries and feed their
 * outcome back into it.
 */
public class BreakerRelayHandler implements RelayHandler {
    
    private static final Logger logger = LoggerFactory.getLogger(BreakerRelayHandler.class);
    
    private final String nodeId;
    private final AdmissionController admissionController;
    private final RetryBuffer retryBuffer;
    private final EgressPublisher egressPublisher;
    private final RelayMetrics metrics;
    private final RelayEventListener eventListener;
    private final Clock clock;
    
    public BreakerRelayHandler(String nodeId, AdmissionController admissionController, RetryBuffer retryBuffer,
                               EgressPublisher egressPublisher, RelayMetrics metrics,
                               RelayEventListener eventListener, Clock clock) {
        this.nodeId = nodeId;
        this.admissionController = admissionController;
        this.retryBuffer = retryBuffer;
        this.egressPublisher = egressPublisher;
        this.metrics = metrics;
        this.eventListener = eventListener;
        this.clock = clock;
    }
    
    @Override
    public RelayStrategy strategy() {
        return RelayStrategy.BREAKER;
    }
    
    @Override
    public void handle(String payload) {
        if (!admissionController.allowRequest()) {
            metrics.recordRejected();
            logger.info("Circuit open - message queued");
            buffer(payload);
            return;
        }
        if (!attemptDelivery(payload)) {
            buffer(payload);
        }
    }
    
    @Override
    public void onTick(Instant now) {
        int forwarded = retryBuffer.drainTick(now, this::retry);
        if (forwarded > 0) {
            logger.info("Delivered {} buffered payloads, {} remaining", forwarded, retryBuffer.size());
        }
        metrics.updateRetryDepth(retryBuffer.size());
    }
    
    private boolean retry(String payload) {
        if (!admissionController.allowRequest()) {
            return false;
        }
        return attemptDelivery(payload);
    }
    
    private boolean attemptDelivery(String payload) {
        boolean delivered;
        try {
            delivered = egressPublisher.deliver(payload);
        } catch (DeliveryException e) {
            logger.warn("Delivery failed: {}", e.getMessage());
            delivered = false;
        }
        if (delivered) {
            admissionController.recordSuccess();
        } else {
            admissionController.recordFailure();
        }
        return delivered;
    }
    
    private void buffer(String payload) {
        EnqueueResult result = retryBuffer.enqueue(payload);
        if (result.isAccepted()) {
            metrics.recordEnqueued(retryBuffer.size());
        }
        if (result.droppedPayload()) {
            metrics.recordOverflowDrop();
            logger.warn("Retry buffer full at {} payloads: {}", retryBuffer.size(), result);
            eventListener.onEvent(new RelayEvent(RelayEventType.RETRY_BUFFER_OVERFLOW, nodeId,
                result.name(), clock.instant()));
        }
    }
    
    public AdmissionController getAdmissionController() {
        return admissionController;
    }
    
    public RetryBuffer getRetryBuffer() {
        return retryBuffer;
    }
}
