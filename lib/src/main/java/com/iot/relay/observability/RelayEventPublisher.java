package com.iot.relay.observability;

import com.iot.relay.model.RelayEvent;
import com.iot.relay.model.RelayEventListener;
import reactor.core.Disposable;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Sinks;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Consumer;

/**
 * Publishes relay state-change events for monitoring and alerting.
 * Provides a reactive stream for subscription and fans events out to every subscriber.
 */
public class RelayEventPublisher implements RelayEventListener, AutoCloseable {
    
    private static final Logger logger = LoggerFactory.getLogger(RelayEventPublisher.class);
    
    private final Sinks.Many<RelayEvent> eventSink;
    private final AtomicInteger subscriberCount;
    
    public RelayEventPublisher() {
        this.eventSink = Sinks.many().multicast().directBestEffort();
        this.subscriberCount = new AtomicInteger();
    }
    
    /**
     * Publishes an event. Emission failures are logged and never propagated to the relay loop.
     * Synchronized since transports report connection changes from their own threads.
     * 
     * @param event the event to publish
     */
    public synchronized void publish(RelayEvent event) {
        Sinks.EmitResult result = eventSink.tryEmitNext(event);
        if (result.isFailure() && result != Sinks.EmitResult.FAIL_ZERO_SUBSCRIBER) {
            logger.warn("Failed to publish relay event {}: {}", event.getType(), result);
        } else {
            logger.debug("Published relay event: {}", event);
        }
    }
    
    @Override
    public void onEvent(RelayEvent event) {
        publish(event);
    }
    
    /**
     * Subscribes to relay events.
     * 
     * @param listener the callback for events
     * @return Disposable to unsubscribe
     */
    public Disposable subscribe(Consumer<RelayEvent> listener) {
        int total = subscriberCount.incrementAndGet();
        logger.info("New relay event subscriber (total subscribers: {})", total);
        
        return eventSink.asFlux()
            .doOnCancel(() -> {
                int remaining = subscriberCount.decrementAndGet();
                logger.info("Relay event subscription cancelled (remaining: {})", remaining);
            })
            .subscribe(
                listener,
                error -> logger.error("Relay event subscriber error", error)
            );
    }
    
    public int getSubscriberCount() {
        return subscriberCount.get();
    }
    
    /**
     * @return the event stream for advanced reactive operations
     */
    public Flux<RelayEvent> getEventStream() {
        return eventSink.asFlux();
    }
    
    @Override
    public void close() {
        logger.info("Closing RelayEventPublisher with {} active subscribers", subscriberCount.get());
        eventSink.tryEmitComplete();
    }
}
