package com.iot.relay.observability;

import com.iot.relay.model.RelayEvent;
import com.iot.relay.model.RelayEventType;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import reactor.core.Disposable;
import reactor.test.StepVerifier;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class RelayEventPublisherTest {

    private RelayEventPublisher publisher;

    @BeforeEach
    void setUp() {
        publisher = new RelayEventPublisher();
    }

    private static RelayEvent event(RelayEventType type) {
        return new RelayEvent(type, "node1", "detail", Instant.parse("2024-01-01T00:00:00Z"));
    }

    @Test
    void testPublishWithoutSubscribersIsHarmless() {
        assertDoesNotThrow(() -> publisher.publish(event(RelayEventType.CIRCUIT_OPENED)));
    }

    @Test
    void testSubscriberReceivesEvents() {
        List<RelayEvent> received = new ArrayList<>();
        Disposable subscription = publisher.subscribe(received::add);
        assertEquals(1, publisher.getSubscriberCount());

        publisher.publish(event(RelayEventType.CIRCUIT_OPENED));
        publisher.onEvent(event(RelayEventType.CIRCUIT_CLOSED));

        assertEquals(2, received.size());
        assertEquals(RelayEventType.CIRCUIT_OPENED, received.get(0).getType());

        subscription.dispose();
        assertEquals(0, publisher.getSubscriberCount());
    }

    @Test
    void testEventStream() {
        StepVerifier.create(publisher.getEventStream().take(2))
            .then(() -> {
                publisher.publish(event(RelayEventType.STAGE_RESTARTED));
                publisher.publish(event(RelayEventType.ROLE_CHANGED));
            })
            .assertNext(e -> assertEquals(RelayEventType.STAGE_RESTARTED, e.getType()))
            .assertNext(e -> assertEquals(RelayEventType.ROLE_CHANGED, e.getType()))
            .verifyComplete();
    }

    @Test
    void testCloseCompletesStream() {
        StepVerifier.create(publisher.getEventStream())
            .then(publisher::close)
            .expectComplete()
            .verify(Duration.ofSeconds(1));
    }
}
