package com.iot.relay.relay;

import com.iot.relay.MutableClock;
import com.iot.relay.RelayException;
import com.iot.relay.config.RelayConfiguration;
import com.iot.relay.config.RelayStrategy;
import com.iot.relay.config.ResilienceConfig;
import com.iot.relay.model.RelayEvent;
import com.iot.relay.model.RelayEventType;
import com.iot.relay.observability.RelayEventPublisher;
import com.iot.relay.observability.RelayMetrics;
import com.iot.relay.resilience.ResilienceManager;
import com.iot.relay.transport.InMemoryMessageTransport;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class RelayNodeTest {

    @Mock
    private RelayHandler handler;

    private MutableClock clock;
    private InMemoryMessageTransport transport;
    private RelayMetrics metrics;
    private RelayNode node;

    @BeforeEach
    void setUp() {
        clock = MutableClock.startingAt("2024-01-01T00:00:00Z");
        transport = new InMemoryMessageTransport();
        metrics = new RelayMetrics("node1");
        RelayConfiguration config = RelayConfiguration.builder()
            .receiveTimeout(Duration.ofMillis(5))
            .pollInterval(Duration.ofMillis(10))
            .resilienceConfig(ResilienceConfig.failFastConfig())
            .build();
        node = new RelayNode(config, transport, handler, metrics, new RelayEventPublisher(),
            new ResilienceManager(config.getResilienceConfig()), clock);
        lenient().when(handler.strategy()).thenReturn(RelayStrategy.BREAKER);
    }

    @AfterEach
    void tearDown() {
        node.close();
    }

    @Test
    void testCycleHandlesMessageThenTicks() {
        transport.connect();
        transport.subscribe("iot/input", 1);
        transport.publish("iot/input", "{\"device_id\":\"d\"}", 1);

        assertTrue(node.runCycle());

        verify(handler).handle("{\"device_id\":\"d\"}");
        verify(handler).onTick(clock.instant());
        assertEquals(1.0, metrics.getMeterRegistry().counter("relay.messages.received", "node", "node1").count());
    }

    @Test
    void testIdleCycleStillTicks() {
        assertFalse(node.runCycle());

        verify(handler, never()).handle(anyString());
        verify(handler).onTick(any(Instant.class));
    }

    @Test
    void testHandlerErrorsDoNotEscapeTheLoop() {
        transport.connect();
        transport.subscribe("iot/input", 1);
        transport.publish("iot/input", "first", 1);
        transport.publish("iot/input", "second", 1);
        doThrow(new RelayException("boom")).doThrow(new IllegalStateException("bug")).when(handler).handle(anyString());

        assertDoesNotThrow(() -> node.runCycle());
        assertDoesNotThrow(() -> node.runCycle());

        verify(handler, times(2)).onTick(any(Instant.class));
        assertEquals(2.0, metrics.getMeterRegistry().counter("relay.loop.errors", "node", "node1").count());
    }

    @Test
    void testTickErrorsDoNotEscapeTheLoop() {
        doThrow(new IllegalStateException("sweep failed")).when(handler).onTick(any(Instant.class));

        assertDoesNotThrow(() -> node.runCycle());
        assertEquals(1.0, metrics.getMeterRegistry().counter("relay.loop.errors", "node", "node1").count());
    }

    @Test
    void testStartConnectsSubscribesAndPolls() {
        node.start();
        assertTrue(node.isRunning());
        assertTrue(transport.isConnected());

        transport.publish("iot/input", "payload", 1);
        verify(handler, timeout(2000)).handle("payload");
        node.stop();
        assertFalse(node.isRunning());
    }

    @Test
    void testConnectionEventsPublished() {
        List<RelayEvent> events = new CopyOnWriteArrayList<>();
        node.getEventPublisher().subscribe(events::add);

        transport.connect();
        transport.dropConnection(new IllegalStateException("broker restart"));

        assertEquals(1, events.size());
        assertEquals(RelayEventType.CONNECTION_LOST, events.get(0).getType());
        assertEquals("broker restart", events.get(0).getDetail());
    }
}
