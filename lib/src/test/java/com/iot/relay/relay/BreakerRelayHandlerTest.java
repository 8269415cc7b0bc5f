package com.iot.relay.relay;

import com.iot.relay.MutableClock;
import com.iot.relay.breaker.AdmissionController;
import com.iot.relay.config.CircuitBreakerConfig;
import com.iot.relay.config.OverflowPolicy;
import com.iot.relay.config.RetryBufferConfig;
import com.iot.relay.model.CircuitState;
import com.iot.relay.model.RelayEvent;
import com.iot.relay.model.RelayEventType;
import com.iot.relay.observability.RelayMetrics;
import com.iot.relay.pipeline.FaultInjector;
import com.iot.relay.retry.RetryBuffer;
import com.iot.relay.transport.EgressPublisher;
import com.iot.relay.transport.InMemoryMessageTransport;
import io.micrometer.core.instrument.MeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class BreakerRelayHandlerTest {

    private static final String EGRESS = "iot/data";

    private MutableClock clock;
    private FaultInjector.Toggle downstreamFault;
    private InMemoryMessageTransport transport;
    private RelayMetrics metrics;
    private List<RelayEvent> events;
    private AdmissionController admission;
    private BreakerRelayHandler handler;

    @BeforeEach
    void setUp() {
        clock = MutableClock.startingAt("2024-01-01T00:00:00Z");
        downstreamFault = FaultInjector.toggle();
        transport = new InMemoryMessageTransport();
        transport.connect();
        metrics = new RelayMetrics("node1");
        events = new ArrayList<>();
        admission = new AdmissionController(CircuitBreakerConfig.defaultConfig(), clock,
            (from, to) -> metrics.recordCircuitState(to == CircuitState.OPEN));
        handler = handler(RetryBufferConfig.defaultConfig());
    }

    private BreakerRelayHandler handler(RetryBufferConfig bufferConfig) {
        return new BreakerRelayHandler("node1", admission, new RetryBuffer(bufferConfig, clock.instant()),
            new EgressPublisher(transport, EGRESS, 1, metrics, downstreamFault), metrics, events::add, clock);
    }

    private static String reading(int n) {
        return "{\"device_id\":\"device_" + n + "\",\"temperature\":21.0}";
    }

    @Test
    void testHealthyDownstreamDeliversDirectly() {
        handler.handle(reading(1));
        handler.handle(reading(2));

        assertEquals(List.of(reading(1), reading(2)), transport.publishedTo(EGRESS));
        assertTrue(handler.getRetryBuffer().isEmpty());
        assertEquals(2, admission.getSuccessCount());
    }

    @Test
    void testFailedDeliveriesAreBufferedAndOpenCircuit() {
        downstreamFault.engage();

        for (int i = 1; i <= 5; i++) {
            handler.handle(reading(i));
        }

        assertEquals(CircuitState.OPEN, admission.getState());
        assertEquals(5, handler.getRetryBuffer().size());
        assertTrue(transport.publishedTo(EGRESS).isEmpty());
        MeterRegistry registry = metrics.getMeterRegistry();
        assertEquals(2.0, registry.counter("relay.breaker.rejected", "node", "node1").count());
        assertEquals(3.0, registry.counter("relay.delivery.failures", "node", "node1").count());
    }

    @Test
    void testRecoveryAfterResetTimeoutDrainsInOrder() {
        downstreamFault.engage();
        for (int i = 1; i <= 5; i++) {
            handler.handle(reading(i));
        }

        downstreamFault.clear();
        clock.advance(Duration.ofSeconds(11));
        handler.onTick(clock.instant());

        assertEquals(CircuitState.CLOSED, admission.getState());
        assertEquals(0, admission.getFailureCount());
        assertTrue(handler.getRetryBuffer().isEmpty());
        assertEquals(List.of(reading(1), reading(2), reading(3), reading(4), reading(5)),
            transport.publishedTo(EGRESS));

        for (int i = 6; i <= 8; i++) {
            handler.handle(reading(i));
        }
        assertEquals(8, transport.publishedTo(EGRESS).size());
        assertEquals(0.0, metrics.getMeterRegistry().get("relay.retry.depth").gauge().value());
    }

    @Test
    void testRetryWaitsForOpenCircuit() {
        downstreamFault.engage();
        for (int i = 1; i <= 3; i++) {
            handler.handle(reading(i));
        }
        downstreamFault.clear();

        clock.advance(Duration.ofSeconds(6));
        handler.onTick(clock.instant());

        assertEquals(3, handler.getRetryBuffer().size());
        assertEquals(CircuitState.OPEN, admission.getState());
        assertTrue(transport.publishedTo(EGRESS).isEmpty());
    }

    @Test
    void testRetryHaltsAtFirstFailureAndKeepsOrder() {
        downstreamFault.engage();
        handler.handle(reading(1));
        handler.handle(reading(2));

        clock.advance(Duration.ofSeconds(5));
        handler.onTick(clock.instant());

        assertEquals(List.of(reading(1), reading(2)), handler.getRetryBuffer().snapshot());
    }

    @Test
    void testTransportFailureTreatedAsDeliveryFailure() {
        transport.dropConnection(new IllegalStateException("broker restart"));

        handler.handle(reading(1));

        assertEquals(1, admission.getFailureCount());
        assertEquals(List.of(reading(1)), handler.getRetryBuffer().snapshot());
    }

    @Test
    void testOverflowPublishesEvent() {
        BreakerRelayHandler bounded = handler(RetryBufferConfig.builder()
            .maxDepth(1)
            .overflowPolicy(OverflowPolicy.DROP_OLDEST)
            .build());
        downstreamFault.engage();

        bounded.handle(reading(1));
        bounded.handle(reading(2));

        assertEquals(List.of(reading(2)), bounded.getRetryBuffer().snapshot());
        assertEquals(1, events.size());
        assertEquals(RelayEventType.RETRY_BUFFER_OVERFLOW, events.get(0).getType());
        assertEquals(1.0, metrics.getMeterRegistry().counter("relay.retry.dropped", "node", "node1").count());
    }

    @Test
    void testNoDrainBeforeRetryInterval() {
        downstreamFault.engage();
        handler.handle(reading(1));
        downstreamFault.clear();

        clock.advance(Duration.ofSeconds(4));
        handler.onTick(clock.instant());

        assertEquals(1, handler.getRetryBuffer().size());
    }
}
