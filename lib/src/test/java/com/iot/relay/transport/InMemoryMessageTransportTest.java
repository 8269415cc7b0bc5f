package com.iot.relay.transport;

import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

class InMemoryMessageTransportTest {

    @Test
    void testSubscribedTopicIsDeliveredInOrder() {
        InMemoryMessageTransport transport = new InMemoryMessageTransport();
        transport.connect();
        transport.subscribe("iot/input", 1);

        transport.publish("iot/input", "first", 1);
        transport.publish("iot/input", "second", 1);
        transport.publish("iot/data", "elsewhere", 1);

        assertEquals(2, transport.pendingInbound());
        assertEquals("first", transport.receive(Duration.ofMillis(10)).map(InboundMessage::getPayload).orElse(null));
        assertEquals("second", transport.receive(Duration.ofMillis(10)).map(InboundMessage::getPayload).orElse(null));
        assertEquals(List.of("elsewhere"), transport.publishedTo("iot/data"));
    }

    @Test
    void testReceiveTimesOutEmpty() {
        InMemoryMessageTransport transport = new InMemoryMessageTransport();

        Optional<InboundMessage> message = transport.receive(Duration.ofMillis(5));

        assertTrue(message.isEmpty());
    }

    @Test
    void testOperationsNeedConnection() {
        InMemoryMessageTransport transport = new InMemoryMessageTransport();

        assertThrows(TransportException.class, () -> transport.subscribe("iot/input", 1));
        assertThrows(TransportException.class, () -> transport.publish("iot/input", "x", 1));
    }

    @Test
    void testConnectionListenerNotified() {
        InMemoryMessageTransport transport = new InMemoryMessageTransport();
        List<String> notifications = new ArrayList<>();
        transport.setConnectionListener(new ConnectionListener() {
            @Override
            public void onConnected(boolean reconnect) {
                notifications.add("connected:" + reconnect);
            }

            @Override
            public void onConnectionLost(Throwable cause) {
                notifications.add("lost:" + cause.getMessage());
            }
        });

        transport.connect();
        transport.dropConnection(new IllegalStateException("broker restart"));

        assertEquals(List.of("connected:false", "lost:broker restart"), notifications);
        assertFalse(transport.isConnected());
    }
}
