package com.iot.relay.example;

import com.fasterxml.jackson.databind.JsonNode;
import com.iot.relay.MutableClock;
import com.iot.relay.example.SensorSimulatorExample.FailureMode;
import com.iot.relay.transport.InMemoryMessageTransport;
import com.iot.relay.util.Jsons;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.Map;
import java.util.Random;

import static org.junit.jupiter.api.Assertions.*;

class SensorSimulatorExampleTest {

    private final MutableClock clock = MutableClock.startingAt("2024-01-01T00:00:00Z");

    @Test
    void testReadingShape() {
        SensorSimulatorExample simulator = new SensorSimulatorExample(FailureMode.NONE, 0.3, new Random(7), clock);

        Map<String, Object> reading = simulator.generateReading();

        assertTrue(reading.get("device_id").toString().startsWith("device_"));
        double temperature = (Double) reading.get("temperature");
        assertTrue(temperature >= 20.0 && temperature <= 30.0);
        double humidity = (Double) reading.get("humidity");
        assertTrue(humidity >= 40.0 && humidity <= 80.0);
        assertTrue(SensorSimulatorExample.STATUSES.contains(reading.get("status").toString()));
        assertNotNull(reading.get("timestamp"));
    }

    @Test
    void testIntermittentModeForcesErrors() throws Exception {
        SensorSimulatorExample simulator = new SensorSimulatorExample(FailureMode.INTERMITTENT, 1.0, new Random(7), clock);

        JsonNode node = Jsons.mapper().readTree(simulator.nextPayload());

        assertEquals(SensorSimulatorExample.FORCED_ERROR, node.get("status").asText());
    }

    @Test
    void testNoneModeNeverForcesErrors() throws Exception {
        SensorSimulatorExample simulator = new SensorSimulatorExample(FailureMode.NONE, 1.0, new Random(7), clock);

        for (int i = 0; i < 20; i++) {
            JsonNode node = Jsons.mapper().readTree(simulator.nextPayload());
            assertNotEquals(SensorSimulatorExample.FORCED_ERROR, node.get("status").asText());
        }
    }

    @Test
    void testOverloadPacing() {
        assertEquals(Duration.ofMillis(1), new SensorSimulatorExample(FailureMode.OVERLOAD).publishDelay());
        assertEquals(Duration.ofSeconds(1), new SensorSimulatorExample(FailureMode.NONE).publishDelay());
    }

    @Test
    void testRunPublishesReadings() {
        InMemoryMessageTransport transport = new InMemoryMessageTransport();
        transport.connect();
        SensorSimulatorExample simulator = new SensorSimulatorExample(FailureMode.OVERLOAD, 0.3, new Random(7), clock);

        int published = simulator.run(transport, "iot/input", 5);

        assertEquals(5, published);
        assertEquals(5, transport.publishedTo("iot/input").size());
    }
}
