package com.iot.relay.example;

import com.iot.relay.config.RelayConfiguration;
import com.iot.relay.transport.MessageTransport;
import com.iot.relay.transport.MqttMessageTransport;
import com.iot.relay.transport.TransportException;
import com.iot.relay.util.Jsons;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Clock;
import java.time.Duration;
import java.time.LocalDateTime;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Random;

/**
 * Publishes simulated IoT sensor readings to a relay's ingress topic.
 * 
 * Failure modes:
 * - NONE: one well-formed reading per second
 * - INTERMITTENT: a share of readings carry {@code status=forced_error}
 * - OVERLOAD: readings every millisecond to saturate the relay
 * 
 * Usage: {@code SensorSimulatorExample [brokerUri] [mode] [count]}
 */
public class SensorSimulatorExample {
    
    private static final Logger logger = LoggerFactory.getLogger(SensorSimulatorExample.class);
    
    static final List<String> STATUSES = List.of("normal", "warning", "error");
    static final String FORCED_ERROR = "forced_error";
    
    public enum FailureMode {
        NONE,
        INTERMITTENT,
        OVERLOAD
    }
    
    private final Random random;
    private final Clock clock;
    private final FailureMode mode;
    private final double intermittentRate;
    
    public SensorSimulatorExample(FailureMode mode) {
        this(mode, 0.3, new Random(), Clock.systemDefaultZone());
    }
    
    public SensorSimulatorExample(FailureMode mode, double intermittentRate, Random random, Clock clock) {
        if (intermittentRate < 0.0 || intermittentRate > 1.0) {
            throw new IllegalArgumentException("Intermittent rate must be between 0 and 1");
        }
        this.mode = mode;
        this.intermittentRate = intermittentRate;
        this.random = random;
        this.clock = clock;
    }
    
    public static void main(String[] args) {
        String brokerUri = args.length > 0 ? args[0] : RelayConfiguration.DEFAULT_BROKER_URI;
        FailureMode mode = args.length > 1 ? FailureMode.valueOf(args[1].toUpperCase()) : FailureMode.NONE;
        int count = args.length > 2 ? Integer.parseInt(args[2]) : Integer.MAX_VALUE;
        
        SensorSimulatorExample simulator = new SensorSimulatorExample(mode);
        try (MessageTransport transport = new MqttMessageTransport(brokerUri, "sensor-simulator",
                Duration.ofSeconds(10))) {
            transport.connect();
            simulator.run(transport, RelayConfiguration.DEFAULT_INGRESS_TOPIC, count);
        } catch (TransportException e) {
            logger.error("Sensor simulator failed against {}: {}", brokerUri, e.getMessage());
        }
    }
    
    /**
     * Publishes {@code count} readings, pacing them per the failure mode.
     * 
     * @return number of readings published
     */
    public int run(MessageTransport transport, String topic, int count) {
        logger.info("Publishing sensor readings to {} in {} mode", topic, mode);
        int published = 0;
        for (int i = 0; i < count && !Thread.currentThread().isInterrupted(); i++) {
            String payload = nextPayload();
            try {
                transport.publish(topic, payload, 1);
                published++;
                logger.debug("Published: {}", payload);
            } catch (TransportException e) {
                logger.warn("Publishing error: {}", e.getMessage());
            }
            pause(publishDelay());
        }
        logger.info("Published {} of {} readings", published, count);
        return published;
    }
    
    public Map<String, Object> generateReading() {
        Map<String, Object> reading = new LinkedHashMap<>();
        reading.put("device_id", "device_" + (random.nextInt(100) + 1));
        reading.put("timestamp", LocalDateTime.now(clock).toString());
        reading.put("temperature", round(20.0 + random.nextDouble() * 10.0));
        reading.put("humidity", round(40.0 + random.nextDouble() * 40.0));
        reading.put("status", STATUSES.get(random.nextInt(STATUSES.size())));
        return reading;
    }
    
    /**
     * @return the next reading as JSON, with the failure mode applied
     */
    public String nextPayload() {
        Map<String, Object> reading = generateReading();
        if (mode == FailureMode.INTERMITTENT && random.nextDouble() < intermittentRate) {
            reading.put("status", FORCED_ERROR);
        }
        return Jsons.toJson(reading);
    }
    
    public Duration publishDelay() {
        return mode == FailureMode.OVERLOAD ? Duration.ofMillis(1) : Duration.ofSeconds(1);
    }
    
    private static double round(double value) {
        return BigDecimal.valueOf(value).setScale(2, RoundingMode.HALF_UP).doubleValue();
    }
    
    private static void pause(Duration delay) {
        try {
            Thread.sleep(delay.toMillis());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }
}
