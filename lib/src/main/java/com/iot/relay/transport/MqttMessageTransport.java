package com.iot.relay.transport;

import org.eclipse.paho.client.mqttv3.IMqttDeliveryToken;
import org.eclipse.paho.client.mqttv3.MqttCallbackExtended;
import org.eclipse.paho.client.mqttv3.MqttClient;
import org.eclipse.paho.client.mqttv3.MqttConnectOptions;
import org.eclipse.paho.client.mqttv3.MqttException;
import org.eclipse.paho.client.mqttv3.MqttMessage;
import org.eclipse.paho.client.mqttv3.persist.MemoryPersistence;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Optional;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;

/**
 * MQTT transport backed by the Eclipse Paho synchronous client.
 *
 * <p>Arriving messages are queued by Paho's callback thread and consumed by the relay
 * loop through {@link #receive(Duration)}, preserving broker delivery order. The session
 * is persistent ({@code cleanSession=false}) so subscriptions survive automatic reconnects.
 */
public class MqttMessageTransport implements MessageTransport {
    
    private static final Logger logger = LoggerFactory.getLogger(MqttMessageTransport.class);
    
    private final String brokerUri;
    private final String clientId;
    private final Duration connectionTimeout;
    private final BlockingQueue<InboundMessage> inbound;
    private volatile ConnectionListener connectionListener = ConnectionListener.noop();
    private MqttClient client;
    
    public MqttMessageTransport(String brokerUri, String clientId, Duration connectionTimeout) {
        this.brokerUri = brokerUri;
        this.clientId = clientId;
        this.connectionTimeout = connectionTimeout;
        this.inbound = new LinkedBlockingQueue<>();
    }
    
    @Override
    public synchronized void connect() {
        try {
            if (client == null) {
                client = new MqttClient(brokerUri, clientId, new MemoryPersistence());
                client.setCallback(new RelayCallback());
            }
            if (client.isConnected()) {
                return;
            }
            MqttConnectOptions options = new MqttConnectOptions();
            options.setAutomaticReconnect(true);
            options.setCleanSession(false);
            options.setConnectionTimeout((int) Math.max(1, connectionTimeout.getSeconds()));
            client.connect(options);
            logger.info("Connected to MQTT broker {} as {}", brokerUri, clientId);
        } catch (MqttException e) {
            throw new TransportException("Failed to connect to MQTT broker " + brokerUri, e);
        }
    }
    
    @Override
    public void subscribe(String topic, int qos) {
        try {
            requireClient().subscribe(topic, qos);
            logger.info("Subscribed to topic: {}", topic);
        } catch (MqttException e) {
            throw new TransportException("Failed to subscribe to " + topic, e);
        }
    }
    
    @Override
    public Optional<InboundMessage> receive(Duration timeout) {
        try {
            return Optional.ofNullable(inbound.poll(timeout.toMillis(), TimeUnit.MILLISECONDS));
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return Optional.empty();
        }
    }
    
    @Override
    public void publish(String topic, String payload, int qos) {
        try {
            requireClient().publish(topic, payload.getBytes(StandardCharsets.UTF_8), qos, false);
        } catch (MqttException e) {
            throw new TransportException("Failed to publish to " + topic, e);
        }
    }
    
    @Override
    public boolean isConnected() {
        MqttClient current = client;
        return current != null && current.isConnected();
    }
    
    @Override
    public void setConnectionListener(ConnectionListener listener) {
        this.connectionListener = listener;
    }
    
    @Override
    public synchronized void close() {
        if (client == null) {
            return;
        }
        try {
            if (client.isConnected()) {
                client.disconnect();
            }
            client.close();
            logger.info("MQTT client {} closed", clientId);
        } catch (MqttException e) {
            logger.warn("Error closing MQTT client {}", clientId, e);
        } finally {
            client = null;
        }
    }
    
    private synchronized MqttClient requireClient() {
        if (client == null) {
            throw new TransportException("MQTT transport is not connected");
        }
        return client;
    }
    
    private class RelayCallback implements MqttCallbackExtended {
        
        @Override
        public void connectComplete(boolean reconnect, String serverURI) {
            if (reconnect) {
                logger.info("Reconnected to MQTT broker {}", serverURI);
            }
            connectionListener.onConnected(reconnect);
        }
        
        @Override
        public void connectionLost(Throwable cause) {
            logger.warn("Connection to MQTT broker {} lost: {}", brokerUri,
                cause != null ? cause.getMessage() : "unknown cause");
            connectionListener.onConnectionLost(cause);
        }
        
        @Override
        public void messageArrived(String topic, MqttMessage message) {
            String payload = new String(message.getPayload(), StandardCharsets.UTF_8);
            logger.debug("Message received on topic '{}': {}", topic, payload);
            inbound.add(new InboundMessage(topic, payload));
        }
        
        @Override
        public void deliveryComplete(IMqttDeliveryToken token) {
            // publish() blocks until completion
        }
    }
}
