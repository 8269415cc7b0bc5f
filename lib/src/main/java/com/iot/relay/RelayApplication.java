package com.iot.relay;

import com.iot.relay.config.RelayConfiguration;
import com.iot.relay.config.RelayConfigurationLoader;
import com.iot.relay.relay.RelayNode;
import com.iot.relay.transport.TransportException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Properties;

/**
 * Command-line entry point. Starts one relay node and runs until the JVM shuts down.
 * 
 * Usage: {@code RelayApplication [brokerUri]}. Everything else comes from
 * {@code relay.properties} and {@code -Drelay.*} system properties.
 */
public class RelayApplication {
    
    private static final Logger logger = LoggerFactory.getLogger(RelayApplication.class);
    
    public static void main(String[] args) {
        RelayConfiguration configuration = loadConfiguration(args);
        logger.info("Starting relay with {}", configuration);
        
        RelayNode node = RelayNodeBuilder.create(configuration);
        Runtime.getRuntime().addShutdownHook(new Thread(node::close, "relay-shutdown"));
        
        try {
            node.start();
        } catch (TransportException e) {
            logger.error("Could not connect to broker {}: {}", configuration.getBrokerUri(), e.getMessage());
            node.close();
            System.exit(1);
        }
    }
    
    static RelayConfiguration loadConfiguration(String[] args) {
        Properties overrides = new Properties();
        overrides.putAll(System.getProperties());
        if (args.length > 0 && !args[0].trim().isEmpty()) {
            overrides.setProperty("relay.broker.uri", args[0].trim());
        }
        return RelayConfigurationLoader.load(RelayConfigurationLoader.DEFAULT_RESOURCE, overrides);
    }
}
