package com.iot.relay.cluster;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class LoggingPeerChannelTest {

    private final LoggingPeerChannel channel = new LoggingPeerChannel("node1");

    @Test
    void testLogsWithoutSending() {
        assertDoesNotThrow(() -> channel.replicate("node2", "{}"));
        assertDoesNotThrow(() -> channel.forwardToLeader("node1", "{}"));
    }

    @Test
    void testMissingPeerIsCoordinationFailure() {
        CoordinationException e = assertThrows(CoordinationException.class, () -> channel.forwardToLeader(" ", "{}"));

        assertEquals(" ", e.getPeerId());
        assertThrows(CoordinationException.class, () -> channel.replicate(null, "{}"));
    }

    @Test
    void testElectionPolicySkipsSeed() {
        FixedOrderElectionPolicy policy = new FixedOrderElectionPolicy();

        assertEquals("node2", policy.elect("node2", "node1", List.of("node1", "node2", "node3")).orElse(null));
        assertTrue(policy.elect("node1", "node1", List.of("node1", "node2")).isEmpty());
        assertTrue(policy.elect("node9", "node1", List.of("node1", "node2")).isEmpty());
    }
}
