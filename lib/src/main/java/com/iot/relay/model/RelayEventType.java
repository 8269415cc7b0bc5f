package com.iot.relay.model;

/**
 * Kinds of state changes a relay node announces.
 */
public enum RelayEventType {
    CIRCUIT_OPENED,
    CIRCUIT_CLOSED,
    RETRY_BUFFER_OVERFLOW,
    STAGE_RESTARTED,
    ROLE_CHANGED,
    LEADER_FAILURE_SUSPECTED,
    CONNECTION_LOST,
    CONNECTION_RESTORED
}
