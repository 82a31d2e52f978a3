package io.pglisten;

/**
 * Lifecycle of the single connection held by the connector.
 */
public enum ConnectionState {
    DISCONNECTED,
    CONNECTING,
    LISTENING
}
