package in.ordergate.infrastructure.venue;

/**
 * Connection lifecycle of one venue link.
 *
 * Flow: DISCONNECTED → CONNECTING → CONNECTED → DISCONNECTING → DISCONNECTED.
 * A failed handshake goes straight from CONNECTING back to DISCONNECTED.
 */
public enum ConnectorState {
    DISCONNECTED,
    CONNECTING,
    CONNECTED,
    DISCONNECTING
}
