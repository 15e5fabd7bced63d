package in.ordergate.infrastructure.venue;

/**
 * Successful outcome of {@link VenueConnector#connect(java.time.Duration)}.
 */
public enum ConnectResult {
    CONNECTED,           // This call (or a concurrent one it joined) completed the handshake
    ALREADY_CONNECTED    // No-op, the link was already up
}
