package in.ordergate.infrastructure.venue;

import in.ordergate.infrastructure.venue.codec.VenueCodec;

import java.util.Optional;
import java.util.Set;

/**
 * Mechanics of one wire protocol to a venue.
 *
 * Responsibilities:
 * - Perform the protocol handshake and tear the link down
 * - Deliver serialized commands
 * - Hand back raw market-data and order-status messages
 *
 * Threading:
 * - Every method is invoked from the owning VenueConnector's single
 *   worker thread, so implementations need no locking of their own
 * - send and poll calls are non-blocking or bounded by the adapter's
 *   configured timeout
 *
 * Retry policy lives in the connector; adapters make exactly one attempt.
 */
public interface ProtocolAdapter {

    // ═══════════════════════════════════════════════════════════════════════
    // LIFECYCLE
    // ═══════════════════════════════════════════════════════════════════════

    /**
     * Establish the transport and perform the protocol handshake.
     *
     * @param credentials venue credentials
     * @throws VenueConnectException if credentials are refused or the transport cannot be established
     */
    void connect(VenueCredentials credentials) throws VenueConnectException;

    /**
     * Close the link. Safe to call on an adapter that never connected.
     *
     * @throws VenueDisconnectException if the link could not be closed cleanly
     */
    void disconnect() throws VenueDisconnectException;

    // ═══════════════════════════════════════════════════════════════════════
    // TRAFFIC
    // ═══════════════════════════════════════════════════════════════════════

    /**
     * Deliver one serialized command produced by {@link #codec()}.
     *
     * @throws OrderSendException if the venue did not accept the message
     */
    void sendOrder(String serializedOrder) throws OrderSendException;

    /**
     * Request market data for the given symbols.
     *
     * @throws VenueIoException if the link is lost
     */
    void subscribe(Set<String> symbols) throws VenueIoException;

    /**
     * Next raw market-data message, if one is available.
     *
     * @throws VenueIoException if the link is lost
     */
    Optional<String> pollMarketData() throws VenueIoException;

    /**
     * Next raw order-status message, if one is available.
     *
     * @throws VenueIoException if the link is lost
     */
    Optional<String> pollOrderStatus() throws VenueIoException;

    // ═══════════════════════════════════════════════════════════════════════
    // METADATA
    // ═══════════════════════════════════════════════════════════════════════

    /**
     * Codec translating commands and status messages for this protocol.
     */
    VenueCodec codec();

    ProtocolType protocol();

    /**
     * Venue name used in logs, metrics and exception messages.
     */
    String venue();
}
