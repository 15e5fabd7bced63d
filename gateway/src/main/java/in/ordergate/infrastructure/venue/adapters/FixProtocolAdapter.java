package in.ordergate.infrastructure.venue.adapters;

import in.ordergate.infrastructure.venue.OrderSendException;
import in.ordergate.infrastructure.venue.ProtocolAdapter;
import in.ordergate.infrastructure.venue.ProtocolType;
import in.ordergate.infrastructure.venue.VenueConnectException;
import in.ordergate.infrastructure.venue.VenueCredentials;
import in.ordergate.infrastructure.venue.VenueDisconnectException;
import in.ordergate.infrastructure.venue.VenueIoException;
import in.ordergate.infrastructure.venue.codec.FixCodec;
import in.ordergate.infrastructure.venue.codec.MalformedMessageException;
import in.ordergate.infrastructure.venue.codec.VenueCodec;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import quickfix.Application;
import quickfix.ConfigError;
import quickfix.DefaultMessageFactory;
import quickfix.FieldNotFound;
import quickfix.FixVersions;
import quickfix.MemoryStoreFactory;
import quickfix.Message;
import quickfix.SLF4JLogFactory;
import quickfix.Session;
import quickfix.SessionID;
import quickfix.SessionNotFound;
import quickfix.SessionSettings;
import quickfix.SocketInitiator;
import quickfix.field.MsgType;
import quickfix.field.Password;
import quickfix.field.Text;
import quickfix.field.Username;

import java.time.Duration;
import java.util.Optional;
import java.util.Queue;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * FIX 4.4 session driven by a QuickFIX/J {@link SocketInitiator}.
 *
 * Handshake: the engine sends Logon with Username/Password and the
 * connect call waits for the venue's Logon within the connect timeout.
 * A Logout before that refuses the logon; once logged on, a Logout or a
 * dropped socket ends the session and the next poll reports link loss.
 *
 * Heartbeats, test requests and sequence numbers are handled by the
 * engine. Inbound application messages are routed by MsgType:
 * ExecutionReport and OrderCancelReject to the status queue,
 * MarketData snapshot/incremental to the market-data queue.
 *
 * Each connect builds a fresh initiator and session, so callbacks from a
 * previous session never reach the current queues. The engine's own
 * reconnect is pushed out of the way; retries belong to the connector.
 */
public final class FixProtocolAdapter implements ProtocolAdapter {
    private static final Logger log = LoggerFactory.getLogger(FixProtocolAdapter.class);

    private static final long ENGINE_RECONNECT_INTERVAL_SECONDS = 3600;

    private final String venue;
    private final String host;
    private final int port;
    private final FixCodec codec;
    private final SessionID sessionId;
    private final int heartbeatIntervalSeconds;
    private final Duration connectTimeout;

    private volatile SocketInitiator initiator;
    private volatile FixSession session;

    public FixProtocolAdapter(String venue, String host, int port, FixCodec codec,
                              int heartbeatIntervalSeconds, Duration connectTimeout) {
        this.venue = venue;
        this.host = host;
        this.port = port;
        this.codec = codec;
        this.sessionId = new SessionID(FixVersions.BEGINSTRING_FIX44, codec.getSenderCompId(), codec.getTargetCompId());
        this.heartbeatIntervalSeconds = heartbeatIntervalSeconds;
        this.connectTimeout = connectTimeout;
    }

    // ═══════════════════════════════════════════════════════════════════════
    // LIFECYCLE
    // ═══════════════════════════════════════════════════════════════════════

    @Override
    public void connect(VenueCredentials credentials) throws VenueConnectException {
        log.info("[FIX ADAPTER] Connecting to {}:{} as {} (venue={})", host, port, sessionId, venue);

        FixSession attempt = new FixSession(credentials);
        SocketInitiator started;
        try {
            SessionSettings settings = sessionSettings();
            started = new SocketInitiator(attempt, new MemoryStoreFactory(), settings,
                new SLF4JLogFactory(settings), new DefaultMessageFactory());
            started.start();
        } catch (ConfigError e) {
            throw new VenueConnectException(venue, "FIX session configuration rejected: " + e.getMessage(), e);
        }

        try {
            attempt.logon.get(connectTimeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (ExecutionException e) {
            stopQuietly(started);
            if (e.getCause() instanceof VenueConnectException refused) {
                throw refused;
            }
            throw new VenueConnectException(venue, "Logon failed: " + e.getCause().getMessage(), e.getCause());
        } catch (TimeoutException e) {
            stopQuietly(started);
            throw new VenueConnectException(venue, "No logon response within " + connectTimeout.toMillis() + "ms");
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            stopQuietly(started);
            throw new VenueConnectException(venue, "Interrupted while waiting for logon");
        }

        initiator = started;
        session = attempt;
        log.info("[FIX ADAPTER] ✅ Logged on to {} as {}", venue, credentials);
    }

    @Override
    public void disconnect() throws VenueDisconnectException {
        SocketInitiator stopping = initiator;
        if (stopping == null) {
            return;
        }
        initiator = null;
        session = null;
        try {
            stopping.stop();
        } catch (RuntimeException e) {
            throw new VenueDisconnectException(venue, "FIX initiator did not stop cleanly", e);
        }
        log.info("[FIX ADAPTER] Disconnected from {}", venue);
    }

    // ═══════════════════════════════════════════════════════════════════════
    // TRAFFIC
    // ═══════════════════════════════════════════════════════════════════════

    @Override
    public void sendOrder(String serializedOrder) throws OrderSendException {
        FixSession current = session;
        if (current == null || current.lostReason != null) {
            throw new OrderSendException(venue, "FIX session is not logged on");
        }
        Message message;
        try {
            message = FixCodec.parse(serializedOrder);
        } catch (MalformedMessageException e) {
            throw new OrderSendException(venue, e.getMessage(), e);
        }
        try {
            if (!Session.sendToTarget(message, sessionId)) {
                throw new OrderSendException(venue, "FIX session did not accept the message");
            }
        } catch (SessionNotFound e) {
            throw new OrderSendException(venue, "No FIX session " + sessionId, e);
        }
    }

    @Override
    public void subscribe(Set<String> symbols) throws VenueIoException {
        if (symbols.isEmpty()) {
            return;
        }
        FixSession current = requireSession();
        current.checkLink();
        try {
            if (!Session.sendToTarget(codec.marketDataRequest(symbols), sessionId)) {
                throw new VenueIoException(venue, "MarketDataRequest not sent, session is down");
            }
        } catch (SessionNotFound e) {
            throw new VenueIoException(venue, "No FIX session " + sessionId, e);
        }
    }

    @Override
    public Optional<String> pollMarketData() throws VenueIoException {
        FixSession current = requireSession();
        String next = current.marketDataMessages.poll();
        if (next == null) {
            current.checkLink();
        }
        return Optional.ofNullable(next);
    }

    @Override
    public Optional<String> pollOrderStatus() throws VenueIoException {
        FixSession current = requireSession();
        String next = current.statusMessages.poll();
        if (next == null) {
            current.checkLink();
        }
        return Optional.ofNullable(next);
    }

    @Override
    public VenueCodec codec() {
        return codec;
    }

    @Override
    public ProtocolType protocol() {
        return ProtocolType.FIX;
    }

    @Override
    public String venue() {
        return venue;
    }

    // ═══════════════════════════════════════════════════════════════════════
    // INTERNALS
    // ═══════════════════════════════════════════════════════════════════════

    private SessionSettings sessionSettings() {
        SessionSettings settings = new SessionSettings();
        settings.setString(sessionId, "BeginString", sessionId.getBeginString());
        settings.setString(sessionId, "SenderCompID", sessionId.getSenderCompID());
        settings.setString(sessionId, "TargetCompID", sessionId.getTargetCompID());
        settings.setString(sessionId, "ConnectionType", "initiator");
        settings.setString(sessionId, "SocketConnectHost", host);
        settings.setLong(sessionId, "SocketConnectPort", port);
        settings.setLong(sessionId, "HeartBtInt", heartbeatIntervalSeconds);
        settings.setLong(sessionId, "ReconnectInterval", ENGINE_RECONNECT_INTERVAL_SECONDS);
        settings.setString(sessionId, "NonStopSession", "Y");
        settings.setString(sessionId, "ResetOnLogon", "Y");
        settings.setString(sessionId, "ResetOnLogout", "Y");
        settings.setString(sessionId, "ResetOnDisconnect", "Y");
        settings.setString(sessionId, "UseDataDictionary", "Y");
        settings.setString(sessionId, "DataDictionary", "FIX44.xml");
        return settings;
    }

    private FixSession requireSession() throws VenueIoException {
        FixSession current = session;
        if (current == null) {
            throw new VenueIoException(venue, "FIX session is not open");
        }
        return current;
    }

    private void stopQuietly(SocketInitiator stopping) {
        try {
            stopping.stop(true);
        } catch (RuntimeException e) {
            log.warn("[FIX ADAPTER] Initiator for {} failed while stopping: {}", venue, e.getMessage());
        }
    }

    /**
     * Engine callbacks for one logon attempt and the session that follows it.
     */
    private final class FixSession implements Application {
        private final VenueCredentials credentials;
        private final CompletableFuture<Void> logon = new CompletableFuture<>();
        private final Queue<String> statusMessages = new ConcurrentLinkedQueue<>();
        private final Queue<String> marketDataMessages = new ConcurrentLinkedQueue<>();
        private volatile String logoutText;
        private volatile String lostReason;

        private FixSession(VenueCredentials credentials) {
            this.credentials = credentials;
        }

        @Override
        public void onCreate(SessionID id) {
            log.debug("[FIX ADAPTER] Session created: {}", id);
        }

        @Override
        public void onLogon(SessionID id) {
            log.debug("[FIX ADAPTER] Logon accepted on {}", id);
            logon.complete(null);
        }

        @Override
        public void onLogout(SessionID id) {
            String reason = logoutText != null ? logoutText : "connection closed";
            if (logon.completeExceptionally(new VenueConnectException(venue, "Logon refused: " + reason))) {
                log.warn("[FIX ADAPTER] Logon to {} refused: {}", venue, reason);
                return;
            }
            lostReason = reason;
            log.info("[FIX ADAPTER] Session {} ended: {}", id, reason);
        }

        @Override
        public void toAdmin(Message message, SessionID id) {
            if (MsgType.LOGON.equals(FixCodec.msgType(message))) {
                message.setString(Username.FIELD, credentials.apiKey());
                message.setString(Password.FIELD, credentials.secretKey());
            }
        }

        @Override
        public void fromAdmin(Message message, SessionID id) throws FieldNotFound {
            if (MsgType.LOGOUT.equals(FixCodec.msgType(message)) && message.isSetField(Text.FIELD)) {
                logoutText = message.getString(Text.FIELD);
            }
        }

        @Override
        public void toApp(Message message, SessionID id) {
            log.debug("[FIX ADAPTER] -> {}", message);
        }

        @Override
        public void fromApp(Message message, SessionID id) {
            String msgType = FixCodec.msgType(message);
            switch (msgType) {
                case MsgType.EXECUTION_REPORT, MsgType.ORDER_CANCEL_REJECT -> statusMessages.add(message.toString());
                case MsgType.MARKET_DATA_SNAPSHOT_FULL_REFRESH, MsgType.MARKET_DATA_INCREMENTAL_REFRESH ->
                    marketDataMessages.add(message.toString());
                default -> log.debug("[FIX ADAPTER] Ignoring MsgType {} from {}", msgType, venue);
            }
        }

        private void checkLink() throws VenueIoException {
            String reason = lostReason;
            if (reason != null) {
                throw new VenueIoException(venue, "Venue ended session: " + reason);
            }
        }
    }
}
