package in.ordergate.infrastructure.venue.adapters;

import in.ordergate.domain.order.Order;
import in.ordergate.domain.order.OrderStatus;
import in.ordergate.domain.order.OrderStatusUpdate;
import in.ordergate.domain.order.Side;
import in.ordergate.infrastructure.venue.OrderSendException;
import in.ordergate.infrastructure.venue.OutboundCommand;
import in.ordergate.infrastructure.venue.VenueConnectException;
import in.ordergate.infrastructure.venue.VenueCredentials;
import in.ordergate.infrastructure.venue.VenueIoException;
import in.ordergate.infrastructure.venue.codec.FixCodec;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import quickfix.Application;
import quickfix.DefaultMessageFactory;
import quickfix.FieldNotFound;
import quickfix.FixVersions;
import quickfix.MemoryStoreFactory;
import quickfix.Message;
import quickfix.RejectLogon;
import quickfix.SLF4JLogFactory;
import quickfix.Session;
import quickfix.SessionID;
import quickfix.SessionNotFound;
import quickfix.SessionSettings;
import quickfix.SocketAcceptor;
import quickfix.field.AvgPx;
import quickfix.field.ClOrdID;
import quickfix.field.CumQty;
import quickfix.field.ExecID;
import quickfix.field.ExecType;
import quickfix.field.LastPx;
import quickfix.field.LastQty;
import quickfix.field.LeavesQty;
import quickfix.field.MDEntryPx;
import quickfix.field.MDEntrySize;
import quickfix.field.MDEntryType;
import quickfix.field.MsgType;
import quickfix.field.NoRelatedSym;
import quickfix.field.OrdStatus;
import quickfix.field.OrderID;
import quickfix.field.OrderQty;
import quickfix.field.Password;
import quickfix.field.Symbol;
import quickfix.fix44.ExecutionReport;
import quickfix.fix44.MarketDataSnapshotFullRefresh;

import java.io.IOException;
import java.math.BigDecimal;
import java.net.ServerSocket;
import java.time.Duration;
import java.time.Instant;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for FixProtocolAdapter against a local QuickFIX/J acceptor.
 *
 * Tests:
 * - Logon with credentials, order out and ExecutionReport back
 * - Logon refused, no listener, send without a session
 * - Venue Logout after logon is reported as link loss
 * - MarketDataRequest answered with a snapshot
 * - Reconnect after disconnect
 */
class FixProtocolAdapterTest {

    private static final VenueCredentials CREDENTIALS = new VenueCredentials("user", "pass");
    private static final SessionID VENUE_SESSION = new SessionID(FixVersions.BEGINSTRING_FIX44, "VENUE", "GATEWAY");

    private int port;
    private SimulatedVenue venue;
    private SocketAcceptor acceptor;
    private FixCodec codec;
    private FixProtocolAdapter adapter;

    @BeforeEach
    void setUp() throws Exception {
        port = freePort();
        venue = new SimulatedVenue();
        SessionSettings settings = acceptorSettings(port);
        acceptor = new SocketAcceptor(venue, new MemoryStoreFactory(), settings,
            new SLF4JLogFactory(settings), new DefaultMessageFactory());
        acceptor.start();

        codec = new FixCodec("GATEWAY", "VENUE");
        adapter = newAdapter(port, Duration.ofSeconds(5));
    }

    @AfterEach
    void tearDown() throws Exception {
        adapter.disconnect();
        acceptor.stop(true);
    }

    // ═══════════════════════════════════════════════════════════════════════
    // SESSION
    // ═══════════════════════════════════════════════════════════════════════

    @Test
    void testLogonThenOrderAndExecutionReport() throws Exception {
        adapter.connect(CREDENTIALS);

        adapter.sendOrder(codec.encode(OutboundCommand.newOrder(order(7, 100))));

        Message received = venue.orders.poll(5, TimeUnit.SECONDS);
        assertNotNull(received, "Venue should receive the NewOrderSingle");
        assertEquals("7", received.getString(ClOrdID.FIELD));
        assertEquals("AAPL", received.getString(Symbol.FIELD));
        assertEquals("user", venue.lastUsername);

        OrderStatusUpdate update = codec.decodeStatus(awaitStatus()).orElseThrow();
        assertEquals(7, update.orderId());
        assertEquals(OrderStatus.FILLED, update.status());
        assertEquals(100, update.filledDelta());
    }

    @Test
    void testLogonRefused() {
        FixProtocolAdapter refused = newAdapter(port, Duration.ofSeconds(5));

        VenueConnectException e = assertThrows(VenueConnectException.class,
            () -> refused.connect(new VenueCredentials("user", "wrong")));

        assertEquals("FIXVENUE", e.getVenue());
        assertThrows(OrderSendException.class,
            () -> refused.sendOrder(codec.encode(OutboundCommand.newOrder(order(1, 10)))));
    }

    @Test
    void testNoListenerIsConnectError() throws Exception {
        FixProtocolAdapter unreachable = newAdapter(freePort(), Duration.ofSeconds(1));

        VenueConnectException e = assertThrows(VenueConnectException.class, () -> unreachable.connect(CREDENTIALS));

        assertTrue(e.getMessage().contains("No logon response"));
    }

    @Test
    void testVenueLogoutIsLinkLoss() throws Exception {
        adapter.connect(CREDENTIALS);

        Session.lookupSession(VENUE_SESSION).logout("End of day");

        VenueIoException e = assertThrows(VenueIoException.class, () -> {
            Instant deadline = Instant.now().plusSeconds(5);
            while (Instant.now().isBefore(deadline)) {
                adapter.pollOrderStatus();
                Thread.sleep(10);
            }
        });
        assertTrue(e.getMessage().contains("End of day"), e.getMessage());
        assertThrows(OrderSendException.class,
            () -> adapter.sendOrder(codec.encode(OutboundCommand.newOrder(order(2, 10)))));
    }

    @Test
    void testSendWithoutSessionFails() {
        assertThrows(OrderSendException.class,
            () -> adapter.sendOrder(codec.encode(OutboundCommand.newOrder(order(1, 100)))));
        assertThrows(VenueIoException.class, () -> adapter.pollOrderStatus());
    }

    @Test
    void testReconnectAfterDisconnect() throws Exception {
        adapter.connect(CREDENTIALS);
        adapter.disconnect();

        adapter.connect(CREDENTIALS);
        adapter.sendOrder(codec.encode(OutboundCommand.newOrder(order(9, 30))));

        OrderStatusUpdate update = codec.decodeStatus(awaitStatus()).orElseThrow();
        assertEquals(9, update.orderId());
        assertEquals(30, update.filledDelta());
    }

    // ═══════════════════════════════════════════════════════════════════════
    // MARKET DATA
    // ═══════════════════════════════════════════════════════════════════════

    @Test
    void testMarketDataSubscriptionAnsweredWithSnapshot() throws Exception {
        adapter.connect(CREDENTIALS);

        adapter.subscribe(new LinkedHashSet<>(List.of("AAPL", "GOOG")));

        Message request = venue.marketDataRequests.poll(5, TimeUnit.SECONDS);
        assertNotNull(request, "Venue should receive the MarketDataRequest");
        assertEquals(2, request.getGroupCount(NoRelatedSym.FIELD));

        String snapshot = awaitMarketData();
        Message parsed = FixCodec.parse(snapshot);
        assertEquals(MsgType.MARKET_DATA_SNAPSHOT_FULL_REFRESH, FixCodec.msgType(parsed));
        assertEquals("AAPL", parsed.getString(Symbol.FIELD));
    }

    // ═══════════════════════════════════════════════════════════════════════
    // HELPERS
    // ═══════════════════════════════════════════════════════════════════════

    private FixProtocolAdapter newAdapter(int venuePort, Duration connectTimeout) {
        return new FixProtocolAdapter("FIXVENUE", "127.0.0.1", venuePort, codec, 30, connectTimeout);
    }

    private String awaitStatus() throws Exception {
        Instant deadline = Instant.now().plusSeconds(5);
        while (Instant.now().isBefore(deadline)) {
            Optional<String> raw = adapter.pollOrderStatus();
            if (raw.isPresent()) {
                return raw.get();
            }
            Thread.sleep(10);
        }
        return fail("No execution report received");
    }

    private String awaitMarketData() throws Exception {
        Instant deadline = Instant.now().plusSeconds(5);
        while (Instant.now().isBefore(deadline)) {
            Optional<String> raw = adapter.pollMarketData();
            if (raw.isPresent()) {
                return raw.get();
            }
            Thread.sleep(10);
        }
        return fail("No market data received");
    }

    private static SessionSettings acceptorSettings(int port) {
        SessionSettings settings = new SessionSettings();
        settings.setString(VENUE_SESSION, "BeginString", VENUE_SESSION.getBeginString());
        settings.setString(VENUE_SESSION, "SenderCompID", VENUE_SESSION.getSenderCompID());
        settings.setString(VENUE_SESSION, "TargetCompID", VENUE_SESSION.getTargetCompID());
        settings.setString(VENUE_SESSION, "ConnectionType", "acceptor");
        settings.setLong(VENUE_SESSION, "SocketAcceptPort", port);
        settings.setString(VENUE_SESSION, "SocketAcceptAddress", "127.0.0.1");
        settings.setString(VENUE_SESSION, "NonStopSession", "Y");
        settings.setString(VENUE_SESSION, "ResetOnLogon", "Y");
        settings.setString(VENUE_SESSION, "ResetOnLogout", "Y");
        settings.setString(VENUE_SESSION, "ResetOnDisconnect", "Y");
        settings.setString(VENUE_SESSION, "UseDataDictionary", "Y");
        settings.setString(VENUE_SESSION, "DataDictionary", "FIX44.xml");
        return settings;
    }

    private static int freePort() throws IOException {
        try (ServerSocket socket = new ServerSocket(0)) {
            return socket.getLocalPort();
        }
    }

    private static Order order(long id, int quantity) {
        Instant now = Instant.now();
        return new Order(id, "AAPL", Side.BUY, new BigDecimal("150.50"), quantity, 0, OrderStatus.PENDING, now, now);
    }

    /**
     * Venue end of the session: checks the password on Logon, fills every
     * NewOrderSingle in full and answers MarketDataRequest with a snapshot.
     */
    private static final class SimulatedVenue implements Application {
        private final BlockingQueue<Message> orders = new LinkedBlockingQueue<>();
        private final BlockingQueue<Message> marketDataRequests = new LinkedBlockingQueue<>();
        private final AtomicLong execIds = new AtomicLong();
        private volatile String lastUsername;

        @Override
        public void onCreate(SessionID sessionId) {
        }

        @Override
        public void onLogon(SessionID sessionId) {
        }

        @Override
        public void onLogout(SessionID sessionId) {
        }

        @Override
        public void toAdmin(Message message, SessionID sessionId) {
        }

        @Override
        public void fromAdmin(Message message, SessionID sessionId) throws FieldNotFound, RejectLogon {
            if (MsgType.LOGON.equals(FixCodec.msgType(message))) {
                if (!message.isSetField(Password.FIELD) || !"pass".equals(message.getString(Password.FIELD))) {
                    throw new RejectLogon("Invalid credentials");
                }
                lastUsername = message.getString(quickfix.field.Username.FIELD);
            }
        }

        @Override
        public void toApp(Message message, SessionID sessionId) {
        }

        @Override
        public void fromApp(Message message, SessionID sessionId) throws FieldNotFound {
            String msgType = FixCodec.msgType(message);
            try {
                if (MsgType.ORDER_SINGLE.equals(msgType)) {
                    orders.add(message);
                    Session.sendToTarget(fill(message), sessionId);
                } else if (MsgType.MARKET_DATA_REQUEST.equals(msgType)) {
                    marketDataRequests.add(message);
                    Session.sendToTarget(snapshot(), sessionId);
                }
            } catch (SessionNotFound e) {
                throw new IllegalStateException("Venue session vanished", e);
            }
        }

        private ExecutionReport fill(Message order) throws FieldNotFound {
            double quantity = order.getDouble(OrderQty.FIELD);
            ExecutionReport report = new ExecutionReport(
                new OrderID("V-" + order.getString(ClOrdID.FIELD)),
                new ExecID("E-" + execIds.incrementAndGet()),
                new ExecType(ExecType.TRADE),
                new OrdStatus(OrdStatus.FILLED),
                new quickfix.field.Side(order.getChar(quickfix.field.Side.FIELD)),
                new LeavesQty(0),
                new CumQty(quantity),
                new AvgPx(150.5));
            report.set(new ClOrdID(order.getString(ClOrdID.FIELD)));
            report.set(new Symbol(order.getString(Symbol.FIELD)));
            report.set(new LastQty(quantity));
            report.set(new LastPx(150.5));
            return report;
        }

        private MarketDataSnapshotFullRefresh snapshot() {
            MarketDataSnapshotFullRefresh snapshot = new MarketDataSnapshotFullRefresh();
            snapshot.set(new Symbol("AAPL"));
            MarketDataSnapshotFullRefresh.NoMDEntries bid = new MarketDataSnapshotFullRefresh.NoMDEntries();
            bid.set(new MDEntryType(MDEntryType.BID));
            bid.set(new MDEntryPx(150.25));
            bid.set(new MDEntrySize(100));
            snapshot.addGroup(bid);
            return snapshot;
        }
    }
}
