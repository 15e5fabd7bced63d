package in.ordergate.infrastructure.venue.codec;

import in.ordergate.domain.order.Order;
import in.ordergate.domain.order.OrderStatus;
import in.ordergate.domain.order.OrderStatusUpdate;
import in.ordergate.domain.order.Side;
import in.ordergate.infrastructure.venue.OutboundCommand;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import quickfix.Message;
import quickfix.field.AvgPx;
import quickfix.field.ClOrdID;
import quickfix.field.CumQty;
import quickfix.field.ExecID;
import quickfix.field.ExecType;
import quickfix.field.LastQty;
import quickfix.field.LeavesQty;
import quickfix.field.MsgType;
import quickfix.field.NoMDEntryTypes;
import quickfix.field.NoRelatedSym;
import quickfix.field.OrdStatus;
import quickfix.field.OrdType;
import quickfix.field.OrderID;
import quickfix.field.OrderQty;
import quickfix.field.OrigClOrdID;
import quickfix.field.Price;
import quickfix.field.SenderCompID;
import quickfix.field.Symbol;
import quickfix.field.TargetCompID;
import quickfix.field.Text;
import quickfix.fix44.ExecutionReport;
import quickfix.fix44.Heartbeat;
import quickfix.fix44.MarketDataRequest;

import java.math.BigDecimal;
import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for FixCodec.
 *
 * Tests:
 * - Order commands encoded as FIX 4.4 D/F/G messages
 * - BodyLength and CheckSum of the encoded wire text
 * - ExecutionReport decoding, acknowledgements and malformed reports
 * - MarketDataRequest groups
 */
class FixCodecTest {

    private static final char SOH = '\u0001';

    private FixCodec codec;
    private Order order;

    @BeforeEach
    void setUp() {
        codec = new FixCodec("CLIENT", "VENUE");
        Instant now = Instant.now();
        order = new Order(12, "AAPL", Side.BUY, new BigDecimal("150.50"), 100, 0, OrderStatus.PENDING, now, now);
    }

    // ═══════════════════════════════════════════════════════════════════════
    // ENCODING
    // ═══════════════════════════════════════════════════════════════════════

    @Test
    void testNewOrderSingle() throws Exception {
        Message message = FixCodec.parse(codec.encode(OutboundCommand.newOrder(order)));

        assertEquals(MsgType.ORDER_SINGLE, FixCodec.msgType(message));
        assertEquals("12", message.getString(ClOrdID.FIELD));
        assertEquals("AAPL", message.getString(Symbol.FIELD));
        assertEquals(quickfix.field.Side.BUY, message.getChar(quickfix.field.Side.FIELD));
        assertEquals(100.0, message.getDouble(OrderQty.FIELD));
        assertEquals(OrdType.LIMIT, message.getChar(OrdType.FIELD));
        assertEquals(150.5, message.getDouble(Price.FIELD));
        assertEquals("CLIENT", message.getHeader().getString(SenderCompID.FIELD));
        assertEquals("VENUE", message.getHeader().getString(TargetCompID.FIELD));
    }

    @Test
    void testCancelAndReplaceReferenceOriginalOrder() throws Exception {
        Message cancel = FixCodec.parse(codec.encode(OutboundCommand.cancel(order)));
        Message replace = FixCodec.parse(codec.encode(OutboundCommand.modify(order)));

        assertEquals(MsgType.ORDER_CANCEL_REQUEST, FixCodec.msgType(cancel));
        assertEquals("12", cancel.getString(OrigClOrdID.FIELD));
        assertTrue(cancel.getString(ClOrdID.FIELD).startsWith("12-C"));
        assertFalse(cancel.isSetField(Price.FIELD), "Cancel carries no price");

        assertEquals(MsgType.ORDER_CANCEL_REPLACE_REQUEST, FixCodec.msgType(replace));
        assertEquals("12", replace.getString(OrigClOrdID.FIELD));
        assertTrue(replace.getString(ClOrdID.FIELD).startsWith("12-M"));
        assertEquals(150.5, replace.getDouble(Price.FIELD));
        assertNotEquals(cancel.getString(ClOrdID.FIELD), replace.getString(ClOrdID.FIELD));
    }

    @Test
    void testChecksumCoversEverythingBeforeTrailer() {
        for (OutboundCommand command : List.of(OutboundCommand.newOrder(order),
                OutboundCommand.cancel(order), OutboundCommand.modify(order))) {
            String wire = codec.encode(command);
            byte[] bytes = wire.getBytes(StandardCharsets.ISO_8859_1);

            int trailerStart = wire.lastIndexOf(SOH + "10=") + 1;
            int sum = 0;
            for (int i = 0; i < trailerStart; i++) {
                sum += bytes[i] & 0xFF;
            }
            String checksum = wire.substring(trailerStart + 3, wire.length() - 1);
            assertEquals(3, checksum.length(), "CheckSum is three digits");
            assertEquals(sum % 256, Integer.parseInt(checksum), command.type() + " checksum");

            int bodyLengthStart = wire.indexOf(SOH + "9=") + 3;
            int bodyStart = wire.indexOf(SOH, bodyLengthStart) + 1;
            int declared = Integer.parseInt(wire.substring(bodyLengthStart, bodyStart - 1));
            assertEquals(trailerStart - bodyStart, declared, command.type() + " body length");
        }
    }

    @Test
    void testCorruptedMessageIsMalformed() {
        String wire = codec.encode(OutboundCommand.newOrder(order));
        String corrupted = wire.replace("55=AAPL", "55=AAPM");

        assertThrows(MalformedMessageException.class, () -> FixCodec.parse(corrupted));
        assertThrows(MalformedMessageException.class, () -> FixCodec.parse(""));
        assertThrows(MalformedMessageException.class, () -> FixCodec.parse("hello world"));
    }

    // ═══════════════════════════════════════════════════════════════════════
    // EXECUTION REPORTS
    // ═══════════════════════════════════════════════════════════════════════

    @Test
    void testDecodePartialFill() {
        Optional<OrderStatusUpdate> update = codec.decodeStatus(
            executionReport("12", null, OrdStatus.PARTIALLY_FILLED, 40.0, null));

        assertTrue(update.isPresent());
        assertEquals(12, update.get().orderId());
        assertEquals(OrderStatus.PARTIALLY_FILLED, update.get().status());
        assertEquals(40, update.get().filledDelta());
    }

    @Test
    void testDecodeCancelUsesOrigClOrdId() {
        OrderStatusUpdate update = codec.decodeStatus(
            executionReport("12-C1", "12", OrdStatus.CANCELED, null, null)).orElseThrow();

        assertEquals(12, update.orderId());
        assertEquals(OrderStatus.CANCELED, update.status());
        assertEquals(0, update.filledDelta());
    }

    @Test
    void testDecodeRejectCarriesText() {
        OrderStatusUpdate update = codec.decodeStatus(
            executionReport("12", null, OrdStatus.REJECTED, null, "Unknown symbol")).orElseThrow();

        assertEquals(OrderStatus.REJECTED, update.status());
        assertEquals("Unknown symbol", update.reason());
    }

    @Test
    void testAcknowledgementsCarryNoUpdate() {
        for (char ack : new char[] {'0', '5', '6', 'A', 'E'}) {
            assertTrue(codec.decodeStatus(executionReport("12", null, ack, null, null)).isEmpty(), "OrdStatus " + ack);
        }
        assertTrue(codec.decodeStatus(new Heartbeat().toString()).isEmpty());
    }

    @Test
    void testDecodeRejectsUnknownStatusAndBadIds() {
        assertThrows(MalformedMessageException.class,
            () -> codec.decodeStatus(executionReport("12", null, 'Z', null, null)));
        assertThrows(MalformedMessageException.class,
            () -> codec.decodeStatus(executionReport("ABC", null, OrdStatus.FILLED, 1.0, null)));
    }

    @Test
    void testNegativeOrFractionalLastQtyIsMalformed() {
        MalformedMessageException negative = assertThrows(MalformedMessageException.class,
            () -> codec.decodeStatus(executionReport("12", null, OrdStatus.PARTIALLY_FILLED, -5.0, null)));
        assertTrue(negative.getMessage().contains("LastQty"));

        assertThrows(MalformedMessageException.class,
            () -> codec.decodeStatus(executionReport("12", null, OrdStatus.PARTIALLY_FILLED, 2.5, null)));
    }

    // ═══════════════════════════════════════════════════════════════════════
    // MARKET DATA
    // ═══════════════════════════════════════════════════════════════════════

    @Test
    void testMarketDataRequestListsSymbols() throws Exception {
        LinkedHashSet<String> symbols = new LinkedHashSet<>(List.of("AAPL", "GOOG"));

        MarketDataRequest request = codec.marketDataRequest(symbols);

        assertEquals(MsgType.MARKET_DATA_REQUEST, FixCodec.msgType(request));
        assertEquals(2, request.getGroupCount(NoMDEntryTypes.FIELD));
        assertEquals(2, request.getGroupCount(NoRelatedSym.FIELD));
        assertEquals("AAPL", request.getGroup(1, NoRelatedSym.FIELD).getString(Symbol.FIELD));
        assertEquals("GOOG", request.getGroup(2, NoRelatedSym.FIELD).getString(Symbol.FIELD));
    }

    static String executionReport(String clOrdId, String origClOrdId, char ordStatus, Double lastQty, String text) {
        ExecutionReport report = new ExecutionReport(
            new OrderID("V-1"),
            new ExecID("E-1"),
            new ExecType(ExecType.TRADE),
            new OrdStatus(ordStatus),
            new quickfix.field.Side(quickfix.field.Side.BUY),
            new LeavesQty(0),
            new CumQty(0),
            new AvgPx(0));
        report.set(new ClOrdID(clOrdId));
        if (origClOrdId != null) {
            report.set(new OrigClOrdID(origClOrdId));
        }
        if (lastQty != null) {
            report.set(new LastQty(lastQty));
        }
        if (text != null) {
            report.set(new Text(text));
        }
        return report.toString();
    }
}
