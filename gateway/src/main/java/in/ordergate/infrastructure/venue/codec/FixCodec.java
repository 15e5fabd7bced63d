package in.ordergate.infrastructure.venue.codec;

import in.ordergate.domain.order.OrderStatus;
import in.ordergate.domain.order.OrderStatusUpdate;
import in.ordergate.infrastructure.venue.OutboundCommand;
import quickfix.FieldMap;
import quickfix.FieldNotFound;
import quickfix.InvalidMessage;
import quickfix.Message;
import quickfix.field.ClOrdID;
import quickfix.field.LastQty;
import quickfix.field.MDEntryType;
import quickfix.field.MDReqID;
import quickfix.field.MarketDepth;
import quickfix.field.MsgType;
import quickfix.field.OrdStatus;
import quickfix.field.OrdType;
import quickfix.field.OrderQty;
import quickfix.field.OrigClOrdID;
import quickfix.field.Price;
import quickfix.field.SenderCompID;
import quickfix.field.Side;
import quickfix.field.SubscriptionRequestType;
import quickfix.field.Symbol;
import quickfix.field.TargetCompID;
import quickfix.field.Text;
import quickfix.field.TransactTime;
import quickfix.fix44.MarketDataRequest;
import quickfix.fix44.NewOrderSingle;
import quickfix.fix44.OrderCancelReplaceRequest;
import quickfix.fix44.OrderCancelRequest;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.atomic.AtomicLong;

/**
 * FIX 4.4 codec built on the QuickFIX/J message classes.
 *
 * Outbound: NewOrderSingle (D), OrderCancelRequest (F) and
 * OrderCancelReplaceRequest (G) as complete wire text, BodyLength and
 * CheckSum included. Sequence number and sending time are stamped by the
 * session when the message goes out.
 * Inbound: ExecutionReport (8) is decoded into an {@link OrderStatusUpdate}.
 *
 * ClOrdID carries the gateway order id; cancel and replace requests use
 * "{id}-C{seq}" / "{id}-M{seq}" with OrigClOrdID set to the order id.
 */
public final class FixCodec implements VenueCodec {

    private static final char SUBSCRIBE_SNAPSHOT_PLUS_UPDATES = '1';
    private static final int TOP_OF_BOOK = 1;

    private final String senderCompId;
    private final String targetCompId;
    private final AtomicLong requestSeq = new AtomicLong(0);

    public FixCodec(String senderCompId, String targetCompId) {
        this.senderCompId = senderCompId;
        this.targetCompId = targetCompId;
    }

    // ═══════════════════════════════════════════════════════════════════════
    // ORDER COMMANDS
    // ═══════════════════════════════════════════════════════════════════════

    @Override
    public String encode(OutboundCommand command) {
        Message message = switch (command.type()) {
            case NEW -> newOrderSingle(command);
            case CANCEL -> cancelRequest(command);
            case MODIFY -> replaceRequest(command);
        };
        message.getHeader().setString(SenderCompID.FIELD, senderCompId);
        message.getHeader().setString(TargetCompID.FIELD, targetCompId);
        return message.toString();
    }

    @Override
    public Optional<OrderStatusUpdate> decodeStatus(String rawMessage) {
        Message message = parse(rawMessage);
        if (!MsgType.EXECUTION_REPORT.equals(msgType(message))) {
            return Optional.empty();
        }

        String ordStatus = require(message, OrdStatus.FIELD);
        OrderStatus status = switch (ordStatus) {
            case "1" -> OrderStatus.PARTIALLY_FILLED;
            case "2" -> OrderStatus.FILLED;
            case "4", "C" -> OrderStatus.CANCELED;   // Canceled, Expired
            case "8" -> OrderStatus.REJECTED;
            // New, PendingCancel, Replaced, PendingNew, PendingReplace are acknowledgements
            case "0", "5", "6", "A", "E" -> null;
            default -> throw new MalformedMessageException("Unsupported OrdStatus(39)=" + ordStatus);
        };
        if (status == null) {
            return Optional.empty();
        }

        String clOrdId = message.isSetField(OrigClOrdID.FIELD)
            ? require(message, OrigClOrdID.FIELD)
            : require(message, ClOrdID.FIELD);
        long orderId = parseOrderId(clOrdId);
        int lastQty = message.isSetField(LastQty.FIELD) ? parseQuantity(require(message, LastQty.FIELD)) : 0;
        String text = message.isSetField(Text.FIELD) ? require(message, Text.FIELD) : null;
        return Optional.of(new OrderStatusUpdate(orderId, status, lastQty, text, Instant.now()));
    }

    // ═══════════════════════════════════════════════════════════════════════
    // MARKET DATA
    // ═══════════════════════════════════════════════════════════════════════

    /**
     * Top-of-book bid/offer subscription for the given symbols.
     */
    public MarketDataRequest marketDataRequest(Set<String> symbols) {
        MarketDataRequest request = new MarketDataRequest(
            new MDReqID("MD-" + requestSeq.incrementAndGet()),
            new SubscriptionRequestType(SUBSCRIBE_SNAPSHOT_PLUS_UPDATES),
            new MarketDepth(TOP_OF_BOOK));

        MarketDataRequest.NoMDEntryTypes entryType = new MarketDataRequest.NoMDEntryTypes();
        entryType.set(new MDEntryType(MDEntryType.BID));
        request.addGroup(entryType);
        entryType.set(new MDEntryType(MDEntryType.OFFER));
        request.addGroup(entryType);

        for (String symbol : symbols) {
            MarketDataRequest.NoRelatedSym related = new MarketDataRequest.NoRelatedSym();
            related.set(new Symbol(symbol));
            request.addGroup(related);
        }
        return request;
    }

    // ═══════════════════════════════════════════════════════════════════════
    // PARSING
    // ═══════════════════════════════════════════════════════════════════════

    /**
     * Parse wire text, validating BodyLength and CheckSum.
     *
     * @throws MalformedMessageException if the text is not a valid FIX message
     */
    public static Message parse(String rawMessage) {
        if (rawMessage == null || rawMessage.isEmpty()) {
            throw new MalformedMessageException("Empty FIX message");
        }
        try {
            return new Message(rawMessage);
        } catch (InvalidMessage e) {
            throw new MalformedMessageException("Invalid FIX message: " + e.getMessage(), e);
        }
    }

    public static String msgType(Message message) {
        return require(message.getHeader(), MsgType.FIELD);
    }

    public String getSenderCompId() {
        return senderCompId;
    }

    public String getTargetCompId() {
        return targetCompId;
    }

    // ═══════════════════════════════════════════════════════════════════════
    // INTERNALS
    // ═══════════════════════════════════════════════════════════════════════

    private static NewOrderSingle newOrderSingle(OutboundCommand command) {
        NewOrderSingle order = new NewOrderSingle(
            new ClOrdID(Long.toString(command.orderId())),
            side(command),
            transactTime(command),
            new OrdType(OrdType.LIMIT));
        order.set(new Symbol(command.symbol()));
        order.set(new OrderQty(command.quantity()));
        order.set(new Price(command.price().doubleValue()));
        return order;
    }

    private OrderCancelRequest cancelRequest(OutboundCommand command) {
        OrderCancelRequest cancel = new OrderCancelRequest(
            new OrigClOrdID(Long.toString(command.orderId())),
            new ClOrdID(command.orderId() + "-C" + requestSeq.incrementAndGet()),
            side(command),
            transactTime(command));
        cancel.set(new Symbol(command.symbol()));
        cancel.set(new OrderQty(command.quantity()));
        return cancel;
    }

    private OrderCancelReplaceRequest replaceRequest(OutboundCommand command) {
        OrderCancelReplaceRequest replace = new OrderCancelReplaceRequest(
            new OrigClOrdID(Long.toString(command.orderId())),
            new ClOrdID(command.orderId() + "-M" + requestSeq.incrementAndGet()),
            side(command),
            transactTime(command),
            new OrdType(OrdType.LIMIT));
        replace.set(new Symbol(command.symbol()));
        replace.set(new OrderQty(command.quantity()));
        replace.set(new Price(command.price().doubleValue()));
        return replace;
    }

    private static Side side(OutboundCommand command) {
        return new Side(command.side() == in.ordergate.domain.order.Side.BUY ? Side.BUY : Side.SELL);
    }

    private static TransactTime transactTime(OutboundCommand command) {
        return new TransactTime(LocalDateTime.ofInstant(command.enqueuedAt(), ZoneOffset.UTC));
    }

    private static String require(FieldMap fields, int tag) {
        try {
            return fields.getString(tag);
        } catch (FieldNotFound e) {
            throw new MalformedMessageException("Missing required tag " + tag, e);
        }
    }

    private static long parseOrderId(String clOrdId) {
        int dash = clOrdId.indexOf('-');
        String id = dash < 0 ? clOrdId : clOrdId.substring(0, dash);
        try {
            return Long.parseLong(id);
        } catch (NumberFormatException e) {
            throw new MalformedMessageException("ClOrdID is not a gateway order id: " + clOrdId, e);
        }
    }

    private static int parseQuantity(String value) {
        int quantity;
        try {
            quantity = new BigDecimal(value).intValueExact();
        } catch (NumberFormatException | ArithmeticException e) {
            throw new MalformedMessageException("Invalid LastQty(32)=" + value, e);
        }
        if (quantity < 0) {
            throw new MalformedMessageException("Negative LastQty(32)=" + value);
        }
        return quantity;
    }
}
