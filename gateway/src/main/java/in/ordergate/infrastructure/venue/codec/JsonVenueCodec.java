package in.ordergate.infrastructure.venue.codec;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import in.ordergate.domain.order.OrderStatus;
import in.ordergate.domain.order.OrderStatusUpdate;
import in.ordergate.domain.order.Side;
import in.ordergate.infrastructure.venue.CommandType;
import in.ordergate.infrastructure.venue.OutboundCommand;
import in.ordergate.infrastructure.venue.VenueCredentials;

import javax.crypto.Mac;
import javax.crypto.spec.SecretKeySpec;
import java.math.BigDecimal;
import java.nio.charset.StandardCharsets;
import java.security.GeneralSecurityException;
import java.time.Instant;
import java.util.HexFormat;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;

/**
 * JSON codec for text-frame venues (WebSocket, paper).
 *
 * Every message is an object with a "type" field:
 * - outbound: newOrder, cancelOrder, modifyOrder, auth, subscribe
 * - inbound:  authAck, orderStatus, marketData, error
 */
public final class JsonVenueCodec implements VenueCodec {

    public static final String TYPE_NEW_ORDER = "newOrder";
    public static final String TYPE_CANCEL_ORDER = "cancelOrder";
    public static final String TYPE_MODIFY_ORDER = "modifyOrder";
    public static final String TYPE_AUTH = "auth";
    public static final String TYPE_AUTH_ACK = "authAck";
    public static final String TYPE_SUBSCRIBE = "subscribe";
    public static final String TYPE_ORDER_STATUS = "orderStatus";
    public static final String TYPE_MARKET_DATA = "marketData";
    public static final String TYPE_ERROR = "error";

    private final ObjectMapper mapper;

    public JsonVenueCodec() {
        this(new ObjectMapper());
    }

    public JsonVenueCodec(ObjectMapper mapper) {
        this.mapper = mapper;
    }

    // ═══════════════════════════════════════════════════════════════════════
    // ORDER COMMANDS
    // ═══════════════════════════════════════════════════════════════════════

    @Override
    public String encode(OutboundCommand command) {
        ObjectNode node = mapper.createObjectNode();
        node.put("type", switch (command.type()) {
            case NEW -> TYPE_NEW_ORDER;
            case CANCEL -> TYPE_CANCEL_ORDER;
            case MODIFY -> TYPE_MODIFY_ORDER;
        });
        node.put("orderId", command.orderId());
        node.put("symbol", command.symbol());
        node.put("side", command.side().name());
        node.put("price", command.price().toPlainString());
        node.put("quantity", command.quantity());
        node.put("timestamp", command.enqueuedAt().toEpochMilli());
        return write(node);
    }

    /**
     * Decode a command written by {@link #encode(OutboundCommand)}.
     * Used by the venue side of the protocol (paper venue, tests).
     */
    public OutboundCommand decodeCommand(String rawMessage) {
        JsonNode node = read(rawMessage);
        String type = text(node, "type");
        CommandType commandType = switch (type) {
            case TYPE_NEW_ORDER -> CommandType.NEW;
            case TYPE_CANCEL_ORDER -> CommandType.CANCEL;
            case TYPE_MODIFY_ORDER -> CommandType.MODIFY;
            default -> throw new MalformedMessageException("Not an order command: " + type);
        };
        try {
            return new OutboundCommand(
                commandType,
                requireField(node, "orderId").asLong(),
                text(node, "symbol"),
                Side.valueOf(text(node, "side")),
                new BigDecimal(text(node, "price")),
                requireField(node, "quantity").asInt(),
                Instant.ofEpochMilli(node.path("timestamp").asLong(System.currentTimeMillis()))
            );
        } catch (IllegalArgumentException e) {
            throw new MalformedMessageException("Invalid order command: " + rawMessage, e);
        }
    }

    @Override
    public Optional<OrderStatusUpdate> decodeStatus(String rawMessage) {
        JsonNode node = read(rawMessage);
        if (!TYPE_ORDER_STATUS.equals(node.path("type").asText())) {
            return Optional.empty();
        }

        OrderStatus status = parseStatus(text(node, "status"));
        if (status == null) {
            return Optional.empty();
        }
        int lastQuantity = node.path("lastQuantity").asInt(0);
        if (lastQuantity < 0) {
            throw new MalformedMessageException("Negative lastQuantity: " + rawMessage);
        }
        String reason = node.hasNonNull("reason") ? node.get("reason").asText() : null;
        return Optional.of(new OrderStatusUpdate(
            requireField(node, "orderId").asLong(), status, lastQuantity, reason, Instant.now()));
    }

    public String encodeStatus(OrderStatusUpdate update) {
        ObjectNode node = mapper.createObjectNode();
        node.put("type", TYPE_ORDER_STATUS);
        node.put("orderId", update.orderId());
        node.put("status", update.status().name());
        node.put("lastQuantity", update.filledDelta());
        if (update.reason() != null) {
            node.put("reason", update.reason());
        }
        return write(node);
    }

    // ═══════════════════════════════════════════════════════════════════════
    // SESSION MESSAGES
    // ═══════════════════════════════════════════════════════════════════════

    /**
     * Auth request signed with HMAC-SHA256 over "{apiKey}:{timestamp}".
     */
    public String auth(VenueCredentials credentials, long timestampMillis) {
        ObjectNode node = mapper.createObjectNode();
        node.put("type", TYPE_AUTH);
        node.put("apiKey", credentials.apiKey());
        node.put("timestamp", timestampMillis);
        node.put("signature", sign(credentials.secretKey(), credentials.apiKey() + ":" + timestampMillis));
        return write(node);
    }

    public String subscribe(Set<String> symbols) {
        ObjectNode node = mapper.createObjectNode();
        node.put("type", TYPE_SUBSCRIBE);
        ArrayNode array = node.putArray("symbols");
        symbols.forEach(array::add);
        return write(node);
    }

    public String marketData(String symbol, BigDecimal bid, BigDecimal ask, BigDecimal last, long timestampMillis) {
        ObjectNode node = mapper.createObjectNode();
        node.put("type", TYPE_MARKET_DATA);
        node.put("symbol", symbol);
        node.put("bid", bid.toPlainString());
        node.put("ask", ask.toPlainString());
        node.put("last", last.toPlainString());
        node.put("timestamp", timestampMillis);
        return write(node);
    }

    /**
     * Value of the "type" field, or empty string when absent.
     */
    public String messageType(String rawMessage) {
        return read(rawMessage).path("type").asText("");
    }

    public JsonNode parse(String rawMessage) {
        return read(rawMessage);
    }

    public static String sign(String secret, String payload) {
        try {
            Mac mac = Mac.getInstance("HmacSHA256");
            mac.init(new SecretKeySpec(secret.getBytes(StandardCharsets.UTF_8), "HmacSHA256"));
            return HexFormat.of().formatHex(mac.doFinal(payload.getBytes(StandardCharsets.UTF_8)));
        } catch (GeneralSecurityException e) {
            throw new IllegalStateException("HmacSHA256 not available", e);
        }
    }

    private static OrderStatus parseStatus(String value) {
        return switch (value.toUpperCase(Locale.ROOT)) {
            case "PARTIALLY_FILLED", "PARTIAL" -> OrderStatus.PARTIALLY_FILLED;
            case "FILLED" -> OrderStatus.FILLED;
            case "CANCELED", "CANCELLED", "EXPIRED" -> OrderStatus.CANCELED;
            case "REJECTED" -> OrderStatus.REJECTED;
            // Acknowledgements carry no state change
            case "NEW", "PENDING", "ACCEPTED", "REPLACED" -> null;
            default -> throw new MalformedMessageException("Unsupported order status: " + value);
        };
    }

    private JsonNode read(String rawMessage) {
        if (rawMessage == null || rawMessage.isBlank()) {
            throw new MalformedMessageException("Empty JSON message");
        }
        try {
            JsonNode node = mapper.readTree(rawMessage);
            if (node == null || !node.isObject()) {
                throw new MalformedMessageException("JSON message is not an object: " + rawMessage);
            }
            return node;
        } catch (JsonProcessingException e) {
            throw new MalformedMessageException("Invalid JSON message: " + rawMessage, e);
        }
    }

    private String write(ObjectNode node) {
        try {
            return mapper.writeValueAsString(node);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize " + node.path("type").asText(), e);
        }
    }

    private static JsonNode requireField(JsonNode node, String field) {
        JsonNode value = node.get(field);
        if (value == null || value.isNull()) {
            throw new MalformedMessageException("Missing field '" + field + "'");
        }
        return value;
    }

    private static String text(JsonNode node, String field) {
        return requireField(node, field).asText();
    }
}
