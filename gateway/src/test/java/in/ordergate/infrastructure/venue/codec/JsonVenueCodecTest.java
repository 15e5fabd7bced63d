package in.ordergate.infrastructure.venue.codec;

import com.fasterxml.jackson.databind.JsonNode;
import in.ordergate.domain.order.Order;
import in.ordergate.domain.order.OrderStatus;
import in.ordergate.domain.order.OrderStatusUpdate;
import in.ordergate.domain.order.Side;
import in.ordergate.infrastructure.venue.CommandType;
import in.ordergate.infrastructure.venue.OutboundCommand;
import in.ordergate.infrastructure.venue.VenueCredentials;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class JsonVenueCodecTest {

    private final JsonVenueCodec codec = new JsonVenueCodec();

    @Test
    void testEncodeNewOrder() {
        Instant now = Instant.now();
        Order order = new Order(3, "GOOG", Side.SELL, new BigDecimal("2725.00"), 50, 0, OrderStatus.PENDING, now, now);

        JsonNode node = codec.parse(codec.encode(OutboundCommand.newOrder(order)));

        assertEquals(JsonVenueCodec.TYPE_NEW_ORDER, node.get("type").asText());
        assertEquals(3, node.get("orderId").asLong());
        assertEquals("GOOG", node.get("symbol").asText());
        assertEquals("SELL", node.get("side").asText());
        assertEquals("2725.00", node.get("price").asText(), "Price keeps its scale");
        assertEquals(50, node.get("quantity").asInt());
    }

    @Test
    void testDecodeCommandReadsWhatEncodeWrites() {
        Instant now = Instant.now();
        Order order = new Order(9, "AAPL", Side.BUY, new BigDecimal("151.00"), 100, 0, OrderStatus.PENDING, now, now);

        OutboundCommand decoded = codec.decodeCommand(codec.encode(OutboundCommand.modify(order)));

        assertEquals(CommandType.MODIFY, decoded.type());
        assertEquals(9, decoded.orderId());
        assertEquals(0, new BigDecimal("151.00").compareTo(decoded.price()));
    }

    @Test
    void testDecodeStatusMessages() {
        OrderStatusUpdate partial = codec.decodeStatus(
            "{\"type\":\"orderStatus\",\"orderId\":4,\"status\":\"PARTIAL\",\"lastQuantity\":25}").orElseThrow();
        OrderStatusUpdate cancelled = codec.decodeStatus(
            "{\"type\":\"orderStatus\",\"orderId\":4,\"status\":\"cancelled\"}").orElseThrow();
        OrderStatusUpdate rejected = codec.decodeStatus(
            "{\"type\":\"orderStatus\",\"orderId\":5,\"status\":\"REJECTED\",\"reason\":\"Halted\"}").orElseThrow();

        assertEquals(OrderStatus.PARTIALLY_FILLED, partial.status());
        assertEquals(25, partial.filledDelta());
        assertEquals(OrderStatus.CANCELED, cancelled.status());
        assertEquals(0, cancelled.filledDelta());
        assertEquals("Halted", rejected.reason());
    }

    @Test
    void testAcknowledgementsAndOtherTypesCarryNoUpdate() {
        assertTrue(codec.decodeStatus("{\"type\":\"orderStatus\",\"orderId\":4,\"status\":\"NEW\"}").isEmpty());
        assertTrue(codec.decodeStatus("{\"type\":\"marketData\",\"symbol\":\"AAPL\"}").isEmpty());
    }

    @Test
    void testMalformedStatus() {
        assertThrows(MalformedMessageException.class, () -> codec.decodeStatus("{oops"));
        assertThrows(MalformedMessageException.class, () -> codec.decodeStatus("[1,2]"));
        assertThrows(MalformedMessageException.class,
            () -> codec.decodeStatus("{\"type\":\"orderStatus\",\"status\":\"FILLED\"}"));
        assertThrows(MalformedMessageException.class,
            () -> codec.decodeStatus("{\"type\":\"orderStatus\",\"orderId\":1,\"status\":\"BOGUS\"}"));
        assertThrows(MalformedMessageException.class,
            () -> codec.decodeStatus("{\"type\":\"orderStatus\",\"orderId\":1,\"status\":\"FILLED\",\"lastQuantity\":-3}"));
    }

    @Test
    void testEncodeStatusIsDecodable() {
        String raw = codec.encodeStatus(new OrderStatusUpdate(8, OrderStatus.FILLED, 10, "done", null));

        OrderStatusUpdate decoded = codec.decodeStatus(raw).orElseThrow();

        assertEquals(8, decoded.orderId());
        assertEquals(OrderStatus.FILLED, decoded.status());
        assertEquals(10, decoded.filledDelta());
        assertEquals("done", decoded.reason());
    }

    @Test
    void testAuthIsSignedWithSecret() {
        JsonNode auth = codec.parse(codec.auth(new VenueCredentials("key-1", "secret-1"), 1700000000000L));

        assertEquals(JsonVenueCodec.TYPE_AUTH, auth.get("type").asText());
        assertEquals("key-1", auth.get("apiKey").asText());
        assertEquals(JsonVenueCodec.sign("secret-1", "key-1:1700000000000"), auth.get("signature").asText());
        assertEquals(64, auth.get("signature").asText().length(), "Hex encoded SHA-256");
    }

    @Test
    void testSignatureDependsOnSecret() {
        assertNotEquals(JsonVenueCodec.sign("a", "payload"), JsonVenueCodec.sign("b", "payload"));
    }

    @Test
    void testSubscribeListsSymbols() {
        JsonNode node = codec.parse(codec.subscribe(new LinkedHashSet<>(List.of("AAPL", "GOOG"))));

        assertEquals(JsonVenueCodec.TYPE_SUBSCRIBE, codec.messageType(codec.subscribe(Set.of("X"))));
        assertEquals("AAPL", node.get("symbols").get(0).asText());
        assertEquals("GOOG", node.get("symbols").get(1).asText());
    }
}
