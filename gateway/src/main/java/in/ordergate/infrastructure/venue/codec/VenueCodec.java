package in.ordergate.infrastructure.venue.codec;

import in.ordergate.domain.order.OrderStatusUpdate;
import in.ordergate.infrastructure.venue.OutboundCommand;

import java.util.Optional;

/**
 * Translates between gateway types and one protocol's message text.
 */
public interface VenueCodec {

    /**
     * Serialize a command for {@code ProtocolAdapter.sendOrder}.
     */
    String encode(OutboundCommand command);

    /**
     * Decode an order-status message.
     *
     * @return the update, or empty if the message carries nothing the gateway tracks
     * @throws MalformedMessageException if the message cannot be parsed
     */
    Optional<OrderStatusUpdate> decodeStatus(String rawMessage);
}
