package in.ordergate.infrastructure.venue;

import in.ordergate.domain.order.Order;
import in.ordergate.domain.order.Side;

import java.math.BigDecimal;
import java.time.Instant;

/**
 * Order action queued for delivery to the venue.
 *
 * Carries the full order terms so every codec can build a complete
 * message without going back to the registry.
 */
public record OutboundCommand(
    CommandType type,
    long orderId,
    String symbol,
    Side side,
    BigDecimal price,
    int quantity,
    Instant enqueuedAt
) {
    public OutboundCommand {
        if (type == null) {
            throw new IllegalArgumentException("Command type cannot be null");
        }
        if (symbol == null || symbol.isBlank()) {
            throw new IllegalArgumentException("Symbol cannot be null or empty");
        }
        if (side == null) {
            throw new IllegalArgumentException("Side cannot be null");
        }
        if (enqueuedAt == null) {
            enqueuedAt = Instant.now();
        }
    }

    public static OutboundCommand newOrder(Order order) {
        return of(CommandType.NEW, order);
    }

    public static OutboundCommand cancel(Order order) {
        return of(CommandType.CANCEL, order);
    }

    public static OutboundCommand modify(Order order) {
        return of(CommandType.MODIFY, order);
    }

    private static OutboundCommand of(CommandType type, Order order) {
        return new OutboundCommand(type, order.orderId(), order.symbol(), order.side(),
            order.limitPrice(), order.requestedQuantity(), Instant.now());
    }
}
