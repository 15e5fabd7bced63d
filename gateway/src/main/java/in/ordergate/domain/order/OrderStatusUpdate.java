package in.ordergate.domain.order;

import java.time.Instant;

/**
 * Order status event reported by the venue (or synthesized by the
 * connector when a command could not be delivered).
 *
 * @param orderId     gateway order id the event refers to
 * @param status      status reported by the venue
 * @param filledDelta quantity executed by this event, zero when none
 * @param reason      venue text or failure reason, may be null
 * @param receivedAt  when the gateway received the event
 */
public record OrderStatusUpdate(
    long orderId,
    OrderStatus status,
    int filledDelta,
    String reason,
    Instant receivedAt
) {
    public OrderStatusUpdate {
        if (status == null) {
            throw new IllegalArgumentException("Status cannot be null");
        }
        if (filledDelta < 0) {
            throw new IllegalArgumentException("Filled delta cannot be negative");
        }
        if (receivedAt == null) {
            receivedAt = Instant.now();
        }
    }

    public static OrderStatusUpdate fill(long orderId, OrderStatus status, int filledDelta) {
        return new OrderStatusUpdate(orderId, status, filledDelta, null, Instant.now());
    }

    public static OrderStatusUpdate rejected(long orderId, String reason) {
        return new OrderStatusUpdate(orderId, OrderStatus.REJECTED, 0, reason, Instant.now());
    }
}
