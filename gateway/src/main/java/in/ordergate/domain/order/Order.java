package in.ordergate.domain.order;

import java.math.BigDecimal;
import java.time.Instant;

/**
 * Point-in-time copy of an order held by the OrderManager.
 *
 * Callers only ever see these snapshots; the live record stays inside
 * the manager's registry.
 */
public record Order(
    long orderId,
    String symbol,
    Side side,
    BigDecimal limitPrice,
    int requestedQuantity,
    int filledQuantity,
    OrderStatus status,
    Instant createdAt,
    Instant updatedAt
) {
    public int remainingQuantity() {
        return requestedQuantity - filledQuantity;
    }

    public boolean isActive() {
        return status.isActive();
    }
}
