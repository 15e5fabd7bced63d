package in.ordergate.domain.order;

/**
 * Order status lifecycle.
 *
 * Flow: PENDING → PARTIALLY_FILLED → FILLED, with CANCELED reachable from
 * PENDING or PARTIALLY_FILLED and REJECTED reachable only from PENDING.
 * FILLED, CANCELED and REJECTED are terminal.
 */
public enum OrderStatus {
    PENDING,            // Accepted by the gateway, no execution yet
    PARTIALLY_FILLED,   // Some quantity executed
    FILLED,             // Requested quantity fully executed
    CANCELED,           // Canceled by caller or venue
    REJECTED;           // Refused by venue or never delivered

    public boolean isTerminal() {
        return this == FILLED || this == CANCELED || this == REJECTED;
    }

    public boolean isActive() {
        return this == PENDING || this == PARTIALLY_FILLED;
    }

    /**
     * Check whether an order in this status may move to {@code next}.
     */
    public boolean canTransitionTo(OrderStatus next) {
        return switch (this) {
            case PENDING -> next == PARTIALLY_FILLED || next == FILLED
                || next == CANCELED || next == REJECTED;
            case PARTIALLY_FILLED -> next == PARTIALLY_FILLED || next == FILLED
                || next == CANCELED;
            case FILLED, CANCELED, REJECTED -> false;
        };
    }
}
