package in.ordergate.domain.order;

/**
 * Order side.
 */
public enum Side {
    BUY,
    SELL
}
