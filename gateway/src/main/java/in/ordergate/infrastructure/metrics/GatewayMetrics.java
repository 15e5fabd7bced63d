package in.ordergate.infrastructure.metrics;

import in.ordergate.domain.order.OrderActionResult;
import in.ordergate.domain.order.OrderStatus;
import in.ordergate.infrastructure.venue.CommandType;

import java.time.Duration;

/**
 * Gateway metrics for monitoring and alerting.
 *
 * Key metrics:
 * - Order actions (create/cancel/modify) and applied status updates
 * - State errors and data-integrity violations
 * - Command delivery success, failure and latency
 * - Connection lifecycle events
 * - Market-data throughput and drops
 */
public interface GatewayMetrics {

    /**
     * Record an accepted caller action.
     *
     * @param venue  venue name
     * @param action "create", "cancel" or "modify"
     */
    void recordOrderAction(String venue, String action);

    void recordStatusUpdate(String venue, OrderStatus status);

    /**
     * Record an operation that was refused (not found, not cancelable, stale...).
     */
    void recordStateError(String venue, OrderActionResult error);

    void recordDataIntegrityError(String venue);

    void recordCommandSent(String venue, CommandType type, Duration latency);

    void recordCommandFailure(String venue, CommandType type);

    void recordConnectionEvent(String venue, ConnectionEvent event);

    void recordMarketDataMessage(String venue);

    void recordMarketDataDropped(String venue);

    /**
     * Metrics sink that discards everything.
     */
    static GatewayMetrics noop() {
        return NoOp.INSTANCE;
    }

    /**
     * Connection lifecycle event.
     */
    enum ConnectionEvent {
        CONNECTING,
        CONNECTED,
        CONNECT_FAILED,
        CONNECT_TIMEOUT,
        DISCONNECTED,
        LINK_LOST
    }

    final class NoOp implements GatewayMetrics {
        private static final NoOp INSTANCE = new NoOp();

        private NoOp() {}

        @Override public void recordOrderAction(String venue, String action) {}
        @Override public void recordStatusUpdate(String venue, OrderStatus status) {}
        @Override public void recordStateError(String venue, OrderActionResult error) {}
        @Override public void recordDataIntegrityError(String venue) {}
        @Override public void recordCommandSent(String venue, CommandType type, Duration latency) {}
        @Override public void recordCommandFailure(String venue, CommandType type) {}
        @Override public void recordConnectionEvent(String venue, ConnectionEvent event) {}
        @Override public void recordMarketDataMessage(String venue) {}
        @Override public void recordMarketDataDropped(String venue) {}
    }
}
