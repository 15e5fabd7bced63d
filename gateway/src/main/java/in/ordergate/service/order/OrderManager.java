package in.ordergate.service.order;

import in.ordergate.domain.order.Order;
import in.ordergate.domain.order.OrderActionResult;
import in.ordergate.domain.order.OrderStatus;
import in.ordergate.domain.order.OrderStatusUpdate;
import in.ordergate.domain.order.Side;
import in.ordergate.infrastructure.metrics.GatewayMetrics;
import in.ordergate.infrastructure.venue.OutboundCommand;
import in.ordergate.infrastructure.venue.SubmissionResult;
import in.ordergate.infrastructure.venue.VenueConnector;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Consumer;
import java.util.function.Predicate;

/**
 * Sole authority over order identity and status.
 *
 * RESPONSIBILITIES:
 * - Allocate sequential order ids
 * - Enforce the order status state machine
 * - Forward new/cancel/modify commands to the venue connector
 * - Apply venue status updates (fills, cancels, rejects)
 *
 * LOCKING:
 * - registryLock guards the order map. Queries take it too, so every read
 *   sees a consistent snapshot.
 * - submissionLock serializes caller-initiated mutations with their
 *   command submission, so commands for one order reach the connector in
 *   the order the mutations happened. It is taken before registryLock and
 *   registryLock is always released before the connector is called.
 * - Listeners run with no lock held.
 */
public final class OrderManager {
    private static final Logger log = LoggerFactory.getLogger(OrderManager.class);

    private final VenueConnector connector;
    private final GatewayMetrics metrics;
    private final String venue;

    private final Object submissionLock = new Object();
    private final Object registryLock = new Object();
    private final Map<Long, OrderRecord> orders = new LinkedHashMap<>();
    private long nextOrderId = 1;

    private final List<Consumer<Order>> listeners = new CopyOnWriteArrayList<>();

    public OrderManager(VenueConnector connector, GatewayMetrics metrics) {
        this.connector = Objects.requireNonNull(connector, "connector");
        this.metrics = Objects.requireNonNull(metrics, "metrics");
        this.venue = Objects.requireNonNullElse(connector.getVenue(), "UNKNOWN");
    }

    // ═══════════════════════════════════════════════════════════════════════
    // CALLER OPERATIONS
    // ═══════════════════════════════════════════════════════════════════════

    /**
     * Create an order and send it to the venue.
     *
     * The order is always recorded. If the connector refuses the command
     * (not connected) the order is immediately REJECTED, so the outcome
     * can still be looked up by id.
     *
     * @return id of the new order
     * @throws IllegalArgumentException for a blank symbol, non-positive price or quantity, or null side
     */
    public long createOrder(String symbol, BigDecimal price, int quantity, Side side) {
        if (symbol == null || symbol.isBlank()) {
            throw new IllegalArgumentException("Symbol cannot be null or empty");
        }
        requireValidTerms(price, quantity);
        if (side == null) {
            throw new IllegalArgumentException("Side cannot be null");
        }

        Order created;
        Order rejected = null;
        synchronized (submissionLock) {
            synchronized (registryLock) {
                Instant now = Instant.now();
                OrderRecord record = new OrderRecord(nextOrderId++, symbol, side, price, quantity, now);
                orders.put(record.orderId, record);
                created = record.snapshot();
            }
            logOrder("CREATE", created);
            metrics.recordOrderAction(venue, "create");

            SubmissionResult result = connector.submitOrder(OutboundCommand.newOrder(created));
            if (!result.isAccepted()) {
                synchronized (registryLock) {
                    OrderRecord record = orders.get(created.orderId());
                    if (record.status == OrderStatus.PENDING) {
                        record.status = OrderStatus.REJECTED;
                        record.updatedAt = Instant.now();
                        rejected = record.snapshot();
                    }
                }
            }
        }

        if (rejected != null) {
            log.warn("[ORDER MANAGER] Order {} rejected: venue {} not connected", created.orderId(), venue);
            logOrder("REJECT", rejected);
            metrics.recordStatusUpdate(venue, OrderStatus.REJECTED);
            notifyListeners(rejected);
        } else {
            notifyListeners(created);
        }
        return created.orderId();
    }

    /**
     * Cancel an order. Legal only while PENDING or PARTIALLY_FILLED.
     *
     * @return OK, NOT_FOUND or NOT_CANCELABLE
     */
    public OrderActionResult cancelOrder(long orderId) {
        Order canceled;
        synchronized (submissionLock) {
            synchronized (registryLock) {
                OrderRecord record = orders.get(orderId);
                if (record == null) {
                    return stateError("CANCEL", orderId, OrderActionResult.NOT_FOUND, null);
                }
                if (!record.status.canTransitionTo(OrderStatus.CANCELED)) {
                    return stateError("CANCEL", orderId, OrderActionResult.NOT_CANCELABLE, record.status);
                }
                record.status = OrderStatus.CANCELED;
                record.updatedAt = Instant.now();
                canceled = record.snapshot();
            }
            submit(OutboundCommand.cancel(canceled));
        }

        logOrder("CANCEL", canceled);
        metrics.recordOrderAction(venue, "cancel");
        notifyListeners(canceled);
        return OrderActionResult.OK;
    }

    /**
     * Replace price and quantity of an order that has not started executing.
     * The order keeps its id.
     *
     * @return OK, NOT_FOUND or NOT_MODIFIABLE (anything other than PENDING)
     * @throws IllegalArgumentException for a non-positive price or quantity
     */
    public OrderActionResult modifyOrder(long orderId, BigDecimal newPrice, int newQuantity) {
        requireValidTerms(newPrice, newQuantity);

        Order modified;
        synchronized (submissionLock) {
            synchronized (registryLock) {
                OrderRecord record = orders.get(orderId);
                if (record == null) {
                    return stateError("MODIFY", orderId, OrderActionResult.NOT_FOUND, null);
                }
                if (record.status != OrderStatus.PENDING) {
                    return stateError("MODIFY", orderId, OrderActionResult.NOT_MODIFIABLE, record.status);
                }
                record.limitPrice = newPrice;
                record.requestedQuantity = newQuantity;
                record.updatedAt = Instant.now();
                modified = record.snapshot();
            }
            submit(OutboundCommand.modify(modified));
        }

        logOrder("MODIFY", modified);
        metrics.recordOrderAction(venue, "modify");
        notifyListeners(modified);
        return OrderActionResult.OK;
    }

    // ═══════════════════════════════════════════════════════════════════════
    // VENUE STATUS UPDATES
    // ═══════════════════════════════════════════════════════════════════════

    public OrderActionResult applyStatusUpdate(long orderId, OrderStatus newStatus, int filledDelta) {
        if (filledDelta < 0) {
            throw new IllegalArgumentException("Filled delta cannot be negative: " + filledDelta);
        }
        return applyStatusUpdate(new OrderStatusUpdate(orderId, newStatus, filledDelta, null, Instant.now()));
    }

    public OrderActionResult applyStatusUpdate(long orderId, OrderStatus newStatus) {
        return applyStatusUpdate(orderId, newStatus, 0);
    }

    /**
     * Apply a venue status event.
     *
     * A positive fill advances filledQuantity and yields PARTIALLY_FILLED or
     * FILLED. An explicit CANCELED applies its fill first and then cancels
     * the remainder, unless the fill completed the order. Updates against a
     * terminal order are stale and ignored. A fill beyond the requested
     * quantity is a data-integrity violation and is never clamped.
     */
    public OrderActionResult applyStatusUpdate(OrderStatusUpdate update) {
        Order applied;
        synchronized (registryLock) {
            OrderRecord record = orders.get(update.orderId());
            if (record == null) {
                return stateError("STATUS", update.orderId(), OrderActionResult.NOT_FOUND, null);
            }
            if (record.status.isTerminal()) {
                return stateError("STATUS", update.orderId(), OrderActionResult.STALE_UPDATE, record.status);
            }

            int delta = update.filledDelta();
            OrderStatus target;
            if (delta > 0) {
                if (update.status() == OrderStatus.REJECTED || update.status() == OrderStatus.PENDING) {
                    return stateError("STATUS", update.orderId(), OrderActionResult.INVALID_TRANSITION, record.status);
                }
                // Compared against the remainder so a huge delta cannot wrap the sum
                if (delta > record.requestedQuantity - record.filledQuantity) {
                    return dataIntegrityViolation(record, delta);
                }
                int newFilled = record.filledQuantity + delta;
                boolean complete = newFilled == record.requestedQuantity;
                if (complete) {
                    target = OrderStatus.FILLED;
                } else if (update.status() == OrderStatus.CANCELED) {
                    target = OrderStatus.CANCELED;
                } else {
                    target = OrderStatus.PARTIALLY_FILLED;
                }
                record.filledQuantity = newFilled;
            } else {
                target = update.status();
                boolean terminalWithoutFill = target == OrderStatus.CANCELED || target == OrderStatus.REJECTED;
                if (!terminalWithoutFill || !record.status.canTransitionTo(target)) {
                    return stateError("STATUS", update.orderId(), OrderActionResult.INVALID_TRANSITION, record.status);
                }
            }

            record.status = target;
            record.updatedAt = Instant.now();
            applied = record.snapshot();
        }

        if (applied.status() == OrderStatus.REJECTED) {
            log.warn("[ORDER MANAGER] Order {} rejected by venue: {}", applied.orderId(), update.reason());
        }
        logOrder("STATUS_UPDATE", applied);
        metrics.recordStatusUpdate(venue, applied.status());
        notifyListeners(applied);
        return OrderActionResult.OK;
    }

    /**
     * Drain the connector's order-status queue into this manager.
     *
     * @return number of updates that were applied
     */
    public int processPendingStatusUpdates() {
        int applied = 0;
        Optional<OrderStatusUpdate> next;
        while ((next = connector.nextOrderStatus()).isPresent()) {
            if (applyStatusUpdate(next.get()).isSuccess()) {
                applied++;
            }
        }
        return applied;
    }

    /**
     * Register a listener called after every change to an order. Listeners
     * run on the thread that made the change, with no lock held.
     */
    public void onOrderUpdate(Consumer<Order> listener) {
        listeners.add(Objects.requireNonNull(listener, "listener"));
    }

    // ═══════════════════════════════════════════════════════════════════════
    // QUERIES
    // ═══════════════════════════════════════════════════════════════════════

    public List<Order> activeOrders() {
        return select(OrderRecord::isActive);
    }

    public List<Order> filledOrders() {
        return select(r -> r.status == OrderStatus.FILLED);
    }

    public List<Order> allOrders() {
        return select(r -> true);
    }

    public boolean isActive(long orderId) {
        synchronized (registryLock) {
            OrderRecord record = orders.get(orderId);
            return record != null && record.isActive();
        }
    }

    public Optional<Order> getOrder(long orderId) {
        synchronized (registryLock) {
            OrderRecord record = orders.get(orderId);
            return record == null ? Optional.empty() : Optional.of(record.snapshot());
        }
    }

    /**
     * Log every order and return the snapshots, in id order.
     */
    public List<Order> orderSummary() {
        List<Order> all = allOrders();
        log.info("[ORDER MANAGER] ═══ Order summary: {} orders ({} active, {} filled) ═══",
            all.size(),
            all.stream().filter(Order::isActive).count(),
            all.stream().filter(o -> o.status() == OrderStatus.FILLED).count());
        for (Order order : all) {
            logOrder("SUMMARY", order);
        }
        return all;
    }

    // ═══════════════════════════════════════════════════════════════════════
    // INTERNALS
    // ═══════════════════════════════════════════════════════════════════════

    private List<Order> select(Predicate<OrderRecord> filter) {
        synchronized (registryLock) {
            List<Order> result = new ArrayList<>();
            for (OrderRecord record : orders.values()) {
                if (filter.test(record)) {
                    result.add(record.snapshot());
                }
            }
            return result;
        }
    }

    private void submit(OutboundCommand command) {
        if (!connector.submitOrder(command).isAccepted()) {
            log.warn("[ORDER MANAGER] {} for order {} not sent: venue {} not connected",
                command.type(), command.orderId(), venue);
        }
    }

    private static void requireValidTerms(BigDecimal price, int quantity) {
        if (price == null || price.signum() <= 0) {
            throw new IllegalArgumentException("Price must be positive: " + price);
        }
        if (quantity <= 0) {
            throw new IllegalArgumentException("Quantity must be positive: " + quantity);
        }
    }

    private OrderActionResult stateError(String action, long orderId, OrderActionResult error, OrderStatus current) {
        log.warn("[ORDER MANAGER] {} on order {} refused: {} (status={})", action, orderId, error, current);
        metrics.recordStateError(venue, error);
        return error;
    }

    private OrderActionResult dataIntegrityViolation(OrderRecord record, int delta) {
        log.error("[ORDER MANAGER] ❌ DATA INTEGRITY: fill of {} on order {} exceeds requested quantity " +
                "(filled={}, requested={}), update not applied",
            delta, record.orderId, record.filledQuantity, record.requestedQuantity);
        metrics.recordDataIntegrityError(venue);
        return OrderActionResult.DATA_INTEGRITY_VIOLATION;
    }

    private void notifyListeners(Order order) {
        for (Consumer<Order> listener : listeners) {
            try {
                listener.accept(order);
            } catch (RuntimeException e) {
                log.warn("[ORDER MANAGER] Order listener failed for order {}", order.orderId(), e);
            }
        }
    }

    private void logOrder(String action, Order order) {
        log.info("[ORDER MANAGER] Action: {}, Order ID: {}, Symbol: {}, Side: {}, Price: {}, Quantity: {}, " +
                "Filled Quantity: {}, Status: {}, Timestamp: {}",
            action, order.orderId(), order.symbol(), order.side(), order.limitPrice().toPlainString(),
            order.requestedQuantity(), order.filledQuantity(), order.status(), order.createdAt());
    }

    /**
     * Live, mutable order state. Only touched while holding registryLock.
     */
    private static final class OrderRecord {
        private final long orderId;
        private final String symbol;
        private final Side side;
        private final Instant createdAt;
        private BigDecimal limitPrice;
        private int requestedQuantity;
        private int filledQuantity;
        private OrderStatus status = OrderStatus.PENDING;
        private Instant updatedAt;

        private OrderRecord(long orderId, String symbol, Side side, BigDecimal limitPrice,
                            int requestedQuantity, Instant createdAt) {
            this.orderId = orderId;
            this.symbol = symbol;
            this.side = side;
            this.limitPrice = limitPrice;
            this.requestedQuantity = requestedQuantity;
            this.createdAt = createdAt;
            this.updatedAt = createdAt;
        }

        private boolean isActive() {
            return status.isActive();
        }

        private Order snapshot() {
            return new Order(orderId, symbol, side, limitPrice, requestedQuantity,
                filledQuantity, status, createdAt, updatedAt);
        }
    }
}
