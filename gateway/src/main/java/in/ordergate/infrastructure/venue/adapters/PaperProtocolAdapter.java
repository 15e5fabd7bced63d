package in.ordergate.infrastructure.venue.adapters;

import in.ordergate.domain.order.OrderStatus;
import in.ordergate.domain.order.OrderStatusUpdate;
import in.ordergate.infrastructure.venue.OrderSendException;
import in.ordergate.infrastructure.venue.OutboundCommand;
import in.ordergate.infrastructure.venue.ProtocolAdapter;
import in.ordergate.infrastructure.venue.ProtocolType;
import in.ordergate.infrastructure.venue.VenueConnectException;
import in.ordergate.infrastructure.venue.VenueCredentials;
import in.ordergate.infrastructure.venue.VenueDisconnectException;
import in.ordergate.infrastructure.venue.VenueIoException;
import in.ordergate.infrastructure.venue.codec.JsonVenueCodec;
import in.ordergate.infrastructure.venue.codec.MalformedMessageException;
import in.ordergate.infrastructure.venue.codec.VenueCodec;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Optional;
import java.util.Random;
import java.util.Set;

/**
 * In-process simulated venue speaking the JSON codec.
 *
 * Resting orders are worked on the status poll: after {@code fillAfterPolls}
 * polls an order receives half its remaining quantity as a partial fill
 * (when partial fills are enabled) and the rest on the following step.
 * Cancels and modifies apply to resting orders; modifies restart the fill
 * countdown. Subscribed symbols receive a random-walk tick every
 * {@code tickEveryPolls} market-data polls.
 */
public final class PaperProtocolAdapter implements ProtocolAdapter {
    private static final Logger log = LoggerFactory.getLogger(PaperProtocolAdapter.class);

    private static final BigDecimal HALF_SPREAD = new BigDecimal("0.05");

    private final String venue;
    private final JsonVenueCodec codec;
    private final int fillAfterPolls;
    private final boolean partialFills;
    private final int tickEveryPolls;
    private final Random random;

    private final Map<Long, RestingOrder> restingOrders = new LinkedHashMap<>();
    private final Deque<String> statusMessages = new ArrayDeque<>();
    private final Set<String> subscriptions = new LinkedHashSet<>();
    private final Map<String, BigDecimal> lastPrices = new LinkedHashMap<>();
    private boolean connected;
    private long marketDataPolls;

    public PaperProtocolAdapter(String venue) {
        this(venue, new JsonVenueCodec(), 50, true, 100, new Random());
    }

    public PaperProtocolAdapter(String venue, JsonVenueCodec codec, int fillAfterPolls,
                                boolean partialFills, int tickEveryPolls, Random random) {
        if (fillAfterPolls < 0) {
            throw new IllegalArgumentException("fillAfterPolls cannot be negative");
        }
        if (tickEveryPolls <= 0) {
            throw new IllegalArgumentException("tickEveryPolls must be positive");
        }
        this.venue = venue;
        this.codec = codec;
        this.fillAfterPolls = fillAfterPolls;
        this.partialFills = partialFills;
        this.tickEveryPolls = tickEveryPolls;
        this.random = random;
    }

    // ═══════════════════════════════════════════════════════════════════════
    // LIFECYCLE
    // ═══════════════════════════════════════════════════════════════════════

    @Override
    public void connect(VenueCredentials credentials) throws VenueConnectException {
        log.info("[PAPER VENUE] Session opened for {} on {}", credentials, venue);
        connected = true;
    }

    @Override
    public void disconnect() throws VenueDisconnectException {
        if (!connected) {
            return;
        }
        connected = false;
        // Resting orders survive a reconnect; queued reports do not
        statusMessages.clear();
        log.info("[PAPER VENUE] Session closed on {} ({} resting orders)", venue, restingOrders.size());
    }

    // ═══════════════════════════════════════════════════════════════════════
    // TRAFFIC
    // ═══════════════════════════════════════════════════════════════════════

    @Override
    public void sendOrder(String serializedOrder) throws OrderSendException {
        if (!connected) {
            throw new OrderSendException(venue, "Paper session is not open");
        }
        OutboundCommand command;
        try {
            command = codec.decodeCommand(serializedOrder);
        } catch (MalformedMessageException e) {
            throw new OrderSendException(venue, "Unreadable command: " + e.getMessage(), e);
        }

        switch (command.type()) {
            case NEW -> {
                restingOrders.put(command.orderId(), new RestingOrder(command, fillAfterPolls));
                lastPrices.putIfAbsent(command.symbol(), command.price());
                log.debug("[PAPER VENUE] Accepted order {} {} {}@{}", command.orderId(),
                    command.side(), command.quantity(), command.price());
            }
            case CANCEL -> {
                RestingOrder resting = restingOrders.remove(command.orderId());
                if (resting != null) {
                    report(command.orderId(), OrderStatus.CANCELED, 0, "Canceled by client");
                } else {
                    log.debug("[PAPER VENUE] Cancel for unknown or completed order {}", command.orderId());
                }
            }
            case MODIFY -> {
                RestingOrder resting = restingOrders.get(command.orderId());
                if (resting == null) {
                    throw new OrderSendException(venue, "Order " + command.orderId() + " is not resting");
                }
                if (command.quantity() <= resting.filled) {
                    throw new OrderSendException(venue, "Order " + command.orderId()
                        + " already filled " + resting.filled + ", cannot resize to " + command.quantity());
                }
                resting.replace(command, fillAfterPolls);
            }
        }
    }

    @Override
    public void subscribe(Set<String> symbols) throws VenueIoException {
        requireOpen();
        subscriptions.addAll(symbols);
        log.info("[PAPER VENUE] Subscribed to {}", symbols);
    }

    @Override
    public Optional<String> pollMarketData() throws VenueIoException {
        requireOpen();
        marketDataPolls++;
        if (subscriptions.isEmpty() || marketDataPolls % tickEveryPolls != 0) {
            return Optional.empty();
        }
        String symbol = subscriptions.stream()
            .skip(random.nextInt(subscriptions.size()))
            .findFirst()
            .orElseThrow();
        BigDecimal last = nextPrice(symbol);
        return Optional.of(codec.marketData(symbol, last.subtract(HALF_SPREAD), last.add(HALF_SPREAD),
            last, System.currentTimeMillis()));
    }

    @Override
    public Optional<String> pollOrderStatus() throws VenueIoException {
        requireOpen();
        workRestingOrders();
        return Optional.ofNullable(statusMessages.pollFirst());
    }

    @Override
    public VenueCodec codec() {
        return codec;
    }

    @Override
    public ProtocolType protocol() {
        return ProtocolType.PAPER;
    }

    @Override
    public String venue() {
        return venue;
    }

    public int getRestingOrderCount() {
        return restingOrders.size();
    }

    // ═══════════════════════════════════════════════════════════════════════
    // SIMULATION
    // ═══════════════════════════════════════════════════════════════════════

    private void workRestingOrders() {
        Iterator<RestingOrder> it = restingOrders.values().iterator();
        while (it.hasNext()) {
            RestingOrder resting = it.next();
            if (resting.pollsUntilFill > 0) {
                resting.pollsUntilFill--;
                continue;
            }
            int remaining = resting.quantity - resting.filled;
            if (partialFills && resting.filled == 0 && remaining > 1) {
                int partial = remaining / 2;
                resting.filled += partial;
                resting.pollsUntilFill = fillAfterPolls;
                report(resting.orderId, OrderStatus.PARTIALLY_FILLED, partial, null);
            } else {
                resting.filled += remaining;
                it.remove();
                report(resting.orderId, OrderStatus.FILLED, remaining, null);
            }
        }
    }

    private void report(long orderId, OrderStatus status, int lastQuantity, String reason) {
        statusMessages.addLast(codec.encodeStatus(
            new OrderStatusUpdate(orderId, status, lastQuantity, reason, null)));
    }

    private BigDecimal nextPrice(String symbol) {
        BigDecimal last = lastPrices.getOrDefault(symbol, new BigDecimal("100.00"));
        // ±0.1% step
        double step = (random.nextDouble() - 0.5) * 0.002;
        BigDecimal next = last.multiply(BigDecimal.valueOf(1.0 + step)).setScale(2, RoundingMode.HALF_UP);
        lastPrices.put(symbol, next);
        return next;
    }

    private void requireOpen() throws VenueIoException {
        if (!connected) {
            throw new VenueIoException(venue, "Paper session is not open");
        }
    }

    private static final class RestingOrder {
        private final long orderId;
        private int quantity;
        private int filled;
        private int pollsUntilFill;

        private RestingOrder(OutboundCommand command, int fillAfterPolls) {
            this.orderId = command.orderId();
            this.quantity = command.quantity();
            this.pollsUntilFill = fillAfterPolls;
        }

        private void replace(OutboundCommand command, int fillAfterPolls) {
            this.quantity = command.quantity();
            this.pollsUntilFill = fillAfterPolls;
        }
    }
}
