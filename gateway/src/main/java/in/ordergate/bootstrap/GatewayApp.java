package in.ordergate.bootstrap;

import ch.qos.logback.classic.LoggerContext;
import in.ordergate.config.GatewayConfig;
import in.ordergate.domain.order.Order;
import in.ordergate.domain.order.Side;
import in.ordergate.infrastructure.metrics.PrometheusGatewayMetrics;
import in.ordergate.infrastructure.venue.GatewayConfigurationException;
import in.ordergate.infrastructure.venue.MarketDataMessage;
import in.ordergate.infrastructure.venue.VenueConnectException;
import in.ordergate.infrastructure.venue.VenueConnector;
import in.ordergate.service.order.OrderManager;
import in.ordergate.service.order.OrderStatusPump;
import in.ordergate.util.Env;
import org.slf4j.ILoggerFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigDecimal;
import java.time.Duration;
import java.time.Instant;
import java.util.Optional;

/**
 * Gateway process entry point.
 *
 * Wires config, metrics, connector, order manager and status pump, runs a
 * short order flow against the configured venue and shuts everything down
 * in reverse order. Without VENUE_PROTOCOL the in-process paper venue is
 * used.
 */
public final class GatewayApp {
    private static final Logger log = LoggerFactory.getLogger(GatewayApp.class);

    private static final Duration SETTLE_TIMEOUT = Duration.ofSeconds(5);

    public static void main(String[] args) {
        log.info("═══════════════════════════════════════════════════════════════");
        log.info("=== Order Gateway Starting ===");
        log.info("═══════════════════════════════════════════════════════════════");

        int exitCode = 0;
        try {
            exitCode = run();
        } finally {
            stopLogging();
        }
        if (exitCode != 0) {
            System.exit(exitCode);
        }
    }

    private static int run() {
        // ═══════════════════════════════════════════════════════════════
        // Configuration
        // ═══════════════════════════════════════════════════════════════
        GatewayConfig config;
        try {
            if (Env.get("VENUE_PROTOCOL", null) == null) {
                log.info("[APP] VENUE_PROTOCOL not set, using paper venue");
                config = GatewayConfig.paper(Env.get("VENUE_NAME", GatewayConfig.DEFAULT_VENUE));
            } else {
                config = GatewayConfig.fromEnv();
            }
        } catch (GatewayConfigurationException e) {
            log.error("[APP] ❌ Invalid configuration: {}", e.getMessage());
            return 1;
        }
        log.info("[APP] Venue={} protocol={} endpoint={}", config.venueName(), config.protocol(), config.endpoint());

        // ═══════════════════════════════════════════════════════════════
        // Prometheus Metrics
        // ═══════════════════════════════════════════════════════════════
        PrometheusGatewayMetrics metrics = new PrometheusGatewayMetrics();
        log.info("✓ Prometheus metrics initialized");

        // ═══════════════════════════════════════════════════════════════
        // Connector, Order Manager, Status Pump
        // ═══════════════════════════════════════════════════════════════
        VenueConnector connector;
        try {
            connector = new VenueConnector(config, metrics);
        } catch (GatewayConfigurationException e) {
            log.error("[APP] ❌ Cannot build connector: {}", e.getMessage());
            return 1;
        }
        OrderManager orderManager = new OrderManager(connector, metrics);
        OrderStatusPump statusPump = new OrderStatusPump(orderManager, config.statusPumpInterval());

        connector.subscribeMarketData("AAPL");
        connector.subscribeMarketData("GOOG");

        // ═══════════════════════════════════════════════════════════════
        // Connect
        // ═══════════════════════════════════════════════════════════════
        try {
            connector.connect(config.connectTimeout(), config.reconnectionPolicy());
        } catch (VenueConnectException e) {
            log.error("[APP] ❌ Could not connect to {}: {}", config.venueName(), e.getMessage());
            return 2;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("[APP] Interrupted while connecting");
            return 2;
        }
        statusPump.start();

        // ═══════════════════════════════════════════════════════════════
        // Order flow
        // ═══════════════════════════════════════════════════════════════
        try {
            long order1 = orderManager.createOrder("AAPL", new BigDecimal("150.50"), 100, Side.BUY);
            long order2 = orderManager.createOrder("GOOG", new BigDecimal("2725.00"), 50, Side.SELL);

            orderManager.modifyOrder(order1, new BigDecimal("151.00"), 100);
            orderManager.cancelOrder(order2);

            awaitSettled(orderManager, order1);
            logMarketData(connector);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("[APP] Interrupted during order flow");
        } finally {
            // ═══════════════════════════════════════════════════════════
            // Shutdown (reverse order)
            // ═══════════════════════════════════════════════════════════
            statusPump.stop();
            connector.disconnect();
            orderManager.orderSummary();
        }

        log.info("[APP] ✅ Gateway stopped");
        return 0;
    }

    private static void awaitSettled(OrderManager orderManager, long orderId) throws InterruptedException {
        Instant deadline = Instant.now().plus(SETTLE_TIMEOUT);
        while (orderManager.isActive(orderId) && Instant.now().isBefore(deadline)) {
            Thread.sleep(50);
        }
        Optional<Order> order = orderManager.getOrder(orderId);
        order.ifPresent(o -> log.info("[APP] Order {} settled as {} ({}/{})",
            o.orderId(), o.status(), o.filledQuantity(), o.requestedQuantity()));
    }

    private static void logMarketData(VenueConnector connector) {
        int count = 0;
        Optional<MarketDataMessage> tick;
        while ((tick = connector.nextMarketData()).isPresent()) {
            count++;
            log.debug("[APP] Tick: {}", tick.get().payload());
        }
        log.info("[APP] Received {} market data messages", count);
    }

    /**
     * Flush and stop the async log writer.
     */
    private static void stopLogging() {
        ILoggerFactory factory = LoggerFactory.getILoggerFactory();
        if (factory instanceof LoggerContext) {
            ((LoggerContext) factory).stop();
        }
    }

    private GatewayApp() {}
}
