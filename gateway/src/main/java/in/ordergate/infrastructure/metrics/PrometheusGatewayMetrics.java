package in.ordergate.infrastructure.metrics;

import in.ordergate.domain.order.OrderActionResult;
import in.ordergate.domain.order.OrderStatus;
import in.ordergate.infrastructure.venue.CommandType;
import io.prometheus.client.CollectorRegistry;
import io.prometheus.client.Counter;
import io.prometheus.client.Gauge;
import io.prometheus.client.Histogram;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;

/**
 * Prometheus implementation of GatewayMetrics.
 *
 * Key Metrics:
 * - gateway_orders_total{venue, action}
 * - gateway_order_status_updates_total{venue, status}
 * - gateway_state_errors_total{venue, error}
 * - gateway_data_integrity_errors_total{venue}
 * - gateway_commands_sent_total{venue, type} / gateway_command_send_failures_total{venue, type}
 * - gateway_command_send_latency_seconds{venue}
 * - gateway_connection_events_total{venue, event}, gateway_connection_status{venue}
 * - gateway_market_data_messages_total{venue}, gateway_market_data_dropped_total{venue}
 */
public class PrometheusGatewayMetrics implements GatewayMetrics {
    private static final Logger log = LoggerFactory.getLogger(PrometheusGatewayMetrics.class);

    private final CollectorRegistry registry;

    // Order metrics
    private final Counter orderCounter;
    private final Counter statusUpdateCounter;
    private final Counter stateErrorCounter;
    private final Counter dataIntegrityCounter;

    // Command delivery metrics
    private final Counter commandSentCounter;
    private final Counter commandFailureCounter;
    private final Histogram commandLatency;

    // Connection metrics
    private final Counter connectionEventCounter;
    private final Gauge connectionStatus;

    // Market data metrics
    private final Counter marketDataCounter;
    private final Counter marketDataDroppedCounter;

    public PrometheusGatewayMetrics() {
        this(CollectorRegistry.defaultRegistry);
    }

    public PrometheusGatewayMetrics(CollectorRegistry registry) {
        this.registry = registry;

        this.orderCounter = Counter.build()
            .name("gateway_orders_total")
            .help("Total number of accepted order actions")
            .labelNames("venue", "action")
            .register(registry);

        this.statusUpdateCounter = Counter.build()
            .name("gateway_order_status_updates_total")
            .help("Total number of applied order status updates")
            .labelNames("venue", "status")
            .register(registry);

        this.stateErrorCounter = Counter.build()
            .name("gateway_state_errors_total")
            .help("Total number of refused order operations")
            .labelNames("venue", "error")
            .register(registry);

        this.dataIntegrityCounter = Counter.build()
            .name("gateway_data_integrity_errors_total")
            .help("Total number of fills exceeding requested quantity")
            .labelNames("venue")
            .register(registry);

        this.commandSentCounter = Counter.build()
            .name("gateway_commands_sent_total")
            .help("Total number of commands delivered to the venue")
            .labelNames("venue", "type")
            .register(registry);

        this.commandFailureCounter = Counter.build()
            .name("gateway_command_send_failures_total")
            .help("Total number of commands the venue did not accept")
            .labelNames("venue", "type")
            .register(registry);

        this.commandLatency = Histogram.build()
            .name("gateway_command_send_latency_seconds")
            .help("Time from enqueue to delivery in seconds")
            .labelNames("venue")
            .buckets(0.001, 0.005, 0.01, 0.05, 0.1, 0.5, 1.0, 5.0)
            .register(registry);

        this.connectionEventCounter = Counter.build()
            .name("gateway_connection_events_total")
            .help("Total number of connection lifecycle events")
            .labelNames("venue", "event")
            .register(registry);

        this.connectionStatus = Gauge.build()
            .name("gateway_connection_status")
            .help("Current connection status (1=connected, 0=not connected)")
            .labelNames("venue")
            .register(registry);

        this.marketDataCounter = Counter.build()
            .name("gateway_market_data_messages_total")
            .help("Total number of market-data messages received")
            .labelNames("venue")
            .register(registry);

        this.marketDataDroppedCounter = Counter.build()
            .name("gateway_market_data_dropped_total")
            .help("Market-data messages dropped because the inbound queue was full")
            .labelNames("venue")
            .register(registry);

        log.info("[METRICS] Prometheus gateway metrics registered");
    }

    @Override
    public void recordOrderAction(String venue, String action) {
        orderCounter.labels(venue, action).inc();
    }

    @Override
    public void recordStatusUpdate(String venue, OrderStatus status) {
        statusUpdateCounter.labels(venue, status.name()).inc();
    }

    @Override
    public void recordStateError(String venue, OrderActionResult error) {
        stateErrorCounter.labels(venue, error.name()).inc();
    }

    @Override
    public void recordDataIntegrityError(String venue) {
        dataIntegrityCounter.labels(venue).inc();
    }

    @Override
    public void recordCommandSent(String venue, CommandType type, Duration latency) {
        commandSentCounter.labels(venue, type.name()).inc();
        commandLatency.labels(venue).observe(latency.toNanos() / 1_000_000_000.0);
    }

    @Override
    public void recordCommandFailure(String venue, CommandType type) {
        commandFailureCounter.labels(venue, type.name()).inc();
    }

    @Override
    public void recordConnectionEvent(String venue, ConnectionEvent event) {
        connectionEventCounter.labels(venue, event.name()).inc();

        if (event == ConnectionEvent.CONNECTED) {
            connectionStatus.labels(venue).set(1);
        } else if (event != ConnectionEvent.CONNECTING) {
            connectionStatus.labels(venue).set(0);
        }
    }

    @Override
    public void recordMarketDataMessage(String venue) {
        marketDataCounter.labels(venue).inc();
    }

    @Override
    public void recordMarketDataDropped(String venue) {
        marketDataDroppedCounter.labels(venue).inc();
    }

    public CollectorRegistry getRegistry() {
        return registry;
    }
}
