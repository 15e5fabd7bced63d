package in.ordergate.config;

import in.ordergate.infrastructure.venue.GatewayConfigurationException;
import in.ordergate.infrastructure.venue.ProtocolType;
import in.ordergate.infrastructure.venue.VenueCredentials;
import in.ordergate.infrastructure.venue.common.ReconnectionPolicy;
import in.ordergate.util.Env;

import java.time.Duration;

/**
 * Gateway configuration for a single venue link.
 *
 * Loaded once at startup via {@link #fromEnv()}; every value is validated
 * here so a bad setting fails the process before any thread starts.
 */
public record GatewayConfig(
    String venueName,
    ProtocolType protocol,
    String endpoint,
    VenueCredentials credentials,
    String senderCompId,
    String targetCompId,
    Duration connectTimeout,
    Duration sendTimeout,
    Duration pollInterval,
    int marketDataQueueCapacity,
    Duration statusPumpInterval,
    int reconnectMaxAttempts,
    Duration reconnectInitialDelay
) {
    public static final String DEFAULT_VENUE = "VENUE";
    public static final String DEFAULT_SENDER_COMP_ID = "ORDERGATE";
    private static final Duration MAX_RECONNECT_DELAY = Duration.ofSeconds(30);

    public GatewayConfig {
        if (venueName == null || venueName.isBlank()) {
            throw new GatewayConfigurationException("Venue name cannot be empty");
        }
        if (protocol == null) {
            throw new GatewayConfigurationException("Protocol must be specified");
        }
        if (credentials == null) {
            throw new GatewayConfigurationException("Credentials must be specified");
        }
        if (protocol != ProtocolType.PAPER && (endpoint == null || endpoint.isBlank())) {
            throw new GatewayConfigurationException("Endpoint is required for protocol " + protocol);
        }
        if (protocol == ProtocolType.FIX
                && (senderCompId == null || senderCompId.isBlank() || targetCompId == null || targetCompId.isBlank())) {
            throw new GatewayConfigurationException("FIX requires SenderCompID and TargetCompID");
        }
        requirePositive("Connect timeout", connectTimeout);
        requirePositive("Send timeout", sendTimeout);
        requirePositive("Poll interval", pollInterval);
        requirePositive("Status pump interval", statusPumpInterval);
        requirePositive("Reconnect initial delay", reconnectInitialDelay);
        if (marketDataQueueCapacity <= 0) {
            throw new GatewayConfigurationException("Market data queue capacity must be positive: " + marketDataQueueCapacity);
        }
        if (reconnectMaxAttempts <= 0) {
            throw new GatewayConfigurationException("Reconnect max attempts must be positive: " + reconnectMaxAttempts);
        }
    }

    public static GatewayConfig fromEnv() {
        String venueName = Env.get("VENUE_NAME", DEFAULT_VENUE);
        ProtocolType protocol = ProtocolType.fromName(Env.get("VENUE_PROTOCOL", null));
        VenueCredentials credentials = new VenueCredentials(
            Env.get("VENUE_API_KEY", null),
            Env.get("VENUE_SECRET_KEY", null));

        return new GatewayConfig(
            venueName,
            protocol,
            Env.get("VENUE_ENDPOINT", null),
            credentials,
            Env.get("VENUE_SENDER_COMP_ID", DEFAULT_SENDER_COMP_ID),
            Env.get("VENUE_TARGET_COMP_ID", venueName),
            Env.getMillis("CONNECT_TIMEOUT_MS", 5000),
            Env.getMillis("SEND_TIMEOUT_MS", 1000),
            Env.getMillis("POLL_INTERVAL_MS", 10),
            Env.getInt("MARKET_DATA_QUEUE_CAPACITY", 10_000),
            Env.getMillis("STATUS_PUMP_INTERVAL_MS", 50),
            Env.getInt("RECONNECT_MAX_ATTEMPTS", 5),
            Env.getMillis("RECONNECT_INITIAL_DELAY_MS", 500));
    }

    /**
     * Paper venue with default timings, used by demo mode and tests.
     */
    public static GatewayConfig paper(String venueName) {
        return new GatewayConfig(
            venueName, ProtocolType.PAPER, null,
            new VenueCredentials("paper-key", "paper-secret"),
            DEFAULT_SENDER_COMP_ID, venueName,
            Duration.ofSeconds(5), Duration.ofSeconds(1), Duration.ofMillis(10),
            10_000, Duration.ofMillis(50), 5, Duration.ofMillis(500));
    }

    public ReconnectionPolicy reconnectionPolicy() {
        Duration maxDelay = reconnectInitialDelay.compareTo(MAX_RECONNECT_DELAY) > 0
            ? reconnectInitialDelay
            : MAX_RECONNECT_DELAY;
        return ReconnectionPolicy.builder()
            .initialDelay(reconnectInitialDelay)
            .maxDelay(maxDelay)
            .maxAttempts(reconnectMaxAttempts)
            .build();
    }

    private static void requirePositive(String name, Duration value) {
        if (value == null || value.isZero() || value.isNegative()) {
            throw new GatewayConfigurationException(name + " must be positive: " + value);
        }
    }
}
