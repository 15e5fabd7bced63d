package in.ordergate.config;

import in.ordergate.infrastructure.venue.GatewayConfigurationException;
import in.ordergate.infrastructure.venue.ProtocolType;
import in.ordergate.infrastructure.venue.VenueCredentials;
import in.ordergate.infrastructure.venue.common.ReconnectionPolicy;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Config is read through system properties here; Env falls back to them
 * when the environment variable is absent.
 */
class GatewayConfigTest {

    private static final List<String> KEYS = List.of(
        "VENUE_NAME", "VENUE_PROTOCOL", "VENUE_ENDPOINT", "VENUE_API_KEY", "VENUE_SECRET_KEY",
        "VENUE_SENDER_COMP_ID", "VENUE_TARGET_COMP_ID", "CONNECT_TIMEOUT_MS", "POLL_INTERVAL_MS",
        "MARKET_DATA_QUEUE_CAPACITY", "RECONNECT_MAX_ATTEMPTS");

    @AfterEach
    void clearProperties() {
        KEYS.forEach(System::clearProperty);
    }

    @Test
    void testFromEnvWithDefaults() {
        System.setProperty("VENUE_PROTOCOL", "fix");
        System.setProperty("VENUE_ENDPOINT", "fix.example.com:9876");
        System.setProperty("VENUE_API_KEY", "key");
        System.setProperty("VENUE_SECRET_KEY", "secret");

        GatewayConfig config = GatewayConfig.fromEnv();

        assertEquals(GatewayConfig.DEFAULT_VENUE, config.venueName());
        assertEquals(ProtocolType.FIX, config.protocol());
        assertEquals("fix.example.com:9876", config.endpoint());
        assertEquals(GatewayConfig.DEFAULT_SENDER_COMP_ID, config.senderCompId());
        assertEquals(GatewayConfig.DEFAULT_VENUE, config.targetCompId());
        assertEquals(Duration.ofMillis(5000), config.connectTimeout());
        assertEquals(Duration.ofMillis(1000), config.sendTimeout());
        assertEquals(Duration.ofMillis(10), config.pollInterval());
        assertEquals(10_000, config.marketDataQueueCapacity());
        assertEquals(Duration.ofMillis(50), config.statusPumpInterval());
        assertEquals(5, config.reconnectMaxAttempts());
    }

    @Test
    void testFromEnvOverrides() {
        System.setProperty("VENUE_NAME", "NSE");
        System.setProperty("VENUE_PROTOCOL", "ws");
        System.setProperty("VENUE_ENDPOINT", "wss://stream.example.com/orders");
        System.setProperty("VENUE_API_KEY", "key");
        System.setProperty("VENUE_SECRET_KEY", "secret");
        System.setProperty("POLL_INTERVAL_MS", "25");
        System.setProperty("MARKET_DATA_QUEUE_CAPACITY", "64");

        GatewayConfig config = GatewayConfig.fromEnv();

        assertEquals("NSE", config.venueName());
        assertEquals(ProtocolType.WEBSOCKET, config.protocol());
        assertEquals(Duration.ofMillis(25), config.pollInterval());
        assertEquals(64, config.marketDataQueueCapacity());
    }

    @Test
    void testMissingProtocolIsConfigurationError() {
        System.setProperty("VENUE_API_KEY", "key");
        System.setProperty("VENUE_SECRET_KEY", "secret");

        assertThrows(GatewayConfigurationException.class, GatewayConfig::fromEnv);
    }

    @Test
    void testUnknownProtocolIsConfigurationError() {
        System.setProperty("VENUE_PROTOCOL", "SMOKE_SIGNALS");
        System.setProperty("VENUE_API_KEY", "key");
        System.setProperty("VENUE_SECRET_KEY", "secret");

        GatewayConfigurationException e = assertThrows(GatewayConfigurationException.class, GatewayConfig::fromEnv);
        assertTrue(e.getMessage().contains("SMOKE_SIGNALS"));
    }

    @Test
    void testMissingCredentialsIsConfigurationError() {
        System.setProperty("VENUE_PROTOCOL", "PAPER");

        assertThrows(GatewayConfigurationException.class, GatewayConfig::fromEnv);
    }

    @Test
    void testEndpointRequiredForNetworkProtocols() {
        System.setProperty("VENUE_PROTOCOL", "FIX");
        System.setProperty("VENUE_API_KEY", "key");
        System.setProperty("VENUE_SECRET_KEY", "secret");

        assertThrows(GatewayConfigurationException.class, GatewayConfig::fromEnv);
    }

    @Test
    void testNonPositiveValuesRejected() {
        GatewayConfig paper = GatewayConfig.paper("P");

        assertThrows(GatewayConfigurationException.class, () -> new GatewayConfig(
            "P", ProtocolType.PAPER, null, paper.credentials(), "S", "T",
            Duration.ZERO, paper.sendTimeout(), paper.pollInterval(), 10,
            paper.statusPumpInterval(), 1, paper.reconnectInitialDelay()));
        assertThrows(GatewayConfigurationException.class, () -> new GatewayConfig(
            "P", ProtocolType.PAPER, null, paper.credentials(), "S", "T",
            paper.connectTimeout(), paper.sendTimeout(), paper.pollInterval(), 0,
            paper.statusPumpInterval(), 1, paper.reconnectInitialDelay()));
    }

    @Test
    void testCredentialsAreMaskedInToString() {
        VenueCredentials credentials = new VenueCredentials("abcdef123456", "topsecretvalue");

        assertFalse(credentials.toString().contains("topsecretvalue"));
        assertFalse(credentials.toString().contains("abcdef123456"));
    }

    @Test
    void testReconnectionPolicyFromConfig() {
        ReconnectionPolicy policy = GatewayConfig.paper("P").reconnectionPolicy();

        assertEquals(5, policy.getMaxAttempts());
        assertEquals(Duration.ofMillis(500), policy.getNextDelay());
    }
}
