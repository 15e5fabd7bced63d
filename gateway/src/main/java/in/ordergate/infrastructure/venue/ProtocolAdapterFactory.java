package in.ordergate.infrastructure.venue;

import in.ordergate.config.GatewayConfig;
import in.ordergate.infrastructure.venue.adapters.FixProtocolAdapter;
import in.ordergate.infrastructure.venue.adapters.PaperProtocolAdapter;
import in.ordergate.infrastructure.venue.adapters.WebSocketProtocolAdapter;
import in.ordergate.infrastructure.venue.codec.FixCodec;
import in.ordergate.infrastructure.venue.codec.JsonVenueCodec;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.URI;
import java.net.URISyntaxException;
import java.util.Locale;

/**
 * Factory for protocol adapters.
 *
 * Selection happens once, when the connector is built. A protocol or
 * endpoint the factory cannot handle is a configuration error reported
 * here rather than on the first connect.
 */
public final class ProtocolAdapterFactory {
    private static final Logger log = LoggerFactory.getLogger(ProtocolAdapterFactory.class);

    private static final int DEFAULT_HEARTBEAT_SECONDS = 30;

    public static ProtocolAdapter create(GatewayConfig config) {
        ProtocolAdapter adapter = switch (config.protocol()) {
            case FIX -> createFix(config);
            case WEBSOCKET -> createWebSocket(config);
            case PAPER -> new PaperProtocolAdapter(config.venueName());
        };
        log.info("[FACTORY] ✅ Using {} adapter for venue {}", adapter.protocol(), config.venueName());
        return adapter;
    }

    private static ProtocolAdapter createFix(GatewayConfig config) {
        String endpoint = config.endpoint().trim();
        int colon = endpoint.lastIndexOf(':');
        if (colon <= 0 || colon == endpoint.length() - 1) {
            throw new GatewayConfigurationException("FIX endpoint must be host:port, got: " + endpoint);
        }
        String host = endpoint.substring(0, colon);
        int port;
        try {
            port = Integer.parseInt(endpoint.substring(colon + 1));
        } catch (NumberFormatException e) {
            throw new GatewayConfigurationException("FIX endpoint has a non-numeric port: " + endpoint, e);
        }
        if (port <= 0 || port > 65535) {
            throw new GatewayConfigurationException("FIX endpoint port out of range: " + port);
        }

        log.info("[FACTORY] 🔧 FIX session {} -> {} at {}:{}",
            config.senderCompId(), config.targetCompId(), host, port);
        FixCodec codec = new FixCodec(config.senderCompId(), config.targetCompId());
        return new FixProtocolAdapter(config.venueName(), host, port, codec,
            DEFAULT_HEARTBEAT_SECONDS, config.connectTimeout());
    }

    private static ProtocolAdapter createWebSocket(GatewayConfig config) {
        URI uri;
        try {
            uri = new URI(config.endpoint().trim());
        } catch (URISyntaxException e) {
            throw new GatewayConfigurationException("Malformed WebSocket endpoint: " + config.endpoint(), e);
        }
        String scheme = uri.getScheme() == null ? "" : uri.getScheme().toLowerCase(Locale.ROOT);
        if (!scheme.equals("ws") && !scheme.equals("wss")) {
            throw new GatewayConfigurationException("WebSocket endpoint must use ws:// or wss://, got: " + uri);
        }
        if (uri.getHost() == null) {
            throw new GatewayConfigurationException("WebSocket endpoint has no host: " + uri);
        }

        log.info("[FACTORY] 🔧 WebSocket endpoint {}", uri);
        return new WebSocketProtocolAdapter(config.venueName(), uri, new JsonVenueCodec(),
            config.connectTimeout(), config.sendTimeout());
    }

    private ProtocolAdapterFactory() {}
}
