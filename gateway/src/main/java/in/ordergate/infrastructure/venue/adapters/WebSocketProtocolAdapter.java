package in.ordergate.infrastructure.venue.adapters;

import com.fasterxml.jackson.databind.JsonNode;
import in.ordergate.infrastructure.venue.OrderSendException;
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

import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.WebSocket;
import java.time.Duration;
import java.util.Optional;
import java.util.Queue;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * JSON-over-WebSocket venue session.
 *
 * Handshake: open the socket, send a signed auth message and wait for an
 * authAck frame within the connect timeout.
 *
 * The HttpClient delivers frames on its own threads; the listener only
 * appends to lock-free queues that the connector's worker drains through
 * the poll methods.
 *
 * Every connect opens a new {@link WsSession} that owns its socket, queues,
 * authAck and close reason. Callbacks from an older socket land on that
 * older session and are ignored, so a late close cannot end a newer one.
 */
public final class WebSocketProtocolAdapter implements ProtocolAdapter {
    private static final Logger log = LoggerFactory.getLogger(WebSocketProtocolAdapter.class);

    private final String venue;
    private final URI endpoint;
    private final JsonVenueCodec codec;
    private final Duration connectTimeout;
    private final Duration sendTimeout;
    private final HttpClient httpClient;

    private volatile WsSession session;

    public WebSocketProtocolAdapter(String venue, URI endpoint, JsonVenueCodec codec,
                                    Duration connectTimeout, Duration sendTimeout) {
        this.venue = venue;
        this.endpoint = endpoint;
        this.codec = codec;
        this.connectTimeout = connectTimeout;
        this.sendTimeout = sendTimeout;
        this.httpClient = HttpClient.newBuilder()
            .connectTimeout(connectTimeout)
            .build();
    }

    // ═══════════════════════════════════════════════════════════════════════
    // LIFECYCLE
    // ═══════════════════════════════════════════════════════════════════════

    @Override
    public void connect(VenueCredentials credentials) throws VenueConnectException {
        log.info("[WS ADAPTER] Connecting to {} (venue={})", endpoint, venue);
        WsSession attempt = new WsSession();
        session = attempt;

        try {
            attempt.webSocket = httpClient.newWebSocketBuilder()
                .connectTimeout(connectTimeout)
                .header("X-API-KEY", credentials.apiKey())
                .buildAsync(endpoint, attempt)
                .get(connectTimeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (ExecutionException e) {
            session = null;
            throw new VenueConnectException(venue, "WebSocket handshake failed: " + e.getCause().getMessage(), e.getCause());
        } catch (TimeoutException e) {
            session = null;
            throw new VenueConnectException(venue, "WebSocket handshake timed out", e);
        } catch (InterruptedException e) {
            session = null;
            Thread.currentThread().interrupt();
            throw new VenueConnectException(venue, "Interrupted during WebSocket handshake", e);
        }

        try {
            attempt.send(codec.auth(credentials, System.currentTimeMillis()));
            JsonNode ack = attempt.authAck.get(connectTimeout.toMillis(), TimeUnit.MILLISECONDS);
            if (!ack.path("success").asBoolean(false)) {
                throw new VenueConnectException(venue, "Authentication refused: " + ack.path("reason").asText("no reason given"));
            }
        } catch (ExecutionException | TimeoutException e) {
            abort(attempt);
            throw new VenueConnectException(venue, "Authentication not acknowledged: " + e.getMessage(), e);
        } catch (InterruptedException e) {
            abort(attempt);
            Thread.currentThread().interrupt();
            throw new VenueConnectException(venue, "Interrupted during authentication", e);
        } catch (VenueConnectException e) {
            abort(attempt);
            throw e;
        }

        log.info("[WS ADAPTER] ✅ Authenticated with {}", venue);
    }

    @Override
    public void disconnect() throws VenueDisconnectException {
        WsSession closing = session;
        session = null;
        if (closing == null || closing.webSocket == null || closing.webSocket.isOutputClosed()) {
            return;
        }
        WebSocket ws = closing.webSocket;
        try {
            ws.sendClose(WebSocket.NORMAL_CLOSURE, "client disconnect")
                .get(sendTimeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (ExecutionException | TimeoutException e) {
            ws.abort();
            throw new VenueDisconnectException(venue, "Close handshake failed", e);
        } catch (InterruptedException e) {
            ws.abort();
            Thread.currentThread().interrupt();
            throw new VenueDisconnectException(venue, "Interrupted during close", e);
        }
        log.info("[WS ADAPTER] Disconnected from {}", venue);
    }

    // ═══════════════════════════════════════════════════════════════════════
    // TRAFFIC
    // ═══════════════════════════════════════════════════════════════════════

    @Override
    public void sendOrder(String serializedOrder) throws OrderSendException {
        WsSession current = session;
        if (current == null || current.webSocket == null || current.closedReason != null) {
            throw new OrderSendException(venue, "WebSocket is not open");
        }
        try {
            current.send(serializedOrder);
        } catch (ExecutionException e) {
            throw new OrderSendException(venue, "Send failed: " + e.getCause().getMessage(), e.getCause());
        } catch (TimeoutException e) {
            throw new OrderSendException(venue, "Send timed out after " + sendTimeout.toMillis() + "ms", e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new OrderSendException(venue, "Interrupted while sending", e);
        }
    }

    @Override
    public void subscribe(Set<String> symbols) throws VenueIoException {
        if (symbols.isEmpty()) {
            return;
        }
        WsSession current = requireSession();
        try {
            current.send(codec.subscribe(symbols));
        } catch (ExecutionException | TimeoutException e) {
            throw new VenueIoException(venue, "Subscribe not delivered", e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new VenueIoException(venue, "Interrupted while subscribing", e);
        }
    }

    @Override
    public Optional<String> pollMarketData() throws VenueIoException {
        WsSession current = requireSession();
        return current.poll(current.marketDataMessages);
    }

    @Override
    public Optional<String> pollOrderStatus() throws VenueIoException {
        WsSession current = requireSession();
        return current.poll(current.statusMessages);
    }

    @Override
    public VenueCodec codec() {
        return codec;
    }

    @Override
    public ProtocolType protocol() {
        return ProtocolType.WEBSOCKET;
    }

    @Override
    public String venue() {
        return venue;
    }

    // ═══════════════════════════════════════════════════════════════════════
    // INTERNALS
    // ═══════════════════════════════════════════════════════════════════════

    private WsSession requireSession() throws VenueIoException {
        WsSession current = session;
        if (current == null || current.webSocket == null) {
            throw new VenueIoException(venue, "WebSocket is not open");
        }
        return current;
    }

    private void abort(WsSession attempt) {
        if (session == attempt) {
            session = null;
        }
        if (attempt.webSocket != null) {
            attempt.webSocket.abort();
        }
    }

    /**
     * One socket's worth of state, and the listener for that socket.
     */
    private final class WsSession implements WebSocket.Listener {
        private final Queue<String> statusMessages = new ConcurrentLinkedQueue<>();
        private final Queue<String> marketDataMessages = new ConcurrentLinkedQueue<>();
        private final CompletableFuture<JsonNode> authAck = new CompletableFuture<>();
        private final StringBuilder buf = new StringBuilder();
        private volatile WebSocket webSocket;
        private volatile String closedReason;

        @Override
        public void onOpen(WebSocket webSocket) {
            log.info("[WS ADAPTER] Socket open to {}", venue);
            webSocket.request(1);
        }

        @Override
        public CompletionStage<?> onText(WebSocket webSocket, CharSequence data, boolean last) {
            buf.append(data);
            if (last) {
                String msg = buf.toString();
                buf.setLength(0);
                if (isCurrent()) {
                    route(msg);
                } else {
                    log.debug("[WS ADAPTER] Ignoring frame from a replaced socket to {}", venue);
                }
            }
            webSocket.request(1);
            return null;
        }

        @Override
        public CompletionStage<?> onClose(WebSocket webSocket, int statusCode, String reason) {
            closedReason = statusCode + " " + reason;
            authAck.completeExceptionally(new IllegalStateException("Closed before authAck: " + closedReason));
            if (isCurrent()) {
                log.warn("[WS ADAPTER] Closed by {}: {} {}", venue, statusCode, reason);
            } else {
                log.debug("[WS ADAPTER] Replaced socket to {} closed: {} {}", venue, statusCode, reason);
            }
            return null;
        }

        @Override
        public void onError(WebSocket webSocket, Throwable error) {
            closedReason = "error: " + error.getMessage();
            authAck.completeExceptionally(error);
            if (isCurrent()) {
                log.error("[WS ADAPTER] WebSocket error on {}", venue, error);
            } else {
                log.debug("[WS ADAPTER] Replaced socket to {} failed: {}", venue, error.getMessage());
            }
        }

        private boolean isCurrent() {
            return session == this;
        }

        private void send(String text) throws ExecutionException, TimeoutException, InterruptedException {
            log.debug("[WS ADAPTER] -> {}", text);
            webSocket.sendText(text, true).get(sendTimeout.toMillis(), TimeUnit.MILLISECONDS);
        }

        private Optional<String> poll(Queue<String> queue) throws VenueIoException {
            String message = queue.poll();
            if (message == null && closedReason != null) {
                throw new VenueIoException(venue, "WebSocket closed: " + closedReason);
            }
            return Optional.ofNullable(message);
        }

        private void route(String text) {
            log.debug("[WS ADAPTER] <- {}", text);
            String type;
            JsonNode node;
            try {
                node = codec.parse(text);
                type = node.path("type").asText("");
            } catch (MalformedMessageException e) {
                log.warn("[WS ADAPTER] Dropping malformed frame: {}", e.getMessage());
                return;
            }

            switch (type) {
                case JsonVenueCodec.TYPE_ORDER_STATUS -> statusMessages.add(text);
                case JsonVenueCodec.TYPE_MARKET_DATA -> marketDataMessages.add(text);
                case JsonVenueCodec.TYPE_AUTH_ACK -> authAck.complete(node);
                case JsonVenueCodec.TYPE_ERROR -> log.warn("[WS ADAPTER] Venue error: {}", node.path("message").asText(text));
                default -> log.debug("[WS ADAPTER] Ignoring message type '{}'", type);
            }
        }
    }
}
