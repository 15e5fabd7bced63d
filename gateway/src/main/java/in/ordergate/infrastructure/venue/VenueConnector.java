package in.ordergate.infrastructure.venue;

import in.ordergate.config.GatewayConfig;
import in.ordergate.domain.order.OrderStatusUpdate;
import in.ordergate.infrastructure.metrics.GatewayMetrics;
import in.ordergate.infrastructure.metrics.GatewayMetrics.ConnectionEvent;
import in.ordergate.infrastructure.venue.codec.MalformedMessageException;
import in.ordergate.infrastructure.venue.common.ReconnectionPolicy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Queue;
import java.util.Set;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Owns one venue link: the connection state machine, a single worker
 * thread that talks to the {@link ProtocolAdapter}, the outbound command
 * FIFO and the inbound market-data / order-status queues.
 *
 * State machine:
 * <pre>
 * DISCONNECTED --connect()--> CONNECTING --handshake ok--> CONNECTED
 * CONNECTING --handshake fails--> DISCONNECTED
 * CONNECTED --disconnect() or link lost--> DISCONNECTING --> DISCONNECTED
 * </pre>
 *
 * Locking:
 * - lifecycleLock guards state and the current worker
 * - outboundLock guards the outbound FIFO
 * - inbound queues are lock-free
 * The two locks are never held together, and no lock is held while the
 * adapter is called.
 *
 * Failures inside the worker never cross threads as exceptions: a failed
 * send becomes a REJECTED status update, a lost link tears the connection
 * down and rejects whatever was still queued.
 */
public final class VenueConnector {
    private static final Logger log = LoggerFactory.getLogger(VenueConnector.class);

    // Cap per worker iteration so inbound floods cannot starve outbound commands
    private static final int MAX_INBOUND_PER_CYCLE = 64;

    private final String venue;
    private final ProtocolAdapter adapter;
    private final VenueCredentials credentials;
    private final Duration pollInterval;
    private final GatewayMetrics metrics;
    private final AtomicInteger workerSeq = new AtomicInteger();

    private final Object lifecycleLock = new Object();
    private volatile ConnectorState state = ConnectorState.DISCONNECTED;
    private Worker worker;

    private final Object outboundLock = new Object();
    private final Deque<OutboundCommand> outbound = new ArrayDeque<>();

    private final BlockingQueue<MarketDataMessage> marketData;
    private final Queue<OrderStatusUpdate> orderStatus = new ConcurrentLinkedQueue<>();

    private final Set<String> subscriptions = ConcurrentHashMap.newKeySet();
    private final Queue<String> pendingSubscriptions = new ConcurrentLinkedQueue<>();

    /**
     * Build the connector and its adapter from configuration.
     *
     * @throws GatewayConfigurationException if the configured protocol is unsupported
     */
    public VenueConnector(GatewayConfig config, GatewayMetrics metrics) {
        this(config.venueName(),
            ProtocolAdapterFactory.create(config),
            config.credentials(),
            config.pollInterval(),
            config.marketDataQueueCapacity(),
            metrics);
    }

    public VenueConnector(String venue, ProtocolAdapter adapter, VenueCredentials credentials,
                          Duration pollInterval, int marketDataQueueCapacity, GatewayMetrics metrics) {
        if (adapter == null) {
            throw new GatewayConfigurationException("Protocol adapter cannot be null");
        }
        if (credentials == null) {
            throw new GatewayConfigurationException("Venue credentials cannot be null");
        }
        if (pollInterval == null || pollInterval.isNegative() || pollInterval.isZero()) {
            throw new GatewayConfigurationException("Poll interval must be positive");
        }
        if (marketDataQueueCapacity <= 0) {
            throw new GatewayConfigurationException("Market data queue capacity must be positive");
        }
        this.venue = venue;
        this.adapter = adapter;
        this.credentials = credentials;
        this.pollInterval = pollInterval;
        this.marketData = new LinkedBlockingQueue<>(marketDataQueueCapacity);
        this.metrics = metrics;

        log.info("[CONNECTOR] Created for venue={} protocol={} pollInterval={}ms",
            venue, adapter.protocol(), pollInterval.toMillis());
    }

    // ═══════════════════════════════════════════════════════════════════════
    // LIFECYCLE
    // ═══════════════════════════════════════════════════════════════════════

    /**
     * Connect to the venue, blocking until the handshake completes, fails or
     * the timeout expires. Concurrent callers share one attempt and one worker.
     *
     * @param timeout overall time to wait for the handshake
     * @return CONNECTED, or ALREADY_CONNECTED if the link was up
     * @throws ConnectTimeoutException if the timeout expired (the attempt is aborted)
     * @throws VenueConnectException   if the handshake failed
     * @throws InterruptedException    if the calling thread was interrupted while waiting
     */
    public ConnectResult connect(Duration timeout) throws VenueConnectException, InterruptedException {
        Worker attempt = null;
        while (attempt == null) {
            Worker previous = null;
            synchronized (lifecycleLock) {
                switch (state) {
                    case CONNECTED -> {
                        log.info("[CONNECTOR] Already connected to {}", venue);
                        return ConnectResult.ALREADY_CONNECTED;
                    }
                    case CONNECTING -> attempt = worker;
                    case DISCONNECTED -> attempt = startWorker();
                    case DISCONNECTING -> previous = worker;
                }
            }
            if (previous != null) {
                // Let the outgoing worker finish tearing down before starting a new one
                previous.join(timeout);
                if (previous.thread.isAlive()) {
                    throw new ConnectTimeoutException(venue, timeout);
                }
            }
        }

        try {
            attempt.connected.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
            return ConnectResult.CONNECTED;
        } catch (ExecutionException e) {
            throw asConnectException(e.getCause());
        } catch (TimeoutException e) {
            return abortTimedOut(attempt, timeout);
        }
    }

    /**
     * Connect, retrying failed attempts with the policy's backoff.
     *
     * @throws VenueConnectException the last failure once the policy gives up
     */
    public ConnectResult connect(Duration timeout, ReconnectionPolicy policy)
            throws VenueConnectException, InterruptedException {
        VenueConnectException lastFailure = null;
        while (policy.shouldRetry()) {
            try {
                ConnectResult result = connect(timeout);
                policy.recordSuccess();
                return result;
            } catch (VenueConnectException e) {
                lastFailure = e;
                policy.recordFailure();
                log.warn("[CONNECTOR] Connect attempt {}/{} to {} failed: {}",
                    policy.getFailedAttempts(), policy.getMaxAttempts(), venue, e.getMessage());
                if (policy.shouldRetry()) {
                    policy.awaitNextAttempt();
                }
            }
        }
        if (lastFailure != null) {
            throw lastFailure;
        }
        throw new VenueConnectException(venue, "Reconnection circuit is open");
    }

    /**
     * Stop the worker and wait for it to exit. No-op when already disconnected.
     */
    public void disconnect() {
        Worker stopping;
        synchronized (lifecycleLock) {
            if (state == ConnectorState.DISCONNECTED) {
                log.debug("[CONNECTOR] Disconnect on {} ignored, already disconnected", venue);
                return;
            }
            stopping = worker;
            stopping.stopRequested = true;
            if (state == ConnectorState.CONNECTING) {
                stopping.connected.completeExceptionally(
                    new VenueConnectException(venue, "Disconnect requested while connecting"));
            }
            state = ConnectorState.DISCONNECTING;
        }

        log.info("[CONNECTOR] Disconnecting from {}", venue);
        try {
            stopping.thread.join();
        } catch (InterruptedException e) {
            log.warn("[CONNECTOR] Interrupted while waiting for {} worker to exit", venue);
            Thread.currentThread().interrupt();
        }
    }

    // ═══════════════════════════════════════════════════════════════════════
    // OUTBOUND
    // ═══════════════════════════════════════════════════════════════════════

    /**
     * Enqueue a command for delivery. Refused, with nothing enqueued, unless
     * the connector is CONNECTED at this moment.
     */
    public SubmissionResult submitOrder(OutboundCommand command) {
        synchronized (outboundLock) {
            if (state != ConnectorState.CONNECTED) {
                log.warn("[CONNECTOR] {} for order {} refused: {} is {}",
                    command.type(), command.orderId(), venue, state);
                return SubmissionResult.NOT_CONNECTED;
            }
            outbound.addLast(command);
        }
        return SubmissionResult.ACCEPTED;
    }

    /**
     * Request market data for a symbol. Sent on the next worker cycle when
     * connected and re-sent after every reconnect.
     */
    public void subscribeMarketData(String symbol) {
        if (symbol == null || symbol.isBlank()) {
            throw new IllegalArgumentException("Symbol cannot be null or empty");
        }
        if (subscriptions.add(symbol)) {
            pendingSubscriptions.add(symbol);
            log.info("[CONNECTOR] Market data subscription added: {}", symbol);
        }
    }

    // ═══════════════════════════════════════════════════════════════════════
    // INBOUND
    // ═══════════════════════════════════════════════════════════════════════

    public Optional<MarketDataMessage> nextMarketData() {
        return Optional.ofNullable(marketData.poll());
    }

    public Optional<OrderStatusUpdate> nextOrderStatus() {
        return Optional.ofNullable(orderStatus.poll());
    }

    // ═══════════════════════════════════════════════════════════════════════
    // METADATA
    // ═══════════════════════════════════════════════════════════════════════

    public ConnectorState getState() {
        return state;
    }

    public boolean isConnected() {
        return state == ConnectorState.CONNECTED;
    }

    public boolean isWorkerAlive() {
        synchronized (lifecycleLock) {
            return worker != null && worker.thread.isAlive();
        }
    }

    public int getQueuedCommandCount() {
        synchronized (outboundLock) {
            return outbound.size();
        }
    }

    public Set<String> getSubscriptions() {
        return Set.copyOf(subscriptions);
    }

    public String getVenue() {
        return venue;
    }

    public ProtocolType getProtocol() {
        return adapter.protocol();
    }

    // ═══════════════════════════════════════════════════════════════════════
    // INTERNALS
    // ═══════════════════════════════════════════════════════════════════════

    /**
     * Caller holds lifecycleLock.
     */
    private Worker startWorker() {
        Worker started = new Worker(venue + "-connector-" + workerSeq.incrementAndGet());
        worker = started;
        state = ConnectorState.CONNECTING;
        metrics.recordConnectionEvent(venue, ConnectionEvent.CONNECTING);
        log.info("[CONNECTOR] Connecting to {} via {}", venue, adapter.protocol());
        started.thread.start();
        return started;
    }

    private ConnectResult abortTimedOut(Worker attempt, Duration timeout)
            throws VenueConnectException, InterruptedException {
        ConnectTimeoutException timeoutException = new ConnectTimeoutException(venue, timeout);
        synchronized (lifecycleLock) {
            if (!attempt.connected.completeExceptionally(timeoutException)) {
                // The handshake finished (or failed) while the timeout was being handled
                return awaitSettled(attempt);
            }
            attempt.stopRequested = true;
            if (worker == attempt) {
                state = ConnectorState.DISCONNECTING;
            }
        }

        log.warn("[CONNECTOR] Connect to {} timed out after {}ms, aborting attempt", venue, timeout.toMillis());
        metrics.recordConnectionEvent(venue, ConnectionEvent.CONNECT_TIMEOUT);
        attempt.thread.interrupt();
        attempt.join(timeout);
        if (attempt.thread.isAlive()) {
            log.warn("[CONNECTOR] Worker {} still inside adapter connect, it will exit when the adapter returns",
                attempt.thread.getName());
        }
        throw timeoutException;
    }

    private ConnectResult awaitSettled(Worker attempt) throws VenueConnectException, InterruptedException {
        try {
            attempt.connected.get();
            return ConnectResult.CONNECTED;
        } catch (ExecutionException e) {
            throw asConnectException(e.getCause());
        }
    }

    private VenueConnectException asConnectException(Throwable cause) {
        if (cause instanceof VenueConnectException vce) {
            return vce;
        }
        return new VenueConnectException(venue, "Connect failed: " + cause.getMessage(), cause);
    }

    /**
     * One connection's worth of I/O. A new worker is started for every
     * connect, so a stopped worker never shares flags with its successor.
     */
    private final class Worker implements Runnable {
        private final Thread thread;
        private final CompletableFuture<Void> connected = new CompletableFuture<>();
        private volatile boolean stopRequested;

        private Worker(String name) {
            this.thread = new Thread(this, name);
            this.thread.setDaemon(true);
        }

        @Override
        public void run() {
            try {
                adapter.connect(credentials);
            } catch (VenueConnectException e) {
                failConnect(e);
                return;
            } catch (RuntimeException e) {
                failConnect(new VenueConnectException(venue, "Adapter failed during connect: " + e.getMessage(), e));
                return;
            }

            boolean published = false;
            synchronized (lifecycleLock) {
                if (!stopRequested && !connected.isDone()) {
                    // State first: connect() returns as soon as the future completes
                    state = ConnectorState.CONNECTED;
                    published = connected.complete(null);
                    if (!published) {
                        state = ConnectorState.DISCONNECTING;
                    }
                }
            }
            if (!published) {
                log.info("[CONNECTOR] Handshake with {} completed after the attempt was abandoned, closing", venue);
                closeAdapter();
                finish();
                return;
            }

            metrics.recordConnectionEvent(venue, ConnectionEvent.CONNECTED);
            log.info("[CONNECTOR] ✅ Connected to {}", venue);

            boolean linkLost = false;
            try {
                resubscribeAll();
                loop();
            } catch (VenueIoException e) {
                linkLost = true;
                log.error("[CONNECTOR] ❌ Link to {} lost: {}", venue, e.getMessage());
                metrics.recordConnectionEvent(venue, ConnectionEvent.LINK_LOST);
            } catch (RuntimeException e) {
                linkLost = true;
                log.error("[CONNECTOR] ❌ Worker for {} failed", venue, e);
                metrics.recordConnectionEvent(venue, ConnectionEvent.LINK_LOST);
            }

            synchronized (lifecycleLock) {
                if (state == ConnectorState.CONNECTED) {
                    state = ConnectorState.DISCONNECTING;
                }
            }
            rejectQueued(linkLost ? "Link to venue lost" : "Connector disconnected");
            closeAdapter();
            finish();
        }

        private void loop() throws VenueIoException {
            while (!stopRequested) {
                OutboundCommand command;
                synchronized (outboundLock) {
                    command = outbound.pollFirst();
                }
                if (command != null) {
                    deliver(command);
                }

                flushPendingSubscriptions();
                drainMarketData();
                drainOrderStatus();

                try {
                    Thread.sleep(pollInterval.toMillis());
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    log.warn("[CONNECTOR] Worker for {} interrupted, stopping", venue);
                    return;
                }
            }
        }

        private void deliver(OutboundCommand command) {
            try {
                adapter.sendOrder(adapter.codec().encode(command));
                metrics.recordCommandSent(venue, command.type(),
                    Duration.between(command.enqueuedAt(), Instant.now()));
                log.debug("[CONNECTOR] Delivered {} for order {}", command.type(), command.orderId());
            } catch (OrderSendException e) {
                reject(command, e.getMessage());
            } catch (RuntimeException e) {
                reject(command, "Could not encode command: " + e.getMessage());
            }
        }

        private void reject(OutboundCommand command, String reason) {
            log.warn("[CONNECTOR] {} for order {} not delivered: {}", command.type(), command.orderId(), reason);
            metrics.recordCommandFailure(venue, command.type());
            orderStatus.add(OrderStatusUpdate.rejected(command.orderId(), reason));
        }

        private void rejectQueued(String reason) {
            List<OutboundCommand> undelivered;
            synchronized (outboundLock) {
                undelivered = new ArrayList<>(outbound);
                outbound.clear();
            }
            for (OutboundCommand command : undelivered) {
                reject(command, reason);
            }
        }

        private void resubscribeAll() throws VenueIoException {
            pendingSubscriptions.clear();
            Set<String> all = new LinkedHashSet<>(subscriptions);
            if (!all.isEmpty()) {
                adapter.subscribe(all);
                log.info("[CONNECTOR] Subscribed {} symbols on {}", all.size(), venue);
            }
        }

        private void flushPendingSubscriptions() throws VenueIoException {
            Set<String> batch = new LinkedHashSet<>();
            String symbol;
            while ((symbol = pendingSubscriptions.poll()) != null) {
                batch.add(symbol);
            }
            if (!batch.isEmpty()) {
                adapter.subscribe(batch);
            }
        }

        private void drainMarketData() throws VenueIoException {
            for (int i = 0; i < MAX_INBOUND_PER_CYCLE; i++) {
                Optional<String> raw = adapter.pollMarketData();
                if (raw.isEmpty()) {
                    return;
                }
                MarketDataMessage message = new MarketDataMessage(venue, raw.get(), Instant.now());
                metrics.recordMarketDataMessage(venue);
                while (!marketData.offer(message)) {
                    // Full: the oldest tick is the least useful one
                    if (marketData.poll() != null) {
                        metrics.recordMarketDataDropped(venue);
                    }
                }
            }
        }

        private void drainOrderStatus() throws VenueIoException {
            for (int i = 0; i < MAX_INBOUND_PER_CYCLE; i++) {
                Optional<String> raw = adapter.pollOrderStatus();
                if (raw.isEmpty()) {
                    return;
                }
                try {
                    adapter.codec().decodeStatus(raw.get()).ifPresent(orderStatus::add);
                } catch (MalformedMessageException | IllegalArgumentException e) {
                    log.warn("[CONNECTOR] Dropping undecodable status message from {}: {}", venue, e.getMessage());
                }
            }
        }

        private void failConnect(VenueConnectException e) {
            log.error("[CONNECTOR] ❌ Connect to {} failed: {}", venue, e.getMessage());
            metrics.recordConnectionEvent(venue, ConnectionEvent.CONNECT_FAILED);
            synchronized (lifecycleLock) {
                if (worker == this) {
                    state = ConnectorState.DISCONNECTED;
                    worker = null;
                }
                connected.completeExceptionally(e);
            }
        }

        private void closeAdapter() {
            try {
                adapter.disconnect();
            } catch (VenueDisconnectException e) {
                log.warn("[CONNECTOR] Adapter for {} did not close cleanly: {}", venue, e.getMessage());
            } catch (RuntimeException e) {
                log.warn("[CONNECTOR] Adapter for {} failed while closing", venue, e);
            }
        }

        private void finish() {
            synchronized (lifecycleLock) {
                if (worker == this) {
                    state = ConnectorState.DISCONNECTED;
                    worker = null;
                }
            }
            metrics.recordConnectionEvent(venue, ConnectionEvent.DISCONNECTED);
            log.info("[CONNECTOR] Worker {} exited, {} is DISCONNECTED", thread.getName(), venue);
        }

        private void join(Duration timeout) throws InterruptedException {
            thread.join(Math.max(1, timeout.toMillis()));
        }
    }
}
