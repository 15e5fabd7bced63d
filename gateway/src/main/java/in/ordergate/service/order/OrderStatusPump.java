package in.ordergate.service.order;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

/**
 * Feeds venue status updates into the OrderManager on a fixed schedule.
 *
 * Runs on its own single thread so the connector worker never calls into
 * the manager and never waits on the registry lock.
 */
public final class OrderStatusPump {
    private static final Logger log = LoggerFactory.getLogger(OrderStatusPump.class);

    private final OrderManager orderManager;
    private final Duration interval;
    private final ScheduledExecutorService scheduler;

    private volatile long totalApplied = 0;

    public OrderStatusPump(OrderManager orderManager, Duration interval) {
        this.orderManager = orderManager;
        this.interval = interval;
        this.scheduler = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "order-status-pump");
            t.setDaemon(true);
            return t;
        });
    }

    /**
     * Start the pump (scheduled job).
     */
    public void start() {
        scheduler.scheduleWithFixedDelay(this::pump, 0, interval.toMillis(), TimeUnit.MILLISECONDS);
        log.info("[STATUS PUMP] Started: interval={}ms", interval.toMillis());
    }

    /**
     * Stop the pump and drain anything already queued one last time.
     */
    public void stop() {
        scheduler.shutdown();
        try {
            if (!scheduler.awaitTermination(5, TimeUnit.SECONDS)) {
                scheduler.shutdownNow();
            }
        } catch (InterruptedException e) {
            scheduler.shutdownNow();
            Thread.currentThread().interrupt();
        }
        pump();
        log.info("[STATUS PUMP] Stopped: {} updates applied", totalApplied);
    }

    public long getTotalApplied() {
        return totalApplied;
    }

    private void pump() {
        // A throw here would cancel the scheduled task for good
        try {
            int applied = orderManager.processPendingStatusUpdates();
            if (applied > 0) {
                totalApplied += applied;
                log.debug("[STATUS PUMP] Applied {} status updates", applied);
            }
        } catch (RuntimeException e) {
            log.error("[STATUS PUMP] Error applying status updates", e);
        }
    }
}
