package stratus.engine.scheduler;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

/**
 * Coordinates background maintenance:
 * - StaleOperationReaper: fails operation records abandoned in RUNNING
 * - resource refresh: re-fetches stale resources (DiscoveryService.refreshStale)
 * <p>
 * Uses a single-threaded executor so maintenance jobs never overlap.
 */
public class Scheduler implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(Scheduler.class);

    private final ScheduledExecutorService executor;
    private final StaleOperationReaper operationReaper;
    private final Runnable resourceRefresher;
    private final Duration reaperInterval;
    private final Duration refreshInterval;

    private volatile boolean running = false;

    /**
     * @param operationReaper   reaper for abandoned operation records
     * @param resourceRefresher runnable refreshing stale resources (typically DiscoveryService::refreshStale)
     * @param reaperInterval    reaper period
     * @param refreshInterval   refresh period
     */
    public Scheduler(StaleOperationReaper operationReaper, Runnable resourceRefresher, Duration reaperInterval,
                     Duration refreshInterval) {
        this.executor = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "stratus-scheduler");
            t.setDaemon(true);
            return t;
        });
        this.operationReaper = operationReaper;
        this.resourceRefresher = resourceRefresher;
        this.reaperInterval = reaperInterval;
        this.refreshInterval = refreshInterval;
    }

    public void start() {
        if (running) {
            log.warn("Scheduler already running");
            return;
        }

        running = true;

        long reaperMs = reaperInterval.toMillis();
        executor.scheduleAtFixedRate(operationReaper, reaperMs, reaperMs, TimeUnit.MILLISECONDS);
        log.info("Operation reaper scheduled every {}ms", reaperMs);

        long refreshMs = refreshInterval.toMillis();
        executor.scheduleAtFixedRate(wrapRunnable("resource-refresh", resourceRefresher),
                refreshMs, refreshMs, TimeUnit.MILLISECONDS);
        log.info("Resource refresh scheduled every {}ms", refreshMs);

        log.info("Scheduler started");
    }

    public void stop() {
        if (!running) {
            return;
        }

        running = false;
        executor.shutdown();

        try {
            if (!executor.awaitTermination(5, TimeUnit.SECONDS)) {
                executor.shutdownNow();
                log.warn("Scheduler forcefully stopped");
            } else {
                log.info("Scheduler stopped gracefully");
            }
        } catch (InterruptedException e) {
            executor.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }

    @Override
    public void close() {
        stop();
    }

    public boolean isRunning() {
        return running;
    }

    /**
     * Get the reaper for a manual trigger.
     */
    public StaleOperationReaper operationReaper() {
        return operationReaper;
    }

    private Runnable wrapRunnable(String name, Runnable task) {
        return () -> {
            try {
                task.run();
            } catch (Exception e) {
                log.error("{} error", name, e);
            }
        };
    }
}
