package io.marketlens.bootstrap;

import io.marketlens.domain.common.ServiceContext;
import io.marketlens.domain.error.UpstreamUnavailableException;
import io.marketlens.domain.ledger.LedgerService;
import io.marketlens.domain.ledger.LedgerStatus;
import io.marketlens.infrastructure.metrics.MarketDataMetrics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Supplier;

/**
 * Polls the ledger daemon for replication progress and publishes it as an immutable
 * ServiceContext. Handlers take one snapshot per request.
 */
public final class ReadinessMonitor implements Supplier<ServiceContext> {
    private static final Logger log = LoggerFactory.getLogger(ReadinessMonitor.class);

    private final LedgerService ledger;
    private final MarketDataMetrics metrics;
    private final AtomicReference<ServiceContext> current;

    private final ScheduledExecutorService scheduler;
    private volatile ScheduledFuture<?> refreshTask;

    public ReadinessMonitor(LedgerService ledger, MarketDataMetrics metrics, boolean testnet) {
        this.ledger = ledger;
        this.metrics = metrics;
        this.current = new AtomicReference<>(ServiceContext.notReady(testnet));
        this.scheduler = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "ReadinessMonitor");
            t.setDaemon(true);
            return t;
        });
    }

    @Override
    public ServiceContext get() {
        return current.get();
    }

    /**
     * Reads the ledger status once. An unreachable ledger marks the service not caught up and
     * keeps the last known indexes.
     */
    public ServiceContext refresh() {
        ServiceContext previous = current.get();
        ServiceContext next;
        try {
            LedgerStatus status = ledger.getStatus();
            next = previous.withBlock(status.lastBlockIndex(), status.lastMessageIndex(), status.caughtUp());
        } catch (UpstreamUnavailableException e) {
            log.warn("[LEDGER] Status unavailable, marking not caught up: {}", e.getMessage());
            next = previous.withBlock(previous.currentBlockIndex(), previous.lastMessageIndex(), false);
        }

        current.set(next);
        metrics.recordReadiness(next.caughtUp(), next.currentBlockIndex());
        if (previous.caughtUp() != next.caughtUp()) {
            log.info("[LEDGER] Caught up: {} -> {} (block {})", previous.caughtUp(), next.caughtUp(), next.currentBlockIndex());
        }
        return next;
    }

    public synchronized void start(Duration interval) {
        if (refreshTask != null) {
            log.warn("[LEDGER] Readiness monitor already running");
            return;
        }
        log.info("[LEDGER] Starting readiness monitor (interval: {}s)", interval.getSeconds());
        refreshTask = scheduler.scheduleAtFixedRate(() -> {
            try {
                refresh();
            } catch (RuntimeException e) {
                log.error("[LEDGER] Readiness refresh failed", e);
            }
        }, 0, interval.toMillis(), TimeUnit.MILLISECONDS);
    }

    public synchronized void stop() {
        if (refreshTask != null) {
            refreshTask.cancel(false);
            refreshTask = null;
        }
        scheduler.shutdown();
        try {
            if (!scheduler.awaitTermination(5, TimeUnit.SECONDS)) {
                scheduler.shutdownNow();
            }
        } catch (InterruptedException e) {
            scheduler.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }
}
