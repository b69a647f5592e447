package io.marketlens.infrastructure.metrics;

import io.prometheus.client.CollectorRegistry;
import io.prometheus.client.Counter;
import io.prometheus.client.Gauge;
import io.prometheus.client.Histogram;

import java.time.Duration;

/**
 * Prometheus metrics of the market data API.
 *
 * Key Metrics:
 * - marketlens_requests_total{operation, outcome} - request outcomes (ok, invalid, not_ready, upstream, integrity, error)
 * - marketlens_request_latency_seconds{operation} - request latency distribution
 * - marketlens_ledger_caught_up - 1 when the ledger replica is caught up
 * - marketlens_ledger_block_index - last block index seen by the readiness monitor
 */
public class MarketDataMetrics {

    private final CollectorRegistry registry;

    private final Counter requestCounter;
    private final Histogram requestLatency;
    private final Gauge caughtUp;
    private final Gauge blockIndex;

    public MarketDataMetrics() {
        this(new CollectorRegistry());
    }

    public MarketDataMetrics(CollectorRegistry registry) {
        this.registry = registry;

        this.requestCounter = Counter.build()
            .name("marketlens_requests_total")
            .help("Total number of API requests by outcome")
            .labelNames("operation", "outcome")
            .register(registry);

        this.requestLatency = Histogram.build()
            .name("marketlens_request_latency_seconds")
            .help("API request latency in seconds")
            .labelNames("operation")
            .buckets(0.005, 0.01, 0.05, 0.1, 0.25, 0.5, 1.0, 2.5, 5.0)
            .register(registry);

        this.caughtUp = Gauge.build()
            .name("marketlens_ledger_caught_up")
            .help("1 when the ledger replica is caught up, 0 otherwise")
            .register(registry);

        this.blockIndex = Gauge.build()
            .name("marketlens_ledger_block_index")
            .help("Last block index reported by the ledger daemon")
            .register(registry);
    }

    public void recordRequest(String operation, String outcome, Duration latency) {
        requestCounter.labels(operation, outcome).inc();
        requestLatency.labels(operation).observe(latency.toNanos() / 1_000_000_000.0);
    }

    public void recordReadiness(boolean isCaughtUp, long currentBlockIndex) {
        caughtUp.set(isCaughtUp ? 1 : 0);
        blockIndex.set(currentBlockIndex);
    }

    public CollectorRegistry getRegistry() {
        return registry;
    }
}
