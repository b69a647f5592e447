package io.marketlens.bootstrap;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.zaxxer.hikari.HikariConfig;
import com.zaxxer.hikari.HikariDataSource;
import io.marketlens.domain.ledger.LedgerService;
import io.marketlens.domain.repository.AssetRepository;
import io.marketlens.domain.repository.BlockRepository;
import io.marketlens.domain.repository.TradeRepository;
import io.marketlens.infrastructure.ledger.JsonRpcLedgerClient;
import io.marketlens.infrastructure.metrics.MarketDataMetrics;
import io.marketlens.infrastructure.metrics.PrometheusMetricsHandler;
import io.marketlens.repository.PostgresAssetRepository;
import io.marketlens.repository.PostgresBlockRepository;
import io.marketlens.repository.PostgresTradeRepository;
import io.marketlens.security.InputValidator;
import io.marketlens.service.asset.AssetHistoryReconstructor;
import io.marketlens.service.asset.ReferenceSupply;
import io.marketlens.service.market.MarketInfoComposer;
import io.marketlens.service.market.OhlcAggregator;
import io.marketlens.service.market.OrderBookBuilder;
import io.marketlens.service.market.PairCanonicalizer;
import io.marketlens.service.market.PriceSynthesizer;
import io.marketlens.service.market.TradeHistoryService;
import io.marketlens.transport.http.MarketApiHandlers;
import io.marketlens.transport.http.MarketJson;
import io.marketlens.util.Env;
import io.undertow.Handlers;
import io.undertow.Undertow;
import io.undertow.server.HttpHandler;
import io.undertow.server.RoutingHandler;
import io.undertow.server.handlers.BlockingHandler;
import io.undertow.util.Headers;
import io.undertow.util.HttpString;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.sql.DataSource;
import java.time.Clock;
import java.time.Duration;

/**
 * Core Java entry point (NO Spring).
 *
 * Wires the record store (Postgres via Hikari), the ledger daemon client, the market data
 * services and the Undertow HTTP API.
 */
public final class App {
    private static final Logger log = LoggerFactory.getLogger(App.class);

    public static void main(String[] args) {
        log.info("═══════════════════════════════════════════════════════════════");
        log.info("=== marketlens Starting ===");
        log.info("═══════════════════════════════════════════════════════════════");

        int port = Env.getInt("PORT", 9190);
        boolean testnet = Env.getBool("TESTNET", false);
        Duration readinessInterval = Env.getMillis("READINESS_INTERVAL_MS", 5000L);

        // ═══════════════════════════════════════════════════════════════
        // Database
        // ═══════════════════════════════════════════════════════════════
        DataSource dataSource = createDataSource();
        TradeRepository tradeRepo = new PostgresTradeRepository(dataSource);
        AssetRepository assetRepo = new PostgresAssetRepository(dataSource);
        BlockRepository blockRepo = new PostgresBlockRepository(dataSource);

        // ═══════════════════════════════════════════════════════════════
        // Prometheus Metrics
        // ═══════════════════════════════════════════════════════════════
        MarketDataMetrics metrics = new MarketDataMetrics();
        log.info("✓ Prometheus metrics initialized");

        // ═══════════════════════════════════════════════════════════════
        // Ledger daemon
        // ═══════════════════════════════════════════════════════════════
        ObjectMapper mapper = new ObjectMapper();
        LedgerService ledger = createLedgerClient(mapper);

        ReadinessMonitor readiness = new ReadinessMonitor(ledger, metrics, testnet);
        readiness.refresh();
        readiness.start(readinessInterval);

        // ═══════════════════════════════════════════════════════════════
        // Market data services
        // ═══════════════════════════════════════════════════════════════
        Clock clock = Clock.systemUTC();
        InputValidator validator = new InputValidator();
        PairCanonicalizer canonicalizer = new PairCanonicalizer(assetRepo, validator);
        PriceSynthesizer priceSynthesizer = new PriceSynthesizer(tradeRepo, canonicalizer, validator, clock);
        OhlcAggregator ohlcAggregator = new OhlcAggregator(tradeRepo, canonicalizer, validator, clock);
        ReferenceSupply referenceSupply = new ReferenceSupply(ledger);
        MarketInfoComposer marketInfoComposer =
            new MarketInfoComposer(priceSynthesizer, ohlcAggregator, assetRepo, referenceSupply, validator);
        TradeHistoryService tradeHistory = new TradeHistoryService(tradeRepo, canonicalizer, validator, clock);
        OrderBookBuilder orderBookBuilder = new OrderBookBuilder(ledger, assetRepo, blockRepo, canonicalizer, validator);
        AssetHistoryReconstructor assetHistory = new AssetHistoryReconstructor(assetRepo, ledger, blockRepo, validator);
        log.info("✓ Market data services initialized");

        // ═══════════════════════════════════════════════════════════════
        // HTTP API
        // ═══════════════════════════════════════════════════════════════
        MarketApiHandlers api = new MarketApiHandlers(
            canonicalizer, priceSynthesizer, marketInfoComposer, ohlcAggregator,
            tradeHistory, orderBookBuilder, assetHistory, readiness, metrics, new MarketJson(mapper));

        PrometheusMetricsHandler metricsHandler = new PrometheusMetricsHandler(metrics.getRegistry());
        log.info("✓ Prometheus /metrics endpoint ready");

        RoutingHandler routes = Handlers.routing()
            .get("/metrics", metricsHandler)
            .get("/api/ready", api::ready)
            .get("/api/pairs/base-quote", api::baseQuote)
            .get("/api/market/price-summary", api::priceSummary)
            .get("/api/market/info", api::marketInfo)
            .get("/api/market/price-history", api::priceHistory)
            .get("/api/market/trades", api::lastTrades)
            .get("/api/market/trades/range", api::tradesWithinDates)
            .get("/api/market/order-book", api::orderBook)
            .get("/api/assets/{asset}/history", api::assetHistory)
            .setFallbackHandler(exchange -> {
                exchange.setStatusCode(404);
                exchange.getResponseHeaders().put(Headers.CONTENT_TYPE, "text/plain; charset=utf-8");
                exchange.getResponseSender().send("marketlens\n\nAPI: GET /api/ready, /api/market/*, /api/assets/{asset}/history\n");
            });

        // Record store and ledger calls block; keep them off the IO threads
        HttpHandler blocking = new BlockingHandler(routes);

        // CORS Handler
        HttpHandler corsHandler = exchange -> {
            exchange.getResponseHeaders()
                .put(HttpString.tryFromString("Access-Control-Allow-Origin"), "*")
                .put(HttpString.tryFromString("Access-Control-Allow-Methods"), "GET, OPTIONS")
                .put(HttpString.tryFromString("Access-Control-Allow-Headers"), "Content-Type")
                .put(HttpString.tryFromString("Access-Control-Max-Age"), "3600");

            if (exchange.getRequestMethod().toString().equals("OPTIONS")) {
                exchange.setStatusCode(200);
                exchange.endExchange();
            } else {
                blocking.handleRequest(exchange);
            }
        };

        Undertow server = Undertow.builder()
            .addHttpListener(port, "0.0.0.0")
            .setHandler(corsHandler)
            .build();

        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            log.info("Shutting down marketlens");
            server.stop();
            readiness.stop();
            if (dataSource instanceof HikariDataSource hikari) {
                hikari.close();
            }
        }, "shutdown"));

        server.start();
        log.info("✓ HTTP API server started on http://localhost:{}/ (testnet={})", port, testnet);
    }

    private static DataSource createDataSource() {
        String url = Env.get("DB_URL", "jdbc:postgresql://localhost:5432/marketlens");
        String user = Env.get("DB_USER", "postgres");
        String pass = Env.get("DB_PASS", "postgres");
        int maxPool = Env.getInt("DB_POOL_SIZE", 10);

        HikariConfig config = new HikariConfig();
        config.setJdbcUrl(url);
        config.setUsername(user);
        config.setPassword(pass);
        config.setMaximumPoolSize(maxPool);
        config.setMinimumIdle(2);
        config.setConnectionTimeout(5000);
        config.setReadOnly(true);
        config.setPoolName("marketlens-hikari");

        log.info("DB: url={}, user={}, pool={}", url, user, maxPool);
        return new HikariDataSource(config);
    }

    private static LedgerService createLedgerClient(ObjectMapper mapper) {
        String url = Env.get("LEDGER_RPC_URL", "http://localhost:4000/api/");
        String user = Env.get("LEDGER_RPC_USER", "rpc");
        String pass = Env.get("LEDGER_RPC_PASS", "rpc");
        Duration timeout = Env.getMillis("LEDGER_RPC_TIMEOUT_MS", 10_000L);

        log.info("[LEDGER] url={}, user={}, timeout={}ms", url, user, timeout.toMillis());
        return new JsonRpcLedgerClient(url, user, pass, timeout, mapper);
    }
}
