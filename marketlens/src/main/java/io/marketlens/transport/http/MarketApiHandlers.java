package io.marketlens.transport.http;

import com.fasterxml.jackson.databind.JsonNode;
import io.marketlens.domain.common.ServiceContext;
import io.marketlens.domain.error.DataIntegrityException;
import io.marketlens.domain.error.InvalidAssetException;
import io.marketlens.domain.error.InvalidPairException;
import io.marketlens.domain.error.UpstreamUnavailableException;
import io.marketlens.domain.market.FeePreference;
import io.marketlens.infrastructure.metrics.MarketDataMetrics;
import io.marketlens.service.asset.AssetHistoryReconstructor;
import io.marketlens.service.market.MarketInfoComposer;
import io.marketlens.service.market.OhlcAggregator;
import io.marketlens.service.market.OrderBookBuilder;
import io.marketlens.service.market.PairCanonicalizer;
import io.marketlens.service.market.PriceSynthesizer;
import io.marketlens.service.market.TradeHistoryService;
import io.undertow.server.HttpServerExchange;
import io.undertow.util.Headers;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigDecimal;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.time.Instant;
import java.util.Arrays;
import java.util.Deque;
import java.util.List;
import java.util.function.Function;
import java.util.function.Supplier;

/**
 * HTTP API handlers of the market data service.
 *
 * Every data route is gated on readiness: while the ledger replica is not caught up the
 * request is answered with 525 and nothing is queried.
 */
public final class MarketApiHandlers {
    private static final Logger log = LoggerFactory.getLogger(MarketApiHandlers.class);

    static final int STATUS_NOT_CAUGHT_UP = 525;

    private final PairCanonicalizer canonicalizer;
    private final PriceSynthesizer priceSynthesizer;
    private final MarketInfoComposer marketInfoComposer;
    private final OhlcAggregator ohlcAggregator;
    private final TradeHistoryService tradeHistory;
    private final OrderBookBuilder orderBookBuilder;
    private final AssetHistoryReconstructor assetHistory;
    private final Supplier<ServiceContext> readiness;
    private final MarketDataMetrics metrics;
    private final MarketJson json;

    public MarketApiHandlers(PairCanonicalizer canonicalizer, PriceSynthesizer priceSynthesizer,
                             MarketInfoComposer marketInfoComposer, OhlcAggregator ohlcAggregator,
                             TradeHistoryService tradeHistory, OrderBookBuilder orderBookBuilder,
                             AssetHistoryReconstructor assetHistory, Supplier<ServiceContext> readiness,
                             MarketDataMetrics metrics, MarketJson json) {
        this.canonicalizer = canonicalizer;
        this.priceSynthesizer = priceSynthesizer;
        this.marketInfoComposer = marketInfoComposer;
        this.ohlcAggregator = ohlcAggregator;
        this.tradeHistory = tradeHistory;
        this.orderBookBuilder = orderBookBuilder;
        this.assetHistory = assetHistory;
        this.readiness = readiness;
        this.metrics = metrics;
        this.json = json;
    }

    public void ready(HttpServerExchange exchange) {
        ServiceContext ctx = readiness.get();
        metrics.recordRequest("ready", "ok", Duration.ZERO);
        send(exchange, 200, json.ready(ctx));
    }

    public void baseQuote(HttpServerExchange exchange) {
        handle(exchange, "base_quote", ctx ->
            json.baseQuote(canonicalizer.canonicalize(param(exchange, "asset1"), param(exchange, "asset2"))));
    }

    public void priceSummary(HttpServerExchange exchange) {
        handle(exchange, "price_summary", ctx -> json.priceSummary(priceSynthesizer.summarize(
            param(exchange, "asset1"),
            param(exchange, "asset2"),
            intParam(exchange, "withLastTrades", 0))));
    }

    public void marketInfo(HttpServerExchange exchange) {
        handle(exchange, "market_info", ctx -> {
            String assets = param(exchange, "assets");
            List<String> list = assets == null || assets.isBlank()
                ? List.of()
                : Arrays.stream(assets.split(",")).map(String::trim).filter(s -> !s.isEmpty()).toList();
            return json.marketInfo(marketInfoComposer.compose(ctx, list));
        });
    }

    public void priceHistory(HttpServerExchange exchange) {
        handle(exchange, "market_price_history", ctx -> json.marketPriceHistory(ohlcAggregator.marketPriceHistory(
            param(exchange, "asset1"),
            param(exchange, "asset2"),
            instantParam(exchange, "startTs"),
            instantParam(exchange, "endTs"))));
    }

    public void lastTrades(HttpServerExchange exchange) {
        handle(exchange, "trade_history", ctx -> json.trades(tradeHistory.lastTrades(
            param(exchange, "asset1"),
            param(exchange, "asset2"),
            intParam(exchange, "limit", TradeHistoryService.DEFAULT_LIMIT))));
    }

    public void tradesWithinDates(HttpServerExchange exchange) {
        handle(exchange, "trade_history_range", ctx -> json.trades(tradeHistory.tradesWithinDates(
            param(exchange, "asset1"),
            param(exchange, "asset2"),
            instantParam(exchange, "startTs"),
            instantParam(exchange, "endTs"),
            intParam(exchange, "limit", TradeHistoryService.DEFAULT_LIMIT))));
    }

    public void orderBook(HttpServerExchange exchange) {
        handle(exchange, "order_book", ctx -> {
            FeePreference fee = new FeePreference(
                decimalParam(exchange, "feeProvided"),
                decimalParam(exchange, "feeRequired"));
            return json.orderBook(orderBookBuilder.build(
                param(exchange, "buyAsset"),
                param(exchange, "sellAsset"),
                fee));
        });
    }

    public void assetHistory(HttpServerExchange exchange) {
        handle(exchange, "asset_history", ctx -> json.assetHistory(assetHistory.reconstruct(
            param(exchange, "asset"),
            "true".equalsIgnoreCase(param(exchange, "reverse")))));
    }

    /**
     * Readiness gate, exception to status mapping and request metrics around one operation.
     */
    private void handle(HttpServerExchange exchange, String operation, Function<ServiceContext, JsonNode> body) {
        Instant start = Instant.now();
        ServiceContext ctx = readiness.get();
        String outcome = "error";
        try {
            if (!ctx.caughtUp()) {
                outcome = "not_ready";
                send(exchange, STATUS_NOT_CAUGHT_UP, json.error("Server is not caught up. Please try again later."));
                return;
            }
            JsonNode response = body.apply(ctx);
            outcome = "ok";
            send(exchange, 200, response);
        } catch (IllegalArgumentException | InvalidAssetException | InvalidPairException e) {
            outcome = "invalid";
            log.debug("[API] {} rejected: {}", operation, e.getMessage());
            send(exchange, 400, json.error(e.getMessage()));
        } catch (DataIntegrityException e) {
            outcome = "integrity";
            log.error("[API] {} integrity fault: {}", operation, e.getMessage());
            send(exchange, 500, json.error(e.getMessage()));
        } catch (UpstreamUnavailableException e) {
            outcome = "upstream";
            log.error("[API] {} upstream failure: {}", operation, e.getMessage());
            send(exchange, 502, json.error(e.getMessage()));
        } catch (RuntimeException e) {
            log.error("[API] {} failed", operation, e);
            send(exchange, 500, json.error("Internal error"));
        } finally {
            metrics.recordRequest(operation, outcome, Duration.between(start, Instant.now()));
        }
    }

    private void send(HttpServerExchange exchange, int status, JsonNode body) {
        exchange.setStatusCode(status);
        exchange.getResponseHeaders().put(Headers.CONTENT_TYPE, "application/json; charset=utf-8");
        exchange.getResponseSender().send(body.toString(), StandardCharsets.UTF_8);
    }

    static String param(HttpServerExchange exchange, String name) {
        Deque<String> values = exchange.getQueryParameters().get(name);
        return values == null ? null : values.peekFirst();
    }

    static int intParam(HttpServerExchange exchange, String name, int defaultValue) {
        String value = param(exchange, name);
        if (value == null || value.isBlank()) {
            return defaultValue;
        }
        try {
            return Integer.parseInt(value.trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Parameter " + name + " must be an integer: " + value);
        }
    }

    /**
     * Epoch seconds.
     */
    static Instant instantParam(HttpServerExchange exchange, String name) {
        String value = param(exchange, name);
        if (value == null || value.isBlank()) {
            return null;
        }
        try {
            return Instant.ofEpochSecond(Long.parseLong(value.trim()));
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Parameter " + name + " must be epoch seconds: " + value);
        }
    }

    static BigDecimal decimalParam(HttpServerExchange exchange, String name) {
        String value = param(exchange, name);
        if (value == null || value.isBlank()) {
            return null;
        }
        try {
            return new BigDecimal(value.trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Parameter " + name + " must be a decimal: " + value);
        }
    }
}
