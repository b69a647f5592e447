package io.marketlens.transport.http;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.marketlens.domain.common.ServiceContext;
import io.marketlens.domain.error.DataIntegrityException;
import io.marketlens.domain.error.InvalidPairException;
import io.marketlens.domain.error.UpstreamUnavailableException;
import io.marketlens.domain.market.AssetPair;
import io.marketlens.domain.market.FeePreference;
import io.marketlens.domain.market.OrderBook;
import io.marketlens.domain.market.PriceLevel;
import io.marketlens.domain.market.PriceSummary;
import io.marketlens.infrastructure.metrics.MarketDataMetrics;
import io.marketlens.service.asset.AssetHistoryReconstructor;
import io.marketlens.service.market.MarketInfoComposer;
import io.marketlens.service.market.OhlcAggregator;
import io.marketlens.service.market.OrderBookBuilder;
import io.marketlens.service.market.PairCanonicalizer;
import io.marketlens.service.market.PriceSynthesizer;
import io.marketlens.service.market.TradeHistoryService;
import io.prometheus.client.CollectorRegistry;
import io.undertow.Handlers;
import io.undertow.Undertow;
import io.undertow.server.handlers.BlockingHandler;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.math.BigDecimal;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicReference;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

/**
 * HTTP routes against mocked services on a local Undertow server.
 */
@ExtendWith(MockitoExtension.class)
@DisplayName("Market API handlers")
public class MarketApiHandlersTest {

    private static final int TEST_PORT = 19194;
    private static final ServiceContext READY = new ServiceContext(true, 10L, 840_000L, false);

    @Mock
    private PairCanonicalizer canonicalizer;
    @Mock
    private PriceSynthesizer priceSynthesizer;
    @Mock
    private MarketInfoComposer marketInfoComposer;
    @Mock
    private OhlcAggregator ohlcAggregator;
    @Mock
    private TradeHistoryService tradeHistory;
    @Mock
    private OrderBookBuilder orderBookBuilder;
    @Mock
    private AssetHistoryReconstructor assetHistory;

    private final ObjectMapper mapper = new ObjectMapper();
    private final AtomicReference<ServiceContext> readiness = new AtomicReference<>(READY);
    private MarketDataMetrics metrics;
    private Undertow server;
    private HttpClient httpClient;

    @BeforeEach
    public void setUp() {
        metrics = new MarketDataMetrics(new CollectorRegistry());
        MarketApiHandlers api = new MarketApiHandlers(canonicalizer, priceSynthesizer, marketInfoComposer,
            ohlcAggregator, tradeHistory, orderBookBuilder, assetHistory, readiness::get, metrics, new MarketJson(mapper));

        server = Undertow.builder()
            .addHttpListener(TEST_PORT, "localhost")
            .setHandler(new BlockingHandler(Handlers.routing()
                .get("/api/ready", api::ready)
                .get("/api/pairs/base-quote", api::baseQuote)
                .get("/api/market/price-summary", api::priceSummary)
                .get("/api/market/order-book", api::orderBook)
                .get("/api/market/trades", api::lastTrades)
                .get("/api/assets/{asset}/history", api::assetHistory)))
            .build();
        server.start();

        httpClient = HttpClient.newBuilder()
            .connectTimeout(Duration.ofSeconds(5))
            .build();
    }

    @AfterEach
    public void tearDown() {
        if (server != null) {
            server.stop();
        }
    }

    @Test
    @DisplayName("Readiness is always answered")
    public void testReady() throws Exception {
        readiness.set(ServiceContext.notReady(true));

        HttpResponse<String> response = get("/api/ready");

        assertEquals(200, response.statusCode());
        JsonNode body = mapper.readTree(response.body());
        assertFalse(body.path("caught_up").asBoolean(true));
        assertTrue(body.path("testnet").asBoolean());
    }

    @Test
    @DisplayName("Data routes answer 525 until caught up")
    public void testNotCaughtUp() throws Exception {
        readiness.set(ServiceContext.notReady(false));

        HttpResponse<String> response = get("/api/pairs/base-quote?asset1=XCP&asset2=BTC");

        assertEquals(525, response.statusCode());
        assertTrue(response.body().contains("not caught up"));
        verifyNoInteractions(canonicalizer);
    }

    @Test
    @DisplayName("Base and quote of a pair")
    public void testBaseQuote() throws Exception {
        when(canonicalizer.canonicalize("BTC", "XCP")).thenReturn(new AssetPair("XCP", "BTC"));

        HttpResponse<String> response = get("/api/pairs/base-quote?asset1=BTC&asset2=XCP");

        assertEquals(200, response.statusCode());
        JsonNode body = mapper.readTree(response.body());
        assertEquals("XCP", body.path("base_asset").asText());
        assertEquals("BTC", body.path("quote_asset").asText());
        assertEquals("XCP/BTC", body.path("pair_name").asText());
    }

    @Test
    @DisplayName("Missing price data is false, never zero")
    public void testPriceSummaryNoData() throws Exception {
        when(priceSynthesizer.summarize("XCP", "GEMZ", 5)).thenReturn(Optional.empty());

        HttpResponse<String> response = get("/api/market/price-summary?asset1=XCP&asset2=GEMZ&withLastTrades=5");

        assertEquals(200, response.statusCode());
        assertEquals("false", response.body());
    }

    @Test
    @DisplayName("Price summary carries the market price")
    public void testPriceSummary() throws Exception {
        AssetPair pair = new AssetPair("XCP", "GEMZ");
        when(priceSynthesizer.summarize("XCP", "GEMZ", 0))
            .thenReturn(Optional.of(new PriceSummary(pair, new BigDecimal("1.25000000"), List.of())));

        JsonNode body = mapper.readTree(get("/api/market/price-summary?asset1=XCP&asset2=GEMZ").body());

        assertEquals(1.25, body.path("market_price").asDouble());
        assertFalse(body.has("last_trades"));
    }

    @Test
    @DisplayName("Domain failures map to 400, 500 and 502")
    public void testErrorMapping() throws Exception {
        when(canonicalizer.canonicalize("XCP", "XCP"))
            .thenThrow(new InvalidPairException("XCP", "XCP", "an asset cannot be paired with itself"));
        when(assetHistory.reconstruct("GEMZ", false))
            .thenThrow(new DataIntegrityException("GEMZ", 100L, "tag mismatch"));
        when(tradeHistory.lastTrades("XCP", "BTC", 50))
            .thenThrow(new UpstreamUnavailableException("record-store", "down"));

        assertEquals(400, get("/api/pairs/base-quote?asset1=XCP&asset2=XCP").statusCode());
        assertEquals(500, get("/api/assets/GEMZ/history").statusCode());
        assertEquals(502, get("/api/market/trades?asset1=XCP&asset2=BTC").statusCode());
        assertEquals(400, get("/api/market/trades?asset1=XCP&asset2=BTC&limit=abc").statusCode());
    }

    @Test
    @DisplayName("Order book passes fee preferences through and renders levels")
    public void testOrderBook() throws Exception {
        AssetPair pair = new AssetPair("BTC", "GEMZ");
        OrderBook book = new OrderBook(pair,
            List.of(new PriceLevel(new BigDecimal("0.5"), new BigDecimal("10"), 1, new BigDecimal("10"))),
            List.of(),
            new BigDecimal("10"), BigDecimal.ZERO, BigDecimal.ZERO, BigDecimal.ZERO, List.of(), List.of());
        when(orderBookBuilder.build(eq("BTC"), eq("GEMZ"), any())).thenReturn(book);

        HttpResponse<String> response = get("/api/market/order-book?buyAsset=BTC&sellAsset=GEMZ&feeRequired=0.0001");

        assertEquals(200, response.statusCode());
        JsonNode body = mapper.readTree(response.body());
        assertEquals(0.5, body.path("base_bid_book").get(0).path("unit_price").asDouble());
        assertEquals(10.0, body.path("bid_depth").asDouble());
        assertEquals(0, body.path("base_ask_book").size());

        ArgumentCaptor<FeePreference> fee = ArgumentCaptor.forClass(FeePreference.class);
        verify(orderBookBuilder).build(eq("BTC"), eq("GEMZ"), fee.capture());
        assertNull(fee.getValue().feeProvided());
        assertEquals(0, new BigDecimal("0.0001").compareTo(fee.getValue().feeRequired()));
    }

    private HttpResponse<String> get(String path) throws Exception {
        HttpRequest request = HttpRequest.newBuilder()
            .uri(URI.create("http://localhost:" + TEST_PORT + path))
            .GET()
            .build();
        return httpClient.send(request, HttpResponse.BodyHandlers.ofString());
    }
}
