package io.marketlens.service.market;

import io.marketlens.domain.asset.AssetChangeType;
import io.marketlens.domain.asset.AssetSnapshot;
import io.marketlens.domain.asset.TrackedAsset;
import io.marketlens.domain.ledger.LedgerService;
import io.marketlens.domain.market.FeePreference;
import io.marketlens.domain.market.Order;
import io.marketlens.domain.market.OrderBook;
import io.marketlens.domain.market.OrderFilter;
import io.marketlens.domain.market.PriceLevel;
import io.marketlens.domain.repository.AssetRepository;
import io.marketlens.domain.repository.BlockRepository;
import io.marketlens.security.InputValidator;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
@DisplayName("Order book construction")
class OrderBookBuilderTest {

    private static final long UNIT = 100_000_000L;
    private static final Instant BLOCK_TIME = Instant.parse("2024-05-01T11:00:00Z");

    @Mock
    private LedgerService ledger;
    @Mock
    private AssetRepository assetRepository;
    @Mock
    private BlockRepository blockRepository;

    private OrderBookBuilder builder;

    @BeforeEach
    void setUp() {
        InputValidator validator = new InputValidator();
        builder = new OrderBookBuilder(ledger, assetRepository, blockRepository,
            new PairCanonicalizer(assetRepository, validator), validator);
    }

    @Test
    @DisplayName("Bid and ask levels, depth, spread and median")
    void scenario() {
        registered("PEPECASH");
        when(blockRepository.findBlockTime(anyLong())).thenReturn(Optional.of(BLOCK_TIME));

        // bids give PEPECASH for XCP, asks give XCP for PEPECASH
        List<Order> bids = List.of(
            order("b1", "PEPECASH", 2 * UNIT, "XCP", 5 * UNIT, 2 * UNIT, 5 * UNIT),
            order("b2", "PEPECASH", 5 * UNIT, "XCP", 10 * UNIT, 5 * UNIT, 10 * UNIT));
        List<Order> asks = List.of(
            order("a1", "XCP", 8 * UNIT, "PEPECASH", 48 * UNIT / 10, 8 * UNIT, 48 * UNIT / 10));
        when(ledger.getOpenOrders(anyList())).thenReturn(List.of(), bids, asks);

        OrderBook book = builder.build("PEPECASH", "XCP", FeePreference.none());

        assertEquals("XCP", book.pair().base());
        assertEquals(2, book.bids().size());
        assertLevel(book.bids().get(0), "0.5", "10", 1, "10");
        assertLevel(book.bids().get(1), "0.4", "5", 1, "15");
        assertEquals(1, book.asks().size());
        assertLevel(book.asks().get(0), "0.6", "8", 1, "8");

        assertDecimal("0.1", book.spread());
        assertDecimal("0.55", book.median());
        assertDecimal("15", book.bidDepth());
        assertDecimal("8", book.askDepth());

        assertEquals(3, book.rawOrders().size());
        assertEquals(BLOCK_TIME, book.rawOrders().get(0).blockTime());
        // every order sits in the same block
        verify(blockRepository, times(1)).findBlockTime(anyLong());
    }

    @Test
    @DisplayName("Orders at the same price merge into one level")
    void mergesLevels() {
        registered("PEPECASH");
        List<Order> bids = List.of(
            order("b1", "PEPECASH", UNIT, "XCP", 2 * UNIT, UNIT, 2 * UNIT),
            order("b2", "PEPECASH", 3 * UNIT, "XCP", 6 * UNIT, 3 * UNIT, 6 * UNIT),
            order("b3", "PEPECASH", UNIT, "XCP", 4 * UNIT, UNIT, 4 * UNIT));
        when(ledger.getOpenOrders(anyList())).thenReturn(List.of(), bids, List.of());
        when(blockRepository.findBlockTime(anyLong())).thenReturn(Optional.of(BLOCK_TIME));

        OrderBook book = builder.build("PEPECASH", "XCP", FeePreference.none());

        assertEquals(2, book.bids().size());
        assertLevel(book.bids().get(0), "0.5", "8", 2, "8");
        assertLevel(book.bids().get(1), "0.25", "4", 1, "12");
        for (int i = 1; i < book.bids().size(); i++) {
            assertTrue(book.bids().get(i).unitPrice().compareTo(book.bids().get(i - 1).unitPrice()) < 0);
            assertTrue(book.bids().get(i).depth().compareTo(book.bids().get(i - 1).depth()) >= 0);
        }
    }

    @Test
    @DisplayName("Empty sides yield zero spread and median")
    void emptySides() {
        registered("PEPECASH");
        List<Order> bids = List.of(order("b1", "PEPECASH", UNIT, "XCP", 2 * UNIT, UNIT, 2 * UNIT));
        when(ledger.getOpenOrders(anyList())).thenReturn(List.of(), bids, List.of());
        when(blockRepository.findBlockTime(anyLong())).thenReturn(Optional.empty());

        OrderBook book = builder.build("PEPECASH", "XCP", FeePreference.none());

        assertDecimal("0", book.spread());
        assertDecimal("0", book.median());
        assertDecimal("0", book.askDepth());
        assertNull(book.rawOrders().get(0).blockTime());
    }

    @Test
    @DisplayName("Orders with nothing left to give are dropped")
    void dropsInactive() {
        registered("PEPECASH");
        List<Order> asks = List.of(
            order("a1", "XCP", 8 * UNIT, "PEPECASH", 4 * UNIT, 0, 0),
            order("a2", "XCP", UNIT, "PEPECASH", UNIT, UNIT, UNIT));
        when(ledger.getOpenOrders(anyList())).thenReturn(List.of(), List.of(), asks);
        when(blockRepository.findBlockTime(anyLong())).thenReturn(Optional.of(BLOCK_TIME));

        OrderBook book = builder.build("PEPECASH", "XCP", FeePreference.none());

        assertEquals(1, book.asks().size());
        assertEquals(1, book.rawOrders().size());
        assertEquals("a2", book.rawOrders().get(0).order().txHash());
    }

    @Test
    @DisplayName("Side filters select bids, asks and the caller's counter orders")
    @SuppressWarnings("unchecked")
    void sideFilters() {
        registered("PEPECASH");
        when(ledger.getOpenOrders(anyList())).thenReturn(List.of());

        builder.build("PEPECASH", "XCP", FeePreference.none());

        ArgumentCaptor<List<OrderFilter>> captor = ArgumentCaptor.forClass(List.class);
        verify(ledger, times(3)).getOpenOrders(captor.capture());
        List<List<OrderFilter>> calls = captor.getAllValues();

        assertEquals(List.of(
            OrderFilter.eq("get_asset", "XCP"),
            OrderFilter.eq("give_asset", "PEPECASH"),
            OrderFilter.ne("give_remaining", 0)), calls.get(0));
        assertEquals(List.of(
            OrderFilter.eq("get_asset", "XCP"),
            OrderFilter.eq("give_asset", "PEPECASH"),
            OrderFilter.ne("give_remaining", 0)), calls.get(1));
        assertEquals(List.of(
            OrderFilter.eq("get_asset", "PEPECASH"),
            OrderFilter.eq("give_asset", "XCP"),
            OrderFilter.ne("give_remaining", 0)), calls.get(2));
    }

    @Test
    @DisplayName("Buying BTC as base narrows by the required fee")
    @SuppressWarnings("unchecked")
    void feeFilterBuyingBtcAsBase() {
        registered("PEPECASH");
        when(ledger.getOpenOrders(anyList())).thenReturn(List.of());

        builder.build("BTC", "PEPECASH", new FeePreference(null, new BigDecimal("0.001")));

        ArgumentCaptor<List<OrderFilter>> captor = ArgumentCaptor.forClass(List.class);
        verify(ledger, times(3)).getOpenOrders(captor.capture());
        List<OrderFilter> bidFilters = captor.getAllValues().get(1);
        List<OrderFilter> askFilters = captor.getAllValues().get(2);

        assertEquals(OrderFilter.gte("fee_required", 100_000L), bidFilters.get(3));
        assertEquals(OrderFilter.gte("fee_provided", 100_000L), askFilters.get(3));
    }

    @Test
    @DisplayName("Selling BTC as quote narrows by the provided fee")
    @SuppressWarnings("unchecked")
    void feeFilterSellingBtcAsQuote() {
        when(ledger.getOpenOrders(anyList())).thenReturn(List.of());

        builder.build("XCP", "BTC", new FeePreference(new BigDecimal("0.0002"), null));

        ArgumentCaptor<List<OrderFilter>> captor = ArgumentCaptor.forClass(List.class);
        verify(ledger, times(3)).getOpenOrders(captor.capture());
        List<OrderFilter> bidFilters = captor.getAllValues().get(1);
        List<OrderFilter> askFilters = captor.getAllValues().get(2);

        assertEquals(OrderFilter.gte("fee_provided", 20_000L), bidFilters.get(3));
        assertEquals(OrderFilter.lte("fee_required", 20_000L), askFilters.get(3));
    }

    @Test
    @DisplayName("Selling BTC as base narrows by the provided fee")
    @SuppressWarnings("unchecked")
    void feeFilterSellingBtcAsBase() {
        registered("PEPECASH");
        when(ledger.getOpenOrders(anyList())).thenReturn(List.of());

        builder.build("PEPECASH", "BTC", new FeePreference(new BigDecimal("0.0003"), null));

        ArgumentCaptor<List<OrderFilter>> captor = ArgumentCaptor.forClass(List.class);
        verify(ledger, times(3)).getOpenOrders(captor.capture());
        List<OrderFilter> bidFilters = captor.getAllValues().get(1);
        List<OrderFilter> askFilters = captor.getAllValues().get(2);

        assertEquals(4, bidFilters.size());
        assertEquals(4, askFilters.size());
        assertEquals(OrderFilter.lte("fee_required", 30_000L), bidFilters.get(3));
        assertEquals(OrderFilter.gte("fee_provided", 30_000L), askFilters.get(3));
    }

    @Test
    @DisplayName("Buying BTC as quote narrows by the required fee")
    @SuppressWarnings("unchecked")
    void feeFilterBuyingBtcAsQuote() {
        when(ledger.getOpenOrders(anyList())).thenReturn(List.of());

        builder.build("BTC", "XCP", new FeePreference(null, new BigDecimal("0.0004")));

        ArgumentCaptor<List<OrderFilter>> captor = ArgumentCaptor.forClass(List.class);
        verify(ledger, times(3)).getOpenOrders(captor.capture());
        List<OrderFilter> bidFilters = captor.getAllValues().get(1);
        List<OrderFilter> askFilters = captor.getAllValues().get(2);

        assertEquals(4, bidFilters.size());
        assertEquals(4, askFilters.size());
        assertEquals(OrderFilter.gte("fee_provided", 40_000L), bidFilters.get(3));
        assertEquals(OrderFilter.gte("fee_required", 40_000L), askFilters.get(3));
    }

    @Test
    @DisplayName("Negative or oversized fees are rejected before any lookup")
    void feeOutOfRange() {
        assertThrows(IllegalArgumentException.class,
            () -> builder.build("BTC", "XCP", new FeePreference(new BigDecimal("-0.5"), null)));
        assertThrows(IllegalArgumentException.class,
            () -> builder.build("BTC", "XCP", new FeePreference(null, new BigDecimal("-0.5"))));
        assertThrows(IllegalArgumentException.class,
            () -> builder.build("BTC", "XCP", new FeePreference(null, new BigDecimal("1e12"))));

        verifyNoInteractions(ledger, assetRepository, blockRepository);
    }

    @Test
    @DisplayName("Missing fee values add no fee filters")
    @SuppressWarnings("unchecked")
    void noFeeNoFilter() {
        when(ledger.getOpenOrders(anyList())).thenReturn(List.of());

        builder.build("BTC", "XCP", new FeePreference(new BigDecimal("0.0001"), null));

        ArgumentCaptor<List<OrderFilter>> captor = ArgumentCaptor.forClass(List.class);
        verify(ledger, times(3)).getOpenOrders(captor.capture());
        for (List<OrderFilter> filters : captor.getAllValues()) {
            assertEquals(3, filters.size());
        }
    }

    private void registered(String asset) {
        AssetSnapshot snapshot = new AssetSnapshot(asset, "1Owner", "", true, false, 1_000 * UNIT,
            new BigDecimal("1000"), AssetChangeType.CREATED, 100, BLOCK_TIME);
        lenient().when(assetRepository.exists(asset)).thenReturn(true);
        lenient().when(assetRepository.findByAsset(asset)).thenReturn(Optional.of(new TrackedAsset(asset, snapshot, List.of())));
    }

    private static Order order(String tx, String giveAsset, long giveQty, String getAsset, long getQty,
                               long giveRemaining, long getRemaining) {
        return new Order(tx, "1Source", giveAsset, giveQty, getAsset, getQty, giveRemaining, getRemaining,
            0L, 0L, 300_000L, 1000L, "open");
    }

    private static void assertLevel(PriceLevel level, String price, String quantity, int count, String depth) {
        assertDecimal(price, level.unitPrice());
        assertDecimal(quantity, level.quantity());
        assertEquals(count, level.count());
        assertDecimal(depth, level.depth());
    }

    private static void assertDecimal(String expected, BigDecimal actual) {
        assertEquals(0, new BigDecimal(expected).compareTo(actual), "expected " + expected + " but was " + actual);
    }
}
