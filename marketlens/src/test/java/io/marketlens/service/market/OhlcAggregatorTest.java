package io.marketlens.service.market;

import io.marketlens.domain.market.AssetPair;
import io.marketlens.domain.market.OhlcBucket;
import io.marketlens.domain.market.ReferenceAsset;
import io.marketlens.domain.market.Trade;
import io.marketlens.domain.market.VolumeSummary;
import io.marketlens.domain.repository.AssetRepository;
import io.marketlens.domain.repository.TradeRepository;
import io.marketlens.security.InputValidator;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
@DisplayName("OHLC and volume aggregation")
class OhlcAggregatorTest {

    private static final Instant NOW = Instant.parse("2024-05-01T12:00:00Z");

    @Mock
    private TradeRepository tradeRepository;
    @Mock
    private AssetRepository assetRepository;

    private OhlcAggregator aggregator;

    @BeforeEach
    void setUp() {
        InputValidator validator = new InputValidator();
        aggregator = new OhlcAggregator(
            tradeRepository,
            new PairCanonicalizer(assetRepository, validator),
            validator,
            Clock.fixed(NOW, ZoneOffset.UTC));
    }

    @Test
    @DisplayName("Rollup follows time order for open and close")
    void rollup() {
        List<Trade> trades = List.of(
            trade("XCP", "GEMZ", "1.5", "2", 12, NOW.minusSeconds(60)),
            trade("XCP", "GEMZ", "1.0", "1", 10, NOW.minusSeconds(600)),
            trade("XCP", "GEMZ", "2.0", "3", 11, NOW.minusSeconds(300)));

        OhlcBucket bucket = OhlcAggregator.rollup(trades, 0L, NOW).orElseThrow();

        assertEquals(new BigDecimal("1.00000000"), bucket.open());
        assertEquals(new BigDecimal("2.00000000"), bucket.high());
        assertEquals(new BigDecimal("1.00000000"), bucket.low());
        assertEquals(new BigDecimal("1.50000000"), bucket.close());
        assertEquals(new BigDecimal("6.00000000"), bucket.volume());
        assertEquals(new BigDecimal("1.50000000"), bucket.averagePrice());
        assertEquals(3, bucket.count());
        assertTrue(OhlcAggregator.rollup(List.of(), 0L, NOW).isEmpty());
    }

    @Test
    @DisplayName("Hourly buckets are keyed by the UTC hour start in epoch millis")
    void hourlyBuckets() {
        Instant hour = Instant.parse("2024-05-01T09:00:00Z");
        List<Trade> trades = List.of(
            trade("XCP", "GEMZ", "1", "1", 1, hour.plusSeconds(100)),
            trade("XCP", "GEMZ", "3", "1", 2, hour.plusSeconds(200)),
            trade("XCP", "GEMZ", "5", "1", 3, hour.plusSeconds(3700)));

        List<OhlcBucket> buckets = OhlcAggregator.hourly(trades);

        assertEquals(2, buckets.size());
        assertEquals(hour.toEpochMilli(), buckets.get(0).periodKey());
        assertEquals(new BigDecimal("2.00000000"), buckets.get(0).averagePrice());
        assertEquals(hour.plusSeconds(3600).toEpochMilli(), buckets.get(1).periodKey());
        assertEquals(1, buckets.get(1).count());
    }

    @Test
    @DisplayName("BTC-denominated XCP market is derived from inverted XCP/BTC trades")
    void invertsReferenceCross() {
        when(tradeRepository.findByPair(eq(new AssetPair("XCP", "BTC")), any(), any()))
            .thenReturn(List.of(trade("XCP", "BTC", "0.00025", "100", 5, NOW.minusSeconds(60))));

        List<Trade> trades = aggregator.tradesQuotedIn(ReferenceAsset.BTC, "XCP", NOW.minusSeconds(3600));

        Trade t = trades.get(0);
        assertEquals("BTC", t.baseAsset());
        assertEquals("XCP", t.quoteAsset());
        assertEquals(new BigDecimal("4000.00000000"), t.unitPrice());
        assertEquals(0, new BigDecimal("0.025").compareTo(t.baseQuantityNormalized()));
        assertEquals(0, new BigDecimal("100").compareTo(t.quoteQuantityNormalized()));
    }

    @Test
    @DisplayName("24h window of a regular asset queries the reference-based pair")
    void window24h() {
        when(tradeRepository.findByPair(new AssetPair("BTC", "GEMZ"), NOW.minusSeconds(86400), NOW))
            .thenReturn(List.of(
                trade("BTC", "GEMZ", "10", "1", 1, NOW.minusSeconds(7200)),
                trade("BTC", "GEMZ", "11", "1", 2, NOW.minusSeconds(3600))));

        OhlcBucket bucket = aggregator.window24h(ReferenceAsset.BTC, "GEMZ").orElseThrow();

        assertEquals(new BigDecimal("10.00000000"), bucket.open());
        assertEquals(new BigDecimal("11.00000000"), bucket.close());
    }

    @Test
    @DisplayName("Total 24h volume sums base quantities as base and quote quantities as quote")
    void totalVolume() {
        Instant since = NOW.minusSeconds(86400);
        when(tradeRepository.findByBaseAsset("GEMZ", since)).thenReturn(List.of(
            trade("GEMZ", "ZEBRA", "2", "5", 1, NOW)));
        when(tradeRepository.findByQuoteAsset("GEMZ", since)).thenReturn(List.of(
            trade("XCP", "GEMZ", "4", "3", 2, NOW),
            trade("BTC", "GEMZ", "10", "1", 3, NOW)));

        VolumeSummary volume = aggregator.totalVolume24h("GEMZ");

        // 5 as base + (3 * 4) + (1 * 10) as quote
        assertEquals(new BigDecimal("27.00000000"), volume.volume());
        assertEquals(3, volume.count());
    }

    @Test
    @DisplayName("Market price history groups by block with default 30 day range")
    void marketPriceHistory() {
        when(assetRepository.exists("GEMZ")).thenReturn(true);
        when(tradeRepository.findByPair(new AssetPair("XCP", "GEMZ"), NOW.minusSeconds(30L * 86400), NOW))
            .thenReturn(List.of(
                trade("XCP", "GEMZ", "1", "1", 100, NOW.minusSeconds(900)),
                trade("XCP", "GEMZ", "2", "1", 100, NOW.minusSeconds(900)),
                trade("XCP", "GEMZ", "3", "1", 101, NOW.minusSeconds(300))));

        List<OhlcBucket> rows = aggregator.marketPriceHistory("GEMZ", "XCP", null, null);

        assertEquals(2, rows.size());
        assertEquals(100L, rows.get(0).periodKey());
        assertEquals(2, rows.get(0).count());
        assertEquals(new BigDecimal("2.00000000"), rows.get(0).high());
        assertEquals(101L, rows.get(1).periodKey());
    }

    @Test
    @DisplayName("Reversed time range is rejected")
    void rejectsReversedRange() {
        when(assetRepository.exists("GEMZ")).thenReturn(true);

        assertThrows(IllegalArgumentException.class,
            () -> aggregator.marketPriceHistory("XCP", "GEMZ", NOW, NOW.minusSeconds(1)));
        verifyNoInteractions(tradeRepository);
    }

    private static Trade trade(String base, String quote, String price, String baseQty, long block, Instant at) {
        BigDecimal p = new BigDecimal(price);
        BigDecimal q = new BigDecimal(baseQty);
        return new Trade(base, quote, p, q, p.multiply(q), block, at);
    }
}
