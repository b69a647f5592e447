package io.marketlens.service.market;

import io.marketlens.domain.common.Decimals;
import io.marketlens.domain.market.AssetPair;
import io.marketlens.domain.market.OhlcBucket;
import io.marketlens.domain.market.ReferenceAsset;
import io.marketlens.domain.market.Trade;
import io.marketlens.domain.market.VolumeSummary;
import io.marketlens.domain.repository.TradeRepository;
import io.marketlens.security.InputValidator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.Function;

/**
 * OHLC / volume rollups over recorded trades.
 *
 * Grains:
 * - whole window (24h summary)
 * - UTC hour (7-day history)
 * - block (market price history)
 *
 * A market quoted in a reference asset that is not the canonical base (only BTC/XCP)
 * is built from the canonical XCP/BTC trades, each inverted.
 */
public final class OhlcAggregator {
    private static final Logger log = LoggerFactory.getLogger(OhlcAggregator.class);

    static final Duration DAY = Duration.ofDays(1);
    static final Duration WEEK = Duration.ofDays(7);
    static final Duration DEFAULT_HISTORY_RANGE = Duration.ofDays(30);

    private final TradeRepository tradeRepository;
    private final PairCanonicalizer canonicalizer;
    private final InputValidator validator;
    private final Clock clock;

    public OhlcAggregator(TradeRepository tradeRepository, PairCanonicalizer canonicalizer,
                          InputValidator validator, Clock clock) {
        this.tradeRepository = tradeRepository;
        this.canonicalizer = canonicalizer;
        this.validator = validator;
        this.clock = clock;
    }

    /**
     * Single bucket over the last 24 hours of the asset's market in {@code reference}.
     *
     * @return empty when no trade happened in the window
     */
    public Optional<OhlcBucket> window24h(ReferenceAsset reference, String asset) {
        Instant since = clock.instant().minus(DAY);
        List<Trade> trades = tradesQuotedIn(reference, asset, since);
        return rollup(trades, since.toEpochMilli(), since);
    }

    /**
     * Hourly buckets over the last 7 days of the asset's market in {@code reference}, oldest first.
     */
    public List<OhlcBucket> history7d(ReferenceAsset reference, String asset) {
        Instant since = clock.instant().minus(WEEK);
        return hourly(tradesQuotedIn(reference, asset, since));
    }

    /**
     * Total 24h traded quantity of an asset across every market. Trades where the asset is
     * base contribute their base quantity, trades where it is quote their quote quantity.
     */
    public VolumeSummary totalVolume24h(String asset) {
        Instant since = clock.instant().minus(DAY);
        VolumeSummary asBase = sum(tradeRepository.findByBaseAsset(asset, since), Trade::baseQuantityNormalized);
        VolumeSummary asQuote = sum(tradeRepository.findByQuoteAsset(asset, since), Trade::quoteQuantityNormalized);
        return asBase.plus(asQuote);
    }

    /**
     * Block-by-block OHLC rows of a pair, ascending by block time. Null bounds default to
     * the 30 days ending now.
     */
    public List<OhlcBucket> marketPriceHistory(String asset1, String asset2, Instant from, Instant to) {
        AssetPair pair = canonicalizer.canonicalize(asset1, asset2);
        Instant end = to != null ? to : clock.instant();
        Instant start = from != null ? from : end.minus(DEFAULT_HISTORY_RANGE);
        validator.validateTimeRange(start, end);

        List<OhlcBucket> rows = byBlock(tradeRepository.findByPair(pair, start, end));
        log.debug("Market price history {} [{} - {}]: {} blocks", pair, start, end, rows.size());
        return rows;
    }

    /**
     * Trades of the asset's market against {@code reference}, oriented so that the reference
     * is the base, oldest first.
     */
    List<Trade> tradesQuotedIn(ReferenceAsset reference, String asset, Instant since) {
        AssetPair pair = PairCanonicalizer.order(reference.symbol(), asset);
        List<Trade> trades = tradeRepository.findByPair(pair, since, clock.instant());
        if (pair.base().equals(reference.symbol())) {
            return trades;
        }
        log.debug("Deriving {}/{} from inverted {} trades", reference, asset, pair);
        return trades.stream().map(Trade::inverted).toList();
    }

    static List<OhlcBucket> hourly(List<Trade> trades) {
        return group(trades, t -> t.blockTime().truncatedTo(ChronoUnit.HOURS).toEpochMilli(),
            t -> t.blockTime().truncatedTo(ChronoUnit.HOURS));
    }

    static List<OhlcBucket> byBlock(List<Trade> trades) {
        return group(trades, Trade::blockIndex, Trade::blockTime);
    }

    private static List<OhlcBucket> group(List<Trade> trades, Function<Trade, Long> keyOf,
                                          Function<Trade, Instant> startOf) {
        List<Trade> ordered = trades.stream()
            .sorted(Comparator.comparing(Trade::blockTime).thenComparingLong(Trade::blockIndex))
            .toList();

        Map<Long, List<Trade>> groups = new LinkedHashMap<>();
        for (Trade trade : ordered) {
            groups.computeIfAbsent(keyOf.apply(trade), k -> new ArrayList<>()).add(trade);
        }

        List<OhlcBucket> buckets = new ArrayList<>(groups.size());
        for (Map.Entry<Long, List<Trade>> entry : groups.entrySet()) {
            List<Trade> members = entry.getValue();
            rollup(members, entry.getKey(), startOf.apply(members.get(0))).ifPresent(buckets::add);
        }
        buckets.sort(Comparator.comparing(OhlcBucket::periodStart).thenComparingLong(OhlcBucket::periodKey));
        return buckets;
    }

    /**
     * Aggregates trades into one bucket. Open and close follow block time order.
     */
    static Optional<OhlcBucket> rollup(List<Trade> trades, long periodKey, Instant periodStart) {
        if (trades.isEmpty()) {
            return Optional.empty();
        }
        List<Trade> ordered = trades.stream()
            .sorted(Comparator.comparing(Trade::blockTime).thenComparingLong(Trade::blockIndex))
            .toList();

        BigDecimal open = ordered.get(0).unitPrice();
        BigDecimal close = ordered.get(ordered.size() - 1).unitPrice();
        BigDecimal high = ordered.stream()
            .map(Trade::unitPrice)
            .max(BigDecimal::compareTo)
            .orElse(BigDecimal.ZERO);
        BigDecimal low = ordered.stream()
            .map(Trade::unitPrice)
            .min(BigDecimal::compareTo)
            .orElse(BigDecimal.ZERO);
        BigDecimal volume = ordered.stream()
            .map(Trade::baseQuantityNormalized)
            .reduce(BigDecimal.ZERO, BigDecimal::add);
        BigDecimal priceSum = ordered.stream()
            .map(Trade::unitPrice)
            .reduce(BigDecimal.ZERO, BigDecimal::add);
        BigDecimal average = Decimals.divide(priceSum, BigDecimal.valueOf(ordered.size()));

        return Optional.of(new OhlcBucket(
            periodKey,
            periodStart,
            Decimals.round8(open),
            Decimals.round8(high),
            Decimals.round8(low),
            Decimals.round8(close),
            Decimals.round8(volume),
            average,
            ordered.size()
        ));
    }

    private static VolumeSummary sum(List<Trade> trades, Function<Trade, BigDecimal> quantity) {
        BigDecimal volume = trades.stream()
            .map(quantity)
            .reduce(BigDecimal.ZERO, BigDecimal::add);
        return new VolumeSummary(Decimals.round8(volume), trades.size());
    }
}
