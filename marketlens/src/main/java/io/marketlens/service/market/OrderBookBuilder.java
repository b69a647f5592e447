package io.marketlens.service.market;

import io.marketlens.domain.common.Decimals;
import io.marketlens.domain.ledger.LedgerService;
import io.marketlens.domain.market.AssetPair;
import io.marketlens.domain.market.FeePreference;
import io.marketlens.domain.market.Order;
import io.marketlens.domain.market.OrderBook;
import io.marketlens.domain.market.OrderFilter;
import io.marketlens.domain.market.PriceLevel;
import io.marketlens.domain.market.ReferenceAsset;
import io.marketlens.domain.market.TimedOrder;
import io.marketlens.domain.repository.AssetRepository;
import io.marketlens.domain.repository.BlockRepository;
import io.marketlens.security.InputValidator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;

/**
 * Builds the bid/ask price-level book of a pair from the ledger's open orders.
 *
 * Bids are orders giving the quote asset for the base, asks orders giving the base for the
 * quote. When BTC is part of the pair, the caller's fee stance narrows both sides to the
 * orders it actually competes with or could match:
 *
 * <pre>
 * base=BTC  buying BTC   bid: fee_required >= required   ask: fee_provided >= required
 * base=BTC  selling BTC  bid: fee_required <= provided   ask: fee_provided >= provided
 * quote=BTC buying BTC   bid: fee_provided >= required   ask: fee_required >= required
 * quote=BTC selling BTC  bid: fee_provided >= provided   ask: fee_required <= provided
 * </pre>
 */
public final class OrderBookBuilder {
    private static final Logger log = LoggerFactory.getLogger(OrderBookBuilder.class);

    private static final String BTC = ReferenceAsset.BTC.symbol();
    private static final BigDecimal TWO = BigDecimal.valueOf(2);

    private final LedgerService ledger;
    private final AssetRepository assetRepository;
    private final BlockRepository blockRepository;
    private final PairCanonicalizer canonicalizer;
    private final InputValidator validator;

    public OrderBookBuilder(LedgerService ledger, AssetRepository assetRepository,
                            BlockRepository blockRepository, PairCanonicalizer canonicalizer,
                            InputValidator validator) {
        this.ledger = ledger;
        this.assetRepository = assetRepository;
        this.blockRepository = blockRepository;
        this.canonicalizer = canonicalizer;
        this.validator = validator;
    }

    /**
     * Current order book for the market the caller wants to trade in.
     *
     * @param buyAsset  asset the caller wants to receive
     * @param sellAsset asset the caller wants to give
     * @param fee       caller's BTC fee stance, ignored unless BTC is in the pair
     */
    public OrderBook build(String buyAsset, String sellAsset, FeePreference fee) {
        if (fee != null) {
            validator.validateFee("feeProvided", fee.feeProvided());
            validator.validateFee("feeRequired", fee.feeRequired());
        }
        AssetPair pair = canonicalizer.canonicalize(buyAsset, sellAsset);
        AssetLookup assets = new AssetLookup(assetRepository);
        boolean baseDivisible = assets.divisible(pair.base());
        boolean quoteDivisible = assets.divisible(pair.quote());

        List<OrderFilter> counterFilters = sideFilters(buyAsset, sellAsset);
        List<OrderFilter> bidFilters = sideFilters(pair.quote(), pair.base());
        List<OrderFilter> askFilters = sideFilters(pair.base(), pair.quote());
        applyFeeFilters(pair, buyAsset, fee != null ? fee : FeePreference.none(), bidFilters, askFilters);

        List<Order> counterOrders = active(ledger.getOpenOrders(counterFilters));
        List<Order> bidOrders = active(ledger.getOpenOrders(bidFilters));
        List<Order> askOrders = active(ledger.getOpenOrders(askFilters));

        List<PriceLevel> bids = makeBook(pair, bidOrders, true, baseDivisible, quoteDivisible);
        List<PriceLevel> asks = makeBook(pair, askOrders, false, baseDivisible, quoteDivisible);

        BigDecimal spread = spread(bids, asks);
        BigDecimal median = asks.isEmpty()
            ? Decimals.round8(BigDecimal.ZERO)
            : Decimals.round8(asks.get(0).unitPrice().subtract(spread.divide(TWO)));

        Map<Long, Optional<Instant>> blockTimes = new HashMap<>();
        List<TimedOrder> rawOrders = new ArrayList<>(bidOrders.size() + askOrders.size());
        for (Order order : bidOrders) {
            rawOrders.add(timed(order, blockTimes));
        }
        for (Order order : askOrders) {
            rawOrders.add(timed(order, blockTimes));
        }
        List<TimedOrder> openCounter = counterOrders.stream()
            .map(o -> timed(o, blockTimes))
            .toList();

        log.debug("Order book {}: {} bid levels, {} ask levels, spread {}",
            pair, bids.size(), asks.size(), spread);

        return new OrderBook(
            pair,
            bids,
            asks,
            totalDepth(bids),
            totalDepth(asks),
            spread,
            median,
            rawOrders,
            openCounter
        );
    }

    /**
     * Adds the fee predicates of the table in the class comment. A predicate is only added
     * when the caller supplied the fee value it compares against.
     */
    static void applyFeeFilters(AssetPair pair, String buyAsset, FeePreference fee,
                                List<OrderFilter> bidFilters, List<OrderFilter> askFilters) {
        if (!pair.contains(BTC)) {
            return;
        }
        boolean buyingBtc = BTC.equals(buyAsset);
        BigDecimal callerFee = buyingBtc ? fee.feeRequired() : fee.feeProvided();
        if (callerFee == null) {
            return;
        }
        long raw = Decimals.denormalize(callerFee);

        if (BTC.equals(pair.base())) {
            if (buyingBtc) {
                bidFilters.add(OrderFilter.gte("fee_required", raw));
                askFilters.add(OrderFilter.gte("fee_provided", raw));
            } else {
                bidFilters.add(OrderFilter.lte("fee_required", raw));
                askFilters.add(OrderFilter.gte("fee_provided", raw));
            }
        } else {
            if (buyingBtc) {
                bidFilters.add(OrderFilter.gte("fee_provided", raw));
                askFilters.add(OrderFilter.gte("fee_required", raw));
            } else {
                bidFilters.add(OrderFilter.gte("fee_provided", raw));
                askFilters.add(OrderFilter.lte("fee_required", raw));
            }
        }
    }

    /**
     * Merges orders into price levels. Quantities are remaining base units.
     */
    static List<PriceLevel> makeBook(AssetPair pair, List<Order> orders, boolean bidBook,
                                     boolean baseDivisible, boolean quoteDivisible) {
        Comparator<BigDecimal> order = bidBook ? Comparator.reverseOrder() : Comparator.naturalOrder();
        TreeMap<BigDecimal, LevelAccumulator> levels = new TreeMap<>(order);

        for (Order o : orders) {
            BigDecimal baseQuantity;
            BigDecimal quoteQuantity;
            BigDecimal remaining;
            if (o.gives(pair.base())) {
                baseQuantity = Decimals.normalize(o.giveQuantity(), baseDivisible);
                quoteQuantity = Decimals.normalize(o.getQuantity(), quoteDivisible);
                remaining = Decimals.normalize(o.giveRemaining(), baseDivisible);
            } else {
                baseQuantity = Decimals.normalize(o.getQuantity(), baseDivisible);
                quoteQuantity = Decimals.normalize(o.giveQuantity(), quoteDivisible);
                remaining = Decimals.normalize(o.getRemaining(), baseDivisible);
            }
            if (Decimals.isZero(baseQuantity)) {
                log.warn("Skipping order {} with zero base quantity in {}", o.txHash(), pair);
                continue;
            }
            BigDecimal unitPrice = Decimals.divide(quoteQuantity, baseQuantity);
            levels.computeIfAbsent(unitPrice, p -> new LevelAccumulator()).add(remaining);
        }

        List<PriceLevel> book = new ArrayList<>(levels.size());
        BigDecimal depth = BigDecimal.ZERO;
        for (Map.Entry<BigDecimal, LevelAccumulator> level : levels.entrySet()) {
            depth = depth.add(level.getValue().quantity);
            book.add(new PriceLevel(
                level.getKey(),
                Decimals.round8(level.getValue().quantity),
                level.getValue().count,
                Decimals.round8(depth)
            ));
        }
        return book;
    }

    static BigDecimal spread(List<PriceLevel> bids, List<PriceLevel> asks) {
        if (bids.isEmpty() || asks.isEmpty()) {
            return Decimals.round8(BigDecimal.ZERO);
        }
        return Decimals.round8(asks.get(0).unitPrice().subtract(bids.get(0).unitPrice()));
    }

    private static BigDecimal totalDepth(List<PriceLevel> levels) {
        return levels.isEmpty()
            ? Decimals.round8(BigDecimal.ZERO)
            : levels.get(levels.size() - 1).depth();
    }

    private static List<OrderFilter> sideFilters(String giveAsset, String getAsset) {
        List<OrderFilter> filters = new ArrayList<>();
        filters.add(OrderFilter.eq("get_asset", getAsset));
        filters.add(OrderFilter.eq("give_asset", giveAsset));
        filters.add(OrderFilter.ne("give_remaining", 0));
        return filters;
    }

    private static List<Order> active(List<Order> orders) {
        return orders.stream().filter(Order::isActive).toList();
    }

    private TimedOrder timed(Order order, Map<Long, Optional<Instant>> blockTimes) {
        Optional<Instant> blockTime = blockTimes.computeIfAbsent(order.blockIndex(), blockRepository::findBlockTime);
        return new TimedOrder(order, blockTime.orElse(null));
    }

    private static final class LevelAccumulator {
        private BigDecimal quantity = BigDecimal.ZERO;
        private int count;

        void add(BigDecimal remaining) {
            quantity = quantity.add(remaining);
            count++;
        }
    }
}
