package io.marketlens.domain.market;

import java.math.BigDecimal;
import java.util.List;

/**
 * Price-level view of the open orders of a pair. Bids are best (highest) first, asks best
 * (lowest) first.
 */
public record OrderBook(
    AssetPair pair,
    List<PriceLevel> bids,
    List<PriceLevel> asks,
    BigDecimal bidDepth,
    BigDecimal askDepth,
    BigDecimal spread,
    BigDecimal median,
    List<TimedOrder> rawOrders,
    List<TimedOrder> openCounterOrders
) {
}
