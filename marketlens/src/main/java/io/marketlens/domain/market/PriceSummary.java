package io.marketlens.domain.market;

import io.marketlens.domain.common.Decimals;

import java.math.BigDecimal;
import java.util.List;

/**
 * Synthesized market price of a pair plus, when requested, the trades it was derived from
 * (oldest first).
 */
public record PriceSummary(
    AssetPair pair,
    BigDecimal marketPrice,
    List<Trade> lastTrades
) {
    public PriceSummary {
        lastTrades = List.copyOf(lastTrades);
    }

    /**
     * View of the same market from the quote side. Only meaningful for the XCP/BTC pair,
     * whose reverse ordering is never stored.
     */
    public PriceSummary inverted() {
        return new PriceSummary(
            new AssetPair(pair.quote(), pair.base()),
            Decimals.inverse(marketPrice),
            lastTrades.stream().map(Trade::inverted).toList()
        );
    }
}
