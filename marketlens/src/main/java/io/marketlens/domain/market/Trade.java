package io.marketlens.domain.market;

import io.marketlens.domain.common.Decimals;

import java.math.BigDecimal;
import java.time.Instant;

/**
 * A recorded trade between the base and quote asset of a canonical pair.
 * unitPrice = quoteQuantityNormalized / baseQuantityNormalized.
 */
public record Trade(
    String baseAsset,
    String quoteAsset,
    BigDecimal unitPrice,
    BigDecimal baseQuantityNormalized,
    BigDecimal quoteQuantityNormalized,
    long blockIndex,
    Instant blockTime
) {
    public AssetPair pair() {
        return new AssetPair(baseAsset, quoteAsset);
    }

    /**
     * Same trade seen from the opposite direction: price inverted, quantity roles swapped.
     */
    public Trade inverted() {
        return new Trade(
            quoteAsset,
            baseAsset,
            Decimals.inverse(unitPrice),
            quoteQuantityNormalized,
            baseQuantityNormalized,
            blockIndex,
            blockTime
        );
    }
}
