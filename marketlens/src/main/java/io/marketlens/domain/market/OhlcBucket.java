package io.marketlens.domain.market;

import java.math.BigDecimal;
import java.time.Instant;

/**
 * Open/high/low/close rollup of the trades in one period.
 *
 * periodKey is the bucket identity for its grain: epoch millis of the period start for
 * time grains, the block index for block grain.
 */
public record OhlcBucket(
    long periodKey,
    Instant periodStart,
    BigDecimal open,
    BigDecimal high,
    BigDecimal low,
    BigDecimal close,
    BigDecimal volume,
    BigDecimal averagePrice,
    int count
) {
}
