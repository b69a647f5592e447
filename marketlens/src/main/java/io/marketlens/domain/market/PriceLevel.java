package io.marketlens.domain.market;

import java.math.BigDecimal;

/**
 * Aggregated orders at one unit price. quantity is in base units; depth is the running total
 * from the best price down to and including this level.
 */
public record PriceLevel(BigDecimal unitPrice, BigDecimal quantity, int count, BigDecimal depth) {
}
