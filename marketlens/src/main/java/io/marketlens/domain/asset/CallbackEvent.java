package io.marketlens.domain.asset;

import java.math.BigDecimal;

/**
 * Proportional supply reduction reported by the ledger daemon. fraction is in (0, 1].
 */
public record CallbackEvent(String asset, BigDecimal fraction, long blockIndex) {
}
