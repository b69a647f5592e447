package io.marketlens.domain.market;

import java.math.BigDecimal;

/**
 * Caller's BTC fee stance for an order book request, in normalized BTC.
 * feeProvided applies when selling BTC, feeRequired when buying it. Either may be null.
 */
public record FeePreference(BigDecimal feeProvided, BigDecimal feeRequired) {
    public static FeePreference none() {
        return new FeePreference(null, null);
    }
}
