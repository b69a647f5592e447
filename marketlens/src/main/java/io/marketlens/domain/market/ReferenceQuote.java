package io.marketlens.domain.market;

import java.math.BigDecimal;
import java.util.List;

/**
 * One asset's market figures denominated in one reference asset. Nullable fields are absent
 * for lack of trade data.
 */
public record ReferenceQuote(
    ReferenceAsset reference,
    BigDecimal priceIn,
    BigDecimal priceAs,
    BigDecimal aggregatedPriceIn,
    BigDecimal aggregatedPriceAs,
    BigDecimal marketCap,
    OhlcBucket ohlc24h,
    BigDecimal change24h,
    List<OhlcBucket> history7d
) {
}
