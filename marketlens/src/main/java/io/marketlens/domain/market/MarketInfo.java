package io.marketlens.domain.market;

import java.math.BigDecimal;
import java.util.Map;

/**
 * Market snapshot of a single asset across both reference markets.
 */
public record MarketInfo(
    String asset,
    BigDecimal totalSupply,
    VolumeSummary volume24h,
    Map<ReferenceAsset, ReferenceQuote> quotes
) {
    public ReferenceQuote in(ReferenceAsset reference) {
        return quotes.get(reference);
    }
}
