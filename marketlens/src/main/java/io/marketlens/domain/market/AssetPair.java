package io.marketlens.domain.market;

import java.util.Objects;

/**
 * Canonically ordered asset pair. Prices are quote-per-base.
 */
public record AssetPair(String base, String quote) {
    public AssetPair {
        Objects.requireNonNull(base, "base cannot be null");
        Objects.requireNonNull(quote, "quote cannot be null");
    }

    public String name() {
        return base + "/" + quote;
    }

    public boolean contains(String asset) {
        return base.equals(asset) || quote.equals(asset);
    }

    @Override
    public String toString() {
        return name();
    }
}
