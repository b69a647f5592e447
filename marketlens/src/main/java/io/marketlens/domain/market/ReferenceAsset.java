package io.marketlens.domain.market;

/**
 * The two assets every market is quoted against.
 */
public enum ReferenceAsset {
    /** Native ledger asset. Always the base of any pair it is part of. */
    XCP,
    /** Fee-bearing asset. Base of any pair that does not contain XCP. */
    BTC;

    public String symbol() {
        return name();
    }

    public ReferenceAsset other() {
        return this == XCP ? BTC : XCP;
    }

    /** JSON field suffix, e.g. {@code price_in_xcp}. */
    public String suffix() {
        return name().toLowerCase();
    }

    public static boolean isReference(String asset) {
        return XCP.symbol().equals(asset) || BTC.symbol().equals(asset);
    }

    public static ReferenceAsset of(String asset) {
        return valueOf(asset);
    }
}
