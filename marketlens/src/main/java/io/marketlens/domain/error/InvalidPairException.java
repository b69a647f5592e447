package io.marketlens.domain.error;

/**
 * Thrown when two identifiers cannot form a market, e.g. the same asset twice.
 */
public class InvalidPairException extends MarketDataException {

    private final String asset1;
    private final String asset2;

    public InvalidPairException(String asset1, String asset2, String message) {
        super(String.format("Invalid pair [%s, %s]: %s", asset1, asset2, message));
        this.asset1 = asset1;
        this.asset2 = asset2;
    }

    public String getAsset1() {
        return asset1;
    }

    public String getAsset2() {
        return asset2;
    }
}
