package io.marketlens.domain.error;

/**
 * Thrown when an asset identifier is unknown to the registry.
 */
public class InvalidAssetException extends MarketDataException {

    private final String asset;

    public InvalidAssetException(String asset) {
        super(String.format("Invalid asset: %s", asset));
        this.asset = asset;
    }

    public String getAsset() {
        return asset;
    }
}
