package io.marketlens.domain.error;

/**
 * Thrown when replicated records contradict themselves. Never corrected silently.
 */
public class DataIntegrityException extends MarketDataException {

    private final String asset;
    private final long blockIndex;

    public DataIntegrityException(String asset, long blockIndex, String message) {
        super(String.format("[%s@%d] %s", asset, blockIndex, message));
        this.asset = asset;
        this.blockIndex = blockIndex;
    }

    public String getAsset() {
        return asset;
    }

    public long getBlockIndex() {
        return blockIndex;
    }
}
