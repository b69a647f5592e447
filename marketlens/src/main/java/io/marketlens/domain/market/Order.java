package io.marketlens.domain.market;

/**
 * Open order as listed by the ledger daemon. Quantities and fees are raw ledger units.
 */
public record Order(
    String txHash,
    String source,
    String giveAsset,
    long giveQuantity,
    String getAsset,
    long getQuantity,
    long giveRemaining,
    long getRemaining,
    long feeRequired,
    long feeProvided,
    long blockIndex,
    long expiration,
    String status
) {
    /**
     * An order with nothing left to give no longer rests on the book.
     */
    public boolean isActive() {
        return giveRemaining != 0;
    }

    public boolean gives(String asset) {
        return giveAsset.equals(asset);
    }
}
