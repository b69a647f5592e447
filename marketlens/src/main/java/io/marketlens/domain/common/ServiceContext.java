package io.marketlens.domain.common;

/**
 * Readiness of the ledger replica at the moment a request is accepted.
 *
 * Handed to each request explicitly; nothing reads readiness from global state.
 */
public record ServiceContext(
    boolean caughtUp,
    long lastMessageIndex,
    long currentBlockIndex,
    boolean testnet
) {
    public static ServiceContext notReady(boolean testnet) {
        return new ServiceContext(false, -1L, 0L, testnet);
    }

    public ServiceContext withBlock(long blockIndex, long messageIndex, boolean caughtUp) {
        return new ServiceContext(caughtUp, messageIndex, blockIndex, testnet);
    }
}
