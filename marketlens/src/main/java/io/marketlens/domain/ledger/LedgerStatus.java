package io.marketlens.domain.ledger;

/**
 * Replication progress reported by the ledger daemon.
 */
public record LedgerStatus(boolean caughtUp, long lastBlockIndex, long lastMessageIndex) {
}
