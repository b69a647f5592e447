package io.marketlens.domain.asset;

import java.math.BigDecimal;
import java.time.Instant;

/**
 * State of an asset as of one block, tagged with the change that produced it.
 */
public record AssetSnapshot(
    String asset,
    String owner,
    String description,
    boolean divisible,
    boolean locked,
    long totalIssued,
    BigDecimal totalIssuedNormalized,
    AssetChangeType changeType,
    long atBlock,
    Instant atBlockTime
) {
}
