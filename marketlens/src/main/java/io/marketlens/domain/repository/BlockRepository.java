package io.marketlens.domain.repository;

import java.time.Instant;
import java.util.Optional;

/**
 * Block index to block time mapping of processed blocks.
 */
public interface BlockRepository {

    Optional<Instant> findBlockTime(long blockIndex);
}
