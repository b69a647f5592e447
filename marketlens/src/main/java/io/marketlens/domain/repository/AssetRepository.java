package io.marketlens.domain.repository;

import io.marketlens.domain.asset.TrackedAsset;

import java.util.Optional;

/**
 * Asset registry with per-asset change log.
 */
public interface AssetRepository {

    Optional<TrackedAsset> findByAsset(String asset);

    boolean exists(String asset);
}
