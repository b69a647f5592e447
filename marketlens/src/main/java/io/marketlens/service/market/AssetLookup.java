package io.marketlens.service.market;

import io.marketlens.domain.asset.TrackedAsset;
import io.marketlens.domain.error.InvalidAssetException;
import io.marketlens.domain.market.ReferenceAsset;
import io.marketlens.domain.repository.AssetRepository;

import java.util.HashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Memoized registry lookups for the duration of one request.
 *
 * Create one per call and drop it with the call; instances are not thread-safe and must
 * never be shared between requests.
 */
public final class AssetLookup {

    private final AssetRepository assetRepository;
    private final Map<String, Optional<TrackedAsset>> memo = new HashMap<>();

    public AssetLookup(AssetRepository assetRepository) {
        this.assetRepository = assetRepository;
    }

    public Optional<TrackedAsset> find(String asset) {
        return memo.computeIfAbsent(asset, assetRepository::findByAsset);
    }

    public TrackedAsset require(String asset) {
        return find(asset).orElseThrow(() -> new InvalidAssetException(asset));
    }

    /**
     * Both reference assets are divisible; anything else is read from the registry.
     */
    public boolean divisible(String asset) {
        if (ReferenceAsset.isReference(asset)) {
            return true;
        }
        return require(asset).divisible();
    }

    int size() {
        return memo.size();
    }
}
