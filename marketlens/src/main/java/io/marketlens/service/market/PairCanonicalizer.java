package io.marketlens.service.market;

import io.marketlens.domain.error.InvalidAssetException;
import io.marketlens.domain.error.InvalidPairException;
import io.marketlens.domain.market.AssetPair;
import io.marketlens.domain.market.ReferenceAsset;
import io.marketlens.domain.repository.AssetRepository;
import io.marketlens.security.InputValidator;

/**
 * Assigns base and quote to an unordered pair of assets.
 *
 * Priority: XCP is base whenever present, then BTC, otherwise the lexicographically smaller
 * name. The only pair between the two reference assets is therefore XCP/BTC.
 */
public final class PairCanonicalizer {

    private final AssetRepository assetRepository;
    private final InputValidator validator;

    public PairCanonicalizer(AssetRepository assetRepository, InputValidator validator) {
        this.assetRepository = assetRepository;
        this.validator = validator;
    }

    /**
     * Pure ordering rule. Performs no validation.
     */
    public static AssetPair order(String asset1, String asset2) {
        for (ReferenceAsset reference : ReferenceAsset.values()) {
            String symbol = reference.symbol();
            if (symbol.equals(asset1)) {
                return new AssetPair(asset1, asset2);
            }
            if (symbol.equals(asset2)) {
                return new AssetPair(asset2, asset1);
            }
        }
        return asset1.compareTo(asset2) <= 0
            ? new AssetPair(asset1, asset2)
            : new AssetPair(asset2, asset1);
    }

    /**
     * Validated canonical pair.
     *
     * @throws InvalidPairException if the identifiers are blank or identical
     * @throws InvalidAssetException if either asset is malformed or unknown to the registry
     */
    public AssetPair canonicalize(String asset1, String asset2) {
        if (asset1 == null || asset2 == null || asset1.isBlank() || asset2.isBlank()) {
            throw new InvalidPairException(asset1, asset2, "both assets are required");
        }
        if (asset1.equals(asset2)) {
            throw new InvalidPairException(asset1, asset2, "an asset cannot be paired with itself");
        }
        requireKnown(asset1);
        requireKnown(asset2);
        return order(asset1, asset2);
    }

    private void requireKnown(String asset) {
        if (!validator.isValidAsset(asset)) {
            throw new InvalidAssetException(asset);
        }
        if (ReferenceAsset.isReference(asset)) {
            return;
        }
        if (!assetRepository.exists(asset)) {
            throw new InvalidAssetException(asset);
        }
    }
}
