package io.marketlens.service.market;

import io.marketlens.domain.common.Decimals;
import io.marketlens.domain.common.ServiceContext;
import io.marketlens.domain.market.AssetPair;
import io.marketlens.domain.market.MarketInfo;
import io.marketlens.domain.market.OhlcBucket;
import io.marketlens.domain.market.PriceSummary;
import io.marketlens.domain.market.ReferenceAsset;
import io.marketlens.domain.market.ReferenceQuote;
import io.marketlens.domain.market.VolumeSummary;
import io.marketlens.domain.repository.AssetRepository;
import io.marketlens.security.InputValidator;
import io.marketlens.service.asset.ReferenceSupply;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigDecimal;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Composes per-asset market snapshots against both reference assets.
 *
 * "Price in X" is the market price of the pair whose base is X, i.e. units of the asset
 * per unit of X. The XCP/BTC cross rate is computed once per call and converts a price in
 * one reference into the other.
 */
public final class MarketInfoComposer {
    private static final Logger log = LoggerFactory.getLogger(MarketInfoComposer.class);

    static final int CROSS_RATE_TRADES = 30;

    private static final AssetPair REFERENCE_PAIR =
        new AssetPair(ReferenceAsset.XCP.symbol(), ReferenceAsset.BTC.symbol());

    private final PriceSynthesizer priceSynthesizer;
    private final OhlcAggregator ohlcAggregator;
    private final AssetRepository assetRepository;
    private final ReferenceSupply referenceSupply;
    private final InputValidator validator;

    public MarketInfoComposer(PriceSynthesizer priceSynthesizer, OhlcAggregator ohlcAggregator,
                              AssetRepository assetRepository, ReferenceSupply referenceSupply,
                              InputValidator validator) {
        this.priceSynthesizer = priceSynthesizer;
        this.ohlcAggregator = ohlcAggregator;
        this.assetRepository = assetRepository;
        this.referenceSupply = referenceSupply;
        this.validator = validator;
    }

    /**
     * Market info for each requested asset, in request order.
     *
     * @throws io.marketlens.domain.error.InvalidAssetException if any asset is not registered
     */
    public Map<String, MarketInfo> compose(ServiceContext ctx, List<String> assets) {
        validator.validateAssetList(assets);
        AssetLookup lookup = new AssetLookup(assetRepository);

        Optional<PriceSummary> crossSummary = priceSynthesizer.summarize(REFERENCE_PAIR, CROSS_RATE_TRADES);
        BigDecimal xcpBtc = crossSummary.map(PriceSummary::marketPrice).orElse(null);
        BigDecimal btcXcp = crossSummary.map(s -> s.inverted().marketPrice()).orElse(null);
        log.debug("Cross rate XCP/BTC={} BTC/XCP={}", xcpBtc, btcXcp);

        Map<String, MarketInfo> result = new LinkedHashMap<>();
        for (String asset : assets) {
            if (result.containsKey(asset)) {
                continue;
            }
            result.put(asset, composeOne(ctx, lookup, asset, xcpBtc, btcXcp));
        }
        log.info("Composed market info for {} assets ({} registry lookups)", result.size(), lookup.size());
        return result;
    }

    private MarketInfo composeOne(ServiceContext ctx, AssetLookup lookup, String asset,
                                  BigDecimal xcpBtc, BigDecimal btcXcp) {
        BigDecimal supply;
        Map<ReferenceAsset, BigDecimal> priceIn = new EnumMap<>(ReferenceAsset.class);
        Map<ReferenceAsset, BigDecimal> aggregatedIn = new EnumMap<>(ReferenceAsset.class);

        if (ReferenceAsset.isReference(asset)) {
            ReferenceAsset self = ReferenceAsset.of(asset);
            supply = referenceSupply.totalIssuedNormalized(self, ctx);
            BigDecimal one = Decimals.round8(BigDecimal.ONE);
            // price of the other reference expressed with this one as base
            BigDecimal cross = self == ReferenceAsset.XCP ? btcXcp : xcpBtc;
            priceIn.put(self, one);
            aggregatedIn.put(self, one);
            putIfPresent(priceIn, self.other(), cross);
            putIfPresent(aggregatedIn, self.other(), cross);
        } else {
            supply = lookup.require(asset).current().totalIssuedNormalized();
            for (ReferenceAsset reference : ReferenceAsset.values()) {
                AssetPair pair = PairCanonicalizer.order(reference.symbol(), asset);
                priceSynthesizer.summarize(pair, 0)
                    .ifPresent(s -> priceIn.put(reference, s.marketPrice()));
            }
            putIfPresent(aggregatedIn, ReferenceAsset.XCP,
                aggregate(priceIn.get(ReferenceAsset.XCP), priceIn.get(ReferenceAsset.BTC), xcpBtc));
            putIfPresent(aggregatedIn, ReferenceAsset.BTC,
                aggregate(priceIn.get(ReferenceAsset.BTC), priceIn.get(ReferenceAsset.XCP), btcXcp));
        }

        Map<ReferenceAsset, ReferenceQuote> quotes = new EnumMap<>(ReferenceAsset.class);
        for (ReferenceAsset reference : ReferenceAsset.values()) {
            quotes.put(reference, quote(reference, asset, supply, priceIn.get(reference), aggregatedIn.get(reference)));
        }
        VolumeSummary volume24h = ohlcAggregator.totalVolume24h(asset);
        return new MarketInfo(asset, Decimals.round8(supply), volume24h, quotes);
    }

    private ReferenceQuote quote(ReferenceAsset reference, String asset, BigDecimal supply,
                                 BigDecimal priceIn, BigDecimal aggregatedIn) {
        BigDecimal marketCap = priceIn != null && !Decimals.isZero(priceIn)
            ? Decimals.divide(supply, priceIn)
            : null;

        OhlcBucket ohlc24h = null;
        BigDecimal change24h = null;
        List<OhlcBucket> history7d = List.of();
        if (!reference.symbol().equals(asset)) {
            ohlc24h = ohlcAggregator.window24h(reference, asset).orElse(null);
            if (ohlc24h != null && !Decimals.isZero(ohlc24h.open())) {
                change24h = Decimals.percentChange(ohlc24h.open(), ohlc24h.close());
            }
            history7d = ohlcAggregator.history7d(reference, asset);
        }

        return new ReferenceQuote(
            reference,
            priceIn,
            invert(priceIn),
            aggregatedIn,
            invert(aggregatedIn),
            marketCap,
            ohlc24h,
            change24h,
            history7d
        );
    }

    /**
     * Mean of the direct price and the price via the other reference. Absent unless both
     * operands are present.
     */
    static BigDecimal aggregate(BigDecimal direct, BigDecimal viaOther, BigDecimal crossRate) {
        if (direct == null || viaOther == null || crossRate == null) {
            return null;
        }
        return Decimals.mean(direct, viaOther.multiply(crossRate));
    }

    private static BigDecimal invert(BigDecimal price) {
        return price == null || Decimals.isZero(price) ? null : Decimals.inverse(price);
    }

    private static void putIfPresent(Map<ReferenceAsset, BigDecimal> target, ReferenceAsset key, BigDecimal value) {
        if (value != null) {
            target.put(key, value);
        }
    }
}
