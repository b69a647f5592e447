package io.marketlens.service.market;

import io.marketlens.domain.common.Decimals;
import io.marketlens.domain.market.AssetPair;
import io.marketlens.domain.market.PriceSummary;
import io.marketlens.domain.market.Trade;
import io.marketlens.domain.repository.TradeRepository;
import io.marketlens.security.InputValidator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;

/**
 * Synthesizes a market price for a pair from its most recent trades.
 *
 * The last max(6, requested) trades of the past 10 days are taken oldest first and the
 * first six are weighted by [1, .9, .72, .6, .4, .3]. The oldest selected trade carries
 * the largest weight.
 */
public final class PriceSynthesizer {
    private static final Logger log = LoggerFactory.getLogger(PriceSynthesizer.class);

    static final Duration LOOKBACK = Duration.ofDays(10);
    static final List<BigDecimal> WEIGHTS = List.of(
        new BigDecimal("1"),
        new BigDecimal("0.9"),
        new BigDecimal("0.72"),
        new BigDecimal("0.6"),
        new BigDecimal("0.4"),
        new BigDecimal("0.3")
    );

    private final TradeRepository tradeRepository;
    private final PairCanonicalizer canonicalizer;
    private final InputValidator validator;
    private final Clock clock;

    public PriceSynthesizer(TradeRepository tradeRepository, PairCanonicalizer canonicalizer,
                            InputValidator validator, Clock clock) {
        this.tradeRepository = tradeRepository;
        this.canonicalizer = canonicalizer;
        this.validator = validator;
        this.clock = clock;
    }

    /**
     * Market price for two assets in either order.
     *
     * @param withLastTrades number of raw trades to include, 0-30
     * @return empty when no trade happened in the lookback window
     */
    public Optional<PriceSummary> summarize(String asset1, String asset2, int withLastTrades) {
        validator.validateLastTrades(withLastTrades);
        AssetPair pair = canonicalizer.canonicalize(asset1, asset2);
        return summarize(pair, withLastTrades);
    }

    /**
     * Market price for an already canonical, validated pair.
     */
    public Optional<PriceSummary> summarize(AssetPair pair, int withLastTrades) {
        Instant since = clock.instant().minus(LOOKBACK);
        int fetch = Math.max(WEIGHTS.size(), withLastTrades);

        List<Trade> trades = new ArrayList<>(tradeRepository.findRecent(pair, since, fetch));
        if (trades.isEmpty()) {
            log.debug("No trades for {} since {}", pair, since);
            return Optional.empty();
        }
        Collections.reverse(trades);

        int inputs = Math.min(trades.size(), WEIGHTS.size());
        List<BigDecimal> prices = new ArrayList<>(inputs);
        for (int i = 0; i < inputs; i++) {
            prices.add(trades.get(i).unitPrice());
        }
        BigDecimal marketPrice = Decimals.weightedAverage(prices, WEIGHTS.subList(0, inputs));

        log.debug("Market price {} for {} from {} trades", marketPrice, pair, inputs);
        return Optional.of(new PriceSummary(pair, marketPrice, withLastTrades > 0 ? trades : List.of()));
    }
}
