package io.marketlens.service.market;

import io.marketlens.domain.market.AssetPair;
import io.marketlens.domain.market.Trade;
import io.marketlens.domain.repository.TradeRepository;
import io.marketlens.security.InputValidator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;

/**
 * Raw trade listings of a pair, newest first.
 */
public final class TradeHistoryService {
    private static final Logger log = LoggerFactory.getLogger(TradeHistoryService.class);

    public static final int DEFAULT_LIMIT = 50;
    static final Duration DEFAULT_RANGE = Duration.ofDays(30);

    private final TradeRepository tradeRepository;
    private final PairCanonicalizer canonicalizer;
    private final InputValidator validator;
    private final Clock clock;

    public TradeHistoryService(TradeRepository tradeRepository, PairCanonicalizer canonicalizer,
                               InputValidator validator, Clock clock) {
        this.tradeRepository = tradeRepository;
        this.canonicalizer = canonicalizer;
        this.validator = validator;
        this.clock = clock;
    }

    public List<Trade> lastTrades(String asset1, String asset2, int limit) {
        validator.validateLimit(limit);
        AssetPair pair = canonicalizer.canonicalize(asset1, asset2);
        List<Trade> trades = tradeRepository.findLatest(pair, limit);
        log.debug("Last {} trades of {}: {}", limit, pair, trades.size());
        return trades;
    }

    /**
     * Trades with block time in [from, to]. Null bounds default to the 30 days ending now.
     */
    public List<Trade> tradesWithinDates(String asset1, String asset2, Instant from, Instant to, int limit) {
        validator.validateLimit(limit);
        AssetPair pair = canonicalizer.canonicalize(asset1, asset2);
        Instant end = to != null ? to : clock.instant();
        Instant start = from != null ? from : end.minus(DEFAULT_RANGE);
        validator.validateTimeRange(start, end);

        List<Trade> trades = tradeRepository.findByPairNewestFirst(pair, start, end, limit);
        log.debug("Trades of {} in [{} - {}]: {}", pair, start, end, trades.size());
        return trades;
    }
}
