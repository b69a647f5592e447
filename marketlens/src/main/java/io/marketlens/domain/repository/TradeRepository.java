package io.marketlens.domain.repository;

import io.marketlens.domain.market.AssetPair;
import io.marketlens.domain.market.Trade;

import java.time.Instant;
import java.util.List;

/**
 * Read access to recorded trades.
 */
public interface TradeRepository {

    /**
     * Most recent trades of a pair at or after {@code since}, newest first, at most {@code limit}.
     */
    List<Trade> findRecent(AssetPair pair, Instant since, int limit);

    /**
     * Trades of a pair with block time in [from, to], oldest first.
     */
    List<Trade> findByPair(AssetPair pair, Instant from, Instant to);

    /**
     * Trades of a pair with block time in [from, to], newest first, at most {@code limit}.
     */
    List<Trade> findByPairNewestFirst(AssetPair pair, Instant from, Instant to, int limit);

    /**
     * Latest trades of a pair regardless of time, newest first.
     */
    List<Trade> findLatest(AssetPair pair, int limit);

    /**
     * Trades where {@code asset} is the base, at or after {@code since}.
     */
    List<Trade> findByBaseAsset(String asset, Instant since);

    /**
     * Trades where {@code asset} is the quote, at or after {@code since}.
     */
    List<Trade> findByQuoteAsset(String asset, Instant since);
}
