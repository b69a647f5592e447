package io.marketlens.service.asset;

import io.marketlens.domain.common.Decimals;
import io.marketlens.domain.common.ServiceContext;
import io.marketlens.domain.ledger.LedgerService;
import io.marketlens.domain.market.ReferenceAsset;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigDecimal;

/**
 * Total issuance of the two reference assets. Neither is tracked by the asset registry with a
 * meaningful supply: XCP comes from the ledger daemon, BTC from the block subsidy schedule.
 */
public final class ReferenceSupply {
    private static final Logger log = LoggerFactory.getLogger(ReferenceSupply.class);

    static final long INITIAL_SUBSIDY_SATOSHIS = 50L * 100_000_000L;
    static final long HALVING_INTERVAL = 210_000L;

    private final LedgerService ledger;

    public ReferenceSupply(LedgerService ledger) {
        this.ledger = ledger;
    }

    /**
     * Raw total issued of a reference asset as of the context's current block.
     */
    public long totalIssued(ReferenceAsset reference, ServiceContext ctx) {
        if (reference == ReferenceAsset.XCP) {
            long supply = ledger.getXcpSupply();
            log.debug("XCP supply {} at block {}", supply, ctx.currentBlockIndex());
            return supply;
        }
        return btcSupply(ctx.currentBlockIndex());
    }

    public BigDecimal totalIssuedNormalized(ReferenceAsset reference, ServiceContext ctx) {
        return Decimals.normalize(totalIssued(reference, ctx), true);
    }

    /**
     * Satoshis mined after {@code blockCount} blocks: 50 BTC per block, halved every
     * 210,000 blocks.
     */
    public static long btcSupply(long blockCount) {
        long remaining = Math.max(0L, blockCount);
        long subsidy = INITIAL_SUBSIDY_SATOSHIS;
        long total = 0L;
        while (remaining > 0 && subsidy > 0) {
            long blocks = Math.min(remaining, HALVING_INTERVAL);
            total += blocks * subsidy;
            remaining -= blocks;
            subsidy >>= 1;
        }
        return total;
    }
}
