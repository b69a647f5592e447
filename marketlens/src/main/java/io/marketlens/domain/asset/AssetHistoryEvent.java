package io.marketlens.domain.asset;

import java.math.BigDecimal;
import java.time.Instant;

/**
 * One entry of an asset's lifecycle timeline. Each variant carries only its own fields.
 */
public sealed interface AssetHistoryEvent {

    String type();

    long atBlock();

    Instant atBlockTime();

    record Created(
        long atBlock,
        Instant atBlockTime,
        String owner,
        String description,
        boolean divisible,
        boolean locked,
        long totalIssued,
        BigDecimal totalIssuedNormalized
    ) implements AssetHistoryEvent {
        @Override
        public String type() {
            return "created";
        }
    }

    record IssuedMore(
        long atBlock,
        Instant atBlockTime,
        long additional,
        BigDecimal additionalNormalized,
        long totalIssued,
        BigDecimal totalIssuedNormalized
    ) implements AssetHistoryEvent {
        @Override
        public String type() {
            return "issued_more";
        }
    }

    record DescriptionChanged(
        long atBlock,
        Instant atBlockTime,
        String prevDescription,
        String newDescription
    ) implements AssetHistoryEvent {
        @Override
        public String type() {
            return "changed_description";
        }
    }

    record Locked(long atBlock, Instant atBlockTime) implements AssetHistoryEvent {
        @Override
        public String type() {
            return "locked";
        }
    }

    record Transferred(
        long atBlock,
        Instant atBlockTime,
        String prevOwner,
        String newOwner
    ) implements AssetHistoryEvent {
        @Override
        public String type() {
            return "transferred";
        }
    }

    record CalledBack(long atBlock, Instant atBlockTime, BigDecimal percentage) implements AssetHistoryEvent {
        @Override
        public String type() {
            return "called_back";
        }
    }
}
