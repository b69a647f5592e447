package io.marketlens.service.asset;

import io.marketlens.domain.asset.AssetChangeType;
import io.marketlens.domain.asset.AssetHistoryEvent;
import io.marketlens.domain.asset.AssetSnapshot;
import io.marketlens.domain.asset.CallbackEvent;
import io.marketlens.domain.asset.TrackedAsset;
import io.marketlens.domain.common.Decimals;
import io.marketlens.domain.error.DataIntegrityException;
import io.marketlens.domain.error.InvalidAssetException;
import io.marketlens.domain.ledger.LedgerService;
import io.marketlens.domain.repository.AssetRepository;
import io.marketlens.domain.repository.BlockRepository;
import io.marketlens.security.InputValidator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Rebuilds the lifecycle timeline of an asset.
 *
 * The registry keeps a snapshot of the asset per change. Consecutive snapshots are diffed to
 * recover the change each one records; the diff has to agree with the snapshot's tag. Callbacks
 * never touch the registry and are spliced in from the ledger daemon by block.
 */
public final class AssetHistoryReconstructor {
    private static final Logger log = LoggerFactory.getLogger(AssetHistoryReconstructor.class);

    private static final BigDecimal HUNDRED = BigDecimal.valueOf(100);

    private final AssetRepository assetRepository;
    private final LedgerService ledger;
    private final BlockRepository blockRepository;
    private final InputValidator validator;

    public AssetHistoryReconstructor(AssetRepository assetRepository, LedgerService ledger,
                                     BlockRepository blockRepository, InputValidator validator) {
        this.assetRepository = assetRepository;
        this.ledger = ledger;
        this.blockRepository = blockRepository;
        this.validator = validator;
    }

    /**
     * Block-ordered event timeline of an asset.
     *
     * @param reverse newest first when true
     * @throws InvalidAssetException if the asset is not registered
     * @throws DataIntegrityException if the snapshot log contradicts itself
     */
    public List<AssetHistoryEvent> reconstruct(String asset, boolean reverse) {
        if (!validator.isValidAsset(asset)) {
            throw new InvalidAssetException(asset);
        }
        TrackedAsset tracked = assetRepository.findByAsset(asset)
            .orElseThrow(() -> new InvalidAssetException(asset));

        List<AssetHistoryEvent> changes = replay(tracked);
        List<CallbackEvent> callbacks = new ArrayList<>(ledger.getCallbacks(asset));
        callbacks.sort(Comparator.comparingLong(CallbackEvent::blockIndex));

        List<AssetHistoryEvent> timeline = merge(asset, changes, callbacks);
        log.debug("History of {}: {} changes, {} callbacks", asset, changes.size(), callbacks.size());

        if (reverse) {
            Collections.reverse(timeline);
        }
        return timeline;
    }

    /**
     * Diff events of the snapshot log, oldest first.
     */
    public static List<AssetHistoryEvent> replay(TrackedAsset tracked) {
        List<AssetSnapshot> snapshots = tracked.snapshotLog();
        List<AssetHistoryEvent> events = new ArrayList<>(snapshots.size());

        AssetSnapshot first = snapshots.get(0);
        if (first.changeType() != AssetChangeType.CREATED) {
            throw fault(first, "first snapshot is tagged " + first.changeType().tag() + ", expected created");
        }
        events.add(new AssetHistoryEvent.Created(
            first.atBlock(),
            requireTime(first),
            first.owner(),
            first.description(),
            first.divisible(),
            first.locked(),
            first.totalIssued(),
            first.totalIssuedNormalized()
        ));

        for (int i = 1; i < snapshots.size(); i++) {
            events.add(diff(snapshots.get(i - 1), snapshots.get(i)));
        }
        return events;
    }

    private static AssetHistoryEvent diff(AssetSnapshot prev, AssetSnapshot cur) {
        Instant at = requireTime(cur);
        return switch (cur.changeType()) {
            case LOCKED -> {
                if (prev.locked() == cur.locked()) {
                    throw fault(cur, "tagged locked but lock flag did not flip");
                }
                yield new AssetHistoryEvent.Locked(cur.atBlock(), at);
            }
            case TRANSFERRED -> {
                if (Objects.equals(prev.owner(), cur.owner())) {
                    throw fault(cur, "tagged transferred but owner is unchanged");
                }
                yield new AssetHistoryEvent.Transferred(cur.atBlock(), at, prev.owner(), cur.owner());
            }
            case CHANGED_DESCRIPTION -> {
                if (Objects.equals(prev.description(), cur.description())) {
                    throw fault(cur, "tagged changed_description but description is unchanged");
                }
                yield new AssetHistoryEvent.DescriptionChanged(cur.atBlock(), at, prev.description(), cur.description());
            }
            case ISSUED_MORE -> {
                if (cur.totalIssued() <= prev.totalIssued()) {
                    throw fault(cur, String.format("tagged issued_more but total went from %d to %d",
                        prev.totalIssued(), cur.totalIssued()));
                }
                long additional = cur.totalIssued() - prev.totalIssued();
                yield new AssetHistoryEvent.IssuedMore(
                    cur.atBlock(),
                    at,
                    additional,
                    Decimals.normalize(additional, cur.divisible()),
                    cur.totalIssued(),
                    cur.totalIssuedNormalized()
                );
            }
            case CREATED -> throw fault(cur, "created tag after the first snapshot");
        };
    }

    /**
     * Splices callbacks before the first change event at a later block; the rest go last.
     */
    private List<AssetHistoryEvent> merge(String asset, List<AssetHistoryEvent> changes,
                                          List<CallbackEvent> callbacks) {
        Map<Long, Optional<Instant>> blockTimes = new HashMap<>();
        List<AssetHistoryEvent> timeline = new ArrayList<>(changes.size() + callbacks.size());
        int next = 0;
        for (AssetHistoryEvent change : changes) {
            while (next < callbacks.size() && callbacks.get(next).blockIndex() < change.atBlock()) {
                timeline.add(calledBack(asset, callbacks.get(next++), blockTimes));
            }
            timeline.add(change);
        }
        while (next < callbacks.size()) {
            timeline.add(calledBack(asset, callbacks.get(next++), blockTimes));
        }
        return timeline;
    }

    private AssetHistoryEvent calledBack(String asset, CallbackEvent callback, Map<Long, Optional<Instant>> blockTimes) {
        long block = callback.blockIndex();
        Instant at = blockTimes.computeIfAbsent(block, blockRepository::findBlockTime)
            .orElseThrow(() -> new DataIntegrityException(asset, block, "callback block has no recorded block time"));
        return new AssetHistoryEvent.CalledBack(block, at, Decimals.round8(callback.fraction().multiply(HUNDRED)));
    }

    private static Instant requireTime(AssetSnapshot snapshot) {
        if (snapshot.atBlockTime() == null) {
            throw fault(snapshot, "snapshot block has no recorded block time");
        }
        return snapshot.atBlockTime();
    }

    private static DataIntegrityException fault(AssetSnapshot snapshot, String message) {
        return new DataIntegrityException(snapshot.asset(), snapshot.atBlock(), message);
    }
}
