package io.marketlens.domain.asset;

import java.util.ArrayList;
import java.util.List;

/**
 * Registry entry of an asset: its current state plus every earlier snapshot, oldest first.
 */
public record TrackedAsset(String asset, AssetSnapshot current, List<AssetSnapshot> history) {
    public TrackedAsset {
        history = List.copyOf(history);
    }

    public boolean divisible() {
        return current.divisible();
    }

    /**
     * Full change log, oldest to newest, with the current state as the final entry.
     */
    public List<AssetSnapshot> snapshotLog() {
        List<AssetSnapshot> log = new ArrayList<>(history.size() + 1);
        log.addAll(history);
        log.add(current);
        return log;
    }
}
