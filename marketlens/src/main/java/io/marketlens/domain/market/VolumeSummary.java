package io.marketlens.domain.market;

import java.math.BigDecimal;

public record VolumeSummary(BigDecimal volume, int count) {
    public static final VolumeSummary EMPTY = new VolumeSummary(BigDecimal.ZERO, 0);

    public VolumeSummary plus(VolumeSummary other) {
        return new VolumeSummary(volume.add(other.volume), count + other.count);
    }
}
