package io.marketlens.domain.common;

import java.math.BigDecimal;
import java.math.MathContext;
import java.math.RoundingMode;
import java.util.List;

/**
 * Decimal arithmetic shared by every derived market value.
 *
 * All monetary results leave the system through {@link #round8(BigDecimal)}:
 * 8 fractional digits, round-half-to-even.
 */
public final class Decimals {
    public static final int SCALE = 8;

    /** Raw units per whole unit of a divisible asset. */
    public static final BigDecimal UNIT = new BigDecimal("100000000");

    private static final MathContext MC = MathContext.DECIMAL128;
    private static final BigDecimal HUNDRED = BigDecimal.valueOf(100);
    private static final BigDecimal TWO = BigDecimal.valueOf(2);

    public static BigDecimal round8(BigDecimal value) {
        return value.setScale(SCALE, RoundingMode.HALF_EVEN);
    }

    /**
     * Rounded quotient. Division runs at 34 significant digits before the final rounding.
     */
    public static BigDecimal divide(BigDecimal dividend, BigDecimal divisor) {
        return round8(dividend.divide(divisor, MC));
    }

    public static BigDecimal inverse(BigDecimal value) {
        return divide(BigDecimal.ONE, value);
    }

    public static BigDecimal mean(BigDecimal a, BigDecimal b) {
        return divide(a.add(b), TWO);
    }

    /**
     * Signed percentage change: 100 * (close - open) / open.
     */
    public static BigDecimal percentChange(BigDecimal open, BigDecimal close) {
        return divide(HUNDRED.multiply(close.subtract(open)), open);
    }

    /**
     * Weighted average of (value, weight) pairs. Empty input is a caller error.
     */
    public static BigDecimal weightedAverage(List<BigDecimal> values, List<BigDecimal> weights) {
        if (values.isEmpty() || values.size() != weights.size()) {
            throw new IllegalArgumentException("values and weights must be non-empty and of equal length");
        }
        BigDecimal weighted = BigDecimal.ZERO;
        BigDecimal totalWeight = BigDecimal.ZERO;
        for (int i = 0; i < values.size(); i++) {
            weighted = weighted.add(values.get(i).multiply(weights.get(i)));
            totalWeight = totalWeight.add(weights.get(i));
        }
        return divide(weighted, totalWeight);
    }

    /**
     * Raw ledger quantity to human scale. Indivisible assets are whole counts.
     */
    public static BigDecimal normalize(long rawQuantity, boolean divisible) {
        BigDecimal raw = BigDecimal.valueOf(rawQuantity);
        return divisible ? raw.divide(UNIT, SCALE, RoundingMode.HALF_EVEN) : raw.setScale(SCALE);
    }

    /**
     * Normalized divisible quantity back to raw units.
     */
    public static long denormalize(BigDecimal normalized) {
        return normalized.multiply(UNIT).setScale(0, RoundingMode.HALF_EVEN).longValueExact();
    }

    public static boolean isZero(BigDecimal value) {
        return value.signum() == 0;
    }

    private Decimals() {}
}
