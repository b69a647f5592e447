package io.marketlens.security;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.List;
import java.util.regex.Pattern;

/**
 * Request parameter validation. Everything here runs before the record store or the ledger
 * daemon is queried.
 *
 * Validation Rules:
 * - Asset names: 3-12 uppercase letters, or numeric names "A" followed by 12-20 digits
 * - Trade count for price summaries: 0-30
 * - Result limits for trade history: 1-500
 * - Asset lists: 1-100 entries
 * - BTC fees: 0 up to the 21M BTC supply
 */
public class InputValidator {

    private static final Pattern ASSET_PATTERN = Pattern.compile("^(?:[A-Z]{3,12}|A[0-9]{12,20})$");

    public static final int MAX_LAST_TRADES = 30;
    public static final int MAX_RESULT_LIMIT = 500;
    public static final int MAX_ASSETS_PER_REQUEST = 100;
    public static final BigDecimal MAX_BTC_FEE = BigDecimal.valueOf(21_000_000L);

    /**
     * Validate asset name syntax. Existence is checked against the registry separately.
     *
     * @param asset Asset name
     * @return true if syntactically valid
     */
    public boolean isValidAsset(String asset) {
        if (asset == null || asset.isBlank()) {
            return false;
        }
        return ASSET_PATTERN.matcher(asset).matches();
    }

    public void validateAsset(String asset) {
        if (!isValidAsset(asset)) {
            throw new IllegalArgumentException("Malformed asset name: " + asset);
        }
    }

    /**
     * Number of raw trades to return alongside a market price.
     */
    public void validateLastTrades(int withLastTrades) {
        if (withLastTrades < 0 || withLastTrades > MAX_LAST_TRADES) {
            throw new IllegalArgumentException(
                "Invalid with_last_trades: must be between 0 and " + MAX_LAST_TRADES);
        }
    }

    public void validateLimit(int limit) {
        if (limit < 1) {
            throw new IllegalArgumentException("Limit must be positive");
        }
        if (limit > MAX_RESULT_LIMIT) {
            throw new IllegalArgumentException("Requesting history of too many trades (max " + MAX_RESULT_LIMIT + ")");
        }
    }

    public void validateAssetList(List<String> assets) {
        if (assets == null || assets.isEmpty()) {
            throw new IllegalArgumentException("Asset list must contain at least one asset");
        }
        if (assets.size() > MAX_ASSETS_PER_REQUEST) {
            throw new IllegalArgumentException("Too many assets (max " + MAX_ASSETS_PER_REQUEST + ")");
        }
        for (String asset : assets) {
            validateAsset(asset);
        }
    }

    public void validateTimeRange(Instant from, Instant to) {
        if (from.isAfter(to)) {
            throw new IllegalArgumentException("Start time " + from + " is after end time " + to);
        }
    }

    /**
     * Normalized BTC fee. Null means the caller has no fee preference.
     */
    public void validateFee(String name, BigDecimal fee) {
        if (fee == null) {
            return;
        }
        if (fee.signum() < 0) {
            throw new IllegalArgumentException(name + " must not be negative: " + fee.toPlainString());
        }
        if (fee.compareTo(MAX_BTC_FEE) > 0) {
            throw new IllegalArgumentException(name + " exceeds the BTC supply: " + fee.toPlainString());
        }
    }
}
