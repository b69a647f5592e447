package io.marketlens.domain.error;

/**
 * Base of every failure raised while deriving market data.
 */
public abstract class MarketDataException extends RuntimeException {

    protected MarketDataException(String message) {
        super(message);
    }

    protected MarketDataException(String message, Throwable cause) {
        super(message, cause);
    }
}
