package io.marketlens.domain.error;

/**
 * Thrown when the record store or the ledger daemon cannot answer. Not retried.
 */
public class UpstreamUnavailableException extends MarketDataException {

    private final String upstream;

    public UpstreamUnavailableException(String upstream, String message) {
        super(String.format("[%s] %s", upstream, message));
        this.upstream = upstream;
    }

    public UpstreamUnavailableException(String upstream, String message, Throwable cause) {
        super(String.format("[%s] %s", upstream, message), cause);
        this.upstream = upstream;
    }

    public String getUpstream() {
        return upstream;
    }
}
