package io.gatesync.core.http;

/**
 * An outbound HTTP call failed. Retriable failures (timeouts, network errors, 429 and 5xx)
 * have already exhausted the retry budget when this surfaces.
 */
public class TransportException extends RuntimeException {
    private final boolean retriable;

    public TransportException(String message, boolean retriable) {
        super(message);
        this.retriable = retriable;
    }

    public TransportException(String message, boolean retriable, Throwable cause) {
        super(message, cause);
        this.retriable = retriable;
    }

    public boolean retriable() {
        return retriable;
    }
}
