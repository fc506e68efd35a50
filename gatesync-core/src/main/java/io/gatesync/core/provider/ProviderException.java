package io.gatesync.core.provider;

/**
 * A provider cannot contribute to this run: no active accounts, no working models and the like.
 */
public final class ProviderException extends RuntimeException {

    public ProviderException(String message) {
        super(message);
    }
}
