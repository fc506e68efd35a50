package io.gatesync.core.http;

/**
 * The call reached the server and returned 2xx, but the response envelope reported failure.
 */
public final class ApiRejectedException extends TransportException {

    public ApiRejectedException(String message) {
        super(message, false);
    }
}
