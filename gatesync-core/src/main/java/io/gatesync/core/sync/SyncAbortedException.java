package io.gatesync.core.sync;

/**
 * The run could not start; nothing was changed on the target or any upstream.
 */
public class SyncAbortedException extends RuntimeException {
    public SyncAbortedException(String message) {
        super(message);
    }
}
