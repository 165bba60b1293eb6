package org.deltaio.storage.api;

/**
 * Base class of failures raised while resolving or constructing a store.
 * <p>
 * These errors are never retried internally; they are returned to the caller as soon as
 * they occur.
 */
public class DeltaStorageException extends Exception {

    public DeltaStorageException(String message) {
        super(message);
    }

    public DeltaStorageException(String message, Throwable cause) {
        super(message, cause);
    }
}
