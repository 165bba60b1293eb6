package org.deltaio.storage.api;

import java.io.IOException;

/**
 * Base class of all per-operation object store failures.
 * <p>
 * A plain {@code ObjectStoreException} is a generic backend failure (network error,
 * throttling, unexpected I/O error) and is considered transient: retrying the same
 * operation may succeed. Subclasses describe definite outcomes and are not transient.
 */
public class ObjectStoreException extends IOException {

    public ObjectStoreException(String message) {
        super(message);
    }

    public ObjectStoreException(String message, Throwable cause) {
        super(message, cause);
    }

    /**
     * Returns whether retrying the failed operation may succeed.
     *
     * @return {@code true} for generic failures
     */
    public boolean isTransient() {
        return true;
    }
}
