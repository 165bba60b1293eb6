package org.deltaio.storage.api;

import java.net.URI;

/**
 * Thrown when an {@link ObjectStoreRegistry} has no store registered for a URL.
 * Usually means the caller forgot to register the store before looking it up.
 */
public class StoreNotRegisteredException extends DeltaStorageException {

    public StoreNotRegisteredException(URI url) {
        super("No suitable object store found for " + url
                + ". Did you forget to register it with ObjectStoreRegistry#registerStore?");
    }
}
