package org.deltaio.storage.api;

import java.net.URI;

/**
 * Constructs a store for a URL.
 * <p>
 * Factories are stateless across calls: every invocation builds a fresh backend and
 * applies the decorators its options ask for. Implementations are registered per URL
 * scheme with {@code FactoryRegistry}; classes registered from configuration need a
 * public no-arg constructor.
 */
@FunctionalInterface
public interface ObjectStoreFactory {

    /**
     * Builds a decorated store and its root path for {@code url}.
     *
     * @param url     the location to build a store for
     * @param options the storage options; borrowed for the duration of the call
     * @return the store and root path
     * @throws InvalidTableLocationException if the URL cannot be served by this factory
     * @throws OptionParseException          if an option value is malformed
     * @throws DeltaStorageException         for other construction failures
     */
    StoreWithRoot parseUrlOpts(URI url, StorageOptions options) throws DeltaStorageException;
}
