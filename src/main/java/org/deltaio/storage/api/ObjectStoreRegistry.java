package org.deltaio.storage.api;

import java.net.URI;
import java.util.Optional;
import java.util.concurrent.ConcurrentMap;

/**
 * Cache of live, explicitly registered stores keyed by their full URL.
 * <p>
 * Lookups match the exact URL string, so {@code memory:///a} and {@code memory:///b} are
 * distinct entries. A registry never constructs stores on demand; use
 * {@code FactoryRegistry} for that.
 * <p>
 * <strong>Thread Safety:</strong> Implementations must allow concurrent registration and
 * lookup without external locking. A lookup racing a registration for the same URL
 * observes either the old or the new store.
 */
public interface ObjectStoreRegistry {

    /**
     * Registers {@code store} for {@code url}, replacing any previous registration.
     *
     * @param url   the exact URL to register under
     * @param store the store to register
     * @return the store previously registered for {@code url}, if any
     */
    Optional<ObjectStore> registerStore(URI url, ObjectStore store);

    /**
     * Returns the store registered for {@code url}.
     *
     * @param url the exact URL to look up
     * @return the registered store
     * @throws StoreNotRegisteredException if nothing is registered for {@code url}
     */
    ObjectStore getStore(URI url) throws StoreNotRegisteredException;

    /**
     * Exposes all registrations for enumeration, e.g. for diagnostics.
     *
     * @return the live map from URL string to store
     */
    ConcurrentMap<String, ObjectStore> allStores();
}
