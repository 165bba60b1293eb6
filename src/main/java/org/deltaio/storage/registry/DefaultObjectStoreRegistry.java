package org.deltaio.storage.registry;

import org.deltaio.storage.api.ObjectStore;
import org.deltaio.storage.api.ObjectStoreRegistry;
import org.deltaio.storage.api.StoreNotRegisteredException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.URI;
import java.util.Objects;
import java.util.Optional;
import java.util.TreeSet;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * {@link ObjectStoreRegistry} backed by a {@link ConcurrentHashMap} keyed by the full URL
 * string. Lookups never construct stores.
 */
public class DefaultObjectStoreRegistry implements ObjectStoreRegistry {

    private static final Logger log = LoggerFactory.getLogger(DefaultObjectStoreRegistry.class);

    private final ConcurrentMap<String, ObjectStore> objectStores = new ConcurrentHashMap<>();

    @Override
    public Optional<ObjectStore> registerStore(URI url, ObjectStore store) {
        Objects.requireNonNull(url, "url cannot be null");
        Objects.requireNonNull(store, "store cannot be null");
        ObjectStore previous = objectStores.put(url.toString(), store);
        if (previous != null) {
            log.info("Replaced object store for {}: {} -> {}", url, previous, store);
        } else {
            log.debug("Registered object store for {}: {}", url, store);
        }
        return Optional.ofNullable(previous);
    }

    @Override
    public ObjectStore getStore(URI url) throws StoreNotRegisteredException {
        ObjectStore store = objectStores.get(url.toString());
        if (store == null) {
            throw new StoreNotRegisteredException(url);
        }
        return store;
    }

    @Override
    public ConcurrentMap<String, ObjectStore> allStores() {
        return objectStores;
    }

    @Override
    public String toString() {
        return "DefaultObjectStoreRegistry" + new TreeSet<>(objectStores.keySet());
    }
}
