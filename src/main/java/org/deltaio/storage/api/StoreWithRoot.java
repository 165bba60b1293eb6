package org.deltaio.storage.api;

/**
 * A fully decorated store together with the root path it was built for.
 *
 * @param store The decorated store, ready for use.
 * @param root  The path within the backend that the URL pointed at; the root path when
 *              the store is already anchored there.
 */
public record StoreWithRoot(ObjectStore store, ObjectPath root) {
}
