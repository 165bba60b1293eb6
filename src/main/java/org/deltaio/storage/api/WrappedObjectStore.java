package org.deltaio.storage.api;

/**
 * An {@link ObjectStore} that decorates another store.
 * <p>
 * Decorators keep the capability contract of the store they wrap and add one concern
 * each (path prefixing, concurrency limiting, retrying, runtime isolation). The wrapped
 * store may be shared with other callers.
 */
public interface WrappedObjectStore extends ObjectStore {

    /**
     * Returns the store this decorator delegates to.
     *
     * @return the wrapped store
     */
    ObjectStore inner();
}
