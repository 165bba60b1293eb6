package org.deltaio.storage.config;

import org.deltaio.storage.api.NotFoundException;
import org.deltaio.storage.api.ObjectPath;
import org.deltaio.storage.api.ObjectStore;
import org.deltaio.storage.api.ObjectStoreException;
import org.deltaio.storage.api.PutOptions;
import org.deltaio.storage.api.PutResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Bounded, immediate retries of single store operations.
 * <p>
 * Used for small writes on the commit path where a store-level retry policy may not be
 * configured. Only transient failures are retried; no delay is applied between attempts.
 */
public final class ObjectStoreRetries {

    private static final Logger log = LoggerFactory.getLogger(ObjectStoreRetries.class);

    private ObjectStoreRetries() {
    }

    /**
     * Writes {@code payload}, making at most {@code maxRetries} attempts in total. Transient
     * failures are retried until the attempts are used up. Values below one still make a
     * single attempt.
     *
     * @return the result of the successful attempt
     * @throws ObjectStoreException the last failure, or the first non-transient one
     */
    public static PutResult putWithRetries(ObjectStore store, ObjectPath location, byte[] payload,
                                           PutOptions options, int maxRetries) throws ObjectStoreException {
        int attempt = 1;
        while (true) {
            try {
                return store.putOpts(location, payload, options);
            } catch (ObjectStoreException e) {
                if (!e.isTransient() || attempt >= maxRetries) {
                    throw e;
                }
                log.debug("put of {} failed, attempt {}/{}: {}", location, attempt, maxRetries, e.getMessage());
                attempt++;
            }
        }
    }

    /**
     * Deletes {@code location}, making at most {@code maxRetries} attempts in total.
     * A missing object counts as deleted.
     *
     * @throws ObjectStoreException the last failure, or the first non-transient one
     */
    public static void deleteWithRetries(ObjectStore store, ObjectPath location, int maxRetries)
            throws ObjectStoreException {
        int attempt = 1;
        while (true) {
            try {
                store.delete(location);
                return;
            } catch (NotFoundException e) {
                return;
            } catch (ObjectStoreException e) {
                if (!e.isTransient() || attempt >= maxRetries) {
                    throw e;
                }
                log.debug("delete of {} failed, attempt {}/{}: {}", location, attempt, maxRetries, e.getMessage());
                attempt++;
            }
        }
    }
}
