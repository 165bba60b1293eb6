package org.deltaio.storage.api;

/**
 * A unit of work dispatched to another execution context could not be joined.
 * <p>
 * Raised when the dispatched task was cancelled, rejected by its executor, or abandoned
 * by an interrupted caller before it completed. The operation itself may or may not have
 * taken effect on the backend. Join failures count as transient.
 */
public class JoinException extends ObjectStoreException {

    public JoinException(String message, Throwable cause) {
        super(message, cause);
    }
}
