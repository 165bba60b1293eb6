package org.deltaio.storage.api;

/**
 * A conditional read found the object unchanged since the given eTag or date.
 */
public class NotModifiedException extends ObjectStoreException {

    public NotModifiedException(String message) {
        super(message);
    }

    public NotModifiedException(String message, Throwable cause) {
        super(message, cause);
    }

    @Override
    public boolean isTransient() {
        return false;
    }
}
