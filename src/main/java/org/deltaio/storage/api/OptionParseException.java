package org.deltaio.storage.api;

/**
 * Thrown when a present storage option holds a value that cannot be parsed.
 */
public class OptionParseException extends DeltaStorageException {

    private final String key;
    private final String rawValue;

    /**
     * Creates a new OptionParseException.
     *
     * @param key      the option name
     * @param rawValue the unparsable value as given
     * @param expected a description of the expected format, e.g. "Duration"
     * @param cause    the underlying parse failure, may be {@code null}
     */
    public OptionParseException(String key, String rawValue, String expected, Throwable cause) {
        super(String.format("failed to parse \"%s\" as %s for option '%s'", rawValue, expected, key), cause);
        this.key = key;
        this.rawValue = rawValue;
    }

    public String getKey() {
        return key;
    }

    public String getRawValue() {
        return rawValue;
    }
}
