package org.deltaio.storage.api;

/**
 * Outcome of a successful write.
 *
 * @param eTag    The entity tag of the written object, or {@code null}.
 * @param version The version of the written object, or {@code null}.
 */
public record PutResult(String eTag, String version) {
}
