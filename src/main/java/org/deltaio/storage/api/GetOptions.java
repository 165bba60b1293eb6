package org.deltaio.storage.api;

import java.time.Instant;

/**
 * Options for a read, following HTTP conditional request semantics.
 *
 * @param ifMatch           Return the object only if its eTag matches one of these
 *                          comma-separated tags ({@code "*"} matches any), else fail with
 *                          {@link PreconditionFailedException}.
 * @param ifNoneMatch       Fail with {@link NotModifiedException} if the eTag matches one of
 *                          these comma-separated tags ({@code "*"} matches any).
 * @param ifModifiedSince   Fail with {@link NotModifiedException} unless modified after this instant.
 * @param ifUnmodifiedSince Fail with {@link PreconditionFailedException} if modified after this instant.
 * @param range             The byte range to fetch, or {@code null} for the whole object.
 * @param version           The object version to fetch, or {@code null} for the latest.
 * @param head              If {@code true}, fetch metadata only.
 */
public record GetOptions(
        String ifMatch,
        String ifNoneMatch,
        Instant ifModifiedSince,
        Instant ifUnmodifiedSince,
        GetRange range,
        String version,
        boolean head
) {

    private static final GetOptions DEFAULTS = new GetOptions(null, null, null, null, null, null, false);

    public static GetOptions defaults() {
        return DEFAULTS;
    }

    public GetOptions withRange(GetRange newRange) {
        return new GetOptions(ifMatch, ifNoneMatch, ifModifiedSince, ifUnmodifiedSince, newRange, version, head);
    }

    public GetOptions withIfMatch(String eTags) {
        return new GetOptions(eTags, ifNoneMatch, ifModifiedSince, ifUnmodifiedSince, range, version, head);
    }

    public GetOptions withIfNoneMatch(String eTags) {
        return new GetOptions(ifMatch, eTags, ifModifiedSince, ifUnmodifiedSince, range, version, head);
    }

    public GetOptions withIfModifiedSince(Instant instant) {
        return new GetOptions(ifMatch, ifNoneMatch, instant, ifUnmodifiedSince, range, version, head);
    }

    public GetOptions withIfUnmodifiedSince(Instant instant) {
        return new GetOptions(ifMatch, ifNoneMatch, ifModifiedSince, instant, range, version, head);
    }

    public GetOptions asHead() {
        return new GetOptions(ifMatch, ifNoneMatch, ifModifiedSince, ifUnmodifiedSince, range, version, true);
    }

    /**
     * Evaluates the conditional parts of these options against the current object.
     *
     * @param meta the current metadata of the object
     * @throws PreconditionFailedException if {@code ifMatch} or {@code ifUnmodifiedSince} fails
     * @throws NotModifiedException        if {@code ifNoneMatch} or {@code ifModifiedSince} fails
     */
    public void checkPreconditions(ObjectMeta meta) throws PreconditionFailedException, NotModifiedException {
        String eTag = meta.eTag() == null ? "" : meta.eTag();
        ObjectPath location = meta.location();

        if (ifMatch != null && !matchesAny(ifMatch, eTag)) {
            throw new PreconditionFailedException(String.format(
                    "%s does not match %s for %s", eTag, ifMatch, location));
        }
        if (ifUnmodifiedSince != null && meta.lastModified().isAfter(ifUnmodifiedSince)) {
            throw new PreconditionFailedException(String.format(
                    "%s was modified at %s, after %s", location, meta.lastModified(), ifUnmodifiedSince));
        }
        if (ifNoneMatch != null && matchesAny(ifNoneMatch, eTag)) {
            throw new NotModifiedException(String.format("%s matches %s for %s", eTag, ifNoneMatch, location));
        }
        if (ifModifiedSince != null && !meta.lastModified().isAfter(ifModifiedSince)) {
            throw new NotModifiedException(String.format(
                    "%s was last modified at %s, not after %s", location, meta.lastModified(), ifModifiedSince));
        }
    }

    private static boolean matchesAny(String candidates, String eTag) {
        for (String candidate : candidates.split(",")) {
            String trimmed = candidate.trim();
            if (trimmed.equals("*") || trimmed.equals(eTag)) {
                return true;
            }
        }
        return false;
    }
}
