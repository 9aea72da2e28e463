package com.phillippitts.octvol.exception;

/**
 * Thrown when a crop request cannot be applied to a volume, e.g. a depth margin that is
 * negative or would leave no rows. The source volume is left untouched.
 *
 * <p>{@link #getLimit()} names the bound the request was checked against when the rejection
 * is a range check, such as the depth in rows for a margin; it is null otherwise.
 */
public class InvalidCropException extends OctVolException {

    private final String requested;
    private final String limit;

    public InvalidCropException(Number requested, String reason) {
        this(requested, null, reason);
    }

    public InvalidCropException(Number requested, Number limit, String reason) {
        super("Invalid crop " + requested + ": " + reason);
        this.requested = String.valueOf(requested);
        this.limit = limit == null ? null : String.valueOf(limit);
    }

    public String getRequested() {
        return requested;
    }

    public String getLimit() {
        return limit;
    }
}
