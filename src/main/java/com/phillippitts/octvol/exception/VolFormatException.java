package com.phillippitts.octvol.exception;

/**
 * Thrown when a .vol file carries an unrecognized version tag or a fixed structure
 * (file header, B-scan sub-header, thickness grid) holds values that cannot describe a valid layout.
 */
public class VolFormatException extends OctVolException {

    private final long offset;
    private final String field;

    public VolFormatException(String field, long offset, String reason) {
        super("Malformed .vol " + field + " at offset " + offset + ": " + reason);
        this.offset = offset;
        this.field = field;
    }

    public long getOffset() {
        return offset;
    }

    public String getField() {
        return field;
    }
}
