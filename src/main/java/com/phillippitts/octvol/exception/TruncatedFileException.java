package com.phillippitts.octvol.exception;

/**
 * Thrown when a computed read range runs past the end of the available bytes.
 * Signals a truncated or corrupted file.
 */
public class TruncatedFileException extends OctVolException {

    private final String region;
    private final long offset;
    private final long expectedLength;
    private final long availableLength;

    public TruncatedFileException(String region, long offset, long expectedLength, long availableLength) {
        super("Truncated .vol file: " + region + " needs " + expectedLength + " bytes at offset " + offset
                + " but only " + Math.max(0, availableLength) + " are available");
        this.region = region;
        this.offset = offset;
        this.expectedLength = expectedLength;
        this.availableLength = Math.max(0, availableLength);
    }

    public String getRegion() {
        return region;
    }

    public long getOffset() {
        return offset;
    }

    public long getExpectedLength() {
        return expectedLength;
    }

    public long getAvailableLength() {
        return availableLength;
    }
}
