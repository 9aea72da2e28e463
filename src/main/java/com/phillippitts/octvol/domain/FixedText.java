package com.phillippitts.octvol.domain;

import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.Objects;

/**
 * Fixed-width, NUL-padded ASCII field.
 *
 * <p>The raw bytes are kept as decoded, including anything after the first NUL, so that
 * re-encoding reproduces the field exactly. {@link #text()} is the visible value.
 */
public final class FixedText {

    private final byte[] raw;

    private FixedText(byte[] raw) {
        this.raw = raw;
    }

    /** Wraps a copy of {@code length} raw bytes taken from {@code source} at {@code offset}. */
    public static FixedText copyOf(byte[] source, int offset, int length) {
        Objects.requireNonNull(source, "source must not be null");
        return new FixedText(Arrays.copyOfRange(source, offset, offset + length));
    }

    /**
     * Encodes {@code text} as ASCII into a field of {@code width} bytes, NUL-padded.
     *
     * @throws IllegalArgumentException if the text does not fit
     */
    public static FixedText of(String text, int width) {
        Objects.requireNonNull(text, "text must not be null");
        byte[] encoded = text.getBytes(StandardCharsets.US_ASCII);
        if (encoded.length > width) {
            throw new IllegalArgumentException("Text '" + text + "' exceeds field width " + width);
        }
        return new FixedText(Arrays.copyOf(encoded, width));
    }

    /** Visible value: the ASCII characters before the first NUL. */
    public String text() {
        int end = 0;
        while (end < raw.length && raw[end] != 0) {
            end++;
        }
        return new String(raw, 0, end, StandardCharsets.US_ASCII);
    }

    public int width() {
        return raw.length;
    }

    /** Copies the raw field bytes into {@code target} at {@code offset}. */
    public void copyTo(byte[] target, int offset) {
        System.arraycopy(raw, 0, target, offset, raw.length);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        return o instanceof FixedText other && Arrays.equals(raw, other.raw);
    }

    @Override
    public int hashCode() {
        return Arrays.hashCode(raw);
    }

    @Override
    public String toString() {
        return text();
    }
}
