package com.phillippitts.octvol.domain;

import java.util.Arrays;
import java.util.Objects;

/**
 * Immutable run of bytes whose meaning is opaque to this library (reserved fields, padding,
 * header tails). Carried through every codec unchanged so files round-trip byte-for-byte.
 */
public final class RawBytes {

    private static final RawBytes EMPTY = new RawBytes(new byte[0]);

    private final byte[] bytes;

    private RawBytes(byte[] bytes) {
        this.bytes = bytes;
    }

    /**
     * Copies {@code bytes} into a new instance.
     *
     * @param bytes source bytes (must not be null)
     * @return immutable copy
     */
    public static RawBytes of(byte[] bytes) {
        Objects.requireNonNull(bytes, "bytes must not be null");
        return bytes.length == 0 ? EMPTY : new RawBytes(bytes.clone());
    }

    /** Copies {@code length} bytes of {@code source} starting at {@code offset}. */
    public static RawBytes copyOf(byte[] source, int offset, int length) {
        Objects.requireNonNull(source, "source must not be null");
        return length == 0 ? EMPTY : new RawBytes(Arrays.copyOfRange(source, offset, offset + length));
    }

    /** A zero-filled run of {@code length} bytes. */
    public static RawBytes zeros(int length) {
        return length == 0 ? EMPTY : new RawBytes(new byte[length]);
    }

    public int length() {
        return bytes.length;
    }

    /** Returns a copy of the bytes. */
    public byte[] toArray() {
        return bytes.clone();
    }

    /** Copies the bytes into {@code target} at {@code offset}. */
    public void copyTo(byte[] target, int offset) {
        System.arraycopy(bytes, 0, target, offset, bytes.length);
    }

    /**
     * Returns a copy with {@code [from, to)} set to zero.
     */
    public RawBytes zeroed(int from, int to) {
        if (from < 0 || to > bytes.length || from > to) {
            throw new IndexOutOfBoundsException("Range [" + from + ", " + to + ") outside " + bytes.length + " bytes");
        }
        byte[] copy = bytes.clone();
        Arrays.fill(copy, from, to, (byte) 0);
        return new RawBytes(copy);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        return o instanceof RawBytes other && Arrays.equals(bytes, other.bytes);
    }

    @Override
    public int hashCode() {
        return Arrays.hashCode(bytes);
    }

    @Override
    public String toString() {
        return "RawBytes[" + bytes.length + "]";
    }
}
