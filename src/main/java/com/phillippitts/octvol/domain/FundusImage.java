package com.phillippitts.octvol.domain;

import java.util.Arrays;
import java.util.Objects;

/**
 * Immutable 8-bit grayscale SLO (fundus) image, stored row-major with {@code height} rows of
 * {@code width} pixels. Pixels are never transformed by this library.
 */
public final class FundusImage {

    private final int width;
    private final int height;
    private final byte[] pixels;

    public FundusImage(int width, int height, byte[] pixels) {
        Objects.requireNonNull(pixels, "pixels must not be null");
        if (width < 0 || height < 0) {
            throw new IllegalArgumentException("Fundus dimensions must not be negative: " + width + "x" + height);
        }
        if ((long) width * height != pixels.length) {
            throw new IllegalArgumentException("Fundus raster holds " + pixels.length + " bytes, expected "
                    + width + "x" + height);
        }
        this.width = width;
        this.height = height;
        this.pixels = pixels.clone();
    }

    public int width() {
        return width;
    }

    public int height() {
        return height;
    }

    /** Unsigned gray value at column {@code x}, row {@code y}. */
    public int pixel(int x, int y) {
        if (x < 0 || x >= width || y < 0 || y >= height) {
            throw new IndexOutOfBoundsException("(" + x + ", " + y + ") outside " + width + "x" + height);
        }
        return pixels[y * width + x] & 0xFF;
    }

    /** Returns a copy of the raster. */
    public byte[] pixels() {
        return pixels.clone();
    }

    /** Copies the raster into {@code target} at {@code offset}. */
    public void copyTo(byte[] target, int offset) {
        System.arraycopy(pixels, 0, target, offset, pixels.length);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        return o instanceof FundusImage other
                && width == other.width
                && height == other.height
                && Arrays.equals(pixels, other.pixels);
    }

    @Override
    public int hashCode() {
        return 31 * (31 * width + height) + Arrays.hashCode(pixels);
    }

    @Override
    public String toString() {
        return "FundusImage[" + width + "x" + height + "]";
    }
}
