package com.phillippitts.octvol.domain;

import java.nio.FloatBuffer;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * One immutable B-scan: its sub-header fields, segmentation lines and float32 raster.
 *
 * <p>The raster is {@link #depth()} rows of {@link #width()} columns, row-major. Every
 * segmentation line holds one depth coordinate per column. Arrays passed in are copied and
 * arrays handed out are copies; use {@link #pixelBuffer()} for a read-only view without copying.
 *
 * <p>Instances are created with {@link #builder()} or derived from an existing slice with
 * {@link #toBuilder()}.
 */
public final class Slice {

    private final FixedText version;
    private final int bScanHdrSize;
    private final double startX;
    private final double startY;
    private final double endX;
    private final double endY;
    private final int offSeg;
    private final float quality;
    private final int shift;
    private final RawBytes spare;
    private final RawBytes headerTail;
    private final List<float[]> segmentation;
    private final int depth;
    private final int width;
    private final float[] pixels;

    private Slice(Builder b) {
        this.version = Objects.requireNonNull(b.version, "version must not be null");
        this.spare = Objects.requireNonNull(b.spare, "spare must not be null");
        this.headerTail = Objects.requireNonNull(b.headerTail, "headerTail must not be null");
        Objects.requireNonNull(b.pixels, "pixels must not be null");
        if (b.depth < 0 || b.width < 0) {
            throw new IllegalArgumentException("Raster dimensions must not be negative: " + b.depth + "x" + b.width);
        }
        if ((long) b.depth * b.width != b.pixels.length) {
            throw new IllegalArgumentException("Raster holds " + b.pixels.length + " values, expected "
                    + b.depth + "x" + b.width);
        }
        this.bScanHdrSize = b.bScanHdrSize;
        this.startX = b.startX;
        this.startY = b.startY;
        this.endX = b.endX;
        this.endY = b.endY;
        this.offSeg = b.offSeg;
        this.quality = b.quality;
        this.shift = b.shift;
        this.depth = b.depth;
        this.width = b.width;
        this.pixels = b.pixels.clone();
        List<float[]> lines = new ArrayList<>(b.segmentation.size());
        for (float[] line : b.segmentation) {
            lines.add(Objects.requireNonNull(line, "segmentation line must not be null").clone());
        }
        this.segmentation = Collections.unmodifiableList(lines);
    }

    public static Builder builder() {
        return new Builder();
    }

    public Builder toBuilder() {
        Builder b = new Builder();
        b.version = version;
        b.bScanHdrSize = bScanHdrSize;
        b.startX = startX;
        b.startY = startY;
        b.endX = endX;
        b.endY = endY;
        b.offSeg = offSeg;
        b.quality = quality;
        b.shift = shift;
        b.spare = spare;
        b.headerTail = headerTail;
        b.segmentation = new ArrayList<>(segmentation);
        b.depth = depth;
        b.width = width;
        b.pixels = pixels;
        return b;
    }

    public FixedText version() {
        return version;
    }

    /** Header size this B-scan declares for itself. */
    public int bScanHdrSize() {
        return bScanHdrSize;
    }

    public double startX() {
        return startX;
    }

    public double startY() {
        return startY;
    }

    public double endX() {
        return endX;
    }

    public double endY() {
        return endY;
    }

    /** Offset of the segmentation block relative to the start of the B-scan record. */
    public int offSeg() {
        return offSeg;
    }

    public float quality() {
        return quality;
    }

    public int shift() {
        return shift;
    }

    public RawBytes spare() {
        return spare;
    }

    /**
     * Bytes {@code [256, bScanHdrSize)} of the record as decoded, with the segmentation block
     * zeroed. The segmentation lines are written over them at {@link #offSeg()} on encode.
     */
    public RawBytes headerTail() {
        return headerTail;
    }

    public int segmentationCount() {
        return segmentation.size();
    }

    /** Returns a copy of segmentation line {@code index}. */
    public float[] segmentationLine(int index) {
        return segmentation.get(index).clone();
    }

    public float segmentationValue(int line, int column) {
        return segmentation.get(line)[column];
    }

    /** Length of segmentation line {@code index}. */
    public int segmentationLength(int index) {
        return segmentation.get(index).length;
    }

    public int depth() {
        return depth;
    }

    public int width() {
        return width;
    }

    public float pixel(int row, int column) {
        if (row < 0 || row >= depth || column < 0 || column >= width) {
            throw new IndexOutOfBoundsException("(" + row + ", " + column + ") outside " + depth + "x" + width);
        }
        return pixels[row * width + column];
    }

    /** Returns a copy of the full raster. */
    public float[] pixels() {
        return pixels.clone();
    }

    /** Returns a copy of raster rows {@code [fromRow, toRow)}. */
    public float[] rows(int fromRow, int toRow) {
        if (fromRow < 0 || toRow > depth || fromRow > toRow) {
            throw new IndexOutOfBoundsException("Rows [" + fromRow + ", " + toRow + ") outside depth " + depth);
        }
        return Arrays.copyOfRange(pixels, fromRow * width, toRow * width);
    }

    /** Read-only view of the raster. */
    public FloatBuffer pixelBuffer() {
        return FloatBuffer.wrap(pixels).asReadOnlyBuffer();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof Slice other)) {
            return false;
        }
        if (segmentation.size() != other.segmentation.size()) {
            return false;
        }
        for (int i = 0; i < segmentation.size(); i++) {
            if (!Arrays.equals(segmentation.get(i), other.segmentation.get(i))) {
                return false;
            }
        }
        return bScanHdrSize == other.bScanHdrSize
                && Double.compare(startX, other.startX) == 0
                && Double.compare(startY, other.startY) == 0
                && Double.compare(endX, other.endX) == 0
                && Double.compare(endY, other.endY) == 0
                && offSeg == other.offSeg
                && Float.compare(quality, other.quality) == 0
                && shift == other.shift
                && depth == other.depth
                && width == other.width
                && version.equals(other.version)
                && spare.equals(other.spare)
                && headerTail.equals(other.headerTail)
                && Arrays.equals(pixels, other.pixels);
    }

    @Override
    public int hashCode() {
        int h = Objects.hash(version, bScanHdrSize, startX, startY, endX, endY, offSeg, quality, shift,
                spare, headerTail, depth, width);
        for (float[] line : segmentation) {
            h = 31 * h + Arrays.hashCode(line);
        }
        return 31 * h + Arrays.hashCode(pixels);
    }

    @Override
    public String toString() {
        return "Slice[" + depth + "x" + width + ", segmentation=" + segmentation.size()
                + ", quality=" + quality + "]";
    }

    /**
     * Builder for {@link Slice}. Arrays are copied when the slice is built.
     */
    public static final class Builder {
        private FixedText version;
        private int bScanHdrSize;
        private double startX;
        private double startY;
        private double endX;
        private double endY;
        private int offSeg;
        private float quality;
        private int shift;
        private RawBytes spare;
        private RawBytes headerTail;
        private List<float[]> segmentation = new ArrayList<>();
        private int depth;
        private int width;
        private float[] pixels;

        private Builder() {
        }

        public Builder version(FixedText version) {
            this.version = version;
            return this;
        }

        public Builder bScanHdrSize(int bScanHdrSize) {
            this.bScanHdrSize = bScanHdrSize;
            return this;
        }

        public Builder start(double x, double y) {
            this.startX = x;
            this.startY = y;
            return this;
        }

        public Builder end(double x, double y) {
            this.endX = x;
            this.endY = y;
            return this;
        }

        public Builder offSeg(int offSeg) {
            this.offSeg = offSeg;
            return this;
        }

        public Builder quality(float quality) {
            this.quality = quality;
            return this;
        }

        public Builder shift(int shift) {
            this.shift = shift;
            return this;
        }

        public Builder spare(RawBytes spare) {
            this.spare = spare;
            return this;
        }

        public Builder headerTail(RawBytes headerTail) {
            this.headerTail = headerTail;
            return this;
        }

        public Builder segmentation(List<float[]> lines) {
            this.segmentation = new ArrayList<>(Objects.requireNonNull(lines, "lines must not be null"));
            return this;
        }

        /**
         * Sets the raster: {@code depth} rows of {@code width} columns, row-major.
         */
        public Builder raster(int depth, int width, float[] pixels) {
            this.depth = depth;
            this.width = width;
            this.pixels = pixels;
            return this;
        }

        public Slice build() {
            return new Slice(this);
        }
    }
}
