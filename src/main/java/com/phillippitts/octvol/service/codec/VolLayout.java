package com.phillippitts.octvol.service.codec;

import com.phillippitts.octvol.domain.Header;
import com.phillippitts.octvol.exception.TruncatedFileException;

/**
 * Single source of truth for the Heidelberg Spectralis .vol byte layout.
 *
 * <p>All numeric fields are little-endian. Every offset the codecs use is defined here;
 * codecs never compute positions on their own.
 *
 * <p><b>File Structure:</b>
 * <pre>
 * ┌─────────────────────────────────────┐
 * │ File header (2048 bytes)            │  FILE_HEADER_SIZE
 * ├─────────────────────────────────────┤
 * │ SLO raster (sizeXSlo * sizeYSlo)    │  uint8
 * ├─────────────────────────────────────┤
 * │ B-scan record x numBScans:          │
 * │   - fixed sub-header (256 bytes)    │  BSCAN_FIXED_HEADER_SIZE
 * │   - tail up to bScanHdrSize,        │
 * │     segmentation at offSeg          │  float32 x sizeX per line
 * │   - raster (sizeZ * sizeX)          │  float32, row-major
 * ├─────────────────────────────────────┤
 * │ Tail (optional thickness grid at    │  GRID_SIZE
 * │ gridOffset)                         │
 * └─────────────────────────────────────┘
 * </pre>
 *
 * @since 1.0
 */
public final class VolLayout {

    /** Size of the fixed file header in bytes. The SLO raster starts right after it. */
    public static final int FILE_HEADER_SIZE = 2048;

    // File header fields
    public static final int HDR_VERSION = 0;              // 12 bytes ASCII
    public static final int HDR_VERSION_LENGTH = 12;
    public static final int HDR_SIZE_X = 12;              // int32
    public static final int HDR_NUM_BSCANS = 16;          // int32
    public static final int HDR_SIZE_Z = 20;              // int32
    public static final int HDR_SCALE_X = 24;             // float64
    public static final int HDR_DISTANCE = 32;            // float64
    public static final int HDR_SCALE_Z = 40;             // float64
    public static final int HDR_SIZE_X_SLO = 48;          // int32
    public static final int HDR_SIZE_Y_SLO = 52;          // int32
    public static final int HDR_SCALE_X_SLO = 56;         // float64
    public static final int HDR_SCALE_Y_SLO = 64;         // float64
    public static final int HDR_FIELD_SIZE_SLO = 72;      // int32
    public static final int HDR_SCAN_FOCUS = 76;          // float64
    public static final int HDR_SCAN_POSITION = 84;       // 4 bytes ASCII
    public static final int HDR_SCAN_POSITION_LENGTH = 4;
    public static final int HDR_EXAM_TIME = 88;           // uint64
    public static final int HDR_SCAN_PATTERN = 96;        // int32
    public static final int HDR_BSCAN_HDR_SIZE = 100;     // int32
    public static final int HDR_ID = 104;                 // 16 bytes ASCII
    public static final int HDR_ID_LENGTH = 16;
    public static final int HDR_REFERENCE_ID = 120;       // 16 bytes ASCII
    public static final int HDR_REFERENCE_ID_LENGTH = 16;
    public static final int HDR_PID = 136;                // int32
    public static final int HDR_PATIENT_ID = 140;         // 21 bytes ASCII
    public static final int HDR_PATIENT_ID_LENGTH = 21;
    public static final int HDR_PADDING = 161;            // 3 bytes opaque
    public static final int HDR_PADDING_LENGTH = 3;
    public static final int HDR_DOB = 164;                // float64
    public static final int HDR_VID = 172;                // int32
    public static final int HDR_VISIT_ID = 176;           // 24 bytes ASCII
    public static final int HDR_VISIT_ID_LENGTH = 24;
    public static final int HDR_VISIT_DATE = 200;         // float64
    public static final int HDR_GRID_TYPE = 208;          // int32
    public static final int HDR_GRID_OFFSET = 212;        // int32
    public static final int HDR_SPARE = 216;              // 1832 bytes opaque
    public static final int HDR_SPARE_LENGTH = FILE_HEADER_SIZE - HDR_SPARE;

    /** Size of the fixed part of every B-scan sub-header. */
    public static final int BSCAN_FIXED_HEADER_SIZE = 256;

    // B-scan sub-header fields, relative to the record start
    public static final int BSC_VERSION = 0;              // 12 bytes ASCII
    public static final int BSC_VERSION_LENGTH = 12;
    public static final int BSC_HDR_SIZE = 12;            // int32
    public static final int BSC_START_X = 16;             // float64
    public static final int BSC_START_Y = 24;             // float64
    public static final int BSC_END_X = 32;               // float64
    public static final int BSC_END_Y = 40;               // float64
    public static final int BSC_NUM_SEG = 48;             // int32
    public static final int BSC_OFF_SEG = 52;             // int32
    public static final int BSC_QUALITY = 56;             // float32
    public static final int BSC_SHIFT = 60;               // int32
    public static final int BSC_SPARE = 64;               // 192 bytes opaque
    public static final int BSC_SPARE_LENGTH = BSCAN_FIXED_HEADER_SIZE - BSC_SPARE;

    /** Size of the thickness grid record. */
    public static final int GRID_SIZE = 132;
    public static final int GRID_DIAMETER_COUNT = 3;
    public static final int GRID_SECTOR_COUNT = 9;

    // Thickness grid fields, relative to the grid start
    public static final int GRD_TYPE = 0;                 // int32
    public static final int GRD_DIAMETERS = 4;            // float64 x 3
    public static final int GRD_CENTER_X = 28;            // float64
    public static final int GRD_CENTER_Y = 36;            // float64
    public static final int GRD_CENTRAL_THK = 44;         // float32
    public static final int GRD_MIN_CENTRAL_THK = 48;     // float32
    public static final int GRD_MAX_CENTRAL_THK = 52;     // float32
    public static final int GRD_TOTAL_VOLUME = 56;        // float32
    public static final int GRD_SECTORS = 60;             // (float32 thickness, float32 volume) x 9
    public static final int GRD_SECTOR_STRIDE = 8;

    /** Bytes per float32 sample, used for both segmentation and raster values. */
    public static final int FLOAT_BYTES = Float.BYTES;

    /**
     * Reserved value meaning "no boundary detected" in a segmentation line and
     * "no data" in a B-scan raster.
     */
    public static final float SENTINEL = Float.MAX_VALUE;

    /** Largest file this in-memory codec can address. */
    public static final long MAX_FILE_SIZE = Integer.MAX_VALUE - 8L;

    private VolLayout() {
        // Utility class - prevent instantiation
    }

    /** Number of SLO raster bytes declared by the header. */
    public static long sloBytes(Header header) {
        return (long) header.sizeXSlo() * header.sizeYSlo();
    }

    /** Number of bytes in one B-scan raster. */
    public static long rasterBytes(Header header) {
        return (long) header.sizeX() * header.sizeZ() * FLOAT_BYTES;
    }

    /** Number of bytes in one B-scan record: declared header size plus raster. */
    public static long sliceRecordSize(Header header) {
        return header.bScanHdrSize() + rasterBytes(header);
    }

    /** Absolute file offset of B-scan record {@code index}. */
    public static long sliceOffset(Header header, int index) {
        return FILE_HEADER_SIZE + sloBytes(header) + index * sliceRecordSize(header);
    }

    /** Absolute file offset of the first byte after the last B-scan record. */
    public static long slicesEnd(Header header) {
        return sliceOffset(header, header.numBScans());
    }

    /** Number of bytes in {@code count} segmentation lines of the header's slice width. */
    public static long segmentationBytes(int count, int sizeX) {
        return (long) count * sizeX * FLOAT_BYTES;
    }

    /**
     * Checks that {@code [offset, offset + length)} lies inside a buffer of {@code available} bytes.
     *
     * @throws TruncatedFileException naming the region, offset and lengths when it does not
     */
    public static void requireRange(String region, long offset, long length, long available) {
        if (offset < 0 || length < 0 || offset + length > available) {
            throw new TruncatedFileException(region, offset, length, available - offset);
        }
    }

    /** Whether a segmentation or raster value is the reserved sentinel. */
    public static boolean isSentinel(float value) {
        return value == SENTINEL;
    }
}
