package com.phillippitts.octvol.service.codec;

import com.phillippitts.octvol.config.properties.VolFormatProperties;
import com.phillippitts.octvol.domain.FixedText;
import com.phillippitts.octvol.domain.Header;
import com.phillippitts.octvol.domain.RawBytes;
import com.phillippitts.octvol.exception.VolFormatException;
import org.springframework.stereotype.Component;

import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.util.Objects;
import java.util.Set;

import static com.phillippitts.octvol.service.codec.VolLayout.*;

/**
 * Decodes and encodes the fixed 2048-byte .vol file header.
 *
 * <p>Only version tags listed in {@code octvol.format.accepted-versions} are decoded. Beyond the
 * version check, decoding rejects values that cannot describe a layout (non-positive B-scan
 * dimensions, a B-scan header smaller than its fixed part, negative counts), so later offset
 * arithmetic never runs on nonsense.
 */
@Component
public class HeaderCodec {

    private final Set<String> acceptedVersions;

    public HeaderCodec(VolFormatProperties props) {
        this.acceptedVersions = Set.copyOf(props.getAcceptedVersions());
    }

    /**
     * Decodes the header from the start of {@code bytes}.
     *
     * @param bytes complete file content or at least its first 2048 bytes
     * @return decoded header
     * @throws com.phillippitts.octvol.exception.TruncatedFileException if fewer than 2048 bytes are available
     * @throws VolFormatException if the version tag is not accepted or a structural field is invalid
     */
    public Header decode(byte[] bytes) {
        Objects.requireNonNull(bytes, "bytes must not be null");
        requireRange("file header", 0, FILE_HEADER_SIZE, bytes.length);
        ByteBuffer buf = ByteBuffer.wrap(bytes).order(ByteOrder.LITTLE_ENDIAN);

        FixedText version = FixedText.copyOf(bytes, HDR_VERSION, HDR_VERSION_LENGTH);
        if (!acceptedVersions.contains(version.text())) {
            throw new VolFormatException("header version", HDR_VERSION,
                    "unrecognized version tag '" + version.text() + "', accepted: " + acceptedVersions);
        }

        Header header = new Header(
                version,
                buf.getInt(HDR_SIZE_X),
                buf.getInt(HDR_NUM_BSCANS),
                buf.getInt(HDR_SIZE_Z),
                buf.getDouble(HDR_SCALE_X),
                buf.getDouble(HDR_DISTANCE),
                buf.getDouble(HDR_SCALE_Z),
                buf.getInt(HDR_SIZE_X_SLO),
                buf.getInt(HDR_SIZE_Y_SLO),
                buf.getDouble(HDR_SCALE_X_SLO),
                buf.getDouble(HDR_SCALE_Y_SLO),
                buf.getInt(HDR_FIELD_SIZE_SLO),
                buf.getDouble(HDR_SCAN_FOCUS),
                FixedText.copyOf(bytes, HDR_SCAN_POSITION, HDR_SCAN_POSITION_LENGTH),
                buf.getLong(HDR_EXAM_TIME),
                buf.getInt(HDR_SCAN_PATTERN),
                buf.getInt(HDR_BSCAN_HDR_SIZE),
                FixedText.copyOf(bytes, HDR_ID, HDR_ID_LENGTH),
                FixedText.copyOf(bytes, HDR_REFERENCE_ID, HDR_REFERENCE_ID_LENGTH),
                buf.getInt(HDR_PID),
                FixedText.copyOf(bytes, HDR_PATIENT_ID, HDR_PATIENT_ID_LENGTH),
                RawBytes.copyOf(bytes, HDR_PADDING, HDR_PADDING_LENGTH),
                buf.getDouble(HDR_DOB),
                buf.getInt(HDR_VID),
                FixedText.copyOf(bytes, HDR_VISIT_ID, HDR_VISIT_ID_LENGTH),
                buf.getDouble(HDR_VISIT_DATE),
                buf.getInt(HDR_GRID_TYPE),
                buf.getInt(HDR_GRID_OFFSET),
                RawBytes.copyOf(bytes, HDR_SPARE, HDR_SPARE_LENGTH));

        validateStructure(header);
        return header;
    }

    /**
     * Encodes {@code header} into a new 2048-byte array, opaque regions included.
     *
     * @param header header to encode
     * @return encoded header bytes
     */
    public byte[] encode(Header header) {
        Objects.requireNonNull(header, "header must not be null");
        byte[] out = new byte[FILE_HEADER_SIZE];
        ByteBuffer buf = ByteBuffer.wrap(out).order(ByteOrder.LITTLE_ENDIAN);

        requireWidth(header.version(), HDR_VERSION_LENGTH, "version");
        header.version().copyTo(out, HDR_VERSION);
        buf.putInt(HDR_SIZE_X, header.sizeX());
        buf.putInt(HDR_NUM_BSCANS, header.numBScans());
        buf.putInt(HDR_SIZE_Z, header.sizeZ());
        buf.putDouble(HDR_SCALE_X, header.scaleX());
        buf.putDouble(HDR_DISTANCE, header.distance());
        buf.putDouble(HDR_SCALE_Z, header.scaleZ());
        buf.putInt(HDR_SIZE_X_SLO, header.sizeXSlo());
        buf.putInt(HDR_SIZE_Y_SLO, header.sizeYSlo());
        buf.putDouble(HDR_SCALE_X_SLO, header.scaleXSlo());
        buf.putDouble(HDR_SCALE_Y_SLO, header.scaleYSlo());
        buf.putInt(HDR_FIELD_SIZE_SLO, header.fieldSizeSlo());
        buf.putDouble(HDR_SCAN_FOCUS, header.scanFocus());
        requireWidth(header.scanPosition(), HDR_SCAN_POSITION_LENGTH, "scanPosition");
        header.scanPosition().copyTo(out, HDR_SCAN_POSITION);
        buf.putLong(HDR_EXAM_TIME, header.examTimeTicks());
        buf.putInt(HDR_SCAN_PATTERN, header.scanPattern());
        buf.putInt(HDR_BSCAN_HDR_SIZE, header.bScanHdrSize());
        requireWidth(header.id(), HDR_ID_LENGTH, "id");
        header.id().copyTo(out, HDR_ID);
        requireWidth(header.referenceId(), HDR_REFERENCE_ID_LENGTH, "referenceId");
        header.referenceId().copyTo(out, HDR_REFERENCE_ID);
        buf.putInt(HDR_PID, header.pid());
        requireWidth(header.patientId(), HDR_PATIENT_ID_LENGTH, "patientId");
        header.patientId().copyTo(out, HDR_PATIENT_ID);
        requireLength(header.padding(), HDR_PADDING_LENGTH, "padding");
        header.padding().copyTo(out, HDR_PADDING);
        buf.putDouble(HDR_DOB, header.dobDays());
        buf.putInt(HDR_VID, header.vid());
        requireWidth(header.visitId(), HDR_VISIT_ID_LENGTH, "visitId");
        header.visitId().copyTo(out, HDR_VISIT_ID);
        buf.putDouble(HDR_VISIT_DATE, header.visitDateDays());
        buf.putInt(HDR_GRID_TYPE, header.gridType());
        buf.putInt(HDR_GRID_OFFSET, header.gridOffset());
        requireLength(header.spare(), HDR_SPARE_LENGTH, "spare");
        header.spare().copyTo(out, HDR_SPARE);
        return out;
    }

    private void validateStructure(Header h) {
        if (h.sizeX() <= 0) {
            throw new VolFormatException("header sizeX", HDR_SIZE_X, "must be positive, was " + h.sizeX());
        }
        if (h.sizeZ() <= 0) {
            throw new VolFormatException("header sizeZ", HDR_SIZE_Z, "must be positive, was " + h.sizeZ());
        }
        if (h.numBScans() < 0) {
            throw new VolFormatException("header numBScans", HDR_NUM_BSCANS,
                    "must not be negative, was " + h.numBScans());
        }
        if (h.sizeXSlo() < 0 || h.sizeYSlo() < 0) {
            throw new VolFormatException("header SLO size", HDR_SIZE_X_SLO,
                    "must not be negative, was " + h.sizeXSlo() + "x" + h.sizeYSlo());
        }
        if (h.bScanHdrSize() < BSCAN_FIXED_HEADER_SIZE) {
            throw new VolFormatException("header bScanHdrSize", HDR_BSCAN_HDR_SIZE,
                    "must be at least " + BSCAN_FIXED_HEADER_SIZE + ", was " + h.bScanHdrSize());
        }
        if (h.hasThicknessGrid() && h.gridOffset() < 0) {
            throw new VolFormatException("header gridOffset", HDR_GRID_OFFSET,
                    "must not be negative when a grid is declared, was " + h.gridOffset());
        }
        if (slicesEnd(h) > MAX_FILE_SIZE) {
            throw new VolFormatException("header geometry", HDR_SIZE_X, "declared layout of "
                    + slicesEnd(h) + " bytes exceeds the in-memory limit of " + MAX_FILE_SIZE);
        }
    }

    private static void requireWidth(FixedText text, int width, String field) {
        if (text.width() != width) {
            throw new IllegalArgumentException(field + " must be " + width + " bytes wide, was " + text.width());
        }
    }

    private static void requireLength(RawBytes raw, int length, String field) {
        if (raw.length() != length) {
            throw new IllegalArgumentException(field + " must be " + length + " bytes, was " + raw.length());
        }
    }
}
