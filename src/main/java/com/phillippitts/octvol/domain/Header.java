package com.phillippitts.octvol.domain;

import com.phillippitts.octvol.util.TimeUtils;

import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.Objects;

/**
 * Immutable .vol file header.
 *
 * <p>Dates are kept in their stored encodings so the header round-trips exactly; use
 * {@link #examInstant()}, {@link #dateOfBirth()} and {@link #visitDateTime()} for calendar values.
 *
 * @param version       format version tag, e.g. {@code HSF-OCT-103}
 * @param sizeX         A-scans per B-scan (slice width)
 * @param numBScans     number of B-scans (slices)
 * @param sizeZ         samples per A-scan (slice depth)
 * @param scaleX        A-scan spacing in mm
 * @param distance      B-scan spacing in mm
 * @param scaleZ        axial sample spacing in mm
 * @param sizeXSlo      SLO image width in pixels
 * @param sizeYSlo      SLO image height in pixels
 * @param scaleXSlo     SLO pixel width in mm
 * @param scaleYSlo     SLO pixel height in mm
 * @param fieldSizeSlo  SLO field of view in degrees
 * @param scanFocus     scan focus in dioptres
 * @param scanPosition  eye, {@code OD} or {@code OS}
 * @param examTimeTicks exam time as 100 ns ticks since 1601-01-01 UTC (unsigned)
 * @param scanPattern   acquisition pattern code
 * @param bScanHdrSize  declared size in bytes of every B-scan header, including its tail
 * @param id            exam identifier
 * @param referenceId   reference exam identifier
 * @param pid           internal patient number
 * @param patientId     patient identifier
 * @param padding       opaque alignment bytes after {@code patientId}
 * @param dobDays       date of birth as days since 1899-12-30
 * @param vid           internal visit number
 * @param visitId       visit identifier
 * @param visitDateDays visit date as days since 1899-12-30
 * @param gridType      thickness grid type, 0 when the file carries no grid
 * @param gridOffset    absolute file offset of the thickness grid
 * @param spare         opaque reserved bytes up to the end of the header
 */
public record Header(
        FixedText version,
        int sizeX,
        int numBScans,
        int sizeZ,
        double scaleX,
        double distance,
        double scaleZ,
        int sizeXSlo,
        int sizeYSlo,
        double scaleXSlo,
        double scaleYSlo,
        int fieldSizeSlo,
        double scanFocus,
        FixedText scanPosition,
        long examTimeTicks,
        int scanPattern,
        int bScanHdrSize,
        FixedText id,
        FixedText referenceId,
        int pid,
        FixedText patientId,
        RawBytes padding,
        double dobDays,
        int vid,
        FixedText visitId,
        double visitDateDays,
        int gridType,
        int gridOffset,
        RawBytes spare
) {

    public Header {
        Objects.requireNonNull(version, "version must not be null");
        Objects.requireNonNull(scanPosition, "scanPosition must not be null");
        Objects.requireNonNull(id, "id must not be null");
        Objects.requireNonNull(referenceId, "referenceId must not be null");
        Objects.requireNonNull(patientId, "patientId must not be null");
        Objects.requireNonNull(padding, "padding must not be null");
        Objects.requireNonNull(visitId, "visitId must not be null");
        Objects.requireNonNull(spare, "spare must not be null");
    }

    /** Whether the file carries a thickness grid record. */
    public boolean hasThicknessGrid() {
        return gridType != 0;
    }

    public Instant examInstant() {
        return TimeUtils.fileTimeToInstant(examTimeTicks);
    }

    public LocalDate dateOfBirth() {
        return TimeUtils.oleDateToLocalDate(dobDays);
    }

    public LocalDateTime visitDateTime() {
        return TimeUtils.oleDateToLocalDateTime(visitDateDays);
    }

    public Header withSizeX(int newSizeX) {
        return new Header(version, newSizeX, numBScans, sizeZ, scaleX, distance, scaleZ, sizeXSlo, sizeYSlo,
                scaleXSlo, scaleYSlo, fieldSizeSlo, scanFocus, scanPosition, examTimeTicks, scanPattern,
                bScanHdrSize, id, referenceId, pid, patientId, padding, dobDays, vid, visitId, visitDateDays,
                gridType, gridOffset, spare);
    }

    public Header withNumBScans(int newNumBScans) {
        return new Header(version, sizeX, newNumBScans, sizeZ, scaleX, distance, scaleZ, sizeXSlo, sizeYSlo,
                scaleXSlo, scaleYSlo, fieldSizeSlo, scanFocus, scanPosition, examTimeTicks, scanPattern,
                bScanHdrSize, id, referenceId, pid, patientId, padding, dobDays, vid, visitId, visitDateDays,
                gridType, gridOffset, spare);
    }

    public Header withSizeZ(int newSizeZ) {
        return new Header(version, sizeX, numBScans, newSizeZ, scaleX, distance, scaleZ, sizeXSlo, sizeYSlo,
                scaleXSlo, scaleYSlo, fieldSizeSlo, scanFocus, scanPosition, examTimeTicks, scanPattern,
                bScanHdrSize, id, referenceId, pid, patientId, padding, dobDays, vid, visitId, visitDateDays,
                gridType, gridOffset, spare);
    }

    public Header withGridOffset(int newGridOffset) {
        return new Header(version, sizeX, numBScans, sizeZ, scaleX, distance, scaleZ, sizeXSlo, sizeYSlo,
                scaleXSlo, scaleYSlo, fieldSizeSlo, scanFocus, scanPosition, examTimeTicks, scanPattern,
                bScanHdrSize, id, referenceId, pid, patientId, padding, dobDays, vid, visitId, visitDateDays,
                gridType, newGridOffset, spare);
    }
}
