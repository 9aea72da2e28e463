package com.phillippitts.octvol.service.crop;

import com.phillippitts.octvol.domain.Header;
import com.phillippitts.octvol.domain.Slice;
import com.phillippitts.octvol.domain.ThicknessGrid;
import com.phillippitts.octvol.domain.VolumeModel;
import com.phillippitts.octvol.exception.InvalidCropException;
import com.phillippitts.octvol.service.codec.VolLayout;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Objects;

/**
 * Crops a volume laterally to a square region centred on its thickness grid.
 *
 * <p>The grid centre is given in fundus-plane millimetres. It is rotated into the scan frame
 * using the angle between the end points of the first and last B-scan, converted to 1-based
 * A-scan and B-scan positions (rounded to the nearest half, ties to even) and the region of
 * {@code sizeMm} in both directions is clamped to the volume. Kept B-scans lose the columns
 * outside the region, and their start and end points move along the scan line by the number
 * of columns removed on each side. The shrunken segmentation block leaves zeros behind in the
 * B-scan header tail.
 *
 * <p>A 6 mm region covers the ETDRS rings, so the grid is replaced by an empty ETDRS grid at the
 * same centre; its measurements no longer describe the cropped data.
 */
@Component
public class RegionCropEngine {
    private static final Logger LOG = LogManager.getLogger(RegionCropEngine.class);

    /** Region edge length that resets the grid to ETDRS. */
    public static final double ETDRS_SIZE_MM = 6.0;

    /**
     * Crops {@code volume} to a {@code sizeMm} square around the thickness grid centre.
     *
     * @param volume source volume, never modified
     * @param sizeMm region edge length in mm
     * @return cropped volume
     * @throws InvalidCropException if the volume has no grid or fewer than two B-scans, if
     *                              {@code sizeMm} is not positive, if the header spacing cannot
     *                              locate the centre, or if the region misses the volume
     */
    public VolumeModel cropRegion(VolumeModel volume, double sizeMm) {
        Objects.requireNonNull(volume, "volume must not be null");
        if (!(sizeMm > 0)) {
            throw new InvalidCropException(sizeMm, 0, "region size must be positive");
        }
        ThicknessGrid grid = volume.thicknessGrid()
                .orElseThrow(() -> new InvalidCropException(sizeMm, "volume has no thickness grid to centre on"));
        Header header = volume.header();
        List<Slice> slices = volume.slices();
        if (slices.size() < 2) {
            throw new InvalidCropException(sizeMm, "at least two B-scans are needed to find the scan angle, found "
                    + slices.size());
        }
        requireSpacing(sizeMm, header.scaleX(), "A-scan spacing");
        requireSpacing(sizeMm, header.distance(), "B-scan spacing");

        Slice first = slices.get(0);
        Slice last = slices.get(slices.size() - 1);
        double angle = Math.atan2(first.endY() - last.endY(), first.endX() - last.endX());
        double dx = grid.centerX() - last.endX();
        double dy = grid.centerY() - last.endY();
        double centerXMm = -dx * Math.sin(angle) + dy * Math.cos(angle);
        double centerYMm = dx * Math.cos(angle) + dy * Math.sin(angle);
        double centerA = header.sizeX() - Math.rint(centerXMm / header.scaleX() * 2) / 2;
        double centerB = header.numBScans() - Math.rint(centerYMm / header.distance() * 2) / 2;
        if (!Double.isFinite(centerA) || !Double.isFinite(centerB)) {
            throw new InvalidCropException(sizeMm, "thickness grid centre (" + grid.centerX() + ", "
                    + grid.centerY() + ") does not map onto the scan");
        }

        int firstA = (int) Math.max(Math.ceil(centerA - sizeMm / header.scaleX() / 2), 1);
        int lastA = (int) Math.min(Math.floor(centerA + sizeMm / header.scaleX() / 2), header.sizeX());
        int firstB = (int) Math.max(Math.ceil(centerB - sizeMm / header.distance() / 2), 1);
        int lastB = (int) Math.min(Math.floor(centerB + sizeMm / header.distance() / 2), header.numBScans());
        if (firstA > lastA || firstB > lastB) {
            throw new InvalidCropException(sizeMm, "region A-scans [" + firstA + ", " + lastA + "], B-scans ["
                    + firstB + ", " + lastB + "] lies outside the volume");
        }
        LOG.debug("Region centre at A-scan {} B-scan {}, keeping A-scans [{}, {}] of B-scans [{}, {}]",
                centerA, centerB, firstA, lastA, firstB, lastB);

        int newSizeX = lastA - firstA + 1;
        double startShift = (firstA - 1) * header.scaleX();
        double endShift = (header.sizeX() - lastA) * header.scaleX();
        double startAngle = 3 * Math.PI / 2 + angle;
        double endAngle = Math.PI / 2 + angle;

        List<Slice> cropped = new ArrayList<>(lastB - firstB + 1);
        for (Slice slice : slices.subList(firstB - 1, lastB)) {
            cropped.add(slice.toBuilder()
                    .start(slice.startX() + startShift * Math.cos(startAngle),
                            slice.startY() + startShift * Math.sin(startAngle))
                    .end(slice.endX() + endShift * Math.cos(endAngle),
                            slice.endY() + endShift * Math.sin(endAngle))
                    .segmentation(cropLines(slice, firstA - 1, lastA))
                    .raster(slice.depth(), newSizeX, cropColumns(slice, firstA - 1, lastA))
                    .build());
        }

        Header newHeader = header.withSizeX(newSizeX).withNumBScans(cropped.size());
        newHeader = newHeader.withGridOffset((int) (VolLayout.slicesEnd(newHeader) + volume.gridPosition()));
        ThicknessGrid newGrid = sizeMm == ETDRS_SIZE_MM
                ? ThicknessGrid.etdrs(grid.centerX(), grid.centerY())
                : grid;
        return new VolumeModel(newHeader, volume.fundus(), cropped, volume.tail(), newGrid, volume.gridPosition());
    }

    private static void requireSpacing(double sizeMm, double spacing, String name) {
        if (!(spacing > 0) || Double.isInfinite(spacing)) {
            throw new InvalidCropException(sizeMm, name + " must be positive and finite, was " + spacing + " mm");
        }
    }

    private static List<float[]> cropLines(Slice slice, int from, int to) {
        List<float[]> lines = new ArrayList<>(slice.segmentationCount());
        for (int i = 0; i < slice.segmentationCount(); i++) {
            lines.add(Arrays.copyOfRange(slice.segmentationLine(i), from, to));
        }
        return lines;
    }

    private static float[] cropColumns(Slice slice, int from, int to) {
        int oldWidth = slice.width();
        int newWidth = to - from;
        float[] source = slice.pixels();
        float[] out = new float[slice.depth() * newWidth];
        for (int row = 0; row < slice.depth(); row++) {
            System.arraycopy(source, row * oldWidth + from, out, row * newWidth, newWidth);
        }
        return out;
    }
}
