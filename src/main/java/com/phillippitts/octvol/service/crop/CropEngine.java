package com.phillippitts.octvol.service.crop;

import com.phillippitts.octvol.domain.Header;
import com.phillippitts.octvol.domain.Slice;
import com.phillippitts.octvol.domain.VolumeModel;
import com.phillippitts.octvol.exception.InvalidCropException;
import com.phillippitts.octvol.service.codec.VolLayout;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Removes the same number of rows from the top and bottom of every B-scan.
 *
 * <p>Segmentation lines are depth coordinates, so they move up by the margin. A boundary that
 * falls outside the remaining rows (or was never a number) becomes
 * {@link VolLayout#SENTINEL}, the same value the device writes for "not detected".
 * Width, B-scan count, fundus image and scan coordinates are unchanged.
 *
 * <p>Cropping by {@code m1} and then {@code m2} gives the same volume as cropping by
 * {@code m1 + m2}.
 */
@Component
public class CropEngine {
    private static final Logger LOG = LogManager.getLogger(CropEngine.class);

    /**
     * Crops {@code margin} rows from each depth edge.
     *
     * @param volume source volume, never modified
     * @param margin rows to remove at the top and at the bottom
     * @return cropped volume, or {@code volume} itself when {@code margin} is zero
     * @throws InvalidCropException if {@code margin} is negative or would leave no rows
     */
    public VolumeModel crop(VolumeModel volume, int margin) {
        Objects.requireNonNull(volume, "volume must not be null");
        Header header = volume.header();
        if (margin < 0) {
            throw new InvalidCropException(margin, 0, "margin must not be negative");
        }
        if (2L * margin >= header.sizeZ()) {
            throw new InvalidCropException(margin, header.sizeZ(), "twice the margin must be below the depth of "
                    + header.sizeZ() + " rows");
        }
        if (margin == 0) {
            return volume;
        }

        int newDepth = header.sizeZ() - 2 * margin;
        List<Slice> cropped = new ArrayList<>(volume.slices().size());
        for (Slice slice : volume.slices()) {
            cropped.add(cropSlice(slice, margin, newDepth));
        }

        Header newHeader = header.withSizeZ(newDepth);
        if (volume.thicknessGrid().isPresent()) {
            newHeader = newHeader.withGridOffset((int) (VolLayout.slicesEnd(newHeader) + volume.gridPosition()));
            LOG.debug("Grid offset moved from {} to {}", header.gridOffset(), newHeader.gridOffset());
        }
        return new VolumeModel(newHeader, volume.fundus(), cropped, volume.tail(),
                volume.thicknessGrid().orElse(null), volume.gridPosition());
    }

    private static Slice cropSlice(Slice slice, int margin, int newDepth) {
        List<float[]> lines = new ArrayList<>(slice.segmentationCount());
        for (int i = 0; i < slice.segmentationCount(); i++) {
            float[] line = slice.segmentationLine(i);
            for (int col = 0; col < line.length; col++) {
                line[col] = shift(line[col], margin, newDepth);
            }
            lines.add(line);
        }
        return slice.toBuilder()
                .segmentation(lines)
                .raster(newDepth, slice.width(), slice.rows(margin, margin + newDepth))
                .build();
    }

    static float shift(float value, int margin, int newDepth) {
        if (VolLayout.isSentinel(value)) {
            return VolLayout.SENTINEL;
        }
        double shifted = (double) value - margin;
        if (Double.isNaN(shifted) || shifted < 0 || shifted >= newDepth) {
            return VolLayout.SENTINEL;
        }
        return (float) shifted;
    }
}
