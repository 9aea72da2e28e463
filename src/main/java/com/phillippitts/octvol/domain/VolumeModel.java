package com.phillippitts.octvol.domain;

import com.phillippitts.octvol.exception.VolumeInvariantException;
import com.phillippitts.octvol.service.codec.VolLayout;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * In-memory .vol volume: header, SLO image, ordered B-scans and the bytes that follow them.
 *
 * <p>The tail holds every byte after the last B-scan record exactly as read. When the header
 * declares a thickness grid, the decoded grid sits inside the tail at {@link #gridPosition()}.
 *
 * <p>Instances are immutable and validated on construction; transformations build a new
 * instance. A volume that fails {@link #validate()} is always a programming error, never bad
 * input, because the codecs reject malformed files before a model is assembled.
 */
public final class VolumeModel {

    /** Sentinel for {@link #gridPosition()} when the volume has no thickness grid. */
    public static final int NO_GRID = -1;

    private final Header header;
    private final FundusImage fundus;
    private final List<Slice> slices;
    private final RawBytes tail;
    private final ThicknessGrid thicknessGrid;
    private final int gridPosition;

    /**
     * Creates and validates a volume.
     *
     * @param header        file header
     * @param fundus        SLO image
     * @param slices        B-scans in acquisition order
     * @param tail          bytes following the last B-scan
     * @param thicknessGrid grid decoded from the tail, or null when the header declares none
     * @param gridPosition  offset of the grid inside the tail, or {@link #NO_GRID}
     * @throws VolumeInvariantException if the parts are inconsistent
     */
    public VolumeModel(Header header, FundusImage fundus, List<Slice> slices, RawBytes tail,
                       ThicknessGrid thicknessGrid, int gridPosition) {
        this.header = Objects.requireNonNull(header, "header must not be null");
        this.fundus = Objects.requireNonNull(fundus, "fundus must not be null");
        this.slices = List.copyOf(Objects.requireNonNull(slices, "slices must not be null"));
        this.tail = Objects.requireNonNull(tail, "tail must not be null");
        this.thicknessGrid = thicknessGrid;
        this.gridPosition = thicknessGrid == null ? NO_GRID : gridPosition;
        validate();
    }

    /** Volume without thickness grid. */
    public VolumeModel(Header header, FundusImage fundus, List<Slice> slices, RawBytes tail) {
        this(header, fundus, slices, tail, null, NO_GRID);
    }

    public Header header() {
        return header;
    }

    public FundusImage fundus() {
        return fundus;
    }

    public List<Slice> slices() {
        return slices;
    }

    public Slice slice(int index) {
        return slices.get(index);
    }

    public RawBytes tail() {
        return tail;
    }

    public Optional<ThicknessGrid> thicknessGrid() {
        return Optional.ofNullable(thicknessGrid);
    }

    public int gridPosition() {
        return gridPosition;
    }

    /**
     * Checks every structural invariant.
     *
     * @throws VolumeInvariantException naming the first violated rule
     */
    public void validate() {
        if (slices.size() != header.numBScans()) {
            throw new VolumeInvariantException("slice-count",
                    "header declares " + header.numBScans() + " B-scans, volume holds " + slices.size());
        }
        if (fundus.width() != header.sizeXSlo() || fundus.height() != header.sizeYSlo()) {
            throw new VolumeInvariantException("fundus-shape", "fundus is " + fundus.width() + "x" + fundus.height()
                    + ", header declares " + header.sizeXSlo() + "x" + header.sizeYSlo());
        }
        for (int i = 0; i < slices.size(); i++) {
            validateSlice(i, slices.get(i));
        }
        validateGrid();
    }

    private void validateSlice(int index, Slice slice) {
        if (slice.depth() != header.sizeZ() || slice.width() != header.sizeX()) {
            throw new VolumeInvariantException("raster-shape", "B-scan " + index + " raster is "
                    + slice.depth() + "x" + slice.width() + ", header declares " + header.sizeZ() + "x" + header.sizeX());
        }
        for (int line = 0; line < slice.segmentationCount(); line++) {
            if (slice.segmentationLength(line) != header.sizeX()) {
                throw new VolumeInvariantException("segmentation-length", "B-scan " + index + " line " + line
                        + " has " + slice.segmentationLength(line) + " values, header declares " + header.sizeX());
            }
        }
        if (slice.bScanHdrSize() != header.bScanHdrSize()) {
            throw new VolumeInvariantException("slice-header-size", "B-scan " + index + " declares header size "
                    + slice.bScanHdrSize() + ", file header declares " + header.bScanHdrSize());
        }
        if (slice.headerTail().length() != header.bScanHdrSize() - VolLayout.BSCAN_FIXED_HEADER_SIZE) {
            throw new VolumeInvariantException("slice-header-size", "B-scan " + index + " header tail holds "
                    + slice.headerTail().length() + " bytes, expected "
                    + (header.bScanHdrSize() - VolLayout.BSCAN_FIXED_HEADER_SIZE));
        }
        if (slice.segmentationCount() > 0) {
            long end = slice.offSeg() + VolLayout.segmentationBytes(slice.segmentationCount(), header.sizeX());
            if (slice.offSeg() < VolLayout.BSCAN_FIXED_HEADER_SIZE || end > header.bScanHdrSize()) {
                throw new VolumeInvariantException("segmentation-placement", "B-scan " + index
                        + " segmentation occupies [" + slice.offSeg() + ", " + end + "), outside ["
                        + VolLayout.BSCAN_FIXED_HEADER_SIZE + ", " + header.bScanHdrSize() + ")");
            }
        }
    }

    private void validateGrid() {
        if (header.hasThicknessGrid() != (thicknessGrid != null)) {
            throw new VolumeInvariantException("grid-presence", "header grid type " + header.gridType()
                    + (thicknessGrid == null ? " without" : " with") + " a thickness grid");
        }
        if (thicknessGrid == null) {
            return;
        }
        if (gridPosition < 0 || (long) gridPosition + VolLayout.GRID_SIZE > tail.length()) {
            throw new VolumeInvariantException("grid-placement", "grid at tail position " + gridPosition
                    + " does not fit in " + tail.length() + " tail bytes");
        }
        long expectedOffset = VolLayout.slicesEnd(header) + gridPosition;
        if (expectedOffset != header.gridOffset()) {
            throw new VolumeInvariantException("grid-offset", "header grid offset " + header.gridOffset()
                    + " does not match layout offset " + expectedOffset);
        }
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        return o instanceof VolumeModel other
                && gridPosition == other.gridPosition
                && header.equals(other.header)
                && fundus.equals(other.fundus)
                && slices.equals(other.slices)
                && tail.equals(other.tail)
                && Objects.equals(thicknessGrid, other.thicknessGrid);
    }

    @Override
    public int hashCode() {
        return Objects.hash(header, fundus, slices, tail, thicknessGrid, gridPosition);
    }

    @Override
    public String toString() {
        return "VolumeModel[" + header.version() + ", " + header.numBScans() + " B-scans of "
                + header.sizeZ() + "x" + header.sizeX() + ", grid=" + (thicknessGrid != null) + "]";
    }
}
