package com.phillippitts.octvol.service.crop;

import com.phillippitts.octvol.domain.Slice;
import com.phillippitts.octvol.domain.ThicknessGrid;
import com.phillippitts.octvol.domain.VolumeModel;
import com.phillippitts.octvol.exception.InvalidCropException;
import com.phillippitts.octvol.testutil.SyntheticVolumeBuilder;
import com.phillippitts.octvol.testutil.VolumeFixtures;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

/**
 * Uses a 96 x 48 scan with 0.125 mm A-scan and 0.25 mm B-scan spacing: B-scan {@code s} runs
 * from (0, y) to (12, y) with y = (47 - s) * 0.25, so a grid centred at (6, 6) sits on A-scan 48
 * of B-scan 24.
 */
class RegionCropEngineTest {

    private final RegionCropEngine engine = new RegionCropEngine();

    private static SyntheticVolumeBuilder scan(double gridX, double gridY) {
        return SyntheticVolumeBuilder.aVolume()
                .sizeX(96)
                .numBScans(48)
                .sizeZ(4)
                .scaleX(0.125)
                .distance(0.25)
                .segmentation((s, line, col) -> line * 1000f + col)
                .grid(1, gridX, gridY);
    }

    @Test
    void shouldCropSixMillimetreSquareAroundGridCentre() {
        VolumeModel volume = VolumeFixtures.decode(scan(6.0, 6.0));

        VolumeModel cropped = engine.cropRegion(volume, 6);

        // A-scans 24..72 and B-scans 12..36, 1-based
        assertThat(cropped.header().sizeX()).isEqualTo(49);
        assertThat(cropped.header().numBScans()).isEqualTo(25);
        assertThat(cropped.slices()).hasSize(25);
        Slice first = cropped.slice(0);
        assertThat(first.width()).isEqualTo(49);
        assertThat(first.pixel(0, 0)).isEqualTo(volume.slice(11).pixel(0, 23));
        assertThat(first.pixel(3, 48)).isEqualTo(volume.slice(11).pixel(3, 71));
        assertThat(cropped.slice(24).pixel(1, 10)).isEqualTo(volume.slice(35).pixel(1, 33));
        assertThat(first.segmentationLine(0)[0]).isEqualTo(23f);
        assertThat(first.segmentationLine(1)[48]).isEqualTo(1071f);
    }

    @Test
    void shouldMoveStartAndEndPointsAlongScanLine() {
        VolumeModel volume = VolumeFixtures.decode(scan(6.0, 6.0));

        VolumeModel cropped = engine.cropRegion(volume, 6);

        Slice before = volume.slice(11);
        Slice after = cropped.slice(0);
        assertThat(after.startX()).isCloseTo(2.875, within(1e-9));
        assertThat(after.startY()).isCloseTo(before.startY(), within(1e-9));
        assertThat(after.endX()).isCloseTo(9.0, within(1e-9));
        assertThat(after.endY()).isCloseTo(before.endY(), within(1e-9));
    }

    @Test
    void sixMillimetreCropShouldResetGridToEtdrs() {
        VolumeModel volume = VolumeFixtures.decode(scan(6.0, 6.0));

        VolumeModel cropped = engine.cropRegion(volume, 6);

        ThicknessGrid grid = cropped.thicknessGrid().orElseThrow();
        assertThat(grid).isEqualTo(ThicknessGrid.etdrs(6.0, 6.0));
        assertThat(cropped.header().gridType()).isEqualTo(1);
    }

    @Test
    void otherSizesShouldKeepGridMeasurements() {
        VolumeModel volume = VolumeFixtures.decode(scan(6.0, 6.0));

        VolumeModel cropped = engine.cropRegion(volume, 3);

        assertThat(cropped.header().sizeX()).isEqualTo(25);
        assertThat(cropped.header().numBScans()).isEqualTo(13);
        assertThat(cropped.thicknessGrid()).isEqualTo(volume.thicknessGrid());
    }

    @Test
    void shouldClampRegionToVolumeEdges() {
        VolumeModel volume = VolumeFixtures.decode(scan(11.5, 6.0));

        VolumeModel cropped = engine.cropRegion(volume, 6);

        // centre on A-scan 92: A-scans 68..96
        assertThat(cropped.header().sizeX()).isEqualTo(29);
        assertThat(cropped.slice(0).pixel(0, 28)).isEqualTo(volume.slice(11).pixel(0, 95));
    }

    @Test
    void shouldZeroSegmentationBytesLeftBehindInHeaderTail() {
        SyntheticVolumeBuilder builder = scan(6.0, 6.0);
        VolumeModel volume = VolumeFixtures.decode(builder);

        VolumeModel cropped = engine.cropRegion(volume, 6);

        byte[] tail = cropped.slice(0).headerTail().toArray();
        int blockStart = SyntheticVolumeBuilder.SEGMENTATION_MARGIN;
        int newEnd = blockStart + 2 * 49 * Float.BYTES;
        int oldEnd = blockStart + 2 * 96 * Float.BYTES;
        for (int i = newEnd; i < oldEnd; i++) {
            assertThat(tail[i]).as("tail byte %d", i).isZero();
        }
        assertThat(tail[oldEnd]).isEqualTo((byte) 0x3C);
        assertThat(tail[0]).isEqualTo((byte) 0x3C);
    }

    @Test
    void croppedVolumeShouldSurviveWriteAndRead() {
        VolumeModel volume = VolumeFixtures.decode(scan(6.0, 6.0));
        VolumeModel cropped = engine.cropRegion(volume, 6);

        byte[] written = VolumeFixtures.writer().write(cropped);

        assertThat(VolumeFixtures.sequentialReader().read(written)).isEqualTo(cropped);
        assertThat(cropped.header().gridOffset()).isEqualTo(written.length - cropped.tail().length()
                + cropped.gridPosition());
    }

    @Test
    void shouldComposeWithDepthCrop() {
        VolumeModel volume = VolumeFixtures.decode(scan(6.0, 6.0));

        VolumeModel both = new CropEngine().crop(engine.cropRegion(volume, 6), 1);

        assertThat(both.header().sizeZ()).isEqualTo(2);
        assertThat(both.header().sizeX()).isEqualTo(49);
    }

    @Test
    void shouldRejectVolumeWithoutGrid() {
        VolumeModel volume = VolumeFixtures.defaultVolume();

        assertThatThrownBy(() -> engine.cropRegion(volume, 6))
                .isInstanceOf(InvalidCropException.class)
                .hasMessageContaining("thickness grid");
    }

    @Test
    void shouldRejectSingleBScanVolume() {
        VolumeModel volume = VolumeFixtures.decode(SyntheticVolumeBuilder.aVolume().numBScans(1).grid(1, 0.3, 0.0));

        assertThatThrownBy(() -> engine.cropRegion(volume, 6))
                .isInstanceOf(InvalidCropException.class)
                .hasMessageContaining("two B-scans");
    }

    @Test
    void shouldRejectNonPositiveSize() {
        VolumeModel volume = VolumeFixtures.decode(scan(6.0, 6.0));

        assertThatThrownBy(() -> engine.cropRegion(volume, 0)).isInstanceOf(InvalidCropException.class);
        assertThatThrownBy(() -> engine.cropRegion(volume, -3)).isInstanceOf(InvalidCropException.class);
        assertThatThrownBy(() -> engine.cropRegion(volume, Double.NaN)).isInstanceOf(InvalidCropException.class);
    }

    @Test
    void shouldRejectRegionOutsideVolume() {
        VolumeModel volume = VolumeFixtures.decode(scan(-100.0, 6.0));

        assertThatThrownBy(() -> engine.cropRegion(volume, 6))
                .isInstanceOf(InvalidCropException.class)
                .hasMessageContaining("outside the volume");
    }

    @Test
    void shouldRejectZeroBScanSpacing() {
        VolumeModel volume = VolumeFixtures.decode(scan(12.0, 0.0).distance(0.0));

        assertThatThrownBy(() -> engine.cropRegion(volume, 6))
                .isInstanceOf(InvalidCropException.class)
                .hasMessageContaining("B-scan spacing");
    }

    @Test
    void shouldRejectZeroAScanSpacing() {
        VolumeModel volume = VolumeFixtures.decode(scan(6.0, 6.0).scaleX(0.0));

        assertThatThrownBy(() -> engine.cropRegion(volume, 6))
                .isInstanceOf(InvalidCropException.class)
                .hasMessageContaining("A-scan spacing");
    }

    @Test
    void shouldRejectGridCentreThatIsNotANumber() {
        VolumeModel volume = VolumeFixtures.decode(scan(Double.NaN, 6.0));

        assertThatThrownBy(() -> engine.cropRegion(volume, 6))
                .isInstanceOf(InvalidCropException.class)
                .hasMessageContaining("does not map onto the scan");
    }

    @Test
    void shouldReportZeroAsLimitForNonPositiveSize() {
        VolumeModel volume = VolumeFixtures.decode(scan(6.0, 6.0));

        assertThatThrownBy(() -> engine.cropRegion(volume, -3))
                .isInstanceOf(InvalidCropException.class)
                .satisfies(e -> assertThat(((InvalidCropException) e).getLimit()).isEqualTo("0"));
    }
}
