package com.phillippitts.octvol.service.crop;

import com.phillippitts.octvol.domain.Slice;
import com.phillippitts.octvol.domain.VolumeModel;
import com.phillippitts.octvol.exception.InvalidCropException;
import com.phillippitts.octvol.service.codec.VolLayout;
import com.phillippitts.octvol.service.io.VolumeWriter;
import com.phillippitts.octvol.testutil.SyntheticVolumeBuilder;
import com.phillippitts.octvol.testutil.VolumeFixtures;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class CropEngineTest {

    private final CropEngine engine = new CropEngine();
    private final VolumeWriter writer = VolumeFixtures.writer();

    @Test
    void zeroMarginShouldReturnEqualVolumeAndIdenticalBytes() {
        byte[] file = SyntheticVolumeBuilder.aVolume().grid(1, 0.3, 0.25).build();
        VolumeModel volume = VolumeFixtures.sequentialReader().read(file);

        VolumeModel cropped = engine.crop(volume, 0);

        assertThat(cropped).isEqualTo(volume);
        assertThat(writer.write(cropped)).containsExactly(file);
    }

    @Test
    void shouldCropThreeSliceScenario() {
        VolumeModel volume = VolumeFixtures.defaultVolume();

        VolumeModel cropped = engine.crop(volume, 2);

        assertThat(cropped.header().sizeZ()).isEqualTo(6);
        assertThat(cropped.slices()).hasSize(3);
        for (Slice slice : cropped.slices()) {
            assertThat(slice.depth()).isEqualTo(6);
            assertThat(slice.width()).isEqualTo(5);
            assertThat(slice.segmentationLine(0)).containsOnly(1f);
            assertThat(slice.segmentationLine(1)).containsOnly(VolLayout.SENTINEL);
        }
        assertThat(cropped.slice(1).pixel(0, 0)).isEqualTo(volume.slice(1).pixel(2, 0));
        assertThat(cropped.slice(1).pixel(5, 4)).isEqualTo(volume.slice(1).pixel(7, 4));
    }

    @Test
    void shouldKeepEverythingButDepth() {
        VolumeModel volume = VolumeFixtures.defaultVolume();

        VolumeModel cropped = engine.crop(volume, 3);

        assertThat(cropped.header().sizeX()).isEqualTo(volume.header().sizeX());
        assertThat(cropped.header().numBScans()).isEqualTo(volume.header().numBScans());
        assertThat(cropped.fundus()).isEqualTo(volume.fundus());
        assertThat(cropped.tail()).isEqualTo(volume.tail());
        for (int i = 0; i < volume.slices().size(); i++) {
            Slice before = volume.slice(i);
            Slice after = cropped.slice(i);
            assertThat(after.startX()).isEqualTo(before.startX());
            assertThat(after.endY()).isEqualTo(before.endY());
            assertThat(after.headerTail()).isEqualTo(before.headerTail());
            assertThat(after.segmentationCount()).isEqualTo(before.segmentationCount());
            assertThat(after.segmentationLength(0)).isEqualTo(before.segmentationLength(0));
        }
    }

    @Test
    void shouldLeaveSourceVolumeUntouched() {
        VolumeModel volume = VolumeFixtures.defaultVolume();
        VolumeModel copy = VolumeFixtures.defaultVolume();

        engine.crop(volume, 4);

        assertThat(volume).isEqualTo(copy);
    }

    @Test
    void successiveCropsShouldComposeIntoOne() {
        VolumeModel volume = VolumeFixtures.decode(SyntheticVolumeBuilder.aVolume().sizeZ(20)
                .segmentation((s, line, col) -> line == 0 ? 2f + col * 3 : (col == 2 ? VolLayout.SENTINEL : 19f - col)));

        VolumeModel twice = engine.crop(engine.crop(volume, 2), 3);
        VolumeModel once = engine.crop(volume, 5);

        assertThat(twice).isEqualTo(once);
        assertThat(writer.write(twice)).containsExactly(writer.write(once));
    }

    @Test
    void shouldPreserveSentinelsAndMapOutOfRangeValuesToSentinel() {
        VolumeModel volume = VolumeFixtures.decode(SyntheticVolumeBuilder.aVolume()
                .segmentation((s, line, col) -> new float[]{VolLayout.SENTINEL, 1.5f, 2f, 7.5f, 8f}[col]));

        VolumeModel cropped = engine.crop(volume, 2);

        assertThat(cropped.slice(0).segmentationLine(0))
                .containsExactly(VolLayout.SENTINEL, VolLayout.SENTINEL, 0f, 5.5f, VolLayout.SENTINEL);
    }

    @Test
    void shouldKeepNoDataPixelsInSurvivingRows() {
        int margin = 2;
        VolumeModel volume = VolumeFixtures.decode(SyntheticVolumeBuilder.aVolume()
                .raster((s, row, col) -> row == margin - 1 || row == margin || row == 10 - margin - 1
                        ? VolLayout.SENTINEL
                        : row));

        VolumeModel cropped = engine.crop(volume, margin);

        Slice slice = cropped.slice(1);
        assertThat(slice.depth()).isEqualTo(6);
        for (int col = 0; col < slice.width(); col++) {
            assertThat(slice.pixel(0, col)).isEqualTo(VolLayout.SENTINEL);
            assertThat(slice.pixel(5, col)).isEqualTo(VolLayout.SENTINEL);
            assertThat(slice.pixel(1, col)).isEqualTo(3f);
        }
    }

    @Test
    void shouldMapNaNToSentinel() {
        assertThat(CropEngine.shift(Float.NaN, 1, 8)).isEqualTo(VolLayout.SENTINEL);
        assertThat(CropEngine.shift(Float.POSITIVE_INFINITY, 1, 8)).isEqualTo(VolLayout.SENTINEL);
        assertThat(CropEngine.shift(4.25f, 1, 8)).isEqualTo(3.25f);
    }

    @Test
    void shouldRecomputeGridOffset() {
        SyntheticVolumeBuilder builder = SyntheticVolumeBuilder.aVolume().numBScans(4).grid(1, 0.3, 0.25).gridGap(24);
        VolumeModel volume = VolumeFixtures.decode(builder);

        VolumeModel cropped = engine.crop(volume, 1);

        int removedPerSlice = 2 * 5 * Float.BYTES;
        assertThat(cropped.gridPosition()).isEqualTo(24);
        assertThat(cropped.header().gridOffset()).isEqualTo(builder.gridOffset() - 4 * removedPerSlice);
        assertThat(VolumeFixtures.sequentialReader().read(writer.write(cropped))).isEqualTo(cropped);
    }

    @ParameterizedTest
    @ValueSource(ints = {5, 6, 100})
    void shouldRejectMarginsLeavingNoRows(int margin) {
        VolumeModel volume = VolumeFixtures.defaultVolume();

        assertThatThrownBy(() -> engine.crop(volume, margin))
                .isInstanceOf(InvalidCropException.class)
                .satisfies(e -> {
                    InvalidCropException ex = (InvalidCropException) e;
                    assertThat(ex.getRequested()).isEqualTo(String.valueOf(margin));
                    assertThat(ex.getLimit()).isEqualTo("10");
                });
    }

    @Test
    void shouldRejectNegativeMargin() {
        assertThatThrownBy(() -> engine.crop(VolumeFixtures.defaultVolume(), -1))
                .isInstanceOf(InvalidCropException.class)
                .hasMessageContaining("negative");
    }

    @Test
    void shouldAllowLargestMarginLeavingOneOrTwoRows() {
        VolumeModel even = engine.crop(VolumeFixtures.defaultVolume(), 4);
        VolumeModel odd = engine.crop(VolumeFixtures.decode(SyntheticVolumeBuilder.aVolume().sizeZ(9)), 4);

        assertThat(even.header().sizeZ()).isEqualTo(2);
        assertThat(odd.header().sizeZ()).isEqualTo(1);
    }
}
