package com.phillippitts.octvol.service.codec;

import com.phillippitts.octvol.domain.Header;
import com.phillippitts.octvol.domain.Slice;
import com.phillippitts.octvol.exception.TruncatedFileException;
import com.phillippitts.octvol.exception.VolFormatException;
import com.phillippitts.octvol.testutil.SyntheticVolumeBuilder;
import com.phillippitts.octvol.testutil.VolumeFixtures;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.util.Arrays;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class SliceCodecTest {

    private final SliceCodec codec = new SliceCodec();

    private SyntheticVolumeBuilder builder;
    private byte[] file;
    private Header header;

    @BeforeEach
    void setUp() {
        builder = SyntheticVolumeBuilder.aVolume();
        file = builder.build();
        header = VolumeFixtures.headerCodec().decode(file);
    }

    @Test
    void shouldDecodeSubHeaderSegmentationAndRaster() {
        Slice slice = codec.decode(file, VolLayout.sliceOffset(header, 1), header);

        assertThat(slice.version().text()).isEqualTo("HSF-BS-103");
        assertThat(slice.bScanHdrSize()).isEqualTo(builder.bScanHdrSize());
        assertThat(slice.startX()).isZero();
        assertThat(slice.startY()).isEqualTo(0.25);
        assertThat(slice.endX()).isEqualTo(0.625);
        assertThat(slice.quality()).isEqualTo(26.5f);
        assertThat(slice.shift()).isEqualTo(1);
        assertThat(slice.offSeg()).isEqualTo(builder.offSeg());
        assertThat(slice.segmentationCount()).isEqualTo(2);
        assertThat(slice.segmentationLine(0)).containsOnly(3f);
        assertThat(slice.segmentationLine(1)).containsOnly(1f);
        assertThat(slice.depth()).isEqualTo(10);
        assertThat(slice.width()).isEqualTo(5);
        assertThat(slice.pixel(7, 3)).isEqualTo(10_000f + 700f + 3f);
        assertThat(slice.headerTail().length()).isEqualTo(builder.bScanHdrSize() - 256);
    }

    @Test
    void shouldEncodeToIdenticalRecordBytes() {
        int offset = (int) VolLayout.sliceOffset(header, 2);
        Slice slice = codec.decode(file, offset, header);

        byte[] encoded = codec.encode(slice, header);

        assertThat(encoded).containsExactly(
                Arrays.copyOfRange(file, offset, offset + (int) VolLayout.sliceRecordSize(header)));
    }

    @Test
    void shouldKeepSentinelAndSpecialFloatsBitExact() {
        byte[] special = SyntheticVolumeBuilder.aVolume()
                .raster((s, row, col) -> row == 0 ? Float.MAX_VALUE : (row == 1 ? Float.NEGATIVE_INFINITY : -0.0f))
                .segmentation((s, line, col) -> col == 0 ? Float.MAX_VALUE : 4f)
                .build();
        int offset = (int) VolLayout.sliceOffset(header, 0);

        Slice slice = codec.decode(special, offset, header);

        assertThat(slice.pixel(0, 4)).isEqualTo(Float.MAX_VALUE);
        assertThat(VolLayout.isSentinel(slice.segmentationValue(0, 0))).isTrue();
        assertThat(codec.encode(slice, header)).containsExactly(
                Arrays.copyOfRange(special, offset, offset + (int) VolLayout.sliceRecordSize(header)));
    }

    @Test
    void headerTailShouldHoldZerosWhereSegmentationSits() {
        Slice slice = codec.decode(file, VolLayout.sliceOffset(header, 0), header);

        byte[] tail = slice.headerTail().toArray();
        int blockStart = builder.offSeg() - VolLayout.BSCAN_FIXED_HEADER_SIZE;
        int blockEnd = blockStart + 2 * 5 * Float.BYTES;
        assertThat(Arrays.copyOfRange(tail, blockStart, blockEnd)).containsOnly((byte) 0);
        assertThat(tail[blockStart - 1]).isEqualTo((byte) 0x3C);
        assertThat(tail[blockEnd]).isEqualTo((byte) 0x3C);
    }

    @Test
    void shouldReportTruncatedRasterWithContext() {
        long offset = VolLayout.sliceOffset(header, 2);
        long rasterStart = offset + header.bScanHdrSize();
        byte[] truncated = Arrays.copyOf(file, (int) rasterStart + 40);

        assertThatThrownBy(() -> codec.decode(truncated, offset, header))
                .isInstanceOf(TruncatedFileException.class)
                .satisfies(e -> {
                    TruncatedFileException t = (TruncatedFileException) e;
                    assertThat(t.getRegion()).isEqualTo("B-scan raster");
                    assertThat(t.getOffset()).isEqualTo(rasterStart);
                    assertThat(t.getExpectedLength()).isEqualTo(5 * 10 * 4);
                    assertThat(t.getAvailableLength()).isEqualTo(40);
                });
    }

    @Test
    void shouldReportTruncatedSubHeader() {
        long offset = VolLayout.sliceOffset(header, 0);
        byte[] truncated = Arrays.copyOf(file, (int) offset + 100);

        assertThatThrownBy(() -> codec.decode(truncated, offset, header))
                .isInstanceOf(TruncatedFileException.class)
                .hasMessageContaining("B-scan header");
    }

    @Test
    void shouldRejectHeaderSizeDisagreeingWithFileHeader() {
        int offset = (int) VolLayout.sliceOffset(header, 0);
        ByteBuffer.wrap(file).order(ByteOrder.LITTLE_ENDIAN).putInt(offset + VolLayout.BSC_HDR_SIZE, 512);

        assertThatThrownBy(() -> codec.decode(file, offset, header))
                .isInstanceOf(VolFormatException.class)
                .hasMessageContaining("bScanHdrSize")
                .satisfies(e -> assertThat(((VolFormatException) e).getOffset())
                        .isEqualTo(offset + VolLayout.BSC_HDR_SIZE));
    }

    @Test
    void shouldRejectSegmentationOutsideHeaderTail() {
        int offset = (int) VolLayout.sliceOffset(header, 0);
        ByteBuffer.wrap(file).order(ByteOrder.LITTLE_ENDIAN)
                .putInt(offset + VolLayout.BSC_OFF_SEG, builder.bScanHdrSize() - 4);

        assertThatThrownBy(() -> codec.decode(file, offset, header))
                .isInstanceOf(VolFormatException.class)
                .hasMessageContaining("segmentation");
    }

    @Test
    void shouldRejectNegativeSegmentationCount() {
        int offset = (int) VolLayout.sliceOffset(header, 0);
        ByteBuffer.wrap(file).order(ByteOrder.LITTLE_ENDIAN).putInt(offset + VolLayout.BSC_NUM_SEG, -1);

        assertThatThrownBy(() -> codec.decode(file, offset, header))
                .isInstanceOf(VolFormatException.class)
                .hasMessageContaining("numSeg");
    }

    @Test
    void shouldDecodeSliceWithoutSegmentation() {
        SyntheticVolumeBuilder plain = SyntheticVolumeBuilder.aVolume().numSeg(0);
        byte[] bytes = plain.build();
        Header plainHeader = VolumeFixtures.headerCodec().decode(bytes);

        Slice slice = codec.decode(bytes, VolLayout.sliceOffset(plainHeader, 0), plainHeader);

        assertThat(slice.segmentationCount()).isZero();
        assertThat(slice.headerTail().length()).isEqualTo(2 * SyntheticVolumeBuilder.SEGMENTATION_MARGIN);
    }
}
