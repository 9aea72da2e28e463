package com.phillippitts.octvol.service.codec;

import com.phillippitts.octvol.config.properties.VolFormatProperties;
import com.phillippitts.octvol.domain.FixedText;
import com.phillippitts.octvol.domain.Header;
import com.phillippitts.octvol.exception.TruncatedFileException;
import com.phillippitts.octvol.exception.VolFormatException;
import com.phillippitts.octvol.testutil.SyntheticVolumeBuilder;
import org.junit.jupiter.api.Test;

import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.util.Arrays;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class HeaderCodecTest {

    private final HeaderCodec codec = new HeaderCodec(new VolFormatProperties());

    @Test
    void shouldDecodeAllFields() {
        Header header = codec.decode(SyntheticVolumeBuilder.aVolume().build());

        assertThat(header.version().text()).isEqualTo("HSF-OCT-103");
        assertThat(header.sizeX()).isEqualTo(5);
        assertThat(header.numBScans()).isEqualTo(3);
        assertThat(header.sizeZ()).isEqualTo(10);
        assertThat(header.scaleX()).isEqualTo(0.125);
        assertThat(header.distance()).isEqualTo(0.25);
        assertThat(header.sizeXSlo()).isEqualTo(4);
        assertThat(header.sizeYSlo()).isEqualTo(3);
        assertThat(header.scanPosition().text()).isEqualTo("OD");
        assertThat(header.patientId().text()).isEqualTo("PAT0042");
        assertThat(header.visitId().text()).isEqualTo("VISIT-7");
        assertThat(header.pid()).isEqualTo(4711);
        assertThat(header.gridType()).isZero();
    }

    @Test
    void shouldEncodeHeaderBackToIdenticalBytes() {
        byte[] file = SyntheticVolumeBuilder.aVolume().grid(1, 0.3, 0.2).build();

        byte[] encoded = codec.encode(codec.decode(file));

        assertThat(encoded).containsExactly(Arrays.copyOf(file, VolLayout.FILE_HEADER_SIZE));
    }

    @Test
    void shouldRejectUnknownVersion() {
        byte[] file = SyntheticVolumeBuilder.aVolume().version("HSF-OCT-999").build();

        assertThatThrownBy(() -> codec.decode(file))
                .isInstanceOf(VolFormatException.class)
                .hasMessageContaining("HSF-OCT-999")
                .satisfies(e -> assertThat(((VolFormatException) e).getOffset()).isEqualTo(VolLayout.HDR_VERSION));
    }

    @Test
    void shouldAcceptConfiguredAdditionalVersion() {
        VolFormatProperties props = new VolFormatProperties();
        props.setAcceptedVersions(List.of("HSF-OCT-103", "HSF-OCT-104"));
        HeaderCodec lenient = new HeaderCodec(props);

        Header header = lenient.decode(SyntheticVolumeBuilder.aVolume().version("HSF-OCT-104").build());

        assertThat(header.version().text()).isEqualTo("HSF-OCT-104");
    }

    @Test
    void shouldReportTruncatedHeader() {
        byte[] file = Arrays.copyOf(SyntheticVolumeBuilder.aVolume().build(), 1000);

        assertThatThrownBy(() -> codec.decode(file))
                .isInstanceOf(TruncatedFileException.class)
                .satisfies(e -> {
                    TruncatedFileException t = (TruncatedFileException) e;
                    assertThat(t.getOffset()).isZero();
                    assertThat(t.getExpectedLength()).isEqualTo(2048);
                    assertThat(t.getAvailableLength()).isEqualTo(1000);
                });
    }

    @Test
    void shouldRejectBScanHeaderSmallerThanFixedPart() {
        byte[] file = SyntheticVolumeBuilder.aVolume().build();
        ByteBuffer.wrap(file).order(ByteOrder.LITTLE_ENDIAN).putInt(VolLayout.HDR_BSCAN_HDR_SIZE, 128);

        assertThatThrownBy(() -> codec.decode(file))
                .isInstanceOf(VolFormatException.class)
                .hasMessageContaining("bScanHdrSize");
    }

    @Test
    void shouldRejectNonPositiveDepth() {
        byte[] file = SyntheticVolumeBuilder.aVolume().build();
        ByteBuffer.wrap(file).order(ByteOrder.LITTLE_ENDIAN).putInt(VolLayout.HDR_SIZE_Z, 0);

        assertThatThrownBy(() -> codec.decode(file))
                .isInstanceOf(VolFormatException.class)
                .hasMessageContaining("sizeZ");
    }

    @Test
    void shouldRejectEncodingPatientIdOfWrongWidth() {
        Header header = codec.decode(SyntheticVolumeBuilder.aVolume().build());
        Header broken = new Header(header.version(), header.sizeX(), header.numBScans(), header.sizeZ(),
                header.scaleX(), header.distance(), header.scaleZ(), header.sizeXSlo(), header.sizeYSlo(),
                header.scaleXSlo(), header.scaleYSlo(), header.fieldSizeSlo(), header.scanFocus(),
                header.scanPosition(), header.examTimeTicks(), header.scanPattern(), header.bScanHdrSize(),
                header.id(), header.referenceId(), header.pid(),
                FixedText.of("PAT", 3), header.padding(), header.dobDays(),
                header.vid(), header.visitId(), header.visitDateDays(), header.gridType(), header.gridOffset(),
                header.spare());

        assertThatThrownBy(() -> codec.encode(broken))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("patientId");
    }
}
