package com.phillippitts.octvol.service.io;

import com.phillippitts.octvol.domain.Header;
import com.phillippitts.octvol.domain.Slice;
import com.phillippitts.octvol.domain.VolumeModel;
import com.phillippitts.octvol.service.codec.FundusImageCodec;
import com.phillippitts.octvol.service.codec.HeaderCodec;
import com.phillippitts.octvol.service.codec.SliceCodec;
import com.phillippitts.octvol.service.codec.ThicknessGridCodec;
import com.phillippitts.octvol.service.codec.VolLayout;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.stereotype.Component;

import java.util.Objects;

/**
 * Encodes a {@link VolumeModel} into a complete .vol byte image.
 *
 * <p>The header's {@code numBScans} and, when a grid is present, {@code gridOffset} are taken from
 * the layout actually written rather than trusted from the model. A model decoded from a file and
 * written back unchanged reproduces the file byte for byte.
 */
@Component
public class VolumeWriter {
    private static final Logger LOG = LogManager.getLogger(VolumeWriter.class);

    private final HeaderCodec headerCodec;
    private final FundusImageCodec fundusCodec;
    private final SliceCodec sliceCodec;
    private final ThicknessGridCodec gridCodec;

    public VolumeWriter(HeaderCodec headerCodec,
                        FundusImageCodec fundusCodec,
                        SliceCodec sliceCodec,
                        ThicknessGridCodec gridCodec) {
        this.headerCodec = Objects.requireNonNull(headerCodec);
        this.fundusCodec = Objects.requireNonNull(fundusCodec);
        this.sliceCodec = Objects.requireNonNull(sliceCodec);
        this.gridCodec = Objects.requireNonNull(gridCodec);
    }

    /**
     * Encodes {@code volume}.
     *
     * @param volume volume to encode
     * @return complete file content
     * @throws IllegalStateException if the encoded file would exceed the in-memory size limit
     */
    public byte[] write(VolumeModel volume) {
        Objects.requireNonNull(volume, "volume must not be null");
        Header header = volume.header().withNumBScans(volume.slices().size());
        long slicesEnd = VolLayout.slicesEnd(header);
        if (volume.thicknessGrid().isPresent()) {
            header = header.withGridOffset((int) (slicesEnd + volume.gridPosition()));
        }
        long total = slicesEnd + volume.tail().length();
        if (total > VolLayout.MAX_FILE_SIZE) {
            throw new IllegalStateException("Encoded volume of " + total + " bytes exceeds the in-memory limit");
        }

        byte[] out = new byte[(int) total];
        System.arraycopy(headerCodec.encode(header), 0, out, 0, VolLayout.FILE_HEADER_SIZE);
        byte[] slo = fundusCodec.encode(volume.fundus());
        System.arraycopy(slo, 0, out, VolLayout.FILE_HEADER_SIZE, slo.length);

        for (int i = 0; i < volume.slices().size(); i++) {
            Slice slice = volume.slice(i);
            byte[] record = sliceCodec.encode(slice, header);
            System.arraycopy(record, 0, out, (int) VolLayout.sliceOffset(header, i), record.length);
        }

        volume.tail().copyTo(out, (int) slicesEnd);
        volume.thicknessGrid().ifPresent(grid -> {
            byte[] encoded = gridCodec.encode(grid);
            System.arraycopy(encoded, 0, out, (int) slicesEnd + volume.gridPosition(), encoded.length);
        });

        LOG.debug("Encoded {} B-scans into {} bytes", volume.slices().size(), out.length);
        return out;
    }
}
