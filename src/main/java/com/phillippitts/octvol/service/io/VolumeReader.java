package com.phillippitts.octvol.service.io;

import com.phillippitts.octvol.config.properties.DecodeProperties;
import com.phillippitts.octvol.domain.FundusImage;
import com.phillippitts.octvol.domain.Header;
import com.phillippitts.octvol.domain.RawBytes;
import com.phillippitts.octvol.domain.Slice;
import com.phillippitts.octvol.domain.ThicknessGrid;
import com.phillippitts.octvol.domain.VolumeModel;
import com.phillippitts.octvol.exception.VolFormatException;
import com.phillippitts.octvol.service.codec.FundusImageCodec;
import com.phillippitts.octvol.service.codec.HeaderCodec;
import com.phillippitts.octvol.service.codec.SliceCodec;
import com.phillippitts.octvol.service.codec.ThicknessGridCodec;
import com.phillippitts.octvol.service.codec.VolLayout;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.Executor;

/**
 * Decodes a complete .vol byte image into a {@link VolumeModel}.
 *
 * <p><b>Thread Model:</b> B-scan offsets are fixed by the header, so each record is decoded as an
 * independent task on {@code decodeExecutor} once the volume reaches
 * {@code octvol.decode.parallel-threshold} B-scans. Smaller volumes, or any volume when
 * {@code octvol.decode.parallel=false}, decode on the calling thread. Both paths produce equal
 * models.
 *
 * <p><b>Error Handling:</b> The first failing B-scan aborts the read and its own exception
 * ({@link com.phillippitts.octvol.exception.TruncatedFileException} or {@link VolFormatException})
 * reaches the caller unwrapped. No partial model is ever returned.
 */
@Component
public class VolumeReader {
    private static final Logger LOG = LogManager.getLogger(VolumeReader.class);

    private final HeaderCodec headerCodec;
    private final FundusImageCodec fundusCodec;
    private final SliceCodec sliceCodec;
    private final ThicknessGridCodec gridCodec;
    private final Executor executor;
    private final DecodeProperties decodeProperties;

    public VolumeReader(HeaderCodec headerCodec,
                        FundusImageCodec fundusCodec,
                        SliceCodec sliceCodec,
                        ThicknessGridCodec gridCodec,
                        @Qualifier("decodeExecutor") Executor executor,
                        DecodeProperties decodeProperties) {
        this.headerCodec = Objects.requireNonNull(headerCodec);
        this.fundusCodec = Objects.requireNonNull(fundusCodec);
        this.sliceCodec = Objects.requireNonNull(sliceCodec);
        this.gridCodec = Objects.requireNonNull(gridCodec);
        this.executor = Objects.requireNonNull(executor);
        this.decodeProperties = Objects.requireNonNull(decodeProperties);
    }

    /**
     * Decodes {@code bytes}.
     *
     * @param bytes complete file content
     * @return validated volume
     * @throws com.phillippitts.octvol.exception.TruncatedFileException if any region runs past the end
     * @throws VolFormatException if the version or a fixed structure is malformed
     */
    public VolumeModel read(byte[] bytes) {
        Objects.requireNonNull(bytes, "bytes must not be null");
        Header header = headerCodec.decode(bytes);
        FundusImage fundus = fundusCodec.decode(bytes, header);
        List<Slice> slices = useParallel(header.numBScans())
                ? decodeParallel(bytes, header)
                : decodeSequential(bytes, header);

        long slicesEnd = VolLayout.slicesEnd(header);
        RawBytes tail = RawBytes.copyOf(bytes, (int) slicesEnd, (int) (bytes.length - slicesEnd));
        if (!header.hasThicknessGrid()) {
            LOG.debug("Decoded {} B-scans of {}x{}, {} tail bytes, no thickness grid",
                    slices.size(), header.sizeZ(), header.sizeX(), tail.length());
            return new VolumeModel(header, fundus, slices, tail);
        }

        if (header.gridOffset() < slicesEnd) {
            throw new VolFormatException("header gridOffset", VolLayout.HDR_GRID_OFFSET,
                    "grid at " + header.gridOffset() + " overlaps B-scan data ending at " + slicesEnd);
        }
        ThicknessGrid grid = gridCodec.decode(bytes, header.gridOffset());
        int gridPosition = (int) (header.gridOffset() - slicesEnd);
        LOG.debug("Decoded {} B-scans of {}x{}, thickness grid type {} at tail position {}",
                slices.size(), header.sizeZ(), header.sizeX(), grid.type(), gridPosition);
        return new VolumeModel(header, fundus, slices, tail, grid, gridPosition);
    }

    private boolean useParallel(int sliceCount) {
        return decodeProperties.isParallel() && sliceCount >= decodeProperties.getParallelThreshold();
    }

    private List<Slice> decodeSequential(byte[] bytes, Header header) {
        List<Slice> slices = new ArrayList<>(header.numBScans());
        for (int i = 0; i < header.numBScans(); i++) {
            slices.add(sliceCodec.decode(bytes, VolLayout.sliceOffset(header, i), header));
        }
        return slices;
    }

    private List<Slice> decodeParallel(byte[] bytes, Header header) {
        List<CompletableFuture<Slice>> futures = new ArrayList<>(header.numBScans());
        for (int i = 0; i < header.numBScans(); i++) {
            long offset = VolLayout.sliceOffset(header, i);
            futures.add(CompletableFuture.supplyAsync(() -> sliceCodec.decode(bytes, offset, header), executor));
        }
        // allOf completes only once every task is done, so the loop below reports the lowest failing index
        CompletableFuture.allOf(futures.toArray(CompletableFuture[]::new))
                .exceptionally(t -> null)
                .join();

        List<Slice> slices = new ArrayList<>(futures.size());
        for (CompletableFuture<Slice> future : futures) {
            try {
                slices.add(future.join());
            } catch (CompletionException e) {
                if (e.getCause() instanceof RuntimeException cause) {
                    throw cause;
                }
                throw e;
            }
        }
        LOG.debug("Decoded {} B-scans on decodeExecutor", slices.size());
        return slices;
    }
}
