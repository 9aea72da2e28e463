package com.phillippitts.octvol.service.codec;

import com.phillippitts.octvol.domain.FixedText;
import com.phillippitts.octvol.domain.Header;
import com.phillippitts.octvol.domain.RawBytes;
import com.phillippitts.octvol.domain.Slice;
import com.phillippitts.octvol.exception.VolFormatException;
import org.springframework.stereotype.Component;

import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.nio.FloatBuffer;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

import static com.phillippitts.octvol.service.codec.VolLayout.BSCAN_FIXED_HEADER_SIZE;
import static com.phillippitts.octvol.service.codec.VolLayout.BSC_END_X;
import static com.phillippitts.octvol.service.codec.VolLayout.BSC_END_Y;
import static com.phillippitts.octvol.service.codec.VolLayout.BSC_HDR_SIZE;
import static com.phillippitts.octvol.service.codec.VolLayout.BSC_NUM_SEG;
import static com.phillippitts.octvol.service.codec.VolLayout.BSC_OFF_SEG;
import static com.phillippitts.octvol.service.codec.VolLayout.BSC_QUALITY;
import static com.phillippitts.octvol.service.codec.VolLayout.BSC_SHIFT;
import static com.phillippitts.octvol.service.codec.VolLayout.BSC_SPARE;
import static com.phillippitts.octvol.service.codec.VolLayout.BSC_SPARE_LENGTH;
import static com.phillippitts.octvol.service.codec.VolLayout.BSC_START_X;
import static com.phillippitts.octvol.service.codec.VolLayout.BSC_START_Y;
import static com.phillippitts.octvol.service.codec.VolLayout.BSC_VERSION;
import static com.phillippitts.octvol.service.codec.VolLayout.BSC_VERSION_LENGTH;
import static com.phillippitts.octvol.service.codec.VolLayout.rasterBytes;
import static com.phillippitts.octvol.service.codec.VolLayout.requireRange;
import static com.phillippitts.octvol.service.codec.VolLayout.segmentationBytes;
import static com.phillippitts.octvol.service.codec.VolLayout.sliceRecordSize;

/**
 * Decodes and encodes one B-scan record: fixed sub-header, header tail with the segmentation
 * block, and the float32 raster.
 *
 * <p>Every read range is checked against the buffer before it is touched, in record order, so a
 * truncated file reports the first region that is missing.
 */
@Component
public class SliceCodec {

    /**
     * Decodes the B-scan record starting at absolute {@code offset}.
     *
     * @param bytes  complete file content
     * @param offset absolute offset of the record
     * @param header decoded file header supplying the raster shape and header size
     * @return decoded slice
     * @throws com.phillippitts.octvol.exception.TruncatedFileException if any part of the record runs past the buffer
     * @throws VolFormatException if the declared header size or segmentation block is inconsistent
     */
    public Slice decode(byte[] bytes, long offset, Header header) {
        Objects.requireNonNull(bytes, "bytes must not be null");
        Objects.requireNonNull(header, "header must not be null");
        requireRange("B-scan header", offset, BSCAN_FIXED_HEADER_SIZE, bytes.length);
        int base = (int) offset;
        ByteBuffer buf = ByteBuffer.wrap(bytes).order(ByteOrder.LITTLE_ENDIAN);

        int hdrSize = buf.getInt(base + BSC_HDR_SIZE);
        if (hdrSize != header.bScanHdrSize()) {
            throw new VolFormatException("B-scan bScanHdrSize", offset + BSC_HDR_SIZE,
                    "declares " + hdrSize + " bytes, file header declares " + header.bScanHdrSize());
        }
        int numSeg = buf.getInt(base + BSC_NUM_SEG);
        int offSeg = buf.getInt(base + BSC_OFF_SEG);
        if (numSeg < 0) {
            throw new VolFormatException("B-scan numSeg", offset + BSC_NUM_SEG,
                    "must not be negative, was " + numSeg);
        }
        long segLength = segmentationBytes(numSeg, header.sizeX());
        if (numSeg > 0 && (offSeg < BSCAN_FIXED_HEADER_SIZE || offSeg + segLength > hdrSize)) {
            throw new VolFormatException("B-scan segmentation", offset + BSC_OFF_SEG,
                    numSeg + " lines at " + offSeg + " do not fit in [" + BSCAN_FIXED_HEADER_SIZE + ", " + hdrSize + ")");
        }
        if (numSeg > 0) {
            requireRange("B-scan segmentation", offset + offSeg, segLength, bytes.length);
        }
        int tailLength = hdrSize - BSCAN_FIXED_HEADER_SIZE;
        requireRange("B-scan header tail", offset + BSCAN_FIXED_HEADER_SIZE, tailLength, bytes.length);
        requireRange("B-scan raster", offset + hdrSize, rasterBytes(header), bytes.length);

        List<float[]> segmentation = new ArrayList<>(numSeg);
        for (int line = 0; line < numSeg; line++) {
            int at = base + offSeg + (int) segmentationBytes(line, header.sizeX());
            segmentation.add(readFloats(bytes, at, header.sizeX()));
        }
        float[] pixels = readFloats(bytes, base + hdrSize, header.sizeZ() * header.sizeX());

        // The tail keeps zeros where the segmentation block sits; the lines own those bytes
        RawBytes headerTail = RawBytes.copyOf(bytes, base + BSCAN_FIXED_HEADER_SIZE, tailLength);
        if (numSeg > 0) {
            int blockStart = offSeg - BSCAN_FIXED_HEADER_SIZE;
            headerTail = headerTail.zeroed(blockStart, blockStart + (int) segLength);
        }

        return Slice.builder()
                .version(FixedText.copyOf(bytes, base + BSC_VERSION, BSC_VERSION_LENGTH))
                .bScanHdrSize(hdrSize)
                .start(buf.getDouble(base + BSC_START_X), buf.getDouble(base + BSC_START_Y))
                .end(buf.getDouble(base + BSC_END_X), buf.getDouble(base + BSC_END_Y))
                .offSeg(offSeg)
                .quality(buf.getFloat(base + BSC_QUALITY))
                .shift(buf.getInt(base + BSC_SHIFT))
                .spare(RawBytes.copyOf(bytes, base + BSC_SPARE, BSC_SPARE_LENGTH))
                .headerTail(headerTail)
                .segmentation(segmentation)
                .raster(header.sizeZ(), header.sizeX(), pixels)
                .build();
    }

    /**
     * Encodes {@code slice} into a new record of {@code bScanHdrSize + sizeZ * sizeX * 4} bytes.
     *
     * @throws IllegalArgumentException if the slice does not fit the layout {@code header} declares
     */
    public byte[] encode(Slice slice, Header header) {
        Objects.requireNonNull(slice, "slice must not be null");
        Objects.requireNonNull(header, "header must not be null");
        int hdrSize = header.bScanHdrSize();
        if (slice.headerTail().length() != hdrSize - BSCAN_FIXED_HEADER_SIZE) {
            throw new IllegalArgumentException("Header tail holds " + slice.headerTail().length()
                    + " bytes, expected " + (hdrSize - BSCAN_FIXED_HEADER_SIZE));
        }
        if (slice.depth() != header.sizeZ() || slice.width() != header.sizeX()) {
            throw new IllegalArgumentException("Raster is " + slice.depth() + "x" + slice.width()
                    + ", header declares " + header.sizeZ() + "x" + header.sizeX());
        }
        if (slice.version().width() != BSC_VERSION_LENGTH || slice.spare().length() != BSC_SPARE_LENGTH) {
            throw new IllegalArgumentException("B-scan version or spare field has the wrong width");
        }

        byte[] out = new byte[(int) sliceRecordSize(header)];
        ByteBuffer buf = ByteBuffer.wrap(out).order(ByteOrder.LITTLE_ENDIAN);
        slice.version().copyTo(out, BSC_VERSION);
        buf.putInt(BSC_HDR_SIZE, slice.bScanHdrSize());
        buf.putDouble(BSC_START_X, slice.startX());
        buf.putDouble(BSC_START_Y, slice.startY());
        buf.putDouble(BSC_END_X, slice.endX());
        buf.putDouble(BSC_END_Y, slice.endY());
        buf.putInt(BSC_NUM_SEG, slice.segmentationCount());
        buf.putInt(BSC_OFF_SEG, slice.offSeg());
        buf.putFloat(BSC_QUALITY, slice.quality());
        buf.putInt(BSC_SHIFT, slice.shift());
        slice.spare().copyTo(out, BSC_SPARE);
        slice.headerTail().copyTo(out, BSCAN_FIXED_HEADER_SIZE);

        for (int line = 0; line < slice.segmentationCount(); line++) {
            int at = slice.offSeg() + (int) segmentationBytes(line, header.sizeX());
            writeFloats(out, at, slice.segmentationLine(line));
        }
        writeFloats(out, hdrSize, slice.pixels());
        return out;
    }

    private static float[] readFloats(byte[] bytes, int offset, int count) {
        float[] values = new float[count];
        floatView(bytes, offset, count).get(values);
        return values;
    }

    private static void writeFloats(byte[] target, int offset, float[] values) {
        floatView(target, offset, values.length).put(values);
    }

    private static FloatBuffer floatView(byte[] bytes, int offset, int count) {
        return ByteBuffer.wrap(bytes, offset, count * Float.BYTES).slice()
                .order(ByteOrder.LITTLE_ENDIAN).asFloatBuffer();
    }
}
