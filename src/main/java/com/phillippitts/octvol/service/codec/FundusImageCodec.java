package com.phillippitts.octvol.service.codec;

import com.phillippitts.octvol.domain.FundusImage;
import com.phillippitts.octvol.domain.Header;
import org.springframework.stereotype.Component;

import java.util.Arrays;
import java.util.Objects;

import static com.phillippitts.octvol.service.codec.VolLayout.FILE_HEADER_SIZE;
import static com.phillippitts.octvol.service.codec.VolLayout.requireRange;
import static com.phillippitts.octvol.service.codec.VolLayout.sloBytes;

/**
 * Reads and writes the 8-bit SLO raster that directly follows the file header.
 */
@Component
public class FundusImageCodec {

    /**
     * Decodes the SLO image whose dimensions {@code header} declares.
     *
     * @throws com.phillippitts.octvol.exception.TruncatedFileException if the raster runs past the end of {@code bytes}
     */
    public FundusImage decode(byte[] bytes, Header header) {
        Objects.requireNonNull(bytes, "bytes must not be null");
        Objects.requireNonNull(header, "header must not be null");
        long length = sloBytes(header);
        requireRange("SLO image", FILE_HEADER_SIZE, length, bytes.length);
        byte[] pixels = Arrays.copyOfRange(bytes, FILE_HEADER_SIZE, FILE_HEADER_SIZE + (int) length);
        return new FundusImage(header.sizeXSlo(), header.sizeYSlo(), pixels);
    }

    public byte[] encode(FundusImage image) {
        Objects.requireNonNull(image, "image must not be null");
        return image.pixels();
    }
}
