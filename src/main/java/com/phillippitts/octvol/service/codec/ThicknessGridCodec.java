package com.phillippitts.octvol.service.codec;

import com.phillippitts.octvol.domain.ThicknessGrid;
import org.springframework.stereotype.Component;

import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

import static com.phillippitts.octvol.service.codec.VolLayout.GRD_CENTER_X;
import static com.phillippitts.octvol.service.codec.VolLayout.GRD_CENTER_Y;
import static com.phillippitts.octvol.service.codec.VolLayout.GRD_CENTRAL_THK;
import static com.phillippitts.octvol.service.codec.VolLayout.GRD_DIAMETERS;
import static com.phillippitts.octvol.service.codec.VolLayout.GRD_MAX_CENTRAL_THK;
import static com.phillippitts.octvol.service.codec.VolLayout.GRD_MIN_CENTRAL_THK;
import static com.phillippitts.octvol.service.codec.VolLayout.GRD_SECTORS;
import static com.phillippitts.octvol.service.codec.VolLayout.GRD_SECTOR_STRIDE;
import static com.phillippitts.octvol.service.codec.VolLayout.GRD_TOTAL_VOLUME;
import static com.phillippitts.octvol.service.codec.VolLayout.GRD_TYPE;
import static com.phillippitts.octvol.service.codec.VolLayout.GRID_DIAMETER_COUNT;
import static com.phillippitts.octvol.service.codec.VolLayout.GRID_SECTOR_COUNT;
import static com.phillippitts.octvol.service.codec.VolLayout.GRID_SIZE;
import static com.phillippitts.octvol.service.codec.VolLayout.requireRange;

/**
 * Reads and writes the 132-byte thickness grid record.
 */
@Component
public class ThicknessGridCodec {

    /**
     * Decodes the grid starting at absolute {@code offset}.
     *
     * @throws com.phillippitts.octvol.exception.TruncatedFileException if the record runs past the end of {@code bytes}
     */
    public ThicknessGrid decode(byte[] bytes, long offset) {
        Objects.requireNonNull(bytes, "bytes must not be null");
        requireRange("thickness grid", offset, GRID_SIZE, bytes.length);
        ByteBuffer buf = ByteBuffer.wrap(bytes, (int) offset, GRID_SIZE).slice().order(ByteOrder.LITTLE_ENDIAN);

        List<Double> diameters = new ArrayList<>(GRID_DIAMETER_COUNT);
        for (int i = 0; i < GRID_DIAMETER_COUNT; i++) {
            diameters.add(buf.getDouble(GRD_DIAMETERS + i * Double.BYTES));
        }
        List<ThicknessGrid.Sector> sectors = new ArrayList<>(GRID_SECTOR_COUNT);
        for (int i = 0; i < GRID_SECTOR_COUNT; i++) {
            int at = GRD_SECTORS + i * GRD_SECTOR_STRIDE;
            sectors.add(new ThicknessGrid.Sector(buf.getFloat(at), buf.getFloat(at + Float.BYTES)));
        }
        return new ThicknessGrid(
                buf.getInt(GRD_TYPE),
                diameters,
                buf.getDouble(GRD_CENTER_X),
                buf.getDouble(GRD_CENTER_Y),
                buf.getFloat(GRD_CENTRAL_THK),
                buf.getFloat(GRD_MIN_CENTRAL_THK),
                buf.getFloat(GRD_MAX_CENTRAL_THK),
                buf.getFloat(GRD_TOTAL_VOLUME),
                sectors);
    }

    /** Encodes {@code grid} into a new 132-byte array. */
    public byte[] encode(ThicknessGrid grid) {
        Objects.requireNonNull(grid, "grid must not be null");
        byte[] out = new byte[GRID_SIZE];
        ByteBuffer buf = ByteBuffer.wrap(out).order(ByteOrder.LITTLE_ENDIAN);
        buf.putInt(GRD_TYPE, grid.type());
        for (int i = 0; i < GRID_DIAMETER_COUNT; i++) {
            buf.putDouble(GRD_DIAMETERS + i * Double.BYTES, grid.diameters().get(i));
        }
        buf.putDouble(GRD_CENTER_X, grid.centerX());
        buf.putDouble(GRD_CENTER_Y, grid.centerY());
        buf.putFloat(GRD_CENTRAL_THK, grid.centralThickness());
        buf.putFloat(GRD_MIN_CENTRAL_THK, grid.minCentralThickness());
        buf.putFloat(GRD_MAX_CENTRAL_THK, grid.maxCentralThickness());
        buf.putFloat(GRD_TOTAL_VOLUME, grid.totalVolume());
        for (int i = 0; i < GRID_SECTOR_COUNT; i++) {
            int at = GRD_SECTORS + i * GRD_SECTOR_STRIDE;
            ThicknessGrid.Sector sector = grid.sectors().get(i);
            buf.putFloat(at, sector.thickness());
            buf.putFloat(at + Float.BYTES, sector.volume());
        }
        return out;
    }
}
