package com.phillippitts.octvol.domain;

import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Retinal thickness grid record stored after the B-scans when the header's grid type is non-zero.
 *
 * @param type                grid type code (3 = ETDRS)
 * @param diameters           the three ring diameters in mm
 * @param centerX             grid centre x on the fundus plane, mm
 * @param centerY             grid centre y on the fundus plane, mm
 * @param centralThickness    central thickness
 * @param minCentralThickness minimum central thickness
 * @param maxCentralThickness maximum central thickness
 * @param totalVolume         total volume
 * @param sectors             the nine sector values
 */
public record ThicknessGrid(
        int type,
        List<Double> diameters,
        double centerX,
        double centerY,
        float centralThickness,
        float minCentralThickness,
        float maxCentralThickness,
        float totalVolume,
        List<Sector> sectors
) {

    /** Grid type code for the ETDRS layout. */
    public static final int ETDRS_TYPE = 3;

    private static final int DIAMETER_COUNT = 3;
    private static final int SECTOR_COUNT = 9;

    public ThicknessGrid {
        Objects.requireNonNull(diameters, "diameters must not be null");
        Objects.requireNonNull(sectors, "sectors must not be null");
        if (diameters.size() != DIAMETER_COUNT) {
            throw new IllegalArgumentException("Expected " + DIAMETER_COUNT + " diameters, got " + diameters.size());
        }
        if (sectors.size() != SECTOR_COUNT) {
            throw new IllegalArgumentException("Expected " + SECTOR_COUNT + " sectors, got " + sectors.size());
        }
        diameters = List.copyOf(diameters);
        sectors = List.copyOf(sectors);
    }

    /**
     * An ETDRS grid (1, 3, 6 mm rings) centred at the given point with every measurement reset to zero.
     */
    public static ThicknessGrid etdrs(double centerX, double centerY) {
        return new ThicknessGrid(ETDRS_TYPE, List.of(1.0, 3.0, 6.0), centerX, centerY, 0f, 0f, 0f, 0f,
                Collections.nCopies(SECTOR_COUNT, new Sector(0f, 0f)));
    }

    /**
     * Thickness and volume of one grid sector.
     */
    public record Sector(float thickness, float volume) {
    }
}
