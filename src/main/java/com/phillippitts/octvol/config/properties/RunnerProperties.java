package com.phillippitts.octvol.config.properties;

import jakarta.validation.constraints.PositiveOrZero;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Settings for the one-shot open/crop/save runner.
 *
 * <p>Example:
 * <pre>
 * octvol.runner.enabled=true
 * octvol.runner.input=/data/EYE00023_8370.vol
 * octvol.runner.output=/data/EYE00023_8370_cropped.vol
 * octvol.runner.margin=16
 * octvol.runner.region-size-mm=6
 * </pre>
 */
@ConfigurationProperties(prefix = "octvol.runner")
@Validated
public class RunnerProperties {

    private boolean enabled = false;

    /** Source .vol file. */
    private String input;

    /** Destination file; ".vol" is appended when missing. */
    private String output;

    /** Rows removed from both ends of every A-scan. 0 keeps the full depth. */
    @PositiveOrZero(message = "Crop margin must not be negative")
    private int margin = 0;

    /** Edge length in mm of the fovea-centred region crop. 0 disables the region crop. */
    @PositiveOrZero(message = "Region size must not be negative")
    private double regionSizeMm = 0;

    public boolean isEnabled() {
        return enabled;
    }

    public void setEnabled(boolean enabled) {
        this.enabled = enabled;
    }

    public String getInput() {
        return input;
    }

    public void setInput(String input) {
        this.input = input;
    }

    public String getOutput() {
        return output;
    }

    public void setOutput(String output) {
        this.output = output;
    }

    public int getMargin() {
        return margin;
    }

    public void setMargin(int margin) {
        this.margin = margin;
    }

    public double getRegionSizeMm() {
        return regionSizeMm;
    }

    public void setRegionSizeMm(double regionSizeMm) {
        this.regionSizeMm = regionSizeMm;
    }
}
