package com.phillippitts.octvol.runner;

import com.phillippitts.octvol.config.properties.RunnerProperties;
import com.phillippitts.octvol.domain.VolumeModel;
import com.phillippitts.octvol.service.io.VolumeFiles;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.boot.CommandLineRunner;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.nio.file.Path;
import java.nio.file.Paths;

/**
 * One-shot batch job: opens {@code octvol.runner.input}, applies the configured crops and saves
 * the result to {@code octvol.runner.output}.
 *
 * <p>The region crop runs first (when {@code region-size-mm > 0}), then the depth crop (when
 * {@code margin > 0}). Any
 * failure propagates and aborts startup with a non-zero exit.
 */
@Component
@ConditionalOnProperty(name = "octvol.runner.enabled", havingValue = "true")
public class VolumeCropRunner implements CommandLineRunner {

    private static final Logger LOG = LogManager.getLogger(VolumeCropRunner.class);

    private final VolumeFiles volumeFiles;
    private final RunnerProperties props;

    public VolumeCropRunner(VolumeFiles volumeFiles, RunnerProperties props) {
        this.volumeFiles = volumeFiles;
        this.props = props;
    }

    @Override
    public void run(String... args) {
        Path input = requirePath(props.getInput(), "octvol.runner.input");
        Path output = requirePath(props.getOutput(), "octvol.runner.output");

        VolumeModel volume = volumeFiles.open(input);
        if (props.getRegionSizeMm() > 0) {
            volume = volumeFiles.cropRegion(volume, props.getRegionSizeMm());
        }
        if (props.getMargin() > 0) {
            volume = volumeFiles.crop(volume, props.getMargin());
        }
        Path written = volumeFiles.save(volume, output);

        LOG.info("Crop job finished: {} -> {}", input, written);
    }

    private static Path requirePath(String value, String property) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException(property + " must be set when octvol.runner.enabled=true");
        }
        return Paths.get(value.trim());
    }
}
