package com.phillippitts.octvol.config.properties;

import jakarta.validation.constraints.Positive;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Controls whether B-scans are decoded on the {@code decodeExecutor} pool.
 *
 * <p>Small volumes decode faster on the calling thread; the threshold keeps task
 * overhead away from them.
 */
@ConfigurationProperties(prefix = "octvol.decode")
@Validated
public class DecodeProperties {

    /** Decode B-scans in parallel when the volume is large enough. */
    private boolean parallel = true;

    /** Minimum number of B-scans before parallel decoding kicks in. */
    @Positive(message = "Parallel threshold must be positive")
    private int parallelThreshold = 8;

    public boolean isParallel() {
        return parallel;
    }

    public void setParallel(boolean parallel) {
        this.parallel = parallel;
    }

    public int getParallelThreshold() {
        return parallelThreshold;
    }

    public void setParallelThreshold(int parallelThreshold) {
        this.parallelThreshold = parallelThreshold;
    }
}
