package com.phillippitts.octvol.service.metrics;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Component;

import java.util.concurrent.TimeUnit;

/**
 * Centralized metrics tracking for volume file operations.
 *
 * <p>Provides instrumentation for:
 * <ul>
 *   <li>Open and save latency</li>
 *   <li>Crops performed, by kind (depth, region)</li>
 *   <li>Failures, by operation and exception type</li>
 * </ul>
 *
 * @see io.micrometer.core.instrument.MeterRegistry
 */
@Component
public class VolumeMetrics {

    private static final String METRIC_PREFIX = "octvol.volume";

    /** Crop kind tag for depth-margin crops. */
    public static final String CROP_DEPTH = "depth";

    /** Crop kind tag for square region crops. */
    public static final String CROP_REGION = "region";

    private final MeterRegistry registry;

    public VolumeMetrics(MeterRegistry registry) {
        this.registry = registry;
    }

    /**
     * Records the time taken to read and decode one file.
     *
     * @param durationNanos duration in nanoseconds
     */
    public void recordOpen(long durationNanos) {
        Timer.builder(METRIC_PREFIX + ".open")
                .description("Time taken to read and decode a .vol file")
                .register(registry)
                .record(durationNanos, TimeUnit.NANOSECONDS);
    }

    /**
     * Records the time taken to encode and publish one file.
     *
     * @param durationNanos duration in nanoseconds
     */
    public void recordSave(long durationNanos) {
        Timer.builder(METRIC_PREFIX + ".save")
                .description("Time taken to encode and write a .vol file")
                .register(registry)
                .record(durationNanos, TimeUnit.NANOSECONDS);
    }

    /**
     * Increments the crop counter.
     *
     * @param kind {@link #CROP_DEPTH} or {@link #CROP_REGION}
     */
    public void incrementCrop(String kind) {
        Counter.builder(METRIC_PREFIX + ".crop")
                .description("Number of crops performed")
                .tag("kind", kind)
                .register(registry)
                .increment();
    }

    /**
     * Increments the failure counter.
     *
     * @param operation failed operation (open, save, crop, region-crop)
     * @param exceptionType simple name of the exception raised
     */
    public void incrementFailure(String operation, String exceptionType) {
        Counter.builder(METRIC_PREFIX + ".failure")
                .description("Number of failed volume operations")
                .tag("operation", operation)
                .tag("exception", exceptionType)
                .register(registry)
                .increment();
    }
}
