package com.phillippitts.octvol.service.io;

import com.phillippitts.octvol.domain.VolumeModel;
import com.phillippitts.octvol.exception.VolumeIoException;
import com.phillippitts.octvol.service.crop.CropEngine;
import com.phillippitts.octvol.service.crop.RegionCropEngine;
import com.phillippitts.octvol.service.metrics.VolumeMetrics;
import com.phillippitts.octvol.util.LogSanitizer;
import com.phillippitts.octvol.util.TimeUtils;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.apache.logging.log4j.ThreadContext;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.channels.FileChannel;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.nio.file.StandardOpenOption;
import java.nio.file.attribute.PosixFilePermission;
import java.nio.file.attribute.PosixFilePermissions;
import java.util.Locale;
import java.util.Objects;
import java.util.Set;

/**
 * Entry point for working with .vol files on disk: open, crop and save.
 *
 * <p><b>Open:</b> the file is read with a single bulk read and decoded completely; either a
 * validated model is returned or an exception is thrown, never a partial model.
 *
 * <p><b>Save:</b> the volume is encoded in memory first, written to a temporary file next to the
 * destination, forced to disk and moved over the destination atomically. On filesystems without
 * atomic moves a replacing move is used instead. The destination is never left half written and
 * the temporary file never outlives the call. On POSIX filesystems the saved file takes the
 * permissions of the file it replaces, or {@code rw-r--r--} when it is new.
 *
 * <p>The file name is placed in the Log4j2 {@link ThreadContext} under {@code volFile} while a
 * file is opened or saved, so decode worker logs carry it too.
 */
@Service
public class VolumeFiles {
    private static final Logger LOG = LogManager.getLogger(VolumeFiles.class);

    /** Extension every .vol file name carries. */
    public static final String EXTENSION = ".vol";

    private static final String CONTEXT_KEY = "volFile";

    /** Mode of a newly created .vol file on POSIX filesystems. */
    private static final Set<PosixFilePermission> DEFAULT_PERMISSIONS = PosixFilePermissions.fromString("rw-r--r--");

    private final VolumeReader reader;
    private final VolumeWriter writer;
    private final CropEngine cropEngine;
    private final RegionCropEngine regionCropEngine;
    private final VolumeMetrics metrics;

    public VolumeFiles(VolumeReader reader,
                       VolumeWriter writer,
                       CropEngine cropEngine,
                       RegionCropEngine regionCropEngine,
                       VolumeMetrics metrics) {
        this.reader = Objects.requireNonNull(reader);
        this.writer = Objects.requireNonNull(writer);
        this.cropEngine = Objects.requireNonNull(cropEngine);
        this.regionCropEngine = Objects.requireNonNull(regionCropEngine);
        this.metrics = Objects.requireNonNull(metrics);
    }

    /**
     * Reads and decodes a .vol file.
     *
     * @param path file to read; its name must end with {@code .vol}
     * @return validated volume
     * @throws IllegalArgumentException if the name does not end with {@code .vol}
     * @throws VolumeIoException if the file cannot be read
     */
    public VolumeModel open(Path path) {
        Objects.requireNonNull(path, "path must not be null");
        if (!hasVolExtension(path)) {
            throw new IllegalArgumentException("Not a .vol file: " + path);
        }
        ThreadContext.put(CONTEXT_KEY, String.valueOf(path.getFileName()));
        long t0 = System.nanoTime();
        try {
            byte[] bytes;
            try {
                bytes = Files.readAllBytes(path);
            } catch (IOException e) {
                throw new VolumeIoException("Failed to read .vol file", path, e);
            }
            VolumeModel volume = reader.read(bytes);
            long elapsed = System.nanoTime() - t0;
            metrics.recordOpen(elapsed);
            LOG.info("Opened {} ({} bytes): {} B-scans of {}x{}, patient {} in {} ms",
                    path.getFileName(), bytes.length, volume.header().numBScans(), volume.header().sizeZ(),
                    volume.header().sizeX(), LogSanitizer.maskIdentifier(volume.header().patientId().text()),
                    TimeUtils.nanosToMillis(elapsed));
            return volume;
        } catch (RuntimeException e) {
            metrics.incrementFailure("open", e.getClass().getSimpleName());
            LOG.warn("Failed to open {}: {}", path.getFileName(), e.getMessage());
            throw e;
        } finally {
            ThreadContext.remove(CONTEXT_KEY);
        }
    }

    /**
     * Removes {@code margin} rows from the top and bottom of every B-scan.
     *
     * @see CropEngine#crop(VolumeModel, int)
     */
    public VolumeModel crop(VolumeModel volume, int margin) {
        try {
            VolumeModel cropped = cropEngine.crop(volume, margin);
            metrics.incrementCrop(VolumeMetrics.CROP_DEPTH);
            LOG.info("Cropped depth by {} rows per edge: {} -> {} rows",
                    margin, volume.header().sizeZ(), cropped.header().sizeZ());
            return cropped;
        } catch (RuntimeException e) {
            metrics.incrementFailure("crop", e.getClass().getSimpleName());
            throw e;
        }
    }

    /**
     * Crops to a {@code sizeMm} square centred on the thickness grid.
     *
     * @see RegionCropEngine#cropRegion(VolumeModel, double)
     */
    public VolumeModel cropRegion(VolumeModel volume, double sizeMm) {
        try {
            VolumeModel cropped = regionCropEngine.cropRegion(volume, sizeMm);
            metrics.incrementCrop(VolumeMetrics.CROP_REGION);
            LOG.info("Cropped {} mm region: {} B-scans of width {} -> {} B-scans of width {}", sizeMm,
                    volume.header().numBScans(), volume.header().sizeX(),
                    cropped.header().numBScans(), cropped.header().sizeX());
            return cropped;
        } catch (RuntimeException e) {
            metrics.incrementFailure("region-crop", e.getClass().getSimpleName());
            throw e;
        }
    }

    /**
     * Encodes {@code volume} and publishes it at {@code path} atomically.
     *
     * @param volume volume to write
     * @param path   destination; {@code .vol} is appended when the name lacks it
     * @return the path actually written
     * @throws VolumeIoException if writing or publishing fails
     */
    public Path save(VolumeModel volume, Path path) {
        Objects.requireNonNull(volume, "volume must not be null");
        Objects.requireNonNull(path, "path must not be null");
        Path target = withVolExtension(path);
        ThreadContext.put(CONTEXT_KEY, String.valueOf(target.getFileName()));
        long t0 = System.nanoTime();
        try {
            byte[] bytes = writer.write(volume);
            publish(bytes, target);
            long elapsed = System.nanoTime() - t0;
            metrics.recordSave(elapsed);
            LOG.info("Saved {} ({} bytes) in {} ms", target.getFileName(), bytes.length,
                    TimeUtils.nanosToMillis(elapsed));
            return target;
        } catch (RuntimeException e) {
            metrics.incrementFailure("save", e.getClass().getSimpleName());
            LOG.warn("Failed to save {}: {}", target.getFileName(), e.getMessage());
            throw e;
        } finally {
            ThreadContext.remove(CONTEXT_KEY);
        }
    }

    private void publish(byte[] bytes, Path target) {
        Path dir = target.toAbsolutePath().getParent();
        Path tmp = null;
        try {
            tmp = Files.createTempFile(dir, "." + target.getFileName(), ".tmp");
            copyPermissions(tmp, target);
            try (FileChannel ch = FileChannel.open(tmp, StandardOpenOption.WRITE, StandardOpenOption.TRUNCATE_EXISTING)) {
                ByteBuffer buf = ByteBuffer.wrap(bytes);
                while (buf.hasRemaining()) {
                    ch.write(buf);
                }
                ch.force(true);
            }
            try {
                Files.move(tmp, target, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
            } catch (AtomicMoveNotSupportedException e) {
                LOG.warn("Atomic move not supported in {}, falling back to replacing move", dir);
                Files.move(tmp, target, StandardCopyOption.REPLACE_EXISTING);
            }
        } catch (IOException e) {
            throw new VolumeIoException("Failed to write .vol file", target, e);
        } finally {
            deleteQuietly(tmp);
        }
    }

    // temp files are created owner-only; the published file keeps the destination's mode
    private static void copyPermissions(Path tmp, Path target) throws IOException {
        if (!tmp.getFileSystem().supportedFileAttributeViews().contains("posix")) {
            return;
        }
        Set<PosixFilePermission> permissions = Files.exists(target)
                ? Files.getPosixFilePermissions(target)
                : DEFAULT_PERMISSIONS;
        Files.setPosixFilePermissions(tmp, permissions);
    }

    private static void deleteQuietly(Path tmp) {
        if (tmp == null) {
            return;
        }
        try {
            Files.deleteIfExists(tmp);
        } catch (IOException e) {
            LOG.warn("Could not delete temporary file {}: {}", tmp, e.getMessage());
        }
    }

    static boolean hasVolExtension(Path path) {
        Path name = path.getFileName();
        return name != null && name.toString().toLowerCase(Locale.ROOT).endsWith(EXTENSION);
    }

    static Path withVolExtension(Path path) {
        return hasVolExtension(path) ? path : path.resolveSibling(path.getFileName() + EXTENSION);
    }
}
