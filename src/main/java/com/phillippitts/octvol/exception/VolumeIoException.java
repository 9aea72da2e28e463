package com.phillippitts.octvol.exception;

import java.nio.file.Path;

/**
 * Thrown when reading or publishing a .vol file fails at the filesystem level.
 */
public class VolumeIoException extends OctVolException {

    private final transient Path path;

    public VolumeIoException(String message, Path path, Throwable cause) {
        super(message + ": " + path, cause);
        this.path = path;
    }

    public Path getPath() {
        return path;
    }
}
