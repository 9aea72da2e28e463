package com.phillippitts.octvol.exception;

/**
 * Base exception for all octvol application-specific errors.
 * All domain exceptions should extend this class to enable centralized error handling.
 */
public class OctVolException extends RuntimeException {

    public OctVolException(String message) {
        super(message);
    }

    public OctVolException(String message, Throwable cause) {
        super(message, cause);
    }

    public OctVolException(Throwable cause) {
        super(cause);
    }
}
