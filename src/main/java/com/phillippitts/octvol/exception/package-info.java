/**
 * Application-specific exception hierarchy.
 *
 * <p>All exceptions are unchecked and extend a common base so callers can handle every
 * octvol failure in one place when they do not care about the cause.
 *
 * <p>Exception Hierarchy:
 * <ul>
 *   <li>{@link com.phillippitts.octvol.exception.OctVolException} - Base exception</li>
 *   <li>{@link com.phillippitts.octvol.exception.VolFormatException} - Unrecognized version tag
 *       or malformed fixed structure; carries the field and offset</li>
 *   <li>{@link com.phillippitts.octvol.exception.TruncatedFileException} - A read range exceeds
 *       the available bytes; carries offset, expected and available length</li>
 *   <li>{@link com.phillippitts.octvol.exception.InvalidCropException} - Crop argument invalid
 *       for the volume; raised before any work is done</li>
 *   <li>{@link com.phillippitts.octvol.exception.VolumeInvariantException} - Internal defect:
 *       a decoded or cropped model is inconsistent</li>
 *   <li>{@link com.phillippitts.octvol.exception.VolumeIoException} - Filesystem failure while
 *       opening or saving</li>
 * </ul>
 *
 * @since 1.0
 */
package com.phillippitts.octvol.exception;
