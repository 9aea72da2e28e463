/**
 * Logging infrastructure: Log4j2 ThreadContext (MDC) handling.
 *
 * <p>MDC Keys:
 * <ul>
 *   <li>{@code volFile} - file name of the volume being opened or saved, set by
 *       {@link com.phillippitts.octvol.service.io.VolumeFiles}</li>
 * </ul>
 *
 * <p>The key is carried onto decode worker threads by
 * {@link com.phillippitts.octvol.config.logging.ThreadContextTaskDecorator}.
 *
 * <p>Log Format:
 * <pre>
 * 2026-10-17 15:42:32.529 [vol-decode-1] [EYE00023_8370.vol] DEBUG logger.name - message
 * </pre>
 *
 * @since 1.0
 */
package com.phillippitts.octvol.config.logging;
