/**
 * Application-wide configuration beans and properties.
 *
 * <p>Configuration Classes:
 * <ul>
 *   <li>{@link com.phillippitts.octvol.config.ThreadPoolConfig} - executor used to decode
 *       B-scans in parallel</li>
 * </ul>
 *
 * <p>Sub-packages:
 * <ul>
 *   <li>{@code config.properties} - {@code @ConfigurationProperties} classes bound from
 *       {@code application.properties} (format acceptance, decoding, thread pools, runner)</li>
 *   <li>{@code config.logging} - Log4j2 ThreadContext propagation</li>
 * </ul>
 *
 * @see com.phillippitts.octvol.config.ThreadPoolConfig
 * @since 1.0
 */
package com.phillippitts.octvol.config;
