/**
 * Immutable domain model of a .vol volume.
 *
 * <p>{@link com.phillippitts.octvol.domain.VolumeModel} aggregates the
 * {@link com.phillippitts.octvol.domain.Header}, the
 * {@link com.phillippitts.octvol.domain.FundusImage} and the ordered
 * {@link com.phillippitts.octvol.domain.Slice} sequence, and validates the cross-field
 * invariants on construction. Opaque regions are kept as
 * {@link com.phillippitts.octvol.domain.RawBytes} and text fields as
 * {@link com.phillippitts.octvol.domain.FixedText} so that nothing is lost on round trip.
 *
 * @since 1.0
 */
package com.phillippitts.octvol.domain;
