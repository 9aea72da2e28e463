/**
 * Byte-level codecs for the Heidelberg Spectralis .vol format.
 *
 * <p>{@link com.phillippitts.octvol.service.codec.VolLayout} owns every offset; the codecs read
 * and write one structure each and never reach outside it.
 */
package com.phillippitts.octvol.service.codec;
