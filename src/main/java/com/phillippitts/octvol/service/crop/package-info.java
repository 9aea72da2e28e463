/**
 * Volume transformations. Each engine returns a new validated
 * {@link com.phillippitts.octvol.domain.VolumeModel} and leaves its input untouched.
 */
package com.phillippitts.octvol.service.crop;
