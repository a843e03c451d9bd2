/**
 * Data model of the reduction-to-pole pipeline.
 *
 * <ul>
 * <li>{@link com.polereduction.core.model.Profile} — immutable distance /
 * anomaly sequences</li>
 * <li>{@link com.polereduction.core.model.FieldGeometry} — field inclination,
 * declination and profile azimuth</li>
 * <li>{@link com.polereduction.core.model.Spectrum} — padded transform and
 * its wavenumbers</li>
 * <li>{@link com.polereduction.core.model.TaperMode} — available edge
 * tapering windows</li>
 * </ul>
 *
 * @since 1.0.0
 */
package com.polereduction.core.model;
