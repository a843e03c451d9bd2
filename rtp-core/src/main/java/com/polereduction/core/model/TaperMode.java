package com.polereduction.core.model;

import java.util.Locale;

/**
 * Edge-tapering window constructions.
 *
 * @since 1.0.0
 */
public enum TaperMode {

    /**
     * Halves of a short Hann window placed at each end around a flat centre.
     * Matches the window earlier releases of the processing tool produced.
     */
    HANNING_SPLIT,

    /** Canonical Tukey (tapered cosine) window, exactly zero at both ends. */
    TUKEY;

    /**
     * Resolve a mode from its configuration name, ignoring case and accepting
     * hyphens for underscores.
     *
     * @param name mode name such as {@code tukey} or {@code hanning-split}
     * @return the matching mode
     * @throws IllegalArgumentException if no mode matches
     */
    public static TaperMode fromName(String name) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("Taper mode must not be blank");
        }
        String normalised = name.trim().replace('-', '_').toUpperCase(Locale.ROOT);
        for (TaperMode mode : values()) {
            if (mode.name().equals(normalised)) {
                return mode;
            }
        }
        throw new IllegalArgumentException("Unknown taper mode: '" + name
                + "'. Supported: hanning_split, tukey");
    }
}
