package com.example.roster.domain.model;

import java.util.EnumSet;
import java.util.List;
import java.util.Locale;

/**
 * Domain enumeration describing which parts of a roster extraction the caller wants.
 * Lets the application layer skip work nobody asked for.
 */
public enum RosterFeature {
    MEMBER_ASSIGNMENTS,
    COVER_DATE,
    DOCUMENT_METADATA,
    RAW_TEXT;

	/**
	 * Builds an {@link EnumSet} containing every feature value.
	 *
	 * @return enum set with all defined features
	 */
    public static EnumSet<RosterFeature> allFeatures() {
        return EnumSet.allOf(RosterFeature.class);
    }

	/**
	 * Converts a list of request parameters into an {@link EnumSet} of features.
	 * Unknown values are ignored; an empty outcome falls back to all features.
	 *
	 * @param rawValues feature names supplied by the caller
	 * @return parsed feature set or {@link #allFeatures()} when empty/invalid
	 */
    public static EnumSet<RosterFeature> fromStrings(List<String> rawValues) {
        if (rawValues == null || rawValues.isEmpty()) {
            return allFeatures();
        }
        EnumSet<RosterFeature> features = EnumSet.noneOf(RosterFeature.class);
        for (String value : rawValues) {
            RosterFeature feature = fromString(value);
            if (feature != null) {
                features.add(feature);
            }
        }
        if (features.isEmpty()) {
            return allFeatures();
        }
        return features;
    }

    private static RosterFeature fromString(String rawValue) {
        if (rawValue == null) {
            return null;
        }
        try {
            return RosterFeature.valueOf(rawValue.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException ex) {
            return null;
        }
    }

	/**
	 * Resolves a human friendly label for the upload form.
	 *
	 * @param feature feature to translate
	 * @return display name
	 */
    public static String toDisplayName(RosterFeature feature) {
        return switch (feature) {
            case MEMBER_ASSIGNMENTS -> "Committee assignments";
            case COVER_DATE -> "Roster cover date";
            case DOCUMENT_METADATA -> "PDF info/XMP metadata";
            case RAW_TEXT -> "Page text";
        };
    }

    public String displayName() {
        return toDisplayName(this);
    }
}
