package com.example.roster.model;

import java.util.Locale;

/**
 * Layout requested by the caller; {@code AUTO} defers to the detector.
 */
public enum LayoutOverride {
    AUTO,
    ONE,
    TWO;

    public static LayoutOverride from(String value) {
        if (value == null || value.isBlank()) {
            return AUTO;
        }
        switch (value.trim().toLowerCase(Locale.ROOT)) {
            case "auto": return AUTO;
            case "one":
            case "single": return ONE;
            case "two": return TWO;
            default:
                throw new IllegalArgumentException("Unknown layout: " + value + " (expected auto, one or two)");
        }
    }
}
