package com.browserpilot.core.model;

import java.util.Locale;

/**
 * Browser engines supported by the automation service.
 */
public enum BrowserType {
    CHROMIUM,
    FIREFOX,
    WEBKIT;

    /** Wire name as the service expects it ({@code "chromium"}, ...). */
    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }

    /**
     * Parses a wire or enum name; unknown or blank values fall back to
     * {@link #CHROMIUM}, matching what the service does.
     */
    public static BrowserType fromWire(String value) {
        if (value == null || value.isBlank()) return CHROMIUM;
        try {
            return valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            return CHROMIUM;
        }
    }
}
