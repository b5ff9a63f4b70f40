package com.pricemonitor.common.event;

import java.util.Locale;

/**
 * Site a snapshot was scraped from.
 */
public enum Source {
    JUMIA("jumia"),
    MARJANEMALL("marjanemall"),
    OTHER("other");

    private final String key;

    Source(String key) {
        this.key = key;
    }

    public String key() {
        return key;
    }

    /**
     * Resolves a scraper-supplied source name or host ({@code "jumia"}, {@code "www.jumia.ma"}).
     * Anything unrecognised maps to {@link #OTHER}.
     */
    public static Source fromValue(String value) {
        if (value == null || value.isBlank()) {
            return OTHER;
        }
        var normalized = value.trim().toLowerCase(Locale.ROOT);
        for (var source : values()) {
            if (source != OTHER && normalized.contains(source.key)) {
                return source;
            }
        }
        return OTHER;
    }
}
