package com.hifi.marketsearch.search.model;

import java.util.Locale;

public enum SortKey {
    DATE,
    SITE,
    PRICE;

    public static SortKey fromString(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("sort key is blank (expected date, site or price)");
        }
        String normalized = value.trim().toUpperCase(Locale.ROOT);
        for (SortKey key : values()) {
            if (key.name().equals(normalized)) {
                return key;
            }
        }
        throw new IllegalArgumentException("Unsupported sort key: " + value + " (expected date, site or price)");
    }

    public String label() {
        return name().toLowerCase(Locale.ROOT);
    }
}
