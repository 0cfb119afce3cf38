package dev.blogpulse.entity;

import java.util.Locale;
import java.util.Optional;

/**
 * Traffic source a page view is attributed to.
 * Stored lowercase ({@link #value()}) in the {@code source} columns.
 */
public enum SourceCategory {
    INSTAGRAM,
    FACEBOOK,
    YOUTUBE,
    GOOGLE,
    DIRECT,
    OTHER;

    public String value() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static Optional<SourceCategory> fromValue(String value) {
        if (value == null || value.isBlank()) {
            return Optional.empty();
        }
        try {
            return Optional.of(valueOf(value.trim().toUpperCase(Locale.ROOT)));
        } catch (IllegalArgumentException e) {
            return Optional.empty();
        }
    }
}
