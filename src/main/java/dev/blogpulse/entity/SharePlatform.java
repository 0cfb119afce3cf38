package dev.blogpulse.entity;

import java.util.Locale;
import java.util.Optional;

/**
 * Share targets with their own counter column. Any other platform only
 * counts towards {@code total_shares}.
 */
public enum SharePlatform {
    TWITTER("twitter_shares"),
    FACEBOOK("facebook_shares"),
    LINKEDIN("linkedin_shares"),
    COPY_LINK("copy_link_shares");

    private final String column;

    SharePlatform(String column) {
        this.column = column;
    }

    public String column() {
        return column;
    }

    public static Optional<SharePlatform> fromValue(String value) {
        if (value == null || value.isBlank()) {
            return Optional.empty();
        }
        String normalized = value.trim().toLowerCase(Locale.ROOT).replace('-', '_');
        return switch (normalized) {
            case "twitter", "x" -> Optional.of(TWITTER);
            case "facebook", "fb" -> Optional.of(FACEBOOK);
            case "linkedin" -> Optional.of(LINKEDIN);
            case "copy_link", "copy", "link" -> Optional.of(COPY_LINK);
            default -> Optional.empty();
        };
    }
}
