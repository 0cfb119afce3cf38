package dev.blogpulse.util;

import dev.blogpulse.entity.SourceCategory;

/**
 * Result of classifying a page view.
 *
 * @param category     resolved traffic source
 * @param referrer     raw referrer as received, truncated; {@code null} when absent
 * @param referrerHost lowercase host of the referrer, or {@code null} when it could not be parsed
 */
public record Attribution(SourceCategory category, String referrer, String referrerHost) {

    public static Attribution direct() {
        return new Attribution(SourceCategory.DIRECT, null, null);
    }
}
