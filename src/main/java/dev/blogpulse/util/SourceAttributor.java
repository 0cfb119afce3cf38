package dev.blogpulse.util;

import dev.blogpulse.entity.SourceCategory;

import java.net.URI;
import java.net.URISyntaxException;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Maps a referrer and an optional explicit source hint to a {@link SourceCategory}.
 * <p>
 * Priority order:
 * <ol>
 *   <li>explicit hint (first page view of a session only)</li>
 *   <li>empty referrer on a first page view is {@code direct}</li>
 *   <li>known platform domain</li>
 *   <li>the site's own origin is {@code direct}</li>
 *   <li>anything else is {@code other}, with the raw referrer kept</li>
 * </ol>
 * Pure and stateless. Never throws on malformed input.
 */
public final class SourceAttributor {

    static final int MAX_REFERRER_LENGTH = 2048;

    private static final Map<String, SourceCategory> HINT_ALIASES = Map.ofEntries(
            Map.entry("ig", SourceCategory.INSTAGRAM),
            Map.entry("insta", SourceCategory.INSTAGRAM),
            Map.entry("instagram", SourceCategory.INSTAGRAM),
            Map.entry("fb", SourceCategory.FACEBOOK),
            Map.entry("facebook", SourceCategory.FACEBOOK),
            Map.entry("meta", SourceCategory.FACEBOOK),
            Map.entry("yt", SourceCategory.YOUTUBE),
            Map.entry("youtube", SourceCategory.YOUTUBE),
            Map.entry("google", SourceCategory.GOOGLE),
            Map.entry("goog", SourceCategory.GOOGLE),
            Map.entry("direct", SourceCategory.DIRECT)
    );

    /** Query keys that may carry a source alias inside a hint such as {@code utm_source=ig}. */
    private static final Set<String> HINT_KEYS = Set.of("utm_source", "src", "source", "ref");

    private static final Map<String, SourceCategory> PLATFORM_DOMAINS = Map.of(
            "instagram.com", SourceCategory.INSTAGRAM,
            "facebook.com", SourceCategory.FACEBOOK,
            "fb.com", SourceCategory.FACEBOOK,
            "fb.me", SourceCategory.FACEBOOK,
            "youtube.com", SourceCategory.YOUTUBE,
            "youtu.be", SourceCategory.YOUTUBE
    );

    /** Second-level labels under which Google ccTLDs live (google.co.uk, google.com.br). */
    private static final List<String> GOOGLE_SLDS = List.of("co", "com", "ac", "org", "net");

    private SourceAttributor() {
        // Utility class
    }

    /**
     * Classify one page view.
     *
     * @param referrer      document referrer, may be null or garbage
     * @param explicitHint  client-supplied source hint, may be null
     * @param requestOrigin the site's own origin (for example {@code https://blog.example.com})
     * @param firstPageView whether this is the first page view of the visitor's session
     */
    public static Attribution classify(String referrer, String explicitHint, String requestOrigin,
                                       boolean firstPageView) {
        String rawReferrer = truncate(trimToNull(referrer));
        String referrerHost = rawReferrer != null ? extractHost(rawReferrer) : null;

        if (firstPageView) {
            Optional<SourceCategory> hinted = resolveHint(explicitHint);
            if (hinted.isPresent()) {
                return new Attribution(hinted.get(), rawReferrer, referrerHost);
            }
            if (rawReferrer == null) {
                return Attribution.direct();
            }
        }

        if (referrerHost != null) {
            SourceCategory platform = matchPlatform(referrerHost);
            if (platform != null) {
                return new Attribution(platform, rawReferrer, referrerHost);
            }
            String originHost = extractHost(trimToNull(requestOrigin));
            if (originHost != null && stripWww(originHost).equals(stripWww(referrerHost))) {
                return new Attribution(SourceCategory.DIRECT, rawReferrer, referrerHost);
            }
        }

        return new Attribution(SourceCategory.OTHER, rawReferrer, referrerHost);
    }

    /**
     * Resolve a hint such as {@code ig}, {@code utm_source=ig} or {@code ?src=instagram&x=1}.
     */
    static Optional<SourceCategory> resolveHint(String hint) {
        String value = trimToNull(hint);
        if (value == null) {
            return Optional.empty();
        }
        value = value.toLowerCase(Locale.ROOT);
        if (value.startsWith("?")) {
            value = value.substring(1);
        }
        if (!value.contains("=")) {
            return Optional.ofNullable(HINT_ALIASES.get(value));
        }
        for (String pair : value.split("&")) {
            int eq = pair.indexOf('=');
            if (eq <= 0) {
                continue;
            }
            String key = pair.substring(0, eq).trim();
            String alias = pair.substring(eq + 1).trim();
            if (HINT_KEYS.contains(key) && HINT_ALIASES.containsKey(alias)) {
                return Optional.of(HINT_ALIASES.get(alias));
            }
        }
        return Optional.empty();
    }

    /**
     * Lowercase host of a URL, tolerating a missing scheme. Returns null when nothing usable parses.
     */
    static String extractHost(String url) {
        if (url == null) {
            return null;
        }
        String candidate = url.contains("://") ? url : "http://" + url;
        try {
            String host = new URI(candidate).getHost();
            if (host == null || host.isBlank()) {
                return null;
            }
            host = host.toLowerCase(Locale.ROOT);
            return host.endsWith(".") ? host.substring(0, host.length() - 1) : host;
        } catch (URISyntaxException | IllegalArgumentException e) {
            return null;
        }
    }

    private static SourceCategory matchPlatform(String host) {
        for (Map.Entry<String, SourceCategory> entry : PLATFORM_DOMAINS.entrySet()) {
            String domain = entry.getKey();
            if (host.equals(domain) || host.endsWith("." + domain)) {
                return entry.getValue();
            }
        }
        return isGoogleHost(host) ? SourceCategory.GOOGLE : null;
    }

    private static boolean isGoogleHost(String host) {
        String[] labels = host.split("\\.");
        for (int i = 0; i < labels.length - 1; i++) {
            if (!"google".equals(labels[i])) {
                continue;
            }
            int remaining = labels.length - i - 1;
            if (remaining == 1) {
                return true;
            }
            if (remaining == 2 && GOOGLE_SLDS.contains(labels[i + 1])) {
                return true;
            }
        }
        return false;
    }

    private static String stripWww(String host) {
        return host.startsWith("www.") ? host.substring(4) : host;
    }

    private static String trimToNull(String value) {
        if (value == null) {
            return null;
        }
        String trimmed = value.trim();
        return trimmed.isEmpty() ? null : trimmed;
    }

    private static String truncate(String value) {
        if (value == null || value.length() <= MAX_REFERRER_LENGTH) {
            return value;
        }
        return value.substring(0, MAX_REFERRER_LENGTH);
    }
}
