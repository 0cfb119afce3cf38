package dev.blogpulse.config;

import org.springframework.http.HttpMethod;

import java.util.Locale;

/**
 * Rate-limit bucket a request falls into. Unmatched routes land in {@link #GLOBAL},
 * so a newly added endpoint is never unlimited.
 */
public enum RouteClass {
    TRACKING,
    ADMIN_MUTATION,
    ADMIN,
    GLOBAL;

    public static RouteClass resolve(String path, HttpMethod method) {
        if (path.startsWith("/api/v1/track")) {
            return TRACKING;
        }
        if (path.startsWith("/api/v1/admin/")) {
            boolean read = HttpMethod.GET.equals(method) || HttpMethod.HEAD.equals(method)
                    || HttpMethod.OPTIONS.equals(method);
            return read ? ADMIN : ADMIN_MUTATION;
        }
        return GLOBAL;
    }

    public String tag() {
        return name().toLowerCase(Locale.ROOT);
    }
}
