package dev.blogpulse.service.cache;

/**
 * Cache keys and invalidation patterns shared by the writers and the report services.
 */
public final class CacheTopics {

    public static final String DASHBOARD_OVERVIEW = "dashboard:overview";
    public static final String DASHBOARD_ALL = "dashboard:*";

    public static final String SESSIONS_RECENT = "sessions:recent";
    public static final String SESSIONS_ALL = "sessions:*";

    public static final String TRAFFIC_ALL = "traffic:*";

    public static final String BLOG_OVERVIEW = "blog-analytics:overview";
    public static final String BLOG_LEADERBOARD = "blog-analytics:leaderboard";
    public static final String BLOG_ALL = "blog-analytics:*";

    private CacheTopics() {
    }

    public static String trafficSummary(String rangeKey) {
        return "traffic:summary:" + rangeKey;
    }

    public static String blogPost(Long postId) {
        return "blog-analytics:post:" + postId;
    }
}
