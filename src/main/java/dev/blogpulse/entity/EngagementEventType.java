package dev.blogpulse.entity;

import java.util.Locale;
import java.util.Optional;

public enum EngagementEventType {
    VIEW("view"),
    SCROLL_CHECKPOINT("scroll_checkpoint"),
    SHARE("share"),
    CTA_CLICK("cta_click"),
    TIME_ON_PAGE("time_on_page"),
    TIME_MILESTONE("time_milestone"),
    NEWSLETTER_SIGNUP("newsletter_signup"),
    OUTBOUND_CLICK("outbound_click");

    private final String value;

    EngagementEventType(String value) {
        this.value = value;
    }

    public String value() {
        return value;
    }

    /**
     * Milestones only mark that a reader is still on the page. The reader's final time arrives
     * separately as {@code time_on_page} or {@code exit}, so milestones go to the event log only.
     */
    public boolean isLogOnly() {
        return this == TIME_MILESTONE;
    }

    /**
     * Accepts canonical names plus the aliases older front-end builds still send.
     */
    public static Optional<EngagementEventType> fromValue(String raw) {
        if (raw == null || raw.isBlank()) {
            return Optional.empty();
        }
        return switch (raw.trim().toLowerCase(Locale.ROOT)) {
            case "view" -> Optional.of(VIEW);
            case "scroll_checkpoint", "scroll_milestone" -> Optional.of(SCROLL_CHECKPOINT);
            case "share", "copy_link" -> Optional.of(SHARE);
            case "cta_click" -> Optional.of(CTA_CLICK);
            case "time_on_page", "exit" -> Optional.of(TIME_ON_PAGE);
            case "time_milestone" -> Optional.of(TIME_MILESTONE);
            case "newsletter_signup" -> Optional.of(NEWSLETTER_SIGNUP);
            case "outbound_click" -> Optional.of(OUTBOUND_CLICK);
            default -> Optional.empty();
        };
    }
}
