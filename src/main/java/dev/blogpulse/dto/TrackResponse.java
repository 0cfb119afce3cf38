package dev.blogpulse.dto;

/**
 * Body of every tracking response. Always {@code {"success":true}}.
 */
public record TrackResponse(boolean success) {

    private static final TrackResponse OK = new TrackResponse(true);

    public static TrackResponse ok() {
        return OK;
    }
}
