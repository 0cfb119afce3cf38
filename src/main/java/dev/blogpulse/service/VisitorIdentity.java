package dev.blogpulse.service;

/**
 * @param visitorId   token to hand back to the browser in the visitor cookie
 * @param isNew       true only for the request that created the visitor row
 * @param firstSource source recorded at first contact
 */
public record VisitorIdentity(String visitorId, boolean isNew, String firstSource) {
}
