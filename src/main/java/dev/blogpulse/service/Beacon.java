package dev.blogpulse.service;

/**
 * Request data of a page view beacon after truncation.
 *
 * @param visitorToken value of the visitor cookie, may be null
 * @param userId       subject of a valid access token sent along, may be null
 */
public record Beacon(String visitorToken, String userId, String path, String referrer, String sourceHint,
                     String userAgent, String ip) {
}
