package dev.blogpulse.dto;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonSetter;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import lombok.Setter;

/**
 * Page view beacon. Every field is optional: missing or oversized values are
 * defaulted or truncated, never rejected.
 * <p>
 * An explicit {@code "referrer": null} means the visitor arrived directly and is kept apart
 * from an absent field, which falls back to the {@code Referer} header.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class TrackRequest {
    private String path;
    private String referrer;
    private String source;

    @JsonIgnore
    @Setter(AccessLevel.NONE)
    private boolean referrerPresent;

    @JsonSetter("referrer")
    public void setReferrer(String referrer) {
        this.referrer = referrer;
        this.referrerPresent = true;
    }

    /**
     * True when the body named a referrer, even as null.
     */
    public boolean hasReferrer() {
        return referrerPresent || referrer != null;
    }
}
