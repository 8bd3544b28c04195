package com.projectpulse.core.model;

import java.time.Instant;

/**
 * A deduplicated activity. {@code newsworthy} is {@code null} until the content filter has classified it.
 */
public record Activity(
        long id,
        Source source,
        String sourceNativeId,
        String contentHash,
        Instant observedAt,
        ActivityPayload payload,
        Boolean newsworthy
) {
    public boolean markedNewsworthy() {
        return Boolean.TRUE.equals(newsworthy);
    }

    public boolean classified() {
        return newsworthy != null;
    }

    public Fingerprint fingerprint() {
        return new Fingerprint(source, sourceNativeId, contentHash);
    }

    public Activity withNewsworthy(boolean value) {
        return new Activity(id, source, sourceNativeId, contentHash, observedAt, payload, value);
    }
}
