package com.projectpulse.core.model;

import java.time.Instant;
import java.util.Objects;

/**
 * Activity as yielded by a collector, before admission.
 */
public record RawActivity(Source source, String sourceNativeId, Instant observedAt, ActivityPayload payload) {
    public RawActivity {
        Objects.requireNonNull(source, "source is required");
        Objects.requireNonNull(observedAt, "observedAt is required");
        Objects.requireNonNull(payload, "payload is required");
        if (sourceNativeId != null && sourceNativeId.isBlank()) {
            sourceNativeId = null;
        }
    }
}
