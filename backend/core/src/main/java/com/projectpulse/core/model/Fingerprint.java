package com.projectpulse.core.model;

import java.util.Objects;

/**
 * Deduplication key: the source plus its native id, or the content hash when the source has no stable id.
 */
public record Fingerprint(Source source, String sourceNativeId, String contentHash) {
    public Fingerprint {
        Objects.requireNonNull(source, "source is required");
        Objects.requireNonNull(contentHash, "contentHash is required");
    }

    public boolean anchoredByNativeId() {
        return sourceNativeId != null;
    }

    public String key() {
        return anchoredByNativeId()
                ? source.name() + ":id:" + sourceNativeId
                : source.name() + ":hash:" + contentHash;
    }
}
