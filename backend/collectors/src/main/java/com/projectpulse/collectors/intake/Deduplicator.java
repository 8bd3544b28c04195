package com.projectpulse.collectors.intake;

import com.projectpulse.core.model.Admission;
import com.projectpulse.core.model.Fingerprint;
import com.projectpulse.core.model.RawActivity;
import com.projectpulse.core.store.ActivityStore;
import com.projectpulse.core.util.HashingUtils;
import com.projectpulse.core.util.TextUtils;

import java.util.Objects;

/**
 * Admits a raw activity only when its fingerprint is new. Uniqueness is enforced by the store, so concurrent
 * collectors racing on one fingerprint end up with a single stored activity.
 */
public class Deduplicator {
    private final ActivityStore store;

    public Deduplicator(ActivityStore store) {
        this.store = Objects.requireNonNull(store, "store is required");
    }

    public Admission admit(RawActivity raw) {
        return store.findOrCreate(fingerprintOf(raw), raw);
    }

    public static Fingerprint fingerprintOf(RawActivity raw) {
        return new Fingerprint(raw.source(), raw.sourceNativeId(), contentHash(raw));
    }

    static String contentHash(RawActivity raw) {
        return HashingUtils.sha256(TextUtils.collapseWhitespace(raw.payload().contentText()));
    }
}
