package com.projectpulse.core.model;

/**
 * Outcome of admitting a raw activity: either a newly stored activity or the one already holding its fingerprint.
 */
public record Admission(Activity activity, boolean duplicate) {
    public static Admission admitted(Activity activity) {
        return new Admission(activity, false);
    }

    public static Admission duplicate(Activity existing) {
        return new Admission(existing, true);
    }
}
