package com.projectpulse.core.events;

import com.projectpulse.core.model.Source;

import java.time.Instant;

public record ActivityAdmitted(
        Instant timestamp,
        long activityId,
        Source source,
        String fingerprint,
        Boolean newsworthy
) implements Event {
    @Override
    public String type() {
        return "ActivityAdmitted";
    }
}
