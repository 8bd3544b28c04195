package com.projectpulse.core.events;

import com.projectpulse.core.model.Destination;
import com.projectpulse.core.model.PostStatus;

import java.time.Instant;

public record PublishAttempted(
        Instant timestamp,
        long postId,
        String signature,
        Destination destination,
        int attempt,
        PostStatus status,
        String error
) implements Event {
    @Override
    public String type() {
        return "PublishAttempted";
    }
}
