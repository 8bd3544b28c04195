package com.projectpulse.publishers.api;

/**
 * @param externalReference the destination's id or URL of the created post
 */
public record PublishOutcome(boolean success, String externalReference) {
    public static PublishOutcome published(String externalReference) {
        return new PublishOutcome(true, externalReference);
    }

    public static PublishOutcome notPublished() {
        return new PublishOutcome(false, null);
    }
}
