package com.projectpulse.service.runtime;

import com.projectpulse.core.model.Destination;
import com.projectpulse.core.model.Post;
import com.projectpulse.core.model.PostStatus;

/**
 * Outcome of one candidate on one destination.
 *
 * @param alreadyPublished the post had succeeded before this call; no adapter was invoked
 */
public record PostResult(
        Destination destination,
        PostStatus status,
        long postId,
        int attemptCount,
        String externalReference,
        String error,
        boolean alreadyPublished
) {
    public static PostResult of(Post post) {
        return new PostResult(
                post.destination(),
                post.status(),
                post.id(),
                post.attemptCount(),
                post.externalReference(),
                post.lastError(),
                false
        );
    }

    public static PostResult alreadyPublished(Post post) {
        return new PostResult(
                post.destination(),
                post.status(),
                post.id(),
                post.attemptCount(),
                post.externalReference(),
                post.lastError(),
                true
        );
    }

    public boolean succeeded() {
        return status == PostStatus.SUCCEEDED;
    }
}
