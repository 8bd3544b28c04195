package com.projectpulse.publishers.api;

import com.projectpulse.core.model.Activity;

import java.util.List;

/**
 * Produces the Markdown body of a weekly post.
 */
public interface Summarizer {
    /**
     * @throws IllegalStateException when no summary could be produced
     */
    String summarize(List<Activity> activities);
}
